package com.nevis.agentrun.controller;

import com.nevis.agentrun.model.Scope;
import com.nevis.agentrun.model.Session;
import com.nevis.agentrun.service.SessionService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.security.Principal;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/auth")
@RequiredArgsConstructor
public class AuthController {

    private final SessionService sessionService;

    @GetMapping("/scopes")
    public ResponseEntity<List<ScopeResponse>> scopes() {
        return ResponseEntity.ok(Arrays.stream(Scope.values()).map(ScopeResponse::from).toList());
    }

    @GetMapping("/status")
    public ResponseEntity<AuthStatusResponse> status(Principal principal) {
        AuthStatusResponse response = sessionService.find(principal.getName())
            .map(session -> toStatus(session, sessionService.authorizedScopes(principal.getName())))
            .orElseGet(() -> new AuthStatusResponse(false, List.of(), List.of(), List.of()));
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/logout")
    public ResponseEntity<Map<String, String>> logout(Principal principal) {
        sessionService.logout(principal.getName());
        return ResponseEntity.ok(Map.of("message", "User logged out successfully"));
    }

    private static AuthStatusResponse toStatus(Session session, Collection<String> authorized) {
        return new AuthStatusResponse(
            session.authenticated(),
            sorted(session.requestedScopes()),
            sorted(session.grantedScopes()),
            sorted(authorized)
        );
    }

    private static List<String> sorted(Collection<String> scopes) {
        return scopes.stream().sorted().toList();
    }
}
