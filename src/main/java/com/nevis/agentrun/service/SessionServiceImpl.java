package com.nevis.agentrun.service;

import com.nevis.agentrun.exception.EntityNotFoundException;
import com.nevis.agentrun.exception.StorageException;
import com.nevis.agentrun.exception.ValidationException;
import com.nevis.agentrun.model.Scope;
import com.nevis.agentrun.model.Session;
import com.nevis.agentrun.model.SessionUpdate;
import com.nevis.agentrun.oauth.CredentialRefresher;
import com.nevis.agentrun.repository.SessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

@Service
@Slf4j
@RequiredArgsConstructor
public class SessionServiceImpl implements SessionService {

    private static final String ENTITY = "Session";

    private final SessionRepository sessionRepository;
    private final CredentialRefresher credentialRefresher;

    private final Map<String, RefreshLock> refreshLocks = new ConcurrentHashMap<>();

    /**
     * Lock plus the number of threads holding or waiting on it; guarded by the map's per-key compute.
     */
    private static final class RefreshLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    @Override
    public Session get(String ownerId) {
        return find(ownerId).orElseThrow(() -> new EntityNotFoundException(ENTITY, ownerId));
    }

    @Override
    public Optional<Session> find(String ownerId) {
        return StorageException.guard("session lookup", () -> sessionRepository.findByOwnerId(ownerId));
    }

    @Override
    public Session upsert(String ownerId, SessionUpdate update) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new ValidationException("Owner id must not be blank");
        }
        List<String> unknown = Stream.of(update.requestedScopes(), update.grantedScopes())
            .filter(scopes -> scopes != null)
            .flatMap(Set::stream)
            .filter(scope -> !Scope.isKnown(scope))
            .distinct()
            .toList();
        if (!unknown.isEmpty()) {
            throw new ValidationException("Unknown scopes: " + unknown);
        }

        Session session = StorageException.guard("session upsert", () -> sessionRepository.upsert(ownerId, update));
        log.info("Session for {} updated (authenticated={})", ownerId, session.authenticated());
        return session;
    }

    @Override
    public Set<String> scopeFilter(String ownerId, Set<String> requested) {
        Set<String> granted = find(ownerId).map(Session::grantedScopes).orElse(Set.of());
        return intersect(requested, granted);
    }

    @Override
    public Set<String> authorizedScopes(String ownerId) {
        return find(ownerId)
            .map(session -> intersect(session.requestedScopes(), session.grantedScopes()))
            .orElse(Set.of());
    }

    static Set<String> intersect(Set<String> requested, Set<String> granted) {
        Set<String> result = new LinkedHashSet<>(requested);
        result.retainAll(granted);
        return Set.copyOf(result);
    }

    @Override
    public Session refreshCredentials(String ownerId, long seenVersion) {
        RefreshLock refreshLock = refreshLocks.compute(ownerId, (k, existing) -> {
            RefreshLock entry = existing == null ? new RefreshLock() : existing;
            entry.users++;
            return entry;
        });
        refreshLock.lock.lock();
        try {
            Session current = get(ownerId);
            if (current.credentialVersion() != seenVersion) {
                log.debug("Credentials for {} already refreshed (v{} -> v{})",
                    ownerId, seenVersion, current.credentialVersion());
                return current;
            }

            Map<String, Object> refreshed = credentialRefresher.refresh(ownerId, current.credentialData());

            boolean stored = StorageException.guard("credential update",
                () -> sessionRepository.updateCredentials(ownerId, refreshed, seenVersion));
            if (!stored) {
                // another node refreshed concurrently; its credentials are just as fresh
                log.info("Concurrent credential refresh detected for {}", ownerId);
            }
            return get(ownerId);
        } finally {
            refreshLock.lock.unlock();
            refreshLocks.computeIfPresent(ownerId, (k, entry) -> --entry.users == 0 ? null : entry);
        }
    }

    int refreshLockCount() {
        return refreshLocks.size();
    }

    @Override
    public void logout(String ownerId) {
        boolean updated = StorageException.guard("logout", () -> sessionRepository.markLoggedOut(ownerId));
        if (!updated) {
            throw new EntityNotFoundException(ENTITY, ownerId);
        }
        log.info("Owner {} logged out", ownerId);
    }
}
