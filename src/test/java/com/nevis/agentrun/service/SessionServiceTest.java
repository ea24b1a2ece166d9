package com.nevis.agentrun.service;

import com.nevis.agentrun.exception.EntityNotFoundException;
import com.nevis.agentrun.exception.StorageException;
import com.nevis.agentrun.exception.ValidationException;
import com.nevis.agentrun.model.Session;
import com.nevis.agentrun.model.SessionUpdate;
import com.nevis.agentrun.oauth.CredentialRefresher;
import com.nevis.agentrun.repository.SessionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionServiceTest {

    @Mock
    private SessionRepository sessionRepository;

    @Mock
    private CredentialRefresher credentialRefresher;

    @InjectMocks
    private SessionServiceImpl sessionService;

    private static Session session(Set<String> requested, Set<String> granted, long version) {
        return new Session("alice", Map.of("access_token", "t" + version, "refresh_token", "r"), version,
            requested, granted, true, Map.of(), OffsetDateTime.now(), OffsetDateTime.now());
    }

    @Nested
    @DisplayName("Scope filtering")
    class ScopeFiltering {

        @Test
        @DisplayName("Returns the requested scopes that were actually granted")
        void shouldIntersectWithGrantedScopes() {
            when(sessionRepository.findByOwnerId("alice"))
                .thenReturn(Optional.of(session(Set.of("drive", "gmail_full"), Set.of("drive"), 1)));

            assertThat(sessionService.scopeFilter("alice", Set.of("drive", "gmail_full")))
                .containsExactly("drive");
        }

        @Test
        @DisplayName("Unknown owner has no scopes")
        void shouldReturnEmptyForUnknownOwner() {
            when(sessionRepository.findByOwnerId("ghost")).thenReturn(Optional.empty());

            assertThat(sessionService.scopeFilter("ghost", Set.of("drive"))).isEmpty();
        }

        @Test
        @DisplayName("Authorized scopes are requested intersect granted")
        void shouldComputeAuthorizedScopes() {
            when(sessionRepository.findByOwnerId("alice"))
                .thenReturn(Optional.of(session(Set.of("drive", "documents"), Set.of("documents", "spreadsheets"), 1)));

            assertThat(sessionService.authorizedScopes("alice")).containsExactly("documents");
        }
    }

    @Test
    @DisplayName("get throws NotFound for a missing session")
    void shouldThrowWhenMissing() {
        when(sessionRepository.findByOwnerId("ghost")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> sessionService.get("ghost"))
            .isInstanceOf(EntityNotFoundException.class)
            .hasMessageContaining("ghost");
    }

    @Test
    @DisplayName("Upsert rejects scopes outside the catalog")
    void shouldRejectUnknownScopes() {
        SessionUpdate update = new SessionUpdate(null, Set.of("drive", "teleport"), null, null, null);

        assertThatThrownBy(() -> sessionService.upsert("alice", update))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("teleport");
        verifyNoInteractions(sessionRepository);
    }

    @Test
    @DisplayName("Data access failures surface as StorageException")
    void shouldTranslateStorageFailures() {
        when(sessionRepository.findByOwnerId("alice")).thenThrow(new QueryTimeoutException("timeout"));

        assertThatThrownBy(() -> sessionService.find("alice")).isInstanceOf(StorageException.class);
    }

    @Test
    @DisplayName("Logout of an unknown owner is NotFound")
    void shouldFailLogoutForUnknownOwner() {
        when(sessionRepository.markLoggedOut("ghost")).thenReturn(false);

        assertThatThrownBy(() -> sessionService.logout("ghost")).isInstanceOf(EntityNotFoundException.class);
    }

    @Nested
    @DisplayName("Credential refresh")
    class CredentialRefresh {

        @Test
        @DisplayName("Refreshes and stores new credentials when the version is unchanged")
        void shouldRefreshWhenVersionMatches() {
            Session current = session(Set.of(), Set.of(), 3);
            Session refreshed = session(Set.of(), Set.of(), 4);
            when(sessionRepository.findByOwnerId("alice")).thenReturn(Optional.of(current), Optional.of(refreshed));
            when(credentialRefresher.refresh("alice", current.credentialData())).thenReturn(Map.of("access_token", "t4"));
            when(sessionRepository.updateCredentials("alice", Map.of("access_token", "t4"), 3)).thenReturn(true);

            assertThat(sessionService.refreshCredentials("alice", 3).credentialVersion()).isEqualTo(4);
        }

        @Test
        @DisplayName("Skips the token endpoint when someone else already refreshed")
        void shouldSkipWhenAlreadyRefreshed() {
            when(sessionRepository.findByOwnerId("alice")).thenReturn(Optional.of(session(Set.of(), Set.of(), 5)));

            Session result = sessionService.refreshCredentials("alice", 4);

            assertThat(result.credentialVersion()).isEqualTo(5);
            verifyNoInteractions(credentialRefresher);
            verify(sessionRepository, never()).updateCredentials(anyString(), anyMap(), anyLong());
        }

        @Test
        @DisplayName("Concurrent refreshes for one owner call the token endpoint once")
        void shouldSerializeConcurrentRefreshes() throws Exception {
            AtomicReference<Session> stored = new AtomicReference<>(session(Set.of(), Set.of(), 1));
            when(sessionRepository.findByOwnerId("alice")).thenAnswer(inv -> Optional.of(stored.get()));
            when(credentialRefresher.refresh(eq("alice"), anyMap())).thenReturn(Map.of("access_token", "fresh"));
            when(sessionRepository.updateCredentials(eq("alice"), anyMap(), eq(1L))).thenAnswer(inv -> {
                stored.set(session(Set.of(), Set.of(), 2));
                return true;
            });

            int callers = 6;
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            CountDownLatch start = new CountDownLatch(1);
            try {
                List<Future<Session>> results = new ArrayList<>();
                for (int i = 0; i < callers; i++) {
                    results.add(pool.submit(() -> {
                        start.await();
                        return sessionService.refreshCredentials("alice", 1);
                    }));
                }
                start.countDown();
                for (Future<Session> result : results) {
                    assertThat(result.get().credentialVersion()).isEqualTo(2);
                }
            } finally {
                pool.shutdownNow();
            }

            verify(credentialRefresher, times(1)).refresh(eq("alice"), anyMap());
            assertThat(sessionService.refreshLockCount()).isZero();
        }

        @Test
        @DisplayName("Releases per-owner locks after refreshes, including failed ones")
        void shouldNotRetainLocksForFinishedRefreshes() {
            when(sessionRepository.findByOwnerId(anyString())).thenReturn(Optional.of(session(Set.of(), Set.of(), 5)));
            when(sessionRepository.findByOwnerId("ghost")).thenReturn(Optional.empty());

            for (int i = 0; i < 50; i++) {
                sessionService.refreshCredentials("owner-" + i, 4);
            }
            assertThatThrownBy(() -> sessionService.refreshCredentials("ghost", 1))
                .isInstanceOf(EntityNotFoundException.class);

            assertThat(sessionService.refreshLockCount()).isZero();
        }
    }
}
