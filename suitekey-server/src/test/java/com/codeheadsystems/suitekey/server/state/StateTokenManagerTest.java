package com.codeheadsystems.suitekey.server.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.suitekey.server.MutableClock;
import com.codeheadsystems.suitekey.server.auth.Session;
import com.codeheadsystems.suitekey.server.exceptions.ExpiredStateException;
import com.codeheadsystems.suitekey.server.exceptions.ReplayedStateException;
import com.codeheadsystems.suitekey.server.exceptions.StateTokenException;
import com.codeheadsystems.suitekey.server.exceptions.UnknownStateException;
import com.codeheadsystems.suitekey.server.scope.AuthorizationScope;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StateTokenManagerTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
  private static final Session SESSION = new Session("s1");
  private static final Set<AuthorizationScope> SCOPES = AuthorizationScope.setOf("scope-a", "scope-b");

  private MutableClock clock;
  private InMemoryStateStore stateStore;
  private StateTokenManager manager;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    stateStore = new InMemoryStateStore();
    manager = new StateTokenManager(stateStore, clock, StateTokenManager.DEFAULT_TTL);
  }

  @AfterEach
  void tearDown() {
    manager.shutdown();
  }

  @Test
  void issue_recordsScopesSessionAndReturnTarget() {
    AuthorizationState state = manager.issue(SESSION, SCOPES, "/home");

    assertThat(state.sessionId()).isEqualTo("s1");
    assertThat(state.requestedScopes()).isEqualTo(SCOPES);
    assertThat(state.returnTarget()).isEqualTo("/home");
    assertThat(state.createdAt()).isEqualTo(T0);
    assertThat(state.consumed()).isFalse();
  }

  @Test
  void issue_identifierIs256BitsOfBase64Url() {
    AuthorizationState state = manager.issue(SESSION, SCOPES, null);

    assertThat(state.id()).matches("[A-Za-z0-9_-]{43}");
    assertThat(Base64.getUrlDecoder().decode(state.id())).hasSize(32);
    assertThat(manager.issue(SESSION, SCOPES, null).id()).isNotEqualTo(state.id());
  }

  @Test
  void consume_returnsTheIssuedState() {
    AuthorizationState issued = manager.issue(SESSION, SCOPES, "/after");

    AuthorizationState consumed = manager.consume(issued.id());

    assertThat(consumed.id()).isEqualTo(issued.id());
    assertThat(consumed.requestedScopes()).isEqualTo(SCOPES);
    assertThat(consumed.returnTarget()).isEqualTo("/after");
    assertThat(consumed.consumed()).isTrue();
  }

  @Test
  void consume_secondTime_isReplay() {
    AuthorizationState issued = manager.issue(SESSION, SCOPES, null);
    manager.consume(issued.id());

    assertThatThrownBy(() -> manager.consume(issued.id())).isInstanceOf(ReplayedStateException.class);
  }

  @Test
  void consume_unknown_throws() {
    assertThatThrownBy(() -> manager.consume("never-issued")).isInstanceOf(UnknownStateException.class);
    assertThatThrownBy(() -> manager.consume(null)).isInstanceOf(UnknownStateException.class);
  }

  @Test
  void consume_afterTtl_isExpired() {
    AuthorizationState issued = manager.issue(SESSION, SCOPES, null);
    clock.advance(Duration.ofSeconds(601));

    assertThatThrownBy(() -> manager.consume(issued.id())).isInstanceOf(ExpiredStateException.class);
    // Expired entries are dropped when met.
    assertThatThrownBy(() -> manager.consume(issued.id())).isInstanceOf(UnknownStateException.class);
  }

  @Test
  void consume_justBeforeTtl_succeeds() {
    AuthorizationState issued = manager.issue(SESSION, SCOPES, null);
    clock.advance(Duration.ofSeconds(599));

    assertThat(manager.consume(issued.id()).consumed()).isTrue();
  }

  @Test
  void concurrentConsumers_exactlyOneWins() throws Exception {
    AuthorizationState issued = manager.issue(SESSION, SCOPES, null);
    int threads = 16;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        Callable<Boolean> attempt = () -> {
          start.await();
          try {
            manager.consume(issued.id());
            return true;
          } catch (StateTokenException e) {
            return false;
          }
        };
        results.add(pool.submit(attempt));
      }
      start.countDown();

      int winners = 0;
      for (Future<Boolean> result : results) {
        if (result.get(10, TimeUnit.SECONDS)) {
          winners++;
        }
      }
      assertThat(winners).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void evictExpired_removesOnlyOldStates() {
    AuthorizationState old = manager.issue(SESSION, SCOPES, null);
    clock.advance(Duration.ofSeconds(400));
    AuthorizationState young = manager.issue(SESSION, SCOPES, null);
    clock.advance(Duration.ofSeconds(201));

    assertThat(manager.evictExpired()).isEqualTo(1);
    assertThat(stateStore.load(old.id())).isEmpty();
    assertThat(stateStore.load(young.id())).isPresent();
  }

  @Test
  void evictExpired_removesConsumedStatesToo() {
    AuthorizationState issued = manager.issue(SESSION, SCOPES, null);
    manager.consume(issued.id());
    clock.advance(Duration.ofSeconds(601));

    manager.evictExpired();

    assertThat(stateStore.size()).isZero();
  }

  @Test
  void issue_atCap_throws() {
    for (int i = 0; i < StateTokenManager.MAX_PENDING_STATES; i++) {
      stateStore.store(new AuthorizationState("id-" + i, "s", SCOPES, T0, null, false));
    }

    assertThatThrownBy(() -> manager.issue(SESSION, SCOPES, null)).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void constructor_rejectsNonPositiveTtl() {
    assertThatThrownBy(() -> new StateTokenManager(stateStore, clock, Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
