package com.codeheadsystems.suitekey.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.suitekey.model.oauth.TokenResponse;
import com.codeheadsystems.suitekey.server.MutableClock;
import com.codeheadsystems.suitekey.server.QueryParams;
import com.codeheadsystems.suitekey.server.auth.Session;
import com.codeheadsystems.suitekey.server.exceptions.ExchangeFailedException;
import com.codeheadsystems.suitekey.server.exceptions.ExpiredStateException;
import com.codeheadsystems.suitekey.server.exceptions.ForeignStateException;
import com.codeheadsystems.suitekey.server.exceptions.InvalidStateException;
import com.codeheadsystems.suitekey.server.exceptions.ProviderRejectedException;
import com.codeheadsystems.suitekey.server.exceptions.ProviderUnavailableException;
import com.codeheadsystems.suitekey.server.exceptions.ReplayedStateException;
import com.codeheadsystems.suitekey.server.exceptions.UnknownStateException;
import com.codeheadsystems.suitekey.server.provider.ClientCredentials;
import com.codeheadsystems.suitekey.server.provider.ProviderEndpoints;
import com.codeheadsystems.suitekey.server.provider.TokenEndpoint;
import com.codeheadsystems.suitekey.server.scope.AuthorizationScope;
import com.codeheadsystems.suitekey.server.state.InMemoryStateStore;
import com.codeheadsystems.suitekey.server.state.StateTokenManager;
import com.codeheadsystems.suitekey.server.store.CredentialRecord;
import com.codeheadsystems.suitekey.server.store.InMemoryCredentialStore;
import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class AuthorizationFlowManagerTest {

  private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
  private static final Session SESSION = new Session("s1");
  private static final ClientCredentials CLIENT =
      new ClientCredentials("client-id", "client-secret", "https://app.example.com/auth/callback");

  @Mock private TokenEndpoint tokenEndpoint;

  private MutableClock clock;
  private StateTokenManager stateTokenManager;
  private InMemoryCredentialStore credentialStore;
  private AuthorizationFlowManager manager;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    stateTokenManager = new StateTokenManager(new InMemoryStateStore(), clock, Duration.ofSeconds(600));
    credentialStore = new InMemoryCredentialStore();
    manager = new AuthorizationFlowManager(stateTokenManager, credentialStore, tokenEndpoint, CLIENT,
        ProviderEndpoints.GOOGLE, clock);
  }

  @AfterEach
  void tearDown() {
    stateTokenManager.shutdown();
  }

  // ── Begin ────────────────────────────────────────────────────────────────

  @Test
  void beginAuthorization_buildsConsentUrl() {
    URI url = manager.beginAuthorization(SESSION, AuthorizationScope.setOf("B", "A"), null);

    assertThat(url.toString()).startsWith("https://accounts.google.com/o/oauth2/v2/auth?");
    Map<String, String> params = QueryParams.parse(url);
    assertThat(params)
        .containsEntry("client_id", "client-id")
        .containsEntry("redirect_uri", "https://app.example.com/auth/callback")
        .containsEntry("scope", "A B")
        .containsEntry("response_type", "code")
        .containsEntry("access_type", "offline")
        .containsEntry("include_granted_scopes", "true")
        .containsEntry("prompt", "consent")
        .containsKey("state");
    assertThat(url.toString()).doesNotContain("client-secret");
  }

  @Test
  void beginAuthorization_mergesPreviouslyGrantedScopes() {
    credentialStore.put("s1", record(AuthorizationScope.setOf("A", "B"), "rt"));

    URI url = manager.beginAuthorization(SESSION, AuthorizationScope.setOf("C"), null);

    assertThat(QueryParams.parse(url)).containsEntry("scope", "A B C");
  }

  // ── Complete ─────────────────────────────────────────────────────────────

  @Test
  void completeAuthorization_storesCredential() {
    String state = stateOf(manager.beginAuthorization(SESSION, AuthorizationScope.setOf("A"), "/sheets"));
    when(tokenEndpoint.exchangeCode("code-1"))
        .thenReturn(new TokenResponse("at", 3600L, "rt", "A", "Bearer", null));

    AuthorizationOutcome outcome = manager.completeAuthorization(SESSION, state, "code-1");

    assertThat(outcome.returnTarget()).isEqualTo("/sheets");
    CredentialRecord stored = credentialStore.get("s1").orElseThrow();
    assertThat(stored).isEqualTo(outcome.record());
    assertThat(stored.accessToken()).isEqualTo("at");
    assertThat(stored.refreshToken()).isEqualTo("rt");
    assertThat(stored.expiresAt()).isEqualTo(T0.plusSeconds(3600));
    assertThat(stored.grantedScopes()).isEqualTo(AuthorizationScope.setOf("A"));
  }

  @Test
  void completeAuthorization_providerOmitsScope_usesRequested() {
    String state = stateOf(manager.beginAuthorization(SESSION, AuthorizationScope.setOf("A", "B"), null));
    when(tokenEndpoint.exchangeCode("code-1"))
        .thenReturn(new TokenResponse("at", 3600L, "rt", null, "Bearer", null));

    AuthorizationOutcome outcome = manager.completeAuthorization(SESSION, state, "code-1");

    assertThat(outcome.record().grantedScopes()).isEqualTo(AuthorizationScope.setOf("A", "B"));
  }

  @Test
  void completeAuthorization_keepsPreviousScopesAndRefreshToken() {
    credentialStore.put("s1", record(AuthorizationScope.setOf("A", "B"), "old-rt"));
    String state = stateOf(manager.beginAuthorization(SESSION, AuthorizationScope.setOf("C"), null));
    when(tokenEndpoint.exchangeCode("code-2"))
        .thenReturn(new TokenResponse("at2", 3600L, null, "C", "Bearer", null));

    CredentialRecord record = manager.completeAuthorization(SESSION, state, "code-2").record();

    assertThat(record.grantedScopes()).isEqualTo(AuthorizationScope.setOf("A", "B", "C"));
    assertThat(record.refreshToken()).isEqualTo("old-rt");
    assertThat(record.accessToken()).isEqualTo("at2");
  }

  @Test
  void completeAuthorization_unknownState_isInvalid() {
    assertThatThrownBy(() -> manager.completeAuthorization(SESSION, "forged", "code"))
        .isInstanceOf(InvalidStateException.class)
        .hasCauseInstanceOf(UnknownStateException.class);
    verifyNoInteractions(tokenEndpoint);
  }

  @Test
  void completeAuthorization_replayedState_isInvalid() {
    String state = stateOf(manager.beginAuthorization(SESSION, AuthorizationScope.setOf("A"), null));
    when(tokenEndpoint.exchangeCode("code-1"))
        .thenReturn(new TokenResponse("at", 3600L, "rt", "A", "Bearer", null));
    manager.completeAuthorization(SESSION, state, "code-1");

    assertThatThrownBy(() -> manager.completeAuthorization(SESSION, state, "code-1"))
        .isInstanceOf(InvalidStateException.class)
        .hasCauseInstanceOf(ReplayedStateException.class);
  }

  @Test
  void completeAuthorization_expiredState_isInvalid() {
    String state = stateOf(manager.beginAuthorization(SESSION, AuthorizationScope.setOf("A"), null));
    clock.advance(Duration.ofSeconds(601));

    assertThatThrownBy(() -> manager.completeAuthorization(SESSION, state, "code"))
        .isInstanceOf(InvalidStateException.class)
        .hasCauseInstanceOf(ExpiredStateException.class);
    verifyNoInteractions(tokenEndpoint);
  }

  @Test
  void completeAuthorization_otherSession_isInvalidAndStoresNothing() {
    String state = stateOf(manager.beginAuthorization(SESSION, AuthorizationScope.setOf("A"), null));

    assertThatThrownBy(() -> manager.completeAuthorization(new Session("s2"), state, "victim-code"))
        .isInstanceOf(InvalidStateException.class)
        .hasCauseInstanceOf(ForeignStateException.class);
    verifyNoInteractions(tokenEndpoint);
    assertThat(credentialStore.get("s1")).isEmpty();
    assertThat(credentialStore.get("s2")).isEmpty();
    // The state is spent even though the callback was refused.
    assertThatThrownBy(() -> manager.completeAuthorization(SESSION, state, "code"))
        .isInstanceOf(InvalidStateException.class)
        .hasCauseInstanceOf(ReplayedStateException.class);
  }

  @Test
  void completeAuthorization_noSession_isInvalid() {
    String state = stateOf(manager.beginAuthorization(SESSION, AuthorizationScope.setOf("A"), null));

    assertThatThrownBy(() -> manager.completeAuthorization(null, state, "code"))
        .isInstanceOf(InvalidStateException.class)
        .hasCauseInstanceOf(ForeignStateException.class);
    verifyNoInteractions(tokenEndpoint);
  }

  @Test
  void completeAuthorization_exchangeRejected_failsAndConsumesState() {
    String state = stateOf(manager.beginAuthorization(SESSION, AuthorizationScope.setOf("A"), null));
    when(tokenEndpoint.exchangeCode("bad-code")).thenThrow(new ProviderRejectedException(400, "invalid_grant"));

    assertThatThrownBy(() -> manager.completeAuthorization(SESSION, state, "bad-code"))
        .isInstanceOf(ExchangeFailedException.class)
        .hasCauseInstanceOf(ProviderRejectedException.class);
    assertThat(credentialStore.get("s1")).isEmpty();
    assertThatThrownBy(() -> manager.completeAuthorization(SESSION, state, "bad-code"))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void completeAuthorization_exchangeUnavailable_fails() {
    String state = stateOf(manager.beginAuthorization(SESSION, AuthorizationScope.setOf("A"), null));
    when(tokenEndpoint.exchangeCode("code")).thenThrow(new ProviderUnavailableException("down", null));

    assertThatThrownBy(() -> manager.completeAuthorization(SESSION, state, "code"))
        .isInstanceOf(ExchangeFailedException.class);
  }

  @Test
  void completeAuthorization_providerError_failsWithoutExchange() {
    String state = stateOf(manager.beginAuthorization(SESSION, AuthorizationScope.setOf("A"), null));

    assertThatThrownBy(() -> manager.completeAuthorization(SESSION, state, null, "access_denied"))
        .isInstanceOf(ExchangeFailedException.class);
    verifyNoInteractions(tokenEndpoint);
    assertThatThrownBy(() -> manager.completeAuthorization(SESSION, state, "code"))
        .isInstanceOf(InvalidStateException.class);
  }

  @Test
  void completeAuthorization_missingCode_fails() {
    String state = stateOf(manager.beginAuthorization(SESSION, AuthorizationScope.setOf("A"), null));

    assertThatThrownBy(() -> manager.completeAuthorization(SESSION, state, " "))
        .isInstanceOf(ExchangeFailedException.class);
    verifyNoInteractions(tokenEndpoint);
  }

  // ── Sign out ─────────────────────────────────────────────────────────────

  @Test
  void signOut_deletesAndRevokesRefreshToken() {
    credentialStore.put("s1", record(AuthorizationScope.setOf("A"), "rt"));

    manager.signOut(SESSION);

    assertThat(credentialStore.get("s1")).isEmpty();
    verify(tokenEndpoint).revoke("rt");
  }

  @Test
  void signOut_revocationFailure_stillDeletes() {
    credentialStore.put("s1", record(AuthorizationScope.setOf("A"), null));
    doThrow(new ProviderUnavailableException("down", null)).when(tokenEndpoint).revoke("at");

    manager.signOut(SESSION);

    assertThat(credentialStore.get("s1")).isEmpty();
  }

  @Test
  void signOut_withoutCredential_doesNotCallProvider() {
    manager.signOut(SESSION);

    verify(tokenEndpoint, never()).revoke(anyString());
  }

  private static String stateOf(URI consentUrl) {
    return QueryParams.parse(consentUrl).get("state");
  }

  private static CredentialRecord record(Set<AuthorizationScope> scopes, String refreshToken) {
    return new CredentialRecord("s1", "at", refreshToken, T0.plusSeconds(3600), scopes);
  }
}
