package com.codeheadsystems.suitekey.dropwizard;

import com.codeheadsystems.suitekey.server.state.InMemoryStateStore;
import com.codeheadsystems.suitekey.server.store.InMemoryCredentialStore;
import io.dropwizard.core.Application;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;

/**
 * Minimal Dropwizard application used only in integration tests.
 * Not part of the library's public API.
 */
public class SuitekeyApplication extends Application<SuitekeyConfiguration> {

  /**
   * Token endpoint shared with the tests so they can inspect revocations.
   */
  public static final FakeTokenEndpoint TOKEN_ENDPOINT = new FakeTokenEndpoint();

  /**
   * State store shared with the tests so they can fill it up.
   */
  public static final InMemoryStateStore STATE_STORE = new InMemoryStateStore();

  /**
   * The entry point of application.
   *
   * @param args the input arguments
   * @throws Exception the exception
   */
  public static void main(String[] args) throws Exception {
    new SuitekeyApplication().run(args);
  }

  @Override
  public String getName() {
    return "suitekey-test";
  }

  @Override
  public void initialize(Bootstrap<SuitekeyConfiguration> bootstrap) {
    bootstrap.addBundle(new SuitekeyBundle<>(new InMemoryCredentialStore(), STATE_STORE,
        TOKEN_ENDPOINT));
  }

  @Override
  public void run(SuitekeyConfiguration configuration, Environment environment) {
    // Everything is registered by the bundle.
  }
}
