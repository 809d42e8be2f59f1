package com.codeheadsystems.geni.client.store;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Non-persistent backend for tests and for callers that must not touch the disk.
 */
public class InMemorySecretBackend implements SecretBackend {

  private final AtomicReference<String> secret = new AtomicReference<>();

  @Override
  public Optional<String> get() {
    return Optional.ofNullable(secret.get());
  }

  @Override
  public void set(final String value) {
    secret.set(value);
  }

  @Override
  public void delete() {
    secret.set(null);
  }

  @Override
  public String name() {
    return "memory";
  }
}
