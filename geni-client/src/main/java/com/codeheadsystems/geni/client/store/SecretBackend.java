package com.codeheadsystems.geni.client.store;

import com.codeheadsystems.geni.client.exceptions.SecretBackendException;
import java.util.Optional;

/**
 * A place that holds a single secret string.
 */
public interface SecretBackend {

  /**
   * Reads the secret.
   *
   * @return the secret, or empty if none is stored
   * @throws SecretBackendException if the backend cannot be read
   */
  Optional<String> get();

  /**
   * Replaces the secret.
   *
   * @param value the secret
   * @throws SecretBackendException if the backend cannot be written
   */
  void set(String value);

  /**
   * Removes the secret. Removing an absent secret is not an error.
   *
   * @throws SecretBackendException if the backend cannot be written
   */
  void delete();

  /**
   * Name used in log messages.
   *
   * @return the name
   */
  String name();
}
