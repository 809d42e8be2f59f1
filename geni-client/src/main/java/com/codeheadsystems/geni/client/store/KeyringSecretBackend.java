package com.codeheadsystems.geni.client.store;

import com.codeheadsystems.geni.client.exceptions.SecretBackendException;
import com.github.javakeyring.Keyring;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the secret in the operating system credential store (macOS Keychain, Windows
 * Credential Manager, or the freedesktop Secret Service).
 * <p>
 * The keyring is opened per operation. A platform without a supported keyring fails every
 * call with {@link SecretBackendException}.
 */
public class KeyringSecretBackend implements SecretBackend {

  private static final Logger log = LoggerFactory.getLogger(KeyringSecretBackend.class);

  private final String service;
  private final String account;
  private final KeyringFactory keyringFactory;

  /**
   * Instantiates a new Keyring secret backend on the platform keyring.
   *
   * @param service the service name
   * @param account the account name
   */
  public KeyringSecretBackend(final String service, final String account) {
    this(service, account, Keyring::create);
  }

  /**
   * Instantiates a new Keyring secret backend.
   *
   * @param service        the service name
   * @param account        the account name
   * @param keyringFactory opens the keyring
   */
  public KeyringSecretBackend(final String service, final String account, final KeyringFactory keyringFactory) {
    log.info("KeyringSecretBackend({}/{})", service, account);
    this.service = service;
    this.account = account;
    this.keyringFactory = keyringFactory;
  }

  @Override
  public Optional<String> get() {
    try (Keyring keyring = keyringFactory.create()) {
      String value = keyring.getPassword(service, account);
      return (value == null || value.isEmpty()) ? Optional.empty() : Optional.of(value);
    } catch (Exception e) {
      throw new SecretBackendException("Keyring read failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void set(final String value) {
    try (Keyring keyring = keyringFactory.create()) {
      keyring.setPassword(service, account, value);
    } catch (Exception e) {
      throw new SecretBackendException("Keyring write failed: " + e.getMessage(), e);
    }
  }

  @Override
  public void delete() {
    try (Keyring keyring = keyringFactory.create()) {
      keyring.deletePassword(service, account);
    } catch (Exception e) {
      throw new SecretBackendException("Keyring delete failed: " + e.getMessage(), e);
    }
  }

  @Override
  public String name() {
    return "keyring";
  }

  /**
   * Opens a keyring.
   */
  @FunctionalInterface
  public interface KeyringFactory {
    /**
     * Create keyring.
     *
     * @return the keyring
     * @throws Exception if no keyring is available
     */
    Keyring create() throws Exception;
  }
}
