package com.codeheadsystems.geni.client.store;

import com.codeheadsystems.geni.client.config.TokenStoreConfig;
import com.codeheadsystems.geni.client.exceptions.SecretBackendException;
import com.codeheadsystems.geni.client.exceptions.TokenStorageException;
import com.codeheadsystems.geni.client.model.AuthTokens;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists {@link AuthTokens} in the secure backend when one is configured and works, and in a
 * file otherwise.
 * <p>
 * Only one backend holds tokens at a time: a successful secure write removes the file copy,
 * and a fallback write removes whatever the secure backend still holds. Reads try the secure
 * backend first and fall through to the file when it fails or is empty.
 */
@Singleton
public class TokenStore {

  private static final Logger log = LoggerFactory.getLogger(TokenStore.class);

  private final SecretBackend secureBackend;
  private final SecretBackend fileBackend;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Token store over the platform keyring and the configured token file.
   *
   * @param config       the config
   * @param objectMapper the object mapper
   */
  @Inject
  public TokenStore(final TokenStoreConfig config, final ObjectMapper objectMapper) {
    this(config.useKeyring()
            ? new KeyringSecretBackend(TokenStoreConfig.KEYRING_SERVICE, TokenStoreConfig.KEYRING_ACCOUNT)
            : null,
        new FileSecretBackend(config.tokenFile()),
        objectMapper);
  }

  /**
   * Instantiates a new Token store.
   *
   * @param secureBackend the preferred backend, or null to use only the file
   * @param fileBackend   the fallback backend
   * @param objectMapper  the object mapper
   */
  public TokenStore(final SecretBackend secureBackend,
                    final SecretBackend fileBackend,
                    final ObjectMapper objectMapper) {
    log.info("TokenStore(secure={}, fallback={})",
        secureBackend == null ? "none" : secureBackend.name(), fileBackend.name());
    this.secureBackend = secureBackend;
    this.fileBackend = fileBackend;
    this.objectMapper = objectMapper;
  }

  /**
   * Stores the tokens, replacing any earlier ones.
   *
   * @param tokens the tokens
   * @throws TokenStorageException if no backend accepted the tokens
   */
  public void store(final AuthTokens tokens) {
    log.debug("store(userId={})", tokens.userId());
    String json = serialize(tokens);
    if (secureBackend != null) {
      try {
        secureBackend.set(json);
        deleteQuietly(fileBackend);
        return;
      } catch (SecretBackendException e) {
        log.warn("Unable to store tokens in {}, using {}: {}", secureBackend.name(), fileBackend.name(),
            e.getMessage());
        deleteQuietly(secureBackend);
      }
    }
    try {
      fileBackend.set(json);
    } catch (SecretBackendException e) {
      throw new TokenStorageException("Unable to store tokens", e);
    }
  }

  /**
   * Loads the stored tokens. Unreadable data is logged and treated as absent.
   *
   * @return the tokens, or empty
   */
  public Optional<AuthTokens> load() {
    log.debug("load()");
    Optional<String> json = Optional.empty();
    if (secureBackend != null) {
      json = read(secureBackend);
    }
    if (json.isEmpty()) {
      json = read(fileBackend);
    }
    return json.flatMap(this::parse);
  }

  /**
   * Removes tokens from every backend.
   *
   * @throws TokenStorageException if the file copy could not be removed
   */
  public void clear() {
    log.debug("clear()");
    if (secureBackend != null) {
      deleteQuietly(secureBackend);
    }
    try {
      fileBackend.delete();
    } catch (SecretBackendException e) {
      throw new TokenStorageException("Unable to remove stored tokens", e);
    }
  }

  private Optional<String> read(SecretBackend backend) {
    try {
      return backend.get();
    } catch (SecretBackendException e) {
      log.warn("Unable to read tokens from {}: {}", backend.name(), e.getMessage());
      return Optional.empty();
    }
  }

  private Optional<AuthTokens> parse(String json) {
    try {
      StoredTokens stored = objectMapper.readValue(json, StoredTokens.class);
      if (stored == null) {
        log.error("Stored tokens are empty");
        return Optional.empty();
      }
      return Optional.of(stored.authTokens());
    } catch (JsonProcessingException | IllegalArgumentException e) {
      log.error("Failed to parse stored tokens: {}", e.getMessage());
      return Optional.empty();
    }
  }

  private String serialize(AuthTokens tokens) {
    try {
      return objectMapper.writeValueAsString(new StoredTokens(tokens));
    } catch (JsonProcessingException e) {
      throw new TokenStorageException("Unable to serialize tokens", e);
    }
  }

  private static void deleteQuietly(SecretBackend backend) {
    try {
      backend.delete();
    } catch (SecretBackendException e) {
      log.debug("Unable to remove tokens from {}: {}", backend.name(), e.getMessage());
    }
  }
}
