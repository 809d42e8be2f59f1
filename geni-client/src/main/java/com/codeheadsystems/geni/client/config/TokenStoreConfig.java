package com.codeheadsystems.geni.client.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Where tokens are kept.
 *
 * @param configDirectory the directory holding the fallback token file
 * @param useKeyring      whether the OS keyring is tried before the file
 */
public record TokenStoreConfig(Path configDirectory, boolean useKeyring) {

  /**
   * The keyring service name.
   */
  public static final String KEYRING_SERVICE = "geniable";
  /**
   * The keyring account name.
   */
  public static final String KEYRING_ACCOUNT = "tokens";
  /**
   * The fallback token file name inside {@link #configDirectory()}.
   */
  public static final String TOKEN_FILE_NAME = "tokens.json";

  /**
   * Validates the config.
   */
  public TokenStoreConfig {
    if (configDirectory == null) {
      throw new IllegalArgumentException("configDirectory must be set");
    }
  }

  /**
   * {@code ~/.geniable} with the keyring enabled.
   *
   * @return the token store config
   */
  public static TokenStoreConfig defaults() {
    return new TokenStoreConfig(defaultDirectory(), true);
  }

  /**
   * {@code ~/.geniable}.
   *
   * @return the default config directory
   */
  public static Path defaultDirectory() {
    return Paths.get(System.getProperty("user.home"), ".geniable");
  }

  /**
   * Token file path.
   *
   * @return the fallback token file
   */
  public Path tokenFile() {
    return configDirectory.resolve(TOKEN_FILE_NAME);
  }

  /**
   * A copy of this config with the keyring turned on or off.
   *
   * @param enabled whether to use the keyring
   * @return the token store config
   */
  public TokenStoreConfig withKeyring(boolean enabled) {
    return new TokenStoreConfig(configDirectory, enabled);
  }
}
