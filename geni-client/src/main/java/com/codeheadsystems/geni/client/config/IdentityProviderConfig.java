package com.codeheadsystems.geni.client.config;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * Connection settings for the Cognito user pool.
 * <p>
 * Use {@link #fromEnvironment()} in production. Each value can be overridden through
 * {@code GENI_USER_POOL_ID}, {@code GENI_CLIENT_ID} and {@code GENI_REGION}; the endpoint is
 * derived from the region.
 *
 * @param userPoolId     the user pool id, e.g. {@code ap-southeast-2_5OWr5yHu8}
 * @param clientId       the app client id (public client, no secret)
 * @param region         the AWS region of the pool
 * @param endpoint       the identity provider endpoint
 * @param requestTimeout the per-request timeout
 */
public record IdentityProviderConfig(String userPoolId,
                                     String clientId,
                                     String region,
                                     URI endpoint,
                                     Duration requestTimeout) {

  /**
   * The default user pool id.
   */
  public static final String DEFAULT_USER_POOL_ID = "ap-southeast-2_5OWr5yHu8";
  /**
   * The default app client id.
   */
  public static final String DEFAULT_CLIENT_ID = "3936nngb9i12t5ei6rjn9fblgc";
  /**
   * The default region.
   */
  public static final String DEFAULT_REGION = "ap-southeast-2";
  /**
   * The default request timeout.
   */
  public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

  static final String USER_POOL_ID_VARIABLE = "GENI_USER_POOL_ID";
  static final String CLIENT_ID_VARIABLE = "GENI_CLIENT_ID";
  static final String REGION_VARIABLE = "GENI_REGION";

  /**
   * Validates the config.
   */
  public IdentityProviderConfig {
    requireValue(userPoolId, "userPoolId");
    requireValue(clientId, "clientId");
    requireValue(region, "region");
    if (endpoint == null) {
      throw new IllegalArgumentException("endpoint must be set");
    }
    if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
  }

  /**
   * Builds a config for the given pool with the default endpoint and timeout.
   *
   * @param userPoolId the user pool id
   * @param clientId   the client id
   * @param region     the region
   * @return the identity provider config
   */
  public static IdentityProviderConfig of(String userPoolId, String clientId, String region) {
    return new IdentityProviderConfig(userPoolId, clientId, region, endpointFor(region),
        DEFAULT_REQUEST_TIMEOUT);
  }

  /**
   * Reads the process environment, falling back to the built-in pool.
   *
   * @return the identity provider config
   */
  public static IdentityProviderConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  /**
   * Resolves each value from the given variables, falling back to the built-in pool.
   *
   * @param environment the environment variables
   * @return the identity provider config
   */
  public static IdentityProviderConfig fromEnvironment(Map<String, String> environment) {
    return of(
        valueOrDefault(environment.get(USER_POOL_ID_VARIABLE), DEFAULT_USER_POOL_ID),
        valueOrDefault(environment.get(CLIENT_ID_VARIABLE), DEFAULT_CLIENT_ID),
        valueOrDefault(environment.get(REGION_VARIABLE), DEFAULT_REGION));
  }

  /**
   * The public Cognito endpoint for a region.
   *
   * @param region the region
   * @return the endpoint
   */
  public static URI endpointFor(String region) {
    requireValue(region, "region");
    return URI.create("https://cognito-idp." + region + ".amazonaws.com/");
  }

  private static String valueOrDefault(String value, String defaultValue) {
    return (value == null || value.isBlank()) ? defaultValue : value.trim();
  }

  private static void requireValue(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " must be set");
    }
  }
}
