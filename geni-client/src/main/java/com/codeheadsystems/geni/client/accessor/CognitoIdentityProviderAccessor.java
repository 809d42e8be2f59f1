package com.codeheadsystems.geni.client.accessor;

import com.codeheadsystems.geni.client.config.IdentityProviderConfig;
import com.codeheadsystems.geni.client.exceptions.IdentityProviderAccessorException;
import com.codeheadsystems.geni.client.exceptions.IdentityProviderException;
import com.codeheadsystems.geni.client.exceptions.MalformedResponseException;
import com.codeheadsystems.geni.client.model.provider.AuthChallengeResponse;
import com.codeheadsystems.geni.client.model.provider.InitiateAuthRequest;
import com.codeheadsystems.geni.client.model.provider.ProviderErrorResponse;
import com.codeheadsystems.geni.client.model.provider.RespondToAuthChallengeRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the Cognito identity provider JSON API.
 * <p>
 * Every operation is a {@code POST} to the regional endpoint with the operation named in the
 * {@code X-Amz-Target} header. Calls are unauthenticated: the app client has no secret.
 * <p>
 * Error responses are surfaced as {@link IdentityProviderException} carrying the provider's
 * error type. I/O errors, timeouts and interruptions are wrapped in
 * {@link IdentityProviderAccessorException}; a success body that cannot be read raises
 * {@link MalformedResponseException}.
 */
@Singleton
public class CognitoIdentityProviderAccessor {

  static final String CONTENT_TYPE = "application/x-amz-json-1.1";
  static final String TARGET_PREFIX = "AWSCognitoIdentityProviderService.";

  private static final Logger log = LoggerFactory.getLogger(CognitoIdentityProviderAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final IdentityProviderConfig config;

  /**
   * Instantiates a new Cognito identity provider accessor.
   *
   * @param httpClient   the http client
   * @param objectMapper the object mapper
   * @param config       the identity provider config
   */
  @Inject
  public CognitoIdentityProviderAccessor(final HttpClient httpClient,
                                         final ObjectMapper objectMapper,
                                         final IdentityProviderConfig config) {
    log.info("CognitoIdentityProviderAccessor()");
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.config = config;
  }

  /**
   * Starts an authentication flow, either SRP login or token refresh.
   *
   * @param request the request
   * @return the challenge or tokens
   */
  public AuthChallengeResponse initiateAuth(final InitiateAuthRequest request) {
    log.debug("initiateAuth(authFlow={})", request.authFlow());
    return post("InitiateAuth", request);
  }

  /**
   * Answers a challenge.
   *
   * @param request the request
   * @return the next challenge or tokens
   */
  public AuthChallengeResponse respondToAuthChallenge(final RespondToAuthChallengeRequest request) {
    log.debug("respondToAuthChallenge(challengeName={})", request.challengeName());
    return post("RespondToAuthChallenge", request);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private AuthChallengeResponse post(String operation, Object body) {
    String responseBody;
    try {
      String requestBody = objectMapper.writeValueAsString(body);
      HttpRequest request = HttpRequest.newBuilder()
          .uri(config.endpoint())
          .timeout(config.requestTimeout())
          .header("Content-Type", CONTENT_TYPE)
          .header("X-Amz-Target", TARGET_PREFIX + operation)
          .POST(HttpRequest.BodyPublishers.ofString(requestBody))
          .build();
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      checkStatus(operation, response);
      responseBody = response.body();
    } catch (IOException e) {
      throw new IdentityProviderAccessorException(operation + " request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IdentityProviderAccessorException(operation + " request interrupted", e);
    }
    return readResponse(operation, responseBody);
  }

  private AuthChallengeResponse readResponse(String operation, String body) {
    try {
      AuthChallengeResponse response = body == null
          ? null
          : objectMapper.readValue(body, AuthChallengeResponse.class);
      if (response == null) {
        throw new MalformedResponseException(operation + " returned an empty body", null);
      }
      return response;
    } catch (JsonProcessingException e) {
      throw new MalformedResponseException(operation + " returned an unreadable body", e);
    }
  }

  private void checkStatus(String operation, HttpResponse<String> response) {
    int statusCode = response.statusCode();
    if (statusCode < 400) {
      return;
    }
    ProviderErrorResponse error = readError(response.body());
    log.debug("{} failed: status={}, type={}", operation, statusCode, error.shortType());
    String message = error.message() == null
        ? "Identity provider returned HTTP " + statusCode
        : error.message();
    throw new IdentityProviderException(error.shortType(), message, statusCode);
  }

  private ProviderErrorResponse readError(String body) {
    if (body == null || body.isBlank()) {
      return new ProviderErrorResponse(null, null);
    }
    try {
      ProviderErrorResponse error = objectMapper.readValue(body, ProviderErrorResponse.class);
      return error == null ? new ProviderErrorResponse(null, null) : error;
    } catch (JsonProcessingException e) {
      log.debug("Unreadable error body: {}", e.getOriginalMessage());
      return new ProviderErrorResponse(null, null);
    }
  }
}
