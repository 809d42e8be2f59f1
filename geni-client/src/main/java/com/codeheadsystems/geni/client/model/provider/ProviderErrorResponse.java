package com.codeheadsystems.geni.client.model.provider;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Error body returned with a 4xx or 5xx status.
 *
 * @param type    the qualified error type, e.g. {@code com.amazonaws.cognito#NotAuthorizedException}
 * @param message the message
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderErrorResponse(
    @JsonProperty("__type") String type,
    @JsonProperty("message") @JsonAlias("Message") String message) {

  /**
   * The error type after the last {@code #}, or {@code Unknown}.
   *
   * @return the short type
   */
  public String shortType() {
    if (type == null || type.isBlank()) {
      return "Unknown";
    }
    return type.substring(type.lastIndexOf('#') + 1);
  }
}
