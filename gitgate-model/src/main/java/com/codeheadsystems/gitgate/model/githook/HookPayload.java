package com.codeheadsystems.gitgate.model.githook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.net.URI;

/**
 * Identity bundle the serving process hands to a hook process it spawns.
 * <p>
 * Created once when git is started for a push, passed through the environment, and read once by
 * the hook process at startup. The identity fields are what the hook presents to the serving
 * process, so a payload is only constructible when all of them are present and well formed.
 *
 * @param repoId      id of the repository being pushed to
 * @param principalId id of the principal performing the push
 * @param requestId   trace id of the request that started git; sent back on every hook call
 * @param apiBaseUrl  base address of the serving process's API
 * @param accessToken bearer credential the hook presents to the serving process, may be null
 * @param disabled    when true the hook allows the push without calling the serving process
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record HookPayload(
    @JsonProperty("repo_id") long repoId,
    @JsonProperty("principal_id") long principalId,
    @JsonProperty("request_id") String requestId,
    @JsonProperty("api_base_url") String apiBaseUrl,
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("disabled") boolean disabled) {

  /**
   * Validates the identity fields.
   */
  public HookPayload {
    if (repoId <= 0) {
      throw new IllegalArgumentException("Invalid repo_id: " + repoId);
    }
    if (principalId <= 0) {
      throw new IllegalArgumentException("Invalid principal_id: " + principalId);
    }
    if (requestId == null || requestId.isBlank()) {
      throw new IllegalArgumentException("Missing required field: request_id");
    }
    if (hasControlCharacter(requestId)) {
      throw new IllegalArgumentException("Invalid request_id: contains control characters");
    }
    if (accessToken != null && hasControlCharacter(accessToken)) {
      throw new IllegalArgumentException("Invalid access_token: contains control characters");
    }
    if (apiBaseUrl == null || apiBaseUrl.isBlank()) {
      throw new IllegalArgumentException("Missing required field: api_base_url");
    }
    URI uri;
    try {
      uri = URI.create(apiBaseUrl);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid api_base_url: " + apiBaseUrl, e);
    }
    if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
      throw new IllegalArgumentException("api_base_url must be an absolute http(s) address: " + apiBaseUrl);
    }
    if (uri.getHost() == null) {
      throw new IllegalArgumentException("api_base_url has no host: " + apiBaseUrl);
    }
  }

  // Both values are sent as HTTP header values.
  private static boolean hasControlCharacter(String value) {
    return value.chars().anyMatch(Character::isISOControl);
  }

  /**
   * Base address of the serving process's API with any trailing slash removed.
   *
   * @return the uri
   */
  public URI apiBaseUri() {
    String base = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
    return URI.create(base);
  }

  @Override
  public String toString() {
    return "HookPayload[repoId=" + repoId
        + ", principalId=" + principalId
        + ", requestId=" + requestId
        + ", apiBaseUrl=" + apiBaseUrl
        + ", accessToken=" + (accessToken == null ? "<none>" : "<redacted>")
        + ", disabled=" + disabled + "]";
  }
}
