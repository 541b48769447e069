package com.codeheadsystems.gitgate.githook.accessor;

import com.codeheadsystems.gitgate.githook.config.GitHookClientConfig;
import com.codeheadsystems.gitgate.githook.exceptions.GitHookAccessorException;
import com.codeheadsystems.gitgate.model.githook.GitHookPaths;
import com.codeheadsystems.gitgate.model.githook.HookPayload;
import com.codeheadsystems.gitgate.model.githook.PostReceiveInput;
import com.codeheadsystems.gitgate.model.githook.PreReceiveInput;
import com.codeheadsystems.gitgate.model.githook.ServerHookOutput;
import com.codeheadsystems.gitgate.model.githook.UpdateInput;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the serving process's internal git hook endpoints.
 * <p>
 * Handles request serialization, HTTP dispatch, status-code checking, and response
 * deserialization for the three hook calls. Every request carries the payload's request id in
 * {@value GitHookPaths#REQUEST_ID_HEADER} and, when the payload has one, its access token as a
 * bearer credential.
 * <p>
 * Calls are single-shot. Nothing is retried: the server may already have evaluated policy or
 * fired webhooks for a call whose response was lost. Every failure is surfaced as a
 * {@link GitHookAccessorException}.
 */
@Singleton
public class GitHookAccessor {

  private static final Logger log = LoggerFactory.getLogger(GitHookAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final HookPayload payload;
  private final GitHookClientConfig config;

  /**
   * Instantiates a new Git hook accessor.
   *
   * @param httpClient   the http client, owned by the hook invocation
   * @param objectMapper the object mapper
   * @param payload      the payload of this hook invocation
   * @param config       the client config
   */
  @Inject
  public GitHookAccessor(final HttpClient httpClient,
                         final ObjectMapper objectMapper,
                         final HookPayload payload,
                         final GitHookClientConfig config) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.payload = payload;
    this.config = config;
  }

  /**
   * Asks the server whether the push may proceed, before any reference is moved.
   *
   * @param input the input
   * @return the server's verdict, or null if the server answered with a JSON null
   */
  public ServerHookOutput preReceive(final PreReceiveInput input) {
    log.debug("preReceive(repoId={}, refs={})", input.repoId(), input.refUpdates().size());
    return post(GitHookPaths.PRE_RECEIVE, input);
  }

  /**
   * Asks the server whether a single reference may be updated.
   *
   * @param input the input
   * @return the server's verdict, or null if the server answered with a JSON null
   */
  public ServerHookOutput update(final UpdateInput input) {
    log.debug("update(repoId={}, ref={})", input.repoId(), input.refUpdate().ref());
    return post(GitHookPaths.UPDATE, input);
  }

  /**
   * Notifies the server after all references were moved.
   *
   * @param input the input
   * @return the server's response, or null if the server answered with a JSON null
   */
  public ServerHookOutput postReceive(final PostReceiveInput input) {
    log.debug("postReceive(repoId={}, refs={})", input.repoId(), input.refUpdates().size());
    return post(GitHookPaths.POST_RECEIVE, input);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private ServerHookOutput post(String path, Object body) {
    URI uri = URI.create(payload.apiBaseUri() + path);
    HttpResponse<String> response;
    try {
      String requestBody = objectMapper.writeValueAsString(body);
      response = httpClient.send(buildRequest(uri, requestBody), HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new GitHookAccessorException("HTTP request failed for " + uri + ": " + describe(e), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new GitHookAccessorException("HTTP request interrupted for " + uri, e);
    }
    checkStatus(uri, response.statusCode());
    try {
      return objectMapper.readValue(response.body(), ServerHookOutput.class);
    } catch (JsonProcessingException e) {
      throw new GitHookAccessorException("Malformed response from " + uri, e);
    }
  }

  private HttpRequest buildRequest(URI uri, String requestBody) {
    try {
      HttpRequest.Builder builder = HttpRequest.newBuilder()
          .uri(uri)
          .timeout(config.requestTimeout())
          .header("Content-Type", "application/json")
          .header("Accept", "application/json")
          .header(GitHookPaths.REQUEST_ID_HEADER, payload.requestId())
          .POST(HttpRequest.BodyPublishers.ofString(requestBody));
      String accessToken = payload.accessToken();
      if (accessToken != null && !accessToken.isBlank()) {
        builder.header("Authorization", "Bearer " + accessToken);
      }
      return builder.build();
    } catch (IllegalArgumentException e) {
      throw new GitHookAccessorException("Cannot build HTTP request for " + uri + ": " + e.getMessage(), e);
    }
  }

  private void checkStatus(URI uri, int statusCode) {
    if (statusCode == 401 || statusCode == 403) {
      throw new GitHookAccessorException(
          "Server rejected the hook's credentials (HTTP " + statusCode + ") for " + uri, null);
    }
    if (statusCode < 200 || statusCode >= 300) {
      throw new GitHookAccessorException("Server returned HTTP " + statusCode + " for " + uri, null);
    }
  }

  private static String describe(IOException e) {
    return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
  }
}
