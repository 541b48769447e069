package com.codeheadsystems.gitgate.model.githook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Optional;

/**
 * Verdict returned by the serving process for any of the three bridge calls.
 * <p>
 * An absent {@code error} allows the push. A present {@code error} blocks it, and the message is
 * shown verbatim to the pushing client.
 *
 * @param error the rejection message, or {@code null} to allow
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ServerHookOutput(@JsonProperty("error") String error) {

  /**
   * Allowing verdict.
   *
   * @return the server hook output
   */
  public static ServerHookOutput allow() {
    return new ServerHookOutput(null);
  }

  /**
   * Blocking verdict.
   *
   * @param message the message surfaced to the pushing client
   * @return the server hook output
   */
  public static ServerHookOutput reject(String message) {
    return new ServerHookOutput(message);
  }

  /**
   * The rejection message, if the push was blocked.
   *
   * @return the optional rejection message
   */
  public Optional<String> rejection() {
    return Optional.ofNullable(error);
  }
}
