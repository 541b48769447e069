package com.codeheadsystems.gitgate.githook.outcome;

import com.codeheadsystems.gitgate.model.githook.ServerHookOutput;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the result of a bridge call into the outcome git acts on.
 * <p>
 * Never permissive on ambiguous input: only a received response without an error allows the push.
 */
@Singleton
public class HookOutcomeInterpreter {

  private static final Logger log = LoggerFactory.getLogger(HookOutcomeInterpreter.class);

  static final String SERVER_ERROR_PREFIX = "an error occurred when calling the server: ";
  static final String EMPTY_OUTPUT = "the server returned an empty output";
  static final String DEFAULT_REJECTION = "push rejected by server";
  static final String INVALID_INPUT_PREFIX = "invalid hook input: ";

  /**
   * Resolves a bridge call result.
   *
   * @param output the server's response, null if none was received
   * @param error  the failure of the call, null if it completed
   * @return the hook outcome
   */
  public HookOutcome resolve(final ServerHookOutput output, final Exception error) {
    if (error != null) {
      log.debug("Hook call failed", error);
      return HookOutcome.failed(SERVER_ERROR_PREFIX + error.getMessage());
    }
    if (output == null) {
      return HookOutcome.failed(EMPTY_OUTPUT);
    }
    if (output.error() != null) {
      String message = output.error().isBlank() ? DEFAULT_REJECTION : output.error();
      return HookOutcome.rejected(message);
    }
    return HookOutcome.allowed();
  }

  /**
   * Outcome for input from git that could not be parsed. No call was made.
   *
   * @param error the protocol failure
   * @return the hook outcome
   */
  public HookOutcome invalidInput(final Exception error) {
    return HookOutcome.failed(INVALID_INPUT_PREFIX + error.getMessage());
  }
}
