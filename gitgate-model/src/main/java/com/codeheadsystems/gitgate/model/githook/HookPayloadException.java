package com.codeheadsystems.gitgate.model.githook;

/**
 * Raised when a hook process cannot reconstruct its {@link HookPayload} from the environment.
 * The hook must abort without contacting the serving process.
 */
public class HookPayloadException extends RuntimeException {

  /**
   * Instantiates a new Hook payload exception.
   *
   * @param message the message
   */
  public HookPayloadException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Hook payload exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public HookPayloadException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
