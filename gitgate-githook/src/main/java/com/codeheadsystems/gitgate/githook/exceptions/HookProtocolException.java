package com.codeheadsystems.gitgate.githook.exceptions;

/**
 * Git handed the hook input that does not follow the hook protocol.
 */
public class HookProtocolException extends RuntimeException {

  /**
   * Instantiates a new Hook protocol exception.
   *
   * @param message the message
   */
  public HookProtocolException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Hook protocol exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public HookProtocolException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
