package com.codeheadsystems.gitgate.githook.exceptions;

/**
 * A bridge call to the serving process did not produce a usable response: the request could not
 * be sent, the server answered with an error status, or the body could not be read.
 */
public class GitHookAccessorException extends RuntimeException {

  /**
   * Instantiates a new Git hook accessor exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public GitHookAccessorException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
