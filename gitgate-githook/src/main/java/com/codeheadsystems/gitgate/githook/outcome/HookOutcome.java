package com.codeheadsystems.gitgate.githook.outcome;

import java.util.Optional;

/**
 * What the hook process reports back to git.
 *
 * @param status  the kind of outcome
 * @param message text for the pushing client, or null when there is nothing to say
 */
public record HookOutcome(Status status, String message) {

  /**
   * Kind of outcome, each with its own process exit code. Git only distinguishes zero from
   * non-zero; the separate non-zero codes let operators tell a policy rejection from a failure.
   */
  public enum Status {
    ALLOWED(0),
    REJECTED(1),
    FAILED(2);

    private final int exitCode;

    Status(int exitCode) {
      this.exitCode = exitCode;
    }

    public int exitCode() {
      return exitCode;
    }
  }

  public static HookOutcome allowed() {
    return new HookOutcome(Status.ALLOWED, null);
  }

  public static HookOutcome rejected(String message) {
    return new HookOutcome(Status.REJECTED, message);
  }

  public static HookOutcome failed(String message) {
    return new HookOutcome(Status.FAILED, message);
  }

  public int exitCode() {
    return status.exitCode();
  }

  public boolean isAllowed() {
    return status == Status.ALLOWED;
  }

  public Optional<String> userMessage() {
    return Optional.ofNullable(message);
  }
}
