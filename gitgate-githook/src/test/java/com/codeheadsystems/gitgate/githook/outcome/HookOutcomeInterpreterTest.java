package com.codeheadsystems.gitgate.githook.outcome;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.gitgate.githook.exceptions.GitHookAccessorException;
import com.codeheadsystems.gitgate.githook.exceptions.HookProtocolException;
import com.codeheadsystems.gitgate.model.githook.ServerHookOutput;
import java.net.ConnectException;
import org.junit.jupiter.api.Test;

class HookOutcomeInterpreterTest {

  private final HookOutcomeInterpreter interpreter = new HookOutcomeInterpreter();

  @Test
  void resolve_noError_allows() {
    HookOutcome outcome = interpreter.resolve(ServerHookOutput.allow(), null);

    assertThat(outcome.isAllowed()).isTrue();
    assertThat(outcome.exitCode()).isZero();
    assertThat(outcome.userMessage()).isEmpty();
  }

  @Test
  void resolve_serverRejection_relaysMessage() {
    HookOutcome outcome = interpreter.resolve(ServerHookOutput.reject("branch main is protected"), null);

    assertThat(outcome.status()).isEqualTo(HookOutcome.Status.REJECTED);
    assertThat(outcome.exitCode()).isEqualTo(1);
    assertThat(outcome.userMessage()).contains("branch main is protected");
  }

  @Test
  void resolve_blankRejection_usesDefaultMessage() {
    HookOutcome outcome = interpreter.resolve(new ServerHookOutput("  "), null);

    assertThat(outcome.status()).isEqualTo(HookOutcome.Status.REJECTED);
    assertThat(outcome.userMessage()).contains(HookOutcomeInterpreter.DEFAULT_REJECTION);
  }

  @Test
  void resolve_transportFailure_failsWithDistinctMessage() {
    GitHookAccessorException error = new GitHookAccessorException(
        "HTTP request failed for http://localhost:1/v1/internal/git-hooks/pre-receive: connection refused",
        new ConnectException("connection refused"));

    HookOutcome outcome = interpreter.resolve(null, error);

    assertThat(outcome.status()).isEqualTo(HookOutcome.Status.FAILED);
    assertThat(outcome.exitCode()).isEqualTo(2);
    assertThat(outcome.userMessage()).hasValueSatisfying(message -> {
      assertThat(message).startsWith(HookOutcomeInterpreter.SERVER_ERROR_PREFIX);
      assertThat(message).contains("connection refused");
    });
  }

  @Test
  void resolve_errorWinsOverOutput() {
    HookOutcome outcome = interpreter.resolve(ServerHookOutput.allow(),
        new GitHookAccessorException("boom", null));

    assertThat(outcome.status()).isEqualTo(HookOutcome.Status.FAILED);
  }

  @Test
  void resolve_nullOutput_fails() {
    HookOutcome outcome = interpreter.resolve(null, null);

    assertThat(outcome.status()).isEqualTo(HookOutcome.Status.FAILED);
    assertThat(outcome.userMessage()).contains(HookOutcomeInterpreter.EMPTY_OUTPUT);
  }

  @Test
  void invalidInput_failsWithoutServerPrefix() {
    HookOutcome outcome = interpreter.invalidInput(new HookProtocolException("bad line"));

    assertThat(outcome.exitCode()).isEqualTo(2);
    assertThat(outcome.userMessage()).contains("invalid hook input: bad line");
  }
}
