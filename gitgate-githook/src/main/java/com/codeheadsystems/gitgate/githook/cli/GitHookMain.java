package com.codeheadsystems.gitgate.githook.cli;

import com.codeheadsystems.gitgate.githook.config.GitHookClientConfig;
import com.codeheadsystems.gitgate.githook.outcome.HookOutcome;
import com.codeheadsystems.gitgate.model.githook.HookPayloadException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Map;
import java.util.Optional;

/**
 * Process entry point git runs for each hook.
 *
 * <pre>
 * Usage:
 *   gitgate-githook pre-receive            (reference updates on stdin)
 *   gitgate-githook update &lt;ref&gt; &lt;old&gt; &lt;new&gt;
 *   gitgate-githook post-receive           (reference updates on stdin)
 * </pre>
 *
 * <p>The serving process installs thin hook scripts that exec this entry point, and passes the
 * hook payload in the {@code GITGATE_HOOK_PAYLOAD} environment variable. Anything written to
 * stderr is relayed by git to the pushing client. Exit code 0 allows the push.
 */
public class GitHookMain {

  /**
   * Main entry point.
   *
   * @param args command-line arguments
   */
  public static void main(String[] args) {
    int exitCode = run(args, System.getenv(), System.in, System.err, GitHookClientConfig.defaults());
    System.exit(exitCode);
  }

  /**
   * Runs one hook invocation and returns the process exit code.
   *
   * @param args        command-line arguments
   * @param environment the process environment
   * @param stdin       the process standard input
   * @param stderr      the stream git relays to the pushing client
   * @param config      the client config
   * @return the exit code
   */
  static int run(String[] args, Map<String, String> environment, InputStream stdin,
                 PrintStream stderr, GitHookClientConfig config) {
    Optional<HookKind> kind = args.length == 0 ? Optional.empty() : HookKind.fromHookName(args[0]);
    if (kind.isEmpty()) {
      return usage(stderr);
    }
    if (kind.get() == HookKind.UPDATE && args.length != 4) {
      return usage(stderr);
    }

    GitHookCli cli;
    try {
      cli = GitHookCli.fromEnvironment(environment, config);
    } catch (HookPayloadException e) {
      stderr.println("failed to load hook payload: " + e.getMessage());
      return HookOutcome.Status.FAILED.exitCode();
    }

    HookOutcome outcome = switch (kind.get()) {
      case PRE_RECEIVE -> cli.preReceive(stdin);
      case UPDATE -> cli.update(args[1], args[2], args[3]);
      case POST_RECEIVE -> cli.postReceive(stdin);
    };
    outcome.userMessage().ifPresent(stderr::println);
    stderr.flush();
    return outcome.exitCode();
  }

  private static int usage(PrintStream stderr) {
    stderr.println("Usage: gitgate-githook <pre-receive|update|post-receive> [args]");
    stderr.println();
    stderr.println("  update <ref-name> <old-sha> <new-sha>");
    return HookOutcome.Status.FAILED.exitCode();
  }
}
