package com.codeheadsystems.gitgate.githook.config;

import java.time.Duration;

/**
 * Timeouts for the hook process's calls to the serving process.
 * <p>
 * There is no retry setting: each hook makes exactly one call, and a call that times out blocks
 * the push.
 *
 * @param connectTimeout time allowed to open the connection
 * @param requestTimeout time allowed for the whole request, including the server's decision
 */
public record GitHookClientConfig(Duration connectTimeout, Duration requestTimeout) {

  public GitHookClientConfig {
    if (connectTimeout == null || connectTimeout.isNegative() || connectTimeout.isZero()) {
      throw new IllegalArgumentException("connectTimeout must be positive");
    }
    if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
  }

  /**
   * Default config: 10 second connect timeout, 60 second request timeout.
   *
   * @return the git hook client config
   */
  public static GitHookClientConfig defaults() {
    return new GitHookClientConfig(Duration.ofSeconds(10), Duration.ofSeconds(60));
  }
}
