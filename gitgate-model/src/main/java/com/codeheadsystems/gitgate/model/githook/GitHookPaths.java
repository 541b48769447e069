package com.codeheadsystems.gitgate.model.githook;

/**
 * Routes and headers shared by the hook bridge and the serving process.
 */
public final class GitHookPaths {

  /**
   * Base path of the internal git hook endpoints, relative to the API base address.
   */
  public static final String BASE = "/v1/internal/git-hooks";
  public static final String PRE_RECEIVE = BASE + "/pre-receive";
  public static final String UPDATE = BASE + "/update";
  public static final String POST_RECEIVE = BASE + "/post-receive";

  /**
   * Correlation header joining a hook call with the git invocation that caused it.
   */
  public static final String REQUEST_ID_HEADER = "X-Request-Id";

  private GitHookPaths() {
  }
}
