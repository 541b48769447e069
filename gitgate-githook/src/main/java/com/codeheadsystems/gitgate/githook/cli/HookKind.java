package com.codeheadsystems.gitgate.githook.cli;

import java.util.Optional;

/**
 * The git hooks this process can act as.
 */
public enum HookKind {
  PRE_RECEIVE("pre-receive"),
  UPDATE("update"),
  POST_RECEIVE("post-receive");

  private final String hookName;

  HookKind(String hookName) {
    this.hookName = hookName;
  }

  /**
   * The name git uses for the hook.
   *
   * @return the string
   */
  public String hookName() {
    return hookName;
  }

  /**
   * Looks up a hook by git's name for it.
   *
   * @param name the name
   * @return the hook kind, or empty
   */
  public static Optional<HookKind> fromHookName(String name) {
    for (HookKind kind : values()) {
      if (kind.hookName.equals(name)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
