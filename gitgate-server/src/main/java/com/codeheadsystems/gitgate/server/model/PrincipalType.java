package com.codeheadsystems.gitgate.server.model;

/**
 * The closed set of principal classes that can authenticate.
 */
public enum PrincipalType {
  USER,
  SERVICE_ACCOUNT
}
