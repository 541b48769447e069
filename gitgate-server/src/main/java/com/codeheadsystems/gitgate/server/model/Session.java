package com.codeheadsystems.gitgate.server.model;

/**
 * Request-scoped result of a successful authentication. Never persisted.
 *
 * @param principal the authenticated principal
 * @param metadata  details of the token the request was authenticated with
 */
public record Session(Principal principal, TokenMetadata metadata) {
}
