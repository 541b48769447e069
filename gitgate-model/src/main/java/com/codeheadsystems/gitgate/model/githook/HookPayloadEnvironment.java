package com.codeheadsystems.gitgate.model.githook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Base64;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Moves a {@link HookPayload} across the process boundary between the serving process and the
 * hook process git spawns.
 * <p>
 * The payload travels as a single environment variable, {@value #ENV_PAYLOAD}, holding the
 * base64-encoded JSON form of the payload. The serving process adds the result of
 * {@link #toEnvironment(HookPayload)} to git's environment; the hook process calls
 * {@link #load(Map)} once at startup.
 */
@Singleton
public class HookPayloadEnvironment {

  /**
   * Name of the environment variable carrying the encoded payload.
   */
  public static final String ENV_PAYLOAD = "GITGATE_HOOK_PAYLOAD";

  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Hook payload environment.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public HookPayloadEnvironment(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Encodes the payload into the environment entries for a spawned git process.
   *
   * @param payload the payload
   * @return the environment entries to add
   */
  public Map<String, String> toEnvironment(final HookPayload payload) {
    try {
      byte[] json = objectMapper.writeValueAsBytes(payload);
      return Map.of(ENV_PAYLOAD, B64.encodeToString(json));
    } catch (JsonProcessingException e) {
      throw new HookPayloadException("Unable to encode hook payload", e);
    }
  }

  /**
   * Reconstructs the payload from the environment of the current process.
   *
   * @param environment the process environment
   * @return the payload
   * @throws HookPayloadException if the variable is missing, not base64, not valid JSON, or any
   *                              identity field is missing or malformed
   */
  public HookPayload load(final Map<String, String> environment) {
    String encoded = environment.get(ENV_PAYLOAD);
    if (encoded == null || encoded.isBlank()) {
      throw new HookPayloadException("Environment variable " + ENV_PAYLOAD + " is not set");
    }
    byte[] json;
    try {
      json = B64D.decode(encoded.trim());
    } catch (IllegalArgumentException e) {
      throw new HookPayloadException("Environment variable " + ENV_PAYLOAD + " is not valid base64", e);
    }
    HookPayload payload;
    try {
      payload = objectMapper.readValue(json, HookPayload.class);
    } catch (IOException e) {
      throw new HookPayloadException("Invalid hook payload: " + rootMessage(e), e);
    }
    if (payload == null) {
      throw new HookPayloadException("Invalid hook payload: empty");
    }
    return payload;
  }

  private static String rootMessage(Throwable e) {
    Throwable current = e;
    while (current.getCause() != null && current.getCause() != current) {
      current = current.getCause();
    }
    return current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
  }
}
