package com.codeheadsystems.gitgate.githook.cli;

import com.codeheadsystems.gitgate.githook.accessor.GitHookAccessor;
import com.codeheadsystems.gitgate.githook.codec.RefUpdateCodec;
import com.codeheadsystems.gitgate.githook.config.GitHookClientConfig;
import com.codeheadsystems.gitgate.githook.exceptions.GitHookAccessorException;
import com.codeheadsystems.gitgate.githook.exceptions.HookProtocolException;
import com.codeheadsystems.gitgate.githook.outcome.HookOutcome;
import com.codeheadsystems.gitgate.githook.outcome.HookOutcomeInterpreter;
import com.codeheadsystems.gitgate.model.githook.HookPayload;
import com.codeheadsystems.gitgate.model.githook.HookPayloadEnvironment;
import com.codeheadsystems.gitgate.model.githook.PostReceiveInput;
import com.codeheadsystems.gitgate.model.githook.PreReceiveInput;
import com.codeheadsystems.gitgate.model.githook.ReferenceUpdate;
import com.codeheadsystems.gitgate.model.githook.ServerHookOutput;
import com.codeheadsystems.gitgate.model.githook.UpdateInput;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One git hook invocation: reads git's input, makes the matching bridge call, and interprets
 * the verdict.
 * <p>
 * Instances are built once per process from the environment via
 * {@link #fromEnvironment(Map, GitHookClientConfig)}; the environment is not read again.
 */
public class GitHookCli {

  private static final Logger log = LoggerFactory.getLogger(GitHookCli.class);

  private final HookPayload payload;
  private final GitHookAccessor accessor;
  private final HookOutcomeInterpreter interpreter;

  /**
   * Instantiates a new Git hook cli.
   *
   * @param payload     the payload
   * @param accessor    the accessor
   * @param interpreter the interpreter
   */
  public GitHookCli(final HookPayload payload,
                    final GitHookAccessor accessor,
                    final HookOutcomeInterpreter interpreter) {
    this.payload = payload;
    this.accessor = accessor;
    this.interpreter = interpreter;
  }

  /**
   * Bootstraps a hook invocation from the process environment.
   *
   * @param environment the process environment
   * @param config      the client config
   * @return the git hook cli
   * @throws com.codeheadsystems.gitgate.model.githook.HookPayloadException if the payload is
   *                                                                        missing or malformed
   */
  public static GitHookCli fromEnvironment(final Map<String, String> environment,
                                           final GitHookClientConfig config) {
    ObjectMapper objectMapper = new ObjectMapper();
    HookPayload payload = new HookPayloadEnvironment(objectMapper).load(environment);
    HttpClient httpClient = HttpClient.newBuilder()
        .connectTimeout(config.connectTimeout())
        .build();
    GitHookAccessor accessor = new GitHookAccessor(httpClient, objectMapper, payload, config);
    return new GitHookCli(payload, accessor, new HookOutcomeInterpreter());
  }

  /**
   * Executes the pre-receive hook.
   *
   * @param stdin the reference updates as written by git
   * @return the hook outcome
   */
  public HookOutcome preReceive(final InputStream stdin) {
    if (payload.disabled()) {
      return HookOutcome.allowed();
    }
    List<ReferenceUpdate> refUpdates;
    try {
      refUpdates = RefUpdateCodec.parse(stdin);
    } catch (HookProtocolException e) {
      return interpreter.invalidInput(e);
    }
    PreReceiveInput input = new PreReceiveInput(payload.repoId(), payload.principalId(), refUpdates);
    return call(() -> accessor.preReceive(input));
  }

  /**
   * Executes the update hook for a single reference.
   *
   * @param ref    the reference name
   * @param oldSha the old object id
   * @param newSha the new object id
   * @return the hook outcome
   */
  public HookOutcome update(final String ref, final String oldSha, final String newSha) {
    if (payload.disabled()) {
      return HookOutcome.allowed();
    }
    ReferenceUpdate refUpdate;
    try {
      refUpdate = new ReferenceUpdate(ref, oldSha, newSha);
    } catch (IllegalArgumentException e) {
      return interpreter.invalidInput(e);
    }
    UpdateInput input = new UpdateInput(payload.repoId(), payload.principalId(), refUpdate);
    return call(() -> accessor.update(input));
  }

  /**
   * Executes the post-receive hook.
   *
   * @param stdin the reference updates as written by git
   * @return the hook outcome
   */
  public HookOutcome postReceive(final InputStream stdin) {
    if (payload.disabled()) {
      return HookOutcome.allowed();
    }
    List<ReferenceUpdate> refUpdates;
    try {
      refUpdates = RefUpdateCodec.parse(stdin);
    } catch (HookProtocolException e) {
      return interpreter.invalidInput(e);
    }
    PostReceiveInput input = new PostReceiveInput(payload.repoId(), payload.principalId(), refUpdates);
    return call(() -> accessor.postReceive(input));
  }

  private HookOutcome call(Supplier<ServerHookOutput> hookCall) {
    ServerHookOutput output;
    try {
      output = hookCall.get();
    } catch (GitHookAccessorException e) {
      log.debug("request_id={} hook call failed: {}", payload.requestId(), e.getMessage());
      return interpreter.resolve(null, e);
    }
    return interpreter.resolve(output, null);
  }
}
