package com.codeheadsystems.gitgate.githook.accessor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.gitgate.githook.config.GitHookClientConfig;
import com.codeheadsystems.gitgate.githook.exceptions.GitHookAccessorException;
import com.codeheadsystems.gitgate.model.githook.GitHookPaths;
import com.codeheadsystems.gitgate.model.githook.HookPayload;
import com.codeheadsystems.gitgate.model.githook.PostReceiveInput;
import com.codeheadsystems.gitgate.model.githook.PreReceiveInput;
import com.codeheadsystems.gitgate.model.githook.ReferenceUpdate;
import com.codeheadsystems.gitgate.model.githook.ServerHookOutput;
import com.codeheadsystems.gitgate.model.githook.UpdateInput;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GitHookAccessorTest {

  private static final String BASE_URL = "http://localhost:3000/api/";
  private static final ReferenceUpdate MAIN = new ReferenceUpdate("refs/heads/main", "aaa", "bbb");
  private static final PreReceiveInput PRE_RECEIVE = new PreReceiveInput(11L, 7L, List.of(MAIN));

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<String> httpResponse;

  private final ObjectMapper objectMapper = new ObjectMapper();

  private GitHookAccessor accessor;

  @BeforeEach
  void setUp() {
    accessor = accessorFor(new HookPayload(11L, 7L, "req-1", BASE_URL, "jwt-token", false));
  }

  @AfterEach
  void clearInterrupt() {
    Thread.interrupted();
  }

  private GitHookAccessor accessorFor(HookPayload payload) {
    return new GitHookAccessor(httpClient, objectMapper, payload, GitHookClientConfig.defaults());
  }

  @SuppressWarnings("unchecked")
  private HttpRequest captureRequest() throws Exception {
    ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
    verify(httpClient).send(captor.capture(), any(HttpResponse.BodyHandler.class));
    return captor.getValue();
  }

  @Test
  void preReceive_success_returnsDeserializedOutput() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn("{\"error\":null}");

    ServerHookOutput output = accessor.preReceive(PRE_RECEIVE);

    assertThat(output).isNotNull();
    assertThat(output.rejection()).isEmpty();
  }

  @Test
  void preReceive_sendsIdentityHeadersToResolvedPath() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn("{}");

    accessor.preReceive(PRE_RECEIVE);

    HttpRequest request = captureRequest();
    assertThat(request.method()).isEqualTo("POST");
    assertThat(request.uri()).isEqualTo(URI.create("http://localhost:3000/api" + GitHookPaths.PRE_RECEIVE));
    assertThat(request.headers().firstValue(GitHookPaths.REQUEST_ID_HEADER)).contains("req-1");
    assertThat(request.headers().firstValue("Authorization")).contains("Bearer jwt-token");
    assertThat(request.headers().firstValue("Content-Type")).contains("application/json");
  }

  @Test
  void update_withoutAccessToken_omitsAuthorization() throws Exception {
    accessor = accessorFor(new HookPayload(11L, 7L, "req-2", BASE_URL, null, false));
    doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn("{\"error\":\"branch main is protected\"}");

    ServerHookOutput output = accessor.update(new UpdateInput(11L, 7L, MAIN));

    assertThat(output.rejection()).contains("branch main is protected");
    HttpRequest request = captureRequest();
    assertThat(request.uri().getPath()).endsWith(GitHookPaths.UPDATE);
    assertThat(request.headers().firstValue("Authorization")).isEmpty();
  }

  @Test
  void postReceive_nullBody_returnsNull() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn("null");

    assertThat(accessor.postReceive(new PostReceiveInput(11L, 7L, List.of(MAIN)))).isNull();
  }

  @Test
  void preReceive_connectionRefused_throwsAccessorException() throws Exception {
    doThrow(new ConnectException("connection refused")).when(httpClient).send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> accessor.preReceive(PRE_RECEIVE))
        .isInstanceOf(GitHookAccessorException.class)
        .hasMessageContaining("connection refused")
        .hasCauseInstanceOf(IOException.class);
  }

  @Test
  void preReceive_interrupted_restoresInterruptFlag() throws Exception {
    doThrow(new InterruptedException()).when(httpClient).send(any(HttpRequest.class), any());

    assertThatThrownBy(() -> accessor.preReceive(PRE_RECEIVE))
        .isInstanceOf(GitHookAccessorException.class)
        .hasMessageContaining("interrupted");
    assertThat(Thread.currentThread().isInterrupted()).isTrue();
  }

  @Test
  void preReceive_unsendableHeaderValue_throwsAccessorExceptionWithoutSending() {
    HookPayload payload = mock(HookPayload.class);
    when(payload.apiBaseUri()).thenReturn(URI.create("http://localhost:3000"));
    when(payload.requestId()).thenReturn("req\r\nX-Evil: 1");
    accessor = accessorFor(payload);

    assertThatThrownBy(() -> accessor.preReceive(PRE_RECEIVE))
        .isInstanceOf(GitHookAccessorException.class)
        .hasMessageContaining("Cannot build HTTP request")
        .hasCauseInstanceOf(IllegalArgumentException.class);
    verifyNoInteractions(httpClient);
  }

  @Test
  void preReceive_serverError_throwsWithStatus() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());
    when(httpResponse.statusCode()).thenReturn(500);

    assertThatThrownBy(() -> accessor.preReceive(PRE_RECEIVE))
        .isInstanceOf(GitHookAccessorException.class)
        .hasMessageContaining("HTTP 500");
  }

  @Test
  void preReceive_unauthorized_mentionsCredentials() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());
    when(httpResponse.statusCode()).thenReturn(401);

    assertThatThrownBy(() -> accessor.preReceive(PRE_RECEIVE))
        .isInstanceOf(GitHookAccessorException.class)
        .hasMessageContaining("credentials")
        .hasMessageContaining("HTTP 401");
  }

  @Test
  void preReceive_malformedBody_throwsAccessorException() throws Exception {
    doReturn(httpResponse).when(httpClient).send(any(HttpRequest.class), any());
    when(httpResponse.statusCode()).thenReturn(200);
    when(httpResponse.body()).thenReturn("<html>oops</html>");

    assertThatThrownBy(() -> accessor.preReceive(PRE_RECEIVE))
        .isInstanceOf(GitHookAccessorException.class)
        .hasMessageContaining("Malformed response");
  }
}
