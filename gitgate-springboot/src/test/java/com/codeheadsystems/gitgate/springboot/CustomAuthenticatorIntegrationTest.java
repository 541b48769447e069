package com.codeheadsystems.gitgate.springboot;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.gitgate.server.auth.AuthenticationException;
import com.codeheadsystems.gitgate.server.auth.Authenticator;
import com.codeheadsystems.gitgate.server.auth.TokenAuthenticator;
import com.codeheadsystems.gitgate.server.model.Principal;
import com.codeheadsystems.gitgate.server.model.Session;
import com.codeheadsystems.gitgate.server.model.TokenMetadata;
import com.codeheadsystems.gitgate.server.model.TokenType;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class CustomAuthenticatorIntegrationTest {

  private static final String SHARED_SECRET = "Bearer letmein";

  @TestConfiguration
  static class CustomAuthenticatorConfig {

    @Bean
    public Authenticator customAuthenticator() {
      return request -> {
        if (!SHARED_SECRET.equals(request.getHeader("Authorization"))) {
          throw new AuthenticationException(AuthenticationException.Reason.NO_AUTH_DATA, "no authentication data");
        }
        return new Session(Principal.fromUser(TestTokens.ALICE),
            new TokenMetadata(TokenType.SESSION, 1, Set.of()));
      };
    }
  }

  @LocalServerPort
  private int port;

  @Autowired private ApplicationContext context;

  @Test
  void customAuthenticator_replacesTokenAuthenticator() throws Exception {
    assertThat(context.getBeansOfType(TokenAuthenticator.class)).isEmpty();

    HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create("http://localhost:" + port + "/api/whoami"))
        .header("Authorization", SHARED_SECRET)
        .GET()
        .build();
    HttpResponse<String> response = HttpClient.newHttpClient().send(request, HttpResponse.BodyHandlers.ofString());

    assertThat(response.statusCode()).isEqualTo(200);
    assertThat(response.body()).isEqualTo("alice session");
  }
}
