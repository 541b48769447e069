package com.codeheadsystems.gitgate.server.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import jakarta.servlet.http.HttpServletRequest;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CredentialExtractorTest {

  @Mock private HttpServletRequest request;

  private final CredentialExtractor extractor = new CredentialExtractor();

  @Test
  void extract_bearer_stripsScheme() {
    when(request.getHeader("Authorization")).thenReturn("Bearer abc.def.ghi");

    assertThat(extractor.extract(request)).contains("abc.def.ghi");
  }

  @Test
  void extract_headerWithoutScheme_isUsedAsIs() {
    when(request.getHeader("Authorization")).thenReturn("abc.def.ghi");

    assertThat(extractor.extract(request)).contains("abc.def.ghi");
  }

  @Test
  void extract_header_winsOverParameter() {
    when(request.getHeader("Authorization")).thenReturn("Bearer from-header");

    assertThat(extractor.extract(request)).contains("from-header");
    verify(request, never()).getParameter("access_token");
  }

  @Test
  void extract_basic_returnsPassword() {
    when(request.getHeader("Authorization")).thenReturn("Basic " + encode("git:tok:en"));

    assertThat(extractor.extract(request)).contains("tok:en");
  }

  @Test
  void extract_basicNotBase64_isEmpty() {
    when(request.getHeader("Authorization")).thenReturn("Basic !!!");

    assertThat(extractor.extract(request)).isEmpty();
  }

  @Test
  void extract_basicEmptyPassword_isEmpty() {
    when(request.getHeader("Authorization")).thenReturn("Basic " + encode("git:"));

    assertThat(extractor.extract(request)).isEmpty();
  }

  @Test
  void extract_basicWithoutSpace_isEmpty() {
    when(request.getHeader("Authorization")).thenReturn("Basicabc");

    assertThat(extractor.extract(request)).isEmpty();
  }

  @Test
  void extract_nothing_isEmpty() {
    assertThat(extractor.extract(request)).isEmpty();
  }

  private static String encode(String value) {
    return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
  }
}
