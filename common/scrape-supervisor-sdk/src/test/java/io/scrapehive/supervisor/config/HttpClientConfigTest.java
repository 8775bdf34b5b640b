package io.scrapehive.supervisor.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class HttpClientConfigTest {

  @Test
  void defaultsAreValid() {
    assertThatCode(() -> HttpClientConfig.defaults().validate()).doesNotThrowAnyException();
  }

  @Test
  void bearerTokenAndFileAreExclusive() {
    HttpClientConfig config = HttpClientConfig.builder().bearerToken("t").bearerTokenFile("/f").build();

    assertThatThrownBy(config::validate)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("at most one of bearer_token & bearer_token_file must be configured");
  }

  @Test
  void basicAuthAndBearerTokenAreExclusive() {
    HttpClientConfig config = HttpClientConfig.builder()
        .basicAuth(new HttpClientConfig.BasicAuth("admin", "secret", null))
        .bearerToken("t")
        .build();

    assertThatThrownBy(config::validate)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("at most one of basic_auth, oauth2, bearer_token & bearer_token_file must be configured");
  }

  @Test
  void basicAuthPasswordAndFileAreExclusive() {
    HttpClientConfig config = HttpClientConfig.builder()
        .basicAuth(new HttpClientConfig.BasicAuth("admin", "secret", "/etc/secret"))
        .build();

    assertThatThrownBy(config::validate)
        .hasMessage("at most one of basic_auth password & password_file must be configured");
  }

  @Test
  void authorizationCannotUseBasicType() {
    HttpClientConfig config = HttpClientConfig.builder()
        .authorization(new HttpClientConfig.Authorization("Basic", "abc", null))
        .build();

    assertThatThrownBy(config::validate)
        .hasMessage("authorization type cannot be set to \"basic\", use \"basic_auth\" instead");
  }

  @Test
  void authorizationDefaultsToBearer() {
    HttpClientConfig.Authorization authorization = new HttpClientConfig.Authorization(null, "abc", null);

    assertThat(authorization.effectiveType()).isEqualTo("Bearer");
  }

  @Test
  void basicAuthAndAuthorizationAreExclusive() {
    HttpClientConfig config = HttpClientConfig.builder()
        .basicAuth(new HttpClientConfig.BasicAuth("admin", "secret", null))
        .authorization(new HttpClientConfig.Authorization("Bearer", "abc", null))
        .build();

    assertThatThrownBy(config::validate)
        .hasMessage("at most one of basic_auth, oauth2 & authorization must be configured");
  }

  @Test
  void oauth2RequiresClientIdAndTokenUrl() {
    HttpClientConfig missingClient = HttpClientConfig.builder()
        .oauth2(new HttpClientConfig.OAuth2(null, "s", null, List.of(), "https://idp/token", Map.of()))
        .build();
    HttpClientConfig missingTokenUrl = HttpClientConfig.builder()
        .oauth2(new HttpClientConfig.OAuth2("client", "s", null, List.of("read"), null, Map.of()))
        .build();

    assertThatThrownBy(missingClient::validate).hasMessage("oauth2 client_id must be configured");
    assertThatThrownBy(missingTokenUrl::validate).hasMessage("oauth2 token_url must be configured");
  }

  @Test
  void proxyUrlMustBeAbsoluteHttp() {
    HttpClientConfig config = HttpClientConfig.builder().proxyUrl("socks5://proxy:1080").build();

    assertThatThrownBy(config::validate)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must be an absolute http or https URL");
    assertThatCode(() -> HttpClientConfig.builder().proxyUrl("http://proxy:3128").build().validate())
        .doesNotThrowAnyException();
  }

  @Test
  void tlsCertificateNeedsItsKey() {
    HttpClientConfig config = HttpClientConfig.builder()
        .tls(new HttpClientConfig.TlsConfig(null, "/etc/cert.pem", null, null, false))
        .build();

    assertThatThrownBy(config::validate)
        .hasMessage("tls_config cert_file and key_file must both be configured");
  }
}
