package io.scrapehive.supervisor.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP client settings used by the engine when scraping targets.
 * <p>
 * Authentication mechanisms are mutually exclusive; {@link #validate()} enforces
 * the same rules the engine applies when the configuration is loaded.
 */
public record HttpClientConfig(
    BasicAuth basicAuth,
    Authorization authorization,
    String bearerToken,
    String bearerTokenFile,
    OAuth2 oauth2,
    TlsConfig tls,
    String proxyUrl,
    boolean followRedirects,
    boolean enableHttp2
) {

  public HttpClientConfig {
    tls = tls == null ? TlsConfig.none() : tls;
  }

  public static HttpClientConfig defaults() {
    return new HttpClientConfig(null, null, null, null, null, TlsConfig.none(), null, true, true);
  }

  public static Builder builder() {
    return new Builder(defaults());
  }

  public Builder toBuilder() {
    return new Builder(this);
  }

  /**
   * @throws IllegalArgumentException when the settings contradict each other
   */
  public void validate() {
    boolean hasBearerToken = hasText(bearerToken);
    boolean hasBearerTokenFile = hasText(bearerTokenFile);
    if (hasBearerToken && hasBearerTokenFile) {
      throw new IllegalArgumentException("at most one of bearer_token & bearer_token_file must be configured");
    }
    if ((basicAuth != null || oauth2 != null) && (hasBearerToken || hasBearerTokenFile)) {
      throw new IllegalArgumentException(
          "at most one of basic_auth, oauth2, bearer_token & bearer_token_file must be configured");
    }
    if (basicAuth != null && hasText(basicAuth.password()) && hasText(basicAuth.passwordFile())) {
      throw new IllegalArgumentException("at most one of basic_auth password & password_file must be configured");
    }
    if (authorization != null) {
      if (hasBearerToken || hasBearerTokenFile) {
        throw new IllegalArgumentException("authorization is not compatible with bearer_token & bearer_token_file");
      }
      if (hasText(authorization.credentials()) && hasText(authorization.credentialsFile())) {
        throw new IllegalArgumentException(
            "at most one of authorization credentials & credentials_file must be configured");
      }
      if ("basic".equals(authorization.effectiveType().toLowerCase(Locale.ROOT))) {
        throw new IllegalArgumentException("authorization type cannot be set to \"basic\", use \"basic_auth\" instead");
      }
    }
    if (basicAuth != null && (oauth2 != null || authorization != null)) {
      throw new IllegalArgumentException("at most one of basic_auth, oauth2 & authorization must be configured");
    }
    if (oauth2 != null) {
      if (authorization != null) {
        throw new IllegalArgumentException("at most one of basic_auth, oauth2 & authorization must be configured");
      }
      if (!hasText(oauth2.clientId())) {
        throw new IllegalArgumentException("oauth2 client_id must be configured");
      }
      if (hasText(oauth2.clientSecret()) && hasText(oauth2.clientSecretFile())) {
        throw new IllegalArgumentException("at most one of oauth2 client_secret & client_secret_file must be configured");
      }
      if (!hasText(oauth2.tokenUrl())) {
        throw new IllegalArgumentException("oauth2 token_url must be configured");
      }
    }
    if (hasText(proxyUrl)) {
      validateProxyUrl(proxyUrl);
    }
    tls.validate();
  }

  private static void validateProxyUrl(String value) {
    URI uri;
    try {
      uri = new URI(value);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("invalid proxy_url \"" + value + "\": " + ex.getMessage(), ex);
    }
    String scheme = uri.getScheme();
    if (scheme == null || uri.getHost() == null
        || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
      throw new IllegalArgumentException("proxy_url \"" + value + "\" must be an absolute http or https URL");
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  public record BasicAuth(String username, String password, String passwordFile) {

    public BasicAuth {
      Objects.requireNonNull(username, "basic_auth username");
    }
  }

  /**
   * Authorization header settings. An empty type means {@code Bearer}.
   */
  public record Authorization(String type, String credentials, String credentialsFile) {

    public String effectiveType() {
      return hasText(type) ? type : "Bearer";
    }
  }

  public record OAuth2(
      String clientId,
      String clientSecret,
      String clientSecretFile,
      List<String> scopes,
      String tokenUrl,
      Map<String, String> endpointParams
  ) {

    public OAuth2 {
      scopes = scopes == null ? List.of() : List.copyOf(scopes);
      endpointParams = endpointParams == null ? Map.of() : Map.copyOf(endpointParams);
    }
  }

  public record TlsConfig(
      String caFile,
      String certFile,
      String keyFile,
      String serverName,
      boolean insecureSkipVerify
  ) {

    public static TlsConfig none() {
      return new TlsConfig(null, null, null, null, false);
    }

    void validate() {
      if (hasText(certFile) != hasText(keyFile)) {
        throw new IllegalArgumentException("tls_config cert_file and key_file must both be configured");
      }
    }
  }

  public static final class Builder {

    private BasicAuth basicAuth;
    private Authorization authorization;
    private String bearerToken;
    private String bearerTokenFile;
    private OAuth2 oauth2;
    private TlsConfig tls;
    private String proxyUrl;
    private boolean followRedirects;
    private boolean enableHttp2;

    private Builder(HttpClientConfig source) {
      this.basicAuth = source.basicAuth();
      this.authorization = source.authorization();
      this.bearerToken = source.bearerToken();
      this.bearerTokenFile = source.bearerTokenFile();
      this.oauth2 = source.oauth2();
      this.tls = source.tls();
      this.proxyUrl = source.proxyUrl();
      this.followRedirects = source.followRedirects();
      this.enableHttp2 = source.enableHttp2();
    }

    public Builder basicAuth(BasicAuth basicAuth) {
      this.basicAuth = basicAuth;
      return this;
    }

    public Builder authorization(Authorization authorization) {
      this.authorization = authorization;
      return this;
    }

    public Builder bearerToken(String bearerToken) {
      this.bearerToken = bearerToken;
      return this;
    }

    public Builder bearerTokenFile(String bearerTokenFile) {
      this.bearerTokenFile = bearerTokenFile;
      return this;
    }

    public Builder oauth2(OAuth2 oauth2) {
      this.oauth2 = oauth2;
      return this;
    }

    public Builder tls(TlsConfig tls) {
      this.tls = tls;
      return this;
    }

    public Builder proxyUrl(String proxyUrl) {
      this.proxyUrl = proxyUrl;
      return this;
    }

    public Builder followRedirects(boolean followRedirects) {
      this.followRedirects = followRedirects;
      return this;
    }

    public Builder enableHttp2(boolean enableHttp2) {
      this.enableHttp2 = enableHttp2;
      return this;
    }

    public HttpClientConfig build() {
      return new HttpClientConfig(basicAuth, authorization, bearerToken, bearerTokenFile, oauth2, tls, proxyUrl,
          followRedirects, enableHttp2);
    }
  }
}
