package ca.gc.cra.warden.infrastructure.transport;

import ca.gc.cra.warden.application.port.IdentityTransport;
import ca.gc.cra.warden.application.port.IdentityTransportException;
import ca.gc.cra.warden.domain.auth.IdentityProfile;
import ca.gc.cra.warden.domain.auth.TokenGrant;
import ca.gc.cra.warden.logging.Logs;
import ca.gc.cra.warden.validation.Strings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Identity transport speaking JSON over HTTP with the JDK {@link HttpClient}.
 *
 * <p><strong>Exchanges:</strong>
 * <ul>
 *   <li>token: {@code POST} {@code {"grant_type":"password","username","password"}}, expects
 *   {@code {"access_token","token_type"}}.</li>
 *   <li>profile: {@code GET} with {@code Authorization: Bearer}, expects {@code {"username"}} (falls back to
 *   {@code preferred_username} or {@code sub}).</li>
 *   <li>revoke: {@code POST} {@code {"token"}}, any 2xx accepted.</li>
 * </ul>
 * Any status {@code >= 400}, connection failure, or unreadable body fails the future with
 * {@link IdentityTransportException}.</p>
 *
 * @since 0.1.0
 */
public final class HttpIdentityTransport implements IdentityTransport {
  private static final Logger log = LoggerFactory.getLogger(HttpIdentityTransport.class);
  private static final int MAX_ERROR_BODY_BYTES = 256;
  private static final int MAX_TOKEN_LENGTH = 8192;

  private final IdentityEndpoints endpoints;
  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;

  /**
   * Creates a transport with a default HTTP client and object mapper.
   *
   * @param endpoints provider endpoints; never {@code null}
   */
  public HttpIdentityTransport(IdentityEndpoints endpoints) {
    this(endpoints,
        HttpClient.newBuilder().connectTimeout(Objects.requireNonNull(endpoints, "endpoints").timeout()).build(),
        new ObjectMapper());
  }

  /**
   * Creates a transport with caller-supplied HTTP plumbing.
   *
   * @param endpoints provider endpoints; never {@code null}
   * @param httpClient HTTP client; never {@code null}
   * @param objectMapper JSON mapper; never {@code null}
   */
  public HttpIdentityTransport(IdentityEndpoints endpoints, HttpClient httpClient, ObjectMapper objectMapper) {
    this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  public CompletableFuture<TokenGrant> requestToken(String username, String password) {
    Objects.requireNonNull(username, "username");
    Objects.requireNonNull(password, "password");
    ObjectNode body = objectMapper.createObjectNode()
        .put("grant_type", "password")
        .put("username", username)
        .put("password", password);
    return post(endpoints.tokenUri(), body, "token request")
        .thenApply(response -> {
          JsonNode json = readJson(response, "token response");
          String token = text(json, "access_token");
          if (token == null) {
            throw new CompletionException(
                new IdentityTransportException("Token response did not contain access_token"));
          }
          return new TokenGrant(token, text(json, "token_type"));
        });
  }

  @Override
  public CompletableFuture<IdentityProfile> fetchProfile(String accessToken) {
    Objects.requireNonNull(accessToken, "accessToken");
    String token;
    try {
      token = Strings.requirePrintableAscii("accessToken", accessToken, MAX_TOKEN_LENGTH);
    } catch (IllegalArgumentException ex) {
      return CompletableFuture.failedFuture(
          new IdentityTransportException("Access token is not a valid bearer token", ex));
    }
    HttpRequest request = HttpRequest.newBuilder(endpoints.profileUri())
        .timeout(endpoints.timeout())
        .header("Accept", "application/json")
        .header("Authorization", "Bearer " + token)
        .GET()
        .build();
    return send(request, "profile request")
        .thenApply(response -> {
          JsonNode json = readJson(response, "profile response");
          String username = firstText(json, "username", "preferred_username", "sub");
          if (username == null) {
            throw new CompletionException(
                new IdentityTransportException("Profile response did not identify a user"));
          }
          return new IdentityProfile(username);
        });
  }

  @Override
  public CompletableFuture<Void> revokeToken(String accessToken) {
    Objects.requireNonNull(accessToken, "accessToken");
    ObjectNode body = objectMapper.createObjectNode().put("token", accessToken);
    return post(endpoints.revokeUri(), body, "revoke request").thenApply(response -> null);
  }

  private CompletableFuture<HttpResponse<byte[]>> post(URI uri, JsonNode body, String label) {
    byte[] payload;
    try {
      payload = objectMapper.writeValueAsBytes(body);
    } catch (JsonProcessingException ex) {
      return CompletableFuture.failedFuture(
          new IdentityTransportException("Failed to serialize " + label, ex));
    }
    HttpRequest request = HttpRequest.newBuilder(uri)
        .timeout(endpoints.timeout())
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
        .build();
    return send(request, label);
  }

  private CompletableFuture<HttpResponse<byte[]>> send(HttpRequest request, String label) {
    String target = request.method() + " " + request.uri().getPath();
    return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
        .handle((response, failure) -> {
          if (failure != null) {
            Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                ? failure.getCause()
                : failure;
            log.warn("Identity provider {} failed: {}", target, cause.toString());
            throw new CompletionException(new IdentityTransportException(label + " failed", cause));
          }
          if (response.statusCode() >= 400) {
            String body = Logs.truncate(new String(response.body(), StandardCharsets.UTF_8), MAX_ERROR_BODY_BYTES);
            log.warn("Identity provider {} returned {}: {}", target, response.statusCode(), body);
            throw new CompletionException(new IdentityTransportException(
                label + " rejected with HTTP " + response.statusCode() + ": " + body, response.statusCode()));
          }
          log.debug("Identity provider {} returned {}", target, response.statusCode());
          return response;
        });
  }

  private JsonNode readJson(HttpResponse<byte[]> response, String label) {
    try {
      JsonNode node = objectMapper.readTree(response.body());
      if (node == null || !node.isObject()) {
        throw new CompletionException(new IdentityTransportException(label + " is not a JSON object"));
      }
      return node;
    } catch (IOException ex) {
      throw new CompletionException(new IdentityTransportException("Unreadable " + label, ex));
    }
  }

  private static String firstText(JsonNode json, String... fields) {
    for (String field : fields) {
      String value = text(json, field);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  private static String text(JsonNode json, String field) {
    JsonNode node = json.get(field);
    if (node == null || node.isNull()) {
      return null;
    }
    return Strings.trimToNull(node.asText());
  }
}
