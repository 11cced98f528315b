package ca.gc.cra.warden.infrastructure.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * JSON document persisted by {@link SessionStateCodec}.
 *
 * @param version document format version
 * @param method authentication method that wrote the document
 * @param username signed-in username; may be {@code null}
 * @param accessToken held bearer token; may be {@code null}
 * @param savedAt time the document was written
 *
 * @since 0.1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
record SessionState(
    @JsonProperty("version") int version,
    @JsonProperty("method") String method,
    @JsonProperty("username") String username,
    @JsonProperty("accessToken") String accessToken,
    @JsonProperty("savedAt") Instant savedAt) {}
