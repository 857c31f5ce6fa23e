package ca.gc.cra.feedback.infrastructure.model;

import ca.gc.cra.feedback.application.json.JsonSupport;
import ca.gc.cra.feedback.application.port.TextGenerationException;
import ca.gc.cra.feedback.application.port.TextGenerationPort;
import java.io.IOException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TextGenerationPort} that calls a {@code generateContent}-style HTTP endpoint.
 *
 * <p>Request: {@code {"contents":[{"role":"user","parts":[{"text": prompt}]}]}}. The reply text is the
 * concatenation of {@code candidates[0].content.parts[*].text}. No retries; one call per prompt.</p>
 *
 * @since 0.1.0
 */
public final class OkHttpTextGenerationClient implements TextGenerationPort {
  private static final Logger log = LoggerFactory.getLogger(OkHttpTextGenerationClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient http;
  private final HttpUrl endpoint;
  private final String apiToken;
  private final JsonSupport json = new JsonSupport();

  /**
   * Creates a client with its own connection pool.
   *
   * @param endpoint full URL of the generation endpoint
   * @param apiToken bearer token; blank for none
   * @param callTimeout upper bound on one call, connect to last byte
   */
  public OkHttpTextGenerationClient(String endpoint, String apiToken, Duration callTimeout) {
    this(new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .callTimeout(Objects.requireNonNull(callTimeout, "callTimeout"))
            .retryOnConnectionFailure(true)
            .build(),
        endpoint,
        apiToken);
  }

  OkHttpTextGenerationClient(OkHttpClient http, String endpoint, String apiToken) {
    this.http = Objects.requireNonNull(http, "http");
    HttpUrl parsed = HttpUrl.parse(Objects.requireNonNull(endpoint, "endpoint"));
    if (parsed == null) {
      throw new IllegalArgumentException("endpoint must be an http(s) URL: " + endpoint);
    }
    this.endpoint = parsed;
    this.apiToken = apiToken == null ? "" : apiToken.trim();
  }

  @Override
  public String generate(String prompt) throws TextGenerationException {
    Objects.requireNonNull(prompt, "prompt");
    Map<String, Object> content = new LinkedHashMap<>();
    content.put("role", "user");
    content.put("parts", List.of(Map.of("text", prompt)));
    Map<String, Object> body = Map.of("contents", List.of(content));
    Request.Builder request = new Request.Builder()
        .url(endpoint)
        .post(RequestBody.create(json.write(body), JSON));
    if (!apiToken.isEmpty()) {
      request.header("Authorization", "Bearer " + apiToken);
    }

    String payload;
    try (Response response = http.newCall(request.build()).execute()) {
      ResponseBody responseBody = response.body();
      payload = responseBody == null ? "" : responseBody.string();
      if (!response.isSuccessful()) {
        log.debug("Model endpoint returned {}: {}", response.code(), payload);
        throw new TextGenerationException("Model endpoint returned HTTP " + response.code());
      }
    } catch (IOException ex) {
      throw new TextGenerationException("Model call failed: " + ex.getMessage(), ex);
    }
    return extractText(payload);
  }

  String extractText(String payload) throws TextGenerationException {
    Map<String, Object> root;
    try {
      root = json.parseObject(payload);
    } catch (IllegalArgumentException ex) {
      throw new TextGenerationException("Model response is not a JSON object", ex);
    }
    if (!(root.get("candidates") instanceof List<?> candidates) || candidates.isEmpty()) {
      throw new TextGenerationException("Model response has no candidates");
    }
    if (!(candidates.get(0) instanceof Map<?, ?> candidate)
        || !(candidate.get("content") instanceof Map<?, ?> content)
        || !(content.get("parts") instanceof List<?> parts)) {
      throw new TextGenerationException("Model response candidate has no content parts");
    }
    StringBuilder text = new StringBuilder();
    for (Object part : parts) {
      if (part instanceof Map<?, ?> map && map.get("text") instanceof String s) {
        text.append(s);
      }
    }
    return text.toString();
  }

  @Override
  public void close() {
    http.dispatcher().executorService().shutdown();
    http.connectionPool().evictAll();
  }
}
