package com.gentoro.mistadopt.mist;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.mistadopt.exception.FetchException;
import com.gentoro.mistadopt.fetch.AdoptionConfigClient;
import com.gentoro.mistadopt.fetch.RawConfig;
import com.gentoro.mistadopt.http.OkHttpFactory;
import com.gentoro.mistadopt.inventory.FetchKey;
import java.io.IOException;
import java.time.Duration;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.configuration2.Configuration;

/**
 * Fetches the outbound-SSH adoption command for a site from the Mist API.
 *
 * <p>Transient failures (I/O errors, 5xx, 429) are retried according to the {@link RetryPolicy}.
 * Authentication, not-found and other client errors fail on the first attempt.
 */
public class MistApiClient implements AdoptionConfigClient {
  private static final org.slf4j.Logger log =
      com.gentoro.mistadopt.logging.LoggingService.getLogger(MistApiClient.class);

  public static final String DEFAULT_BASE_URL = "https://api.mist.com/api/v1";

  private final OkHttpClient http;
  private final HttpUrl baseUrl;
  private final RetryPolicy retryPolicy;
  private final ObjectMapper mapper = new ObjectMapper();

  public MistApiClient(OkHttpClient http, String baseUrl, RetryPolicy retryPolicy) {
    this.http = http;
    HttpUrl parsed = HttpUrl.parse(baseUrl);
    if (parsed == null) {
      throw new IllegalArgumentException("Invalid Mist API base URL: " + baseUrl);
    }
    this.baseUrl = parsed;
    this.retryPolicy = retryPolicy;
  }

  public static MistApiClient fromConfiguration(Configuration config) {
    OkHttpClient http =
        OkHttpFactory.create(
            Duration.ofMillis(config.getLong("mist.http.connect-timeout-ms", 10_000)),
            Duration.ofMillis(config.getLong("mist.http.read-timeout-ms", 30_000)));
    return new MistApiClient(
        http,
        config.getString("mist.base-url", DEFAULT_BASE_URL),
        RetryPolicy.fromConfiguration(config));
  }

  @Override
  public RawConfig fetch(String orgId, String siteId, String apiKey) throws FetchException {
    FetchKey key = new FetchKey(orgId, siteId);
    Request request =
        new Request.Builder()
            .url(urlFor(key))
            .header("Content-Type", "application/json")
            .header("Authorization", "Token " + apiKey)
            .get()
            .build();

    FetchException last = null;
    for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
      if (attempt > 1) {
        Duration wait = waitBefore(attempt, last);
        log.info(
            "Retrying adoption config fetch for {} in {} ms (attempt {}/{}): {}",
            key,
            wait.toMillis(),
            attempt,
            retryPolicy.maxAttempts(),
            last.getMessage());
        sleep(wait, key);
      }
      try {
        RawConfig config = execute(request, key);
        log.debug("Fetched adoption config for {} on attempt {}", key, attempt);
        return config;
      } catch (FetchException e) {
        if (!e.isRetryable()) {
          log.warn("Adoption config fetch for {} failed: {}", key, e.getMessage());
          throw e;
        }
        last = e;
      }
    }

    log.warn(
        "Adoption config fetch for {} failed after {} attempts: {}",
        key,
        retryPolicy.maxAttempts(),
        last.getMessage());
    throw last;
  }

  HttpUrl urlFor(FetchKey key) {
    return baseUrl
        .newBuilder()
        .addPathSegment("orgs")
        .addPathSegment(key.orgId())
        .addPathSegments("ocdevices/outbound_ssh_cmd")
        .addQueryParameter("site_id", key.siteId())
        .build();
  }

  private RawConfig execute(Request request, FetchKey key) {
    try (Response response = http.newCall(request).execute()) {
      ResponseBody body = response.body();
      String text = body == null ? "" : body.string();
      int code = response.code();

      if (code == 200) {
        return parse(key, text);
      }
      String message =
          "Failed to fetch adoption command from Mist API for %s: HTTP %d %s"
              .formatted(key, code, abbreviate(text));
      if (code == 429 || code >= 500) {
        throw new RetryAfterException(code, message, retryAfter(response));
      }
      if (code == 401 || code == 403) {
        throw new FetchException(FetchException.Reason.UNAUTHORIZED, code, message);
      }
      if (code == 404) {
        throw new FetchException(FetchException.Reason.NOT_FOUND, code, message);
      }
      throw new FetchException(FetchException.Reason.REJECTED, code, message);
    } catch (IOException e) {
      throw new FetchException(
          FetchException.Reason.UNAVAILABLE,
          "Failed to reach Mist API for %s: %s".formatted(key, e.getMessage()),
          e);
    }
  }

  private RawConfig parse(FetchKey key, String text) {
    JsonNode root;
    try {
      root = mapper.readTree(text);
    } catch (IOException e) {
      throw new FetchException(
          FetchException.Reason.INVALID_RESPONSE,
          "Mist API returned malformed JSON for %s".formatted(key),
          e);
    }
    JsonNode cmd = root == null ? null : root.get("cmd");
    if (cmd == null || !cmd.isTextual() || cmd.asText().isBlank()) {
      throw new FetchException(
          FetchException.Reason.INVALID_RESPONSE,
          200,
          "Mist API response for %s has no adoption command".formatted(key));
    }
    return new RawConfig(key, cmd.asText());
  }

  private Duration waitBefore(int attempt, FetchException last) {
    Duration backoff = retryPolicy.backoffBefore(attempt);
    if (last instanceof RetryAfterException ra && ra.retryAfter != null) {
      Duration hinted =
          ra.retryAfter.compareTo(retryPolicy.maxBackoff()) > 0
              ? retryPolicy.maxBackoff()
              : ra.retryAfter;
      return hinted.compareTo(backoff) > 0 ? hinted : backoff;
    }
    return backoff;
  }

  private static void sleep(Duration wait, FetchKey key) {
    try {
      Thread.sleep(wait.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchException(
          FetchException.Reason.INTERRUPTED,
          "Interrupted while waiting to retry fetch for " + key,
          e);
    }
  }

  private static Duration retryAfter(Response response) {
    String header = response.header("Retry-After");
    if (header == null) return null;
    try {
      long seconds = Long.parseLong(header.trim());
      return seconds >= 0 ? Duration.ofSeconds(seconds) : null;
    } catch (NumberFormatException e) {
      // HTTP-date form is not used by Mist
      return null;
    }
  }

  private static String abbreviate(String text) {
    if (text == null) return "";
    String oneLine = text.replaceAll("\\s+", " ").trim();
    return oneLine.length() > 200 ? oneLine.substring(0, 200) + "..." : oneLine;
  }

  /** Retryable failure that may carry a server-provided wait hint. */
  private static final class RetryAfterException extends FetchException {
    private final transient Duration retryAfter;

    RetryAfterException(int status, String message, Duration retryAfter) {
      super(Reason.UNAVAILABLE, status, message);
      this.retryAfter = retryAfter;
    }
  }
}
