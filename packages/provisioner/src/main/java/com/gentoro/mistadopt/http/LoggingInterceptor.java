package com.gentoro.mistadopt.http;

import java.io.IOException;
import java.util.Set;
import okhttp3.Headers;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import org.jetbrains.annotations.NotNull;

/** Logs every outgoing request and its outcome. Credentials are redacted. */
public class LoggingInterceptor implements Interceptor {
  private static final org.slf4j.Logger log =
      com.gentoro.mistadopt.logging.LoggingService.getLogger(LoggingInterceptor.class);

  private static final Set<String> SENSITIVE_HEADERS = Set.of("authorization", "cookie");

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    log.debug(
        "➡️ Sending request {} {}\nHeaders:\n{}", request.method(), request.url(),
        redact(request.headers()));

    Response response;
    try {
      response = chain.proceed(request);
    } catch (java.net.SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsedMs(startTime));
      throw e;
    } catch (java.net.ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage());
      throw e;
    } catch (IOException e) {
      log.warn(
          "IO error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
      throw e;
    }

    log.debug(
        "⬅️ Received response for {} in {} ms\nStatus: {}",
        response.request().url(),
        elapsedMs(startTime),
        response.code());
    return response;
  }

  static String redact(Headers headers) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < headers.size(); i++) {
      String name = headers.name(i);
      String value = SENSITIVE_HEADERS.contains(name.toLowerCase()) ? "****" : headers.value(i);
      sb.append(name).append(": ").append(value).append('\n');
    }
    return sb.toString();
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }
}
