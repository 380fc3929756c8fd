package com.gentoro.mistadopt.http;

import java.time.Duration;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  public static OkHttpClient create(Duration connectTimeout, Duration readTimeout) {
    if (connectTimeout == null || readTimeout == null) {
      throw new IllegalArgumentException("Timeouts cannot be null");
    }
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        // retries are owned by the API client so they stay bounded and visible
        .retryOnConnectionFailure(false)
        .addInterceptor(new LoggingInterceptor())
        .build();
  }
}
