package com.cardforge.http;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;

public class OkHttpFactory {

  public static OkHttpClient create(Duration callTimeout) {
    return create(callTimeout, null);
  }

  /**
   * Build a client with the default connect/read timeouts, request logging and an optional extra
   * interceptor placed in front of the network (tests use it to short-circuit calls).
   */
  public static OkHttpClient create(Duration callTimeout, Interceptor applicationInterceptor) {
    if (callTimeout == null || callTimeout.isNegative()) {
      throw new IllegalArgumentException("Call timeout must be a non-negative duration");
    }
    OkHttpClient.Builder builder =
        new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(60, TimeUnit.SECONDS)
            .callTimeout(callTimeout)
            .addInterceptor(new LoggingInterceptor());
    if (applicationInterceptor != null) {
      builder.addInterceptor(applicationInterceptor);
    }
    return builder.build();
  }
}
