package com.cardforge.http;

import com.cardforge.logging.LoggingService;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import okhttp3.Interceptor;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

public class LoggingInterceptor implements Interceptor {
  private static final Logger log = LoggingService.getLogger(LoggingInterceptor.class);
  private static final int MAX_LOGGED_BODY = 4000;

  @NotNull
  @Override
  public Response intercept(Chain chain) throws IOException {
    Request request = chain.request();

    long startTime = System.nanoTime();
    if (log.isDebugEnabled()) {
      log.debug(
          "➡️ Sending request {} {}\nBody:\n{}\n",
          request.method(),
          request.url(),
          StringUtils.abbreviate(bodyToString(request), MAX_LOGGED_BODY));
    }

    Response response;
    try {
      response = chain.proceed(request);
    } catch (SocketTimeoutException e) {
      log.warn(
          "Request timed out: {} {} ({}ms)", request.method(), request.url(), elapsedMs(startTime));
      throw e;
    } catch (ConnectException e) {
      log.warn(
          "Connection error: {} {} ({}ms): {}",
          request.method(),
          request.url(),
          elapsedMs(startTime),
          e.getMessage() == null ? "Could not connect to server" : e.getMessage());
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
        "⬅️ Received response for {} in {} ms\nStatus: {}\n",
        response.request().url(),
        elapsedMs(startTime),
        response.code());
    if (log.isTraceEnabled()) {
      String responseBody = "";
      try {
        ResponseBody peekedBody = response.peekBody(Long.MAX_VALUE);
        responseBody = peekedBody.string();
      } catch (IOException e) {
        log.debug("Could not read response body", e);
      }
      log.trace(
          "Response body:\n{}\n",
          responseBody.isEmpty()
              ? "[empty]"
              : StringUtils.abbreviate(responseBody, MAX_LOGGED_BODY));
    }
    return response;
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000;
  }

  private static String bodyToString(Request request) {
    try {
      Request copy = request.newBuilder().build();
      Buffer buffer = new Buffer();
      if (copy.body() != null) copy.body().writeTo(buffer);
      return buffer.readUtf8();
    } catch (IOException e) {
      return "(error reading body)";
    }
  }
}
