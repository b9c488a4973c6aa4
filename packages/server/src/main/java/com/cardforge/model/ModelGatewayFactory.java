package com.cardforge.model;

import com.cardforge.exception.ConfigurationException;
import com.cardforge.http.OkHttpFactory;
import com.cardforge.logging.LoggingService;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;

/** Builds the configured {@link ModelGateway} ({@code gateway.provider}). */
public final class ModelGatewayFactory {
  private static final Logger log = LoggingService.getLogger(ModelGatewayFactory.class);

  private ModelGatewayFactory() {}

  public static AbstractModelGateway create(Configuration configuration) {
    String provider = configuration.getString("gateway.provider", "task-api").trim();
    Duration timeout = Duration.ofSeconds(configuration.getLong("gateway.timeout-seconds", 120L));
    log.info("Using model gateway provider '{}'", provider);
    switch (provider.toLowerCase()) {
      case "task-api":
        return new TaskApiModelGateway(configuration, OkHttpFactory.create(timeout));
      case "openai":
        String apiKey = configuration.getString("gateway.api-key", null);
        if (StringUtils.isBlank(apiKey)) {
          throw new ConfigurationException("gateway.api-key is required for the openai provider");
        }
        OpenAIOkHttpClient.Builder builder =
            OpenAIOkHttpClient.builder().apiKey(apiKey).timeout(timeout);
        String baseUrl = configuration.getString("gateway.base-url", null);
        if (StringUtils.isNotBlank(baseUrl)) {
          builder.baseUrl(baseUrl);
        }
        return new OpenAiModelGateway(configuration, builder.build());
      default:
        throw new ConfigurationException("Unknown gateway.provider: " + provider);
    }
  }
}
