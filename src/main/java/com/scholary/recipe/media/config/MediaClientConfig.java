package com.scholary.recipe.media.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.recipe.media.client.ConfirmationService;
import com.scholary.recipe.media.client.MediaApiClient;
import com.scholary.recipe.media.client.MediaClientProperties;
import com.scholary.recipe.media.client.PollingPolicy;
import com.scholary.recipe.media.client.ProcessingPoller;
import com.scholary.recipe.media.client.UploadBroker;
import com.scholary.recipe.media.session.UploadSessionFactory;
import com.scholary.recipe.media.transfer.FormPostTransferStrategy;
import com.scholary.recipe.media.transfer.PresignedPutTransferStrategy;
import com.scholary.recipe.media.transfer.TransferClient;
import com.scholary.recipe.media.transfer.TusTransferStrategy;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for the upload client pipeline.
 *
 * <p>Wires the broker, transfer client, confirmation service and poller from the "media.client.*"
 * properties, and exposes an {@link UploadSessionFactory} for callers that drive uploads.
 */
@Configuration
@EnableConfigurationProperties(MediaClientProperties.class)
public class MediaClientConfig {

  @Bean
  public MediaApiClient mediaApiClient(
      MediaClientProperties properties,
      ObjectMapper objectMapper,
      @Qualifier("mediaClientExecutor") ThreadPoolTaskExecutor executor) {
    return new MediaApiClient(properties, objectMapper, executor);
  }

  @Bean
  public UploadBroker uploadBroker(MediaApiClient apiClient, MediaClientProperties properties) {
    return new UploadBroker(apiClient, properties.limits());
  }

  @Bean
  public TransferClient transferClient(
      MediaClientProperties properties,
      @Qualifier("mediaClientExecutor") ThreadPoolTaskExecutor executor) {
    HttpClient httpClient =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .executor(executor)
            .build();
    Duration timeout = Duration.ofSeconds(properties.transfer().timeout());
    return new TransferClient(
        List.of(
            new FormPostTransferStrategy(httpClient, timeout),
            new PresignedPutTransferStrategy(httpClient, timeout),
            new TusTransferStrategy(httpClient, properties.transfer(), executor)));
  }

  @Bean
  public ConfirmationService confirmationService(MediaApiClient apiClient) {
    return new ConfirmationService(apiClient);
  }

  @Bean
  public ProcessingPoller processingPoller(
      MediaApiClient apiClient,
      MediaClientProperties properties,
      @Qualifier("mediaPollScheduler") ThreadPoolTaskScheduler scheduler) {
    PollingPolicy policy =
        new PollingPolicy(
            Duration.ofMillis(properties.polling().intervalMillis()),
            properties.polling().maxAttempts());
    return new ProcessingPoller(apiClient, scheduler.getScheduledExecutor(), policy);
  }

  @Bean
  public UploadSessionFactory uploadSessionFactory(
      UploadBroker broker,
      TransferClient transferClient,
      ConfirmationService confirmationService,
      ProcessingPoller poller) {
    return new UploadSessionFactory(broker, transferClient, confirmationService, poller);
  }
}
