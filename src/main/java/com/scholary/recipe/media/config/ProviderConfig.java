package com.scholary.recipe.media.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.recipe.media.asset.AssetRecordStore;
import com.scholary.recipe.media.asset.InMemoryAssetRecordStore;
import com.scholary.recipe.media.provider.MediaProvider;
import com.scholary.recipe.media.provider.cloudflare.CloudflareMediaProvider;
import com.scholary.recipe.media.provider.cloudflare.CloudflareProperties;
import com.scholary.recipe.media.provider.cloudflare.StreamWebhookVerifier;
import com.scholary.recipe.media.service.MediaAssetService;
import java.time.Clock;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the server side of the media pipeline.
 *
 * <p>Wires the asset record store, the media service and the Cloudflare provider. The provider is
 * chosen with {@code media.provider.type}; the object-store provider lives in {@link
 * ObjectStoreConfig}.
 */
@Configuration
public class ProviderConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public AssetRecordStore assetRecordStore(
      @Value("${media.store.max-size}") long maxSize, Clock clock) {
    return new InMemoryAssetRecordStore(maxSize, clock);
  }

  @Bean
  public MediaAssetService mediaAssetService(MediaProvider provider, AssetRecordStore store) {
    return new MediaAssetService(provider, store);
  }

  /** Cloudflare Images and Stream. */
  @Configuration
  @ConditionalOnProperty(name = "media.provider.type", havingValue = "cloudflare")
  @EnableConfigurationProperties(CloudflareProperties.class)
  static class CloudflareProviderConfig {

    @Bean
    public MediaProvider cloudflareMediaProvider(
        CloudflareProperties properties, ObjectMapper objectMapper) {
      return new CloudflareMediaProvider(properties, objectMapper);
    }

    @Bean
    public StreamWebhookVerifier streamWebhookVerifier(
        CloudflareProperties properties, Clock clock) {
      return new StreamWebhookVerifier(
          properties.webhookSecret(),
          Duration.ofSeconds(properties.webhookMaxAgeSeconds()),
          clock);
    }
  }
}
