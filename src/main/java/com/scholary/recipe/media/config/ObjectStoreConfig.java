package com.scholary.recipe.media.config;

import com.scholary.recipe.media.objectstore.ObjectStoreClient;
import com.scholary.recipe.media.objectstore.ObjectStoreProperties;
import com.scholary.recipe.media.objectstore.S3ObjectStoreClient;
import com.scholary.recipe.media.provider.MediaProvider;
import com.scholary.recipe.media.provider.objectstore.ObjectStoreMediaProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for object storage.
 *
 * <p>Only active with {@code media.provider.type=object-store}. This wires up the
 * ObjectStoreClient bean using properties from application.yml and the media provider on top of
 * it.
 */
@Configuration
@ConditionalOnProperty(name = "media.provider.type", havingValue = "object-store")
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }

  @Bean
  public MediaProvider objectStoreMediaProvider(
      ObjectStoreClient objectStoreClient, ObjectStoreProperties properties) {
    return new ObjectStoreMediaProvider(objectStoreClient, properties);
  }
}
