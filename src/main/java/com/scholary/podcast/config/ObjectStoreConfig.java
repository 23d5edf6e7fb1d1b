package com.scholary.podcast.config;

import com.scholary.podcast.objectstore.ObjectStoreClient;
import com.scholary.podcast.objectstore.ObjectStoreProperties;
import com.scholary.podcast.objectstore.S3ObjectStoreClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Wires up the ObjectStoreClient bean from the objectstore.* properties. */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean(destroyMethod = "close")
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties) {
    return new S3ObjectStoreClient(properties);
  }
}
