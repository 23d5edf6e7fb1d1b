package com.scholary.podcast.config;

import com.scholary.podcast.episode.Episode;
import com.scholary.podcast.job.BulkJob;
import com.scholary.podcast.podcast.Podcast;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.stereotype.Component;

/**
 * Ensures the unique indexes deduplication relies on.
 *
 * <p>The audio_url index is what turns a lost registration race into a DuplicateKeyException.
 */
@Component
public class MongoIndexInitializer implements ApplicationRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(MongoIndexInitializer.class);

  private final MongoTemplate mongoTemplate;

  public MongoIndexInitializer(MongoTemplate mongoTemplate) {
    this.mongoTemplate = mongoTemplate;
  }

  @Override
  public void run(ApplicationArguments args) {
    ensureUnique(Episode.class, "episode_id");
    ensureUnique(Episode.class, "audio_url");
    ensureUnique(BulkJob.class, "job_id");
    ensureUnique(Podcast.class, "podcast_id");
    mongoTemplate
        .indexOps(BulkJob.class)
        .ensureIndex(new Index().on("created_at", Sort.Direction.DESC));
    LOGGER.info("MongoDB indexes ensured");
  }

  private void ensureUnique(Class<?> type, String field) {
    mongoTemplate.indexOps(type).ensureIndex(new Index().on(field, Sort.Direction.ASC).unique());
  }
}
