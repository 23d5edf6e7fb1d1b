package com.scholary.podcast.podcast;

import java.time.Instant;
import java.util.List;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

/** MongoDB implementation of {@link PodcastRepository}. */
@Repository
public class MongoPodcastRepository implements PodcastRepository {

  private final MongoTemplate mongoTemplate;

  public MongoPodcastRepository(MongoTemplate mongoTemplate) {
    this.mongoTemplate = mongoTemplate;
  }

  @Override
  public List<Podcast> findActive() {
    return mongoTemplate.find(Query.query(Criteria.where("active").is(true)), Podcast.class);
  }

  @Override
  public List<Podcast> findActiveByPodcastId(String podcastId) {
    return mongoTemplate.find(
        Query.query(Criteria.where("active").is(true).and("podcast_id").is(podcastId)),
        Podcast.class);
  }

  @Override
  public void markPolled(String podcastId, Instant polledAt) {
    mongoTemplate.updateFirst(
        Query.query(Criteria.where("podcast_id").is(podcastId)),
        Update.update("last_polled_at", polledAt),
        Podcast.class);
  }
}
