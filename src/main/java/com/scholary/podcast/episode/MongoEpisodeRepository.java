package com.scholary.podcast.episode;

import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

/** MongoDB implementation of {@link EpisodeRepository}. */
@Repository
public class MongoEpisodeRepository implements EpisodeRepository {

  private static final Logger LOGGER = LoggerFactory.getLogger(MongoEpisodeRepository.class);

  private final MongoTemplate mongoTemplate;

  public MongoEpisodeRepository(MongoTemplate mongoTemplate) {
    this.mongoTemplate = mongoTemplate;
  }

  @Override
  public Optional<Episode> findByAudioUrl(String audioUrl) {
    return Optional.ofNullable(
        mongoTemplate.findOne(Query.query(Criteria.where("audio_url").is(audioUrl)), Episode.class));
  }

  @Override
  public Optional<Episode> findByEpisodeId(String episodeId) {
    return Optional.ofNullable(mongoTemplate.findOne(byEpisodeId(episodeId), Episode.class));
  }

  @Override
  public void insert(Episode episode) {
    // MongoTemplate translates E11000 into DuplicateKeyException
    mongoTemplate.insert(episode);
    LOGGER.debug("Inserted episode: episodeId={}", episode.getEpisodeId());
  }

  @Override
  public boolean markProcessing(String episodeId) {
    return update(episodeId, new Update().set("transcript_status", TranscriptStatus.PROCESSING));
  }

  @Override
  public boolean markFailed(String episodeId, String errorMessage) {
    return update(
        episodeId,
        new Update()
            .set("transcript_status", TranscriptStatus.FAILED)
            .set("error_message", errorMessage));
  }

  @Override
  public boolean markCompleted(
      String episodeId, String transcriptKey, int wordCount, Instant processedAt) {
    return update(
        episodeId,
        new Update()
            .set("transcript_status", TranscriptStatus.COMPLETED)
            .set("transcript_s3_key", transcriptKey)
            .set("transcript_word_count", wordCount)
            .set("processed_at", processedAt)
            .unset("error_message"));
  }

  private boolean update(String episodeId, Update update) {
    update.set("updated_at", Instant.now());
    long matched =
        mongoTemplate.updateFirst(byEpisodeId(episodeId), update, Episode.class).getMatchedCount();
    if (matched == 0) {
      LOGGER.warn("No episode found with episodeId={}", episodeId);
    }
    return matched > 0;
  }

  private static Query byEpisodeId(String episodeId) {
    return Query.query(Criteria.where("episode_id").is(episodeId));
  }
}
