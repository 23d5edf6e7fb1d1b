package com.scholary.podcast.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.podcast.transcript.TranscriptChunkResult;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * In-memory implementation of ChunkCache using Caffeine.
 *
 * <p>Entries expire after a configurable duration (default: 24 hours) and the size is bounded;
 * oldest entries are evicted when the limit is reached.
 */
@Component
public class InMemoryChunkCache implements ChunkCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryChunkCache.class);

  private final Cache<String, TranscriptChunkResult> cache;

  public InMemoryChunkCache(
      @Value("${transcription.cache.maxSize:1000}") int maxSize,
      @Value("${transcription.cache.ttlHours:24}") int ttlHours) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofHours(ttlHours))
            .recordStats()
            .build();

    LOGGER.info("Initialized chunk cache: maxSize={}, ttlHours={}", maxSize, ttlHours);
  }

  @Override
  public void put(String cacheKey, TranscriptChunkResult result) {
    cache.put(cacheKey, result);
    LOGGER.debug("Cached chunk: key={}", cacheKey);
  }

  @Override
  public Optional<TranscriptChunkResult> get(String cacheKey) {
    TranscriptChunkResult result = cache.getIfPresent(cacheKey);
    if (result != null) {
      LOGGER.debug("Cache hit: key={}", cacheKey);
      return Optional.of(result);
    }
    LOGGER.debug("Cache miss: key={}", cacheKey);
    return Optional.empty();
  }

  @Override
  public void evictEpisode(String episodeId) {
    String prefix = episodeId + ":";
    List<String> keys =
        cache.asMap().keySet().stream().filter(k -> k.startsWith(prefix)).toList();
    cache.invalidateAll(keys);
    LOGGER.debug("Evicted {} cached chunks for episode {}", keys.size(), episodeId);
  }
}
