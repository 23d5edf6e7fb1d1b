package com.scholary.podcast.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podcast.objectstore.ObjectStoreClient;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads and writes transcript artifacts in the object store.
 *
 * <p>Layout:
 *
 * <pre>
 * transcripts/{episodeId}/chunk_{index}.json   {"episode_id", "chunk_index", "start_time_seconds", "text"}
 * transcripts/{episodeId}/final.txt            merged plain text
 * bulk-transcripts/{jobId}/{index}.txt         bulk job output
 * </pre>
 */
@Component
public class TranscriptWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptWriter.class);

  private final ObjectMapper objectMapper;
  private final ObjectStoreClient objectStoreClient;

  public TranscriptWriter(ObjectMapper objectMapper, ObjectStoreClient objectStoreClient) {
    this.objectMapper = objectMapper;
    this.objectStoreClient = objectStoreClient;
  }

  public static String chunkKey(String episodeId, int chunkIndex) {
    return String.format("transcripts/%s/chunk_%d.json", episodeId, chunkIndex);
  }

  public static String finalKey(String episodeId) {
    return String.format("transcripts/%s/final.txt", episodeId);
  }

  public static String bulkKey(String jobId, int episodeIndex) {
    return String.format("bulk-transcripts/%s/%d.txt", jobId, episodeIndex);
  }

  /** @return the key the chunk transcript was written to */
  public String writeChunkTranscript(
      String bucket, String episodeId, int chunkIndex, double startTimeSeconds, String text) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("episode_id", episodeId);
    body.put("chunk_index", chunkIndex);
    body.put("start_time_seconds", startTimeSeconds);
    body.put("text", text);

    byte[] json;
    try {
      json = objectMapper.writeValueAsBytes(body);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize chunk transcript " + chunkIndex, e);
    }

    String key = chunkKey(episodeId, chunkIndex);
    objectStoreClient.putObject(bucket, key, json, "application/json");
    return key;
  }

  /**
   * Read the text of a stored chunk transcript. A missing or null {@code text} reads as empty, so
   * the merger skips the chunk.
   *
   * @throws IllegalStateException if the object is not valid JSON
   */
  public String readChunkText(String bucket, String key) {
    byte[] json = objectStoreClient.getObjectBytes(bucket, key);
    JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (IOException e) {
      throw new IllegalStateException("Chunk transcript " + key + " is not valid JSON", e);
    }
    JsonNode text = root == null ? null : root.get("text");
    if (text == null || text.isNull()) {
      LOGGER.warn("Chunk transcript {} has no text; treating it as empty", key);
      return "";
    }
    return text.asText().strip();
  }

  public String writeFinalTranscript(String bucket, String episodeId, String text) {
    String key = finalKey(episodeId);
    objectStoreClient.putObject(
        bucket, key, text.getBytes(StandardCharsets.UTF_8), "text/plain; charset=utf-8");
    return key;
  }

  public String writeBulkTranscript(String bucket, String jobId, int episodeIndex, String text) {
    String key = bulkKey(jobId, episodeIndex);
    objectStoreClient.putObject(
        bucket, key, text.getBytes(StandardCharsets.UTF_8), "text/plain; charset=utf-8");
    return key;
  }
}
