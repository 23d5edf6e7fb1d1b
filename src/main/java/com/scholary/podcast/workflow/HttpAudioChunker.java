package com.scholary.podcast.workflow;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podcast.transcript.ChunkReference;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the chunking service.
 *
 * <p>Posts {@code {"episode_id", "audio_url", "s3_bucket"}} to {@code {baseUrl}/invoke} and reads
 * back the chunk list. Downloading and splitting can take a while, hence the long timeout.
 */
public class HttpAudioChunker implements AudioChunker {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpAudioChunker.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final String baseUrl;
  private final Duration timeout;

  public HttpAudioChunker(
      HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, Duration timeout) {
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.baseUrl = baseUrl;
    this.timeout = timeout;
  }

  @Override
  public List<ChunkReference> split(String episodeId, String audioUrl, String bucket) {
    LOGGER.info("Requesting chunks for episode {}", episodeId);

    ChunkerResponse body;
    try {
      byte[] payload =
          objectMapper.writeValueAsBytes(
              Map.of("episode_id", episodeId, "audio_url", audioUrl, "s3_bucket", bucket));
      HttpRequest request =
          HttpRequest.newBuilder()
              .uri(URI.create(baseUrl + "/invoke"))
              .timeout(timeout)
              .header("Content-Type", "application/json")
              .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
              .build();

      HttpResponse<byte[]> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
      if (response.statusCode() != 200) {
        throw new ChunkingException(
            "Chunking service returned status " + response.statusCode());
      }
      body = objectMapper.readValue(response.body(), ChunkerResponse.class);

    } catch (IOException e) {
      throw new ChunkingException("Chunking failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ChunkingException("Chunking interrupted", e);
    }

    if (body.error() != null) {
      throw new ChunkingException("Chunking failed: " + body.error());
    }
    if (body.chunks() == null || body.chunks().isEmpty()) {
      throw new ChunkingException("No chunks returned from chunking service");
    }

    List<ChunkReference> chunks =
        body.chunks().stream()
            .map(c -> new ChunkReference(c.chunkIndex(), c.s3Key(), c.startTimeSeconds()))
            .sorted(Comparator.comparingInt(ChunkReference::chunkIndex))
            .toList();

    LOGGER.info(
        "Created {} chunks for episode {} (reported total {})",
        chunks.size(),
        episodeId,
        body.totalChunks());
    return chunks;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ChunkerResponse(
      List<ChunkEntry> chunks,
      @JsonProperty("total_chunks") Integer totalChunks,
      String error) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ChunkEntry(
      @JsonProperty("chunk_index") int chunkIndex,
      @JsonProperty("s3_key") String s3Key,
      @JsonProperty("start_time_seconds") double startTimeSeconds) {}
}
