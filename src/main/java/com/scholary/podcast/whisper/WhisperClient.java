package com.scholary.podcast.whisper;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * HTTP client for a Whisper ASR web service.
 *
 * <p>Posts audio to {@code {baseUrl}/asr} as multipart/form-data with the fields {@code
 * audio_file}, {@code task}, {@code language} and {@code output}, and reads the plain-text
 * transcript from the body. Failures are classified into {@link WhisperException.Kind}s; retrying
 * is left to the caller.
 */
@Component
public class WhisperClient implements WhisperService {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperClient.class);

  private final HttpClient httpClient;
  private final WhisperProperties properties;

  public WhisperClient(WhisperProperties properties) {
    this(
        properties,
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build());
  }

  WhisperClient(WhisperProperties properties, HttpClient httpClient) {
    this.properties = properties;
    this.httpClient = httpClient;
    LOGGER.info("Initialized Whisper client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public String transcribe(String filename, byte[] audio, Duration timeout) {
    LOGGER.info(
        "Transcribing audio: file={}, size={} bytes, timeout={}s",
        filename,
        audio.length,
        timeout.toSeconds());
    return postAsr(filename, BodyPublishers.ofByteArray(audio), timeout);
  }

  /**
   * Download the episode and transcribe it. Download and ASR request share one deadline, so the
   * whole call is bounded by {@code timeout}.
   */
  @Override
  public String transcribeUrl(String audioUrl, Duration timeout) {
    long startNanos = System.nanoTime();
    Path tempFile = download(audioUrl, timeout);
    try {
      Duration remaining =
          remainingBudget(timeout, Duration.ofNanos(System.nanoTime() - startNanos));
      LOGGER.info(
          "Transcribing downloaded audio: url={}, size={} bytes, timeout={}s",
          audioUrl,
          Files.size(tempFile),
          remaining.toSeconds());
      // streamed from disk
      return postAsr(tempFile.getFileName().toString(), BodyPublishers.ofFile(tempFile), remaining);
    } catch (IOException e) {
      throw new WhisperException(
          WhisperException.Kind.SERVICE_ERROR, "Failed to read downloaded audio", e);
    } finally {
      deleteQuietly(tempFile);
    }
  }

  /**
   * What is left of {@code budget} after {@code elapsed}.
   *
   * @throws WhisperException of kind TIMEOUT when nothing is left
   */
  static Duration remainingBudget(Duration budget, Duration elapsed) {
    Duration remaining = budget.minus(elapsed);
    if (remaining.isNegative() || remaining.isZero()) {
      throw new WhisperException(
          WhisperException.Kind.TIMEOUT,
          "Episode timeout of " + budget.toSeconds() + "s used up by the audio download");
    }
    return remaining;
  }

  private String postAsr(String filename, BodyPublisher audioPart, Duration timeout) {
    String boundary = UUID.randomUUID().toString();
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/asr"))
            .timeout(timeout)
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(buildMultipartBody(filename, audioPart, boundary))
            .build();

    HttpResponse<byte[]> response = send(request, "transcription");
    String transcript = new String(response.body(), StandardCharsets.UTF_8);

    LOGGER.info("Transcription successful: file={}, chars={}", filename, transcript.length());
    return transcript;
  }

  @Override
  public boolean isHealthy() {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(URI.create(properties.baseUrl() + "/health"))
            .timeout(Duration.ofSeconds(properties.healthTimeout()))
            .GET()
            .build();
    try {
      HttpResponse<Void> response =
          httpClient.send(request, HttpResponse.BodyHandlers.discarding());
      return response.statusCode() == 200;
    } catch (IOException e) {
      LOGGER.warn("Whisper health check failed: {}", e.getMessage());
      return false;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private Path download(String audioUrl, Duration timeout) {
    LOGGER.info("Downloading audio from: {}", audioUrl);

    HttpRequest request =
        HttpRequest.newBuilder().uri(URI.create(audioUrl)).timeout(timeout).GET().build();
    Path tempFile = null;
    try {
      HttpResponse<InputStream> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
      try (InputStream body = response.body()) {
        if (response.statusCode() != 200) {
          throw new WhisperException(
              classify(response.statusCode()),
              "Download failed with status: " + response.statusCode());
        }
        tempFile = Files.createTempFile("podcast-", ".mp3");
        Files.copy(body, tempFile, StandardCopyOption.REPLACE_EXISTING);
      }
      LOGGER.debug("Audio downloaded to: {}", tempFile);
      return tempFile;
    } catch (HttpTimeoutException e) {
      deleteQuietly(tempFile);
      throw new WhisperException(
          WhisperException.Kind.TIMEOUT, "Audio download timed out: " + audioUrl, e);
    } catch (IOException e) {
      deleteQuietly(tempFile);
      throw new WhisperException(
          WhisperException.Kind.SERVICE_ERROR, "Failed to download audio: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      deleteQuietly(tempFile);
      Thread.currentThread().interrupt();
      throw new WhisperException(
          WhisperException.Kind.SERVICE_ERROR, "Audio download interrupted", e);
    }
  }

  private HttpResponse<byte[]> send(HttpRequest request, String what) {
    LOGGER.debug("Sending {} request to {}", what, request.uri());
    try {
      HttpResponse<byte[]> response =
          httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
      if (response.statusCode() != 200) {
        throw new WhisperException(
            classify(response.statusCode()),
            String.format(
                "Whisper service returned status %d: %s",
                response.statusCode(), new String(response.body(), StandardCharsets.UTF_8)));
      }
      return response;
    } catch (HttpTimeoutException e) {
      throw new WhisperException(
          WhisperException.Kind.TIMEOUT, "Whisper " + what + " request timed out", e);
    } catch (IOException e) {
      throw new WhisperException(
          WhisperException.Kind.SERVICE_ERROR,
          "Whisper " + what + " request failed: " + e.getMessage(),
          e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new WhisperException(
          WhisperException.Kind.SERVICE_ERROR, "Whisper " + what + " request interrupted", e);
    }
  }

  static WhisperException.Kind classify(int statusCode) {
    if (statusCode == 429) {
      return WhisperException.Kind.RATE_LIMITED;
    }
    if (statusCode == 408 || statusCode == 504) {
      return WhisperException.Kind.TIMEOUT;
    }
    if (statusCode >= 500) {
      return WhisperException.Kind.SERVICE_ERROR;
    }
    return WhisperException.Kind.CLIENT_ERROR;
  }

  /**
   * Build the multipart/form-data body by hand; HttpClient has no multipart support.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="audio_file"; filename="chunk_0.mp3"
   * Content-Type: application/octet-stream
   *
   * [binary data]
   * --boundary
   * Content-Disposition: form-data; name="task"
   *
   * transcribe
   * ...
   * --boundary--
   * </pre>
   */
  private BodyPublisher buildMultipartBody(
      String filename, BodyPublisher audioPart, String boundary) {
    StringBuilder sb = new StringBuilder();
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"audio_file\"; filename=\"")
        .append(filename)
        .append("\"\r\n");
    sb.append("Content-Type: application/octet-stream\r\n\r\n");
    byte[] prefix = sb.toString().getBytes(StandardCharsets.UTF_8);

    sb = new StringBuilder();
    sb.append("\r\n");
    appendField(sb, boundary, "task", "transcribe");
    appendField(sb, boundary, "language", properties.language());
    appendField(sb, boundary, "output", properties.outputFormat());
    sb.append("--").append(boundary).append("--\r\n");
    byte[] suffix = sb.toString().getBytes(StandardCharsets.UTF_8);

    return BodyPublishers.concat(
        BodyPublishers.ofByteArray(prefix), audioPart, BodyPublishers.ofByteArray(suffix));
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file {}: {}", file, e.getMessage());
    }
  }
}
