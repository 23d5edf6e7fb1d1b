package com.scholary.podcast.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podcast.transcript.ChunkReference;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class HttpAudioChunkerTest {

  @Mock private HttpClient httpClient;
  @Mock private HttpResponse<byte[]> response;

  private HttpAudioChunker chunker;

  @BeforeEach
  void setUp() {
    chunker =
        new HttpAudioChunker(httpClient, new ObjectMapper(), "http://chunker", Duration.ofSeconds(5));
  }

  @Test
  void split_shouldReturnChunksOrderedByIndex() throws Exception {
    respond(
        200,
        "{\"chunks\":["
            + "{\"chunk_index\":1,\"s3_key\":\"chunks/ep/1.mp3\",\"start_time_seconds\":600.0},"
            + "{\"chunk_index\":0,\"s3_key\":\"chunks/ep/0.mp3\",\"start_time_seconds\":0.0}"
            + "],\"total_chunks\":2,\"duration_seconds\":1200}");

    List<ChunkReference> chunks = chunker.split("ep", "https://cdn/ep.mp3", "bucket");

    assertThat(chunks)
        .containsExactly(
            new ChunkReference(0, "chunks/ep/0.mp3", 0.0),
            new ChunkReference(1, "chunks/ep/1.mp3", 600.0));
  }

  @Test
  void split_shouldFailOnEmptyChunkList() throws Exception {
    respond(200, "{\"chunks\":[],\"total_chunks\":0}");

    assertThatThrownBy(() -> chunker.split("ep", "https://cdn/ep.mp3", "bucket"))
        .isInstanceOf(ChunkingException.class)
        .hasMessage("No chunks returned from chunking service");
  }

  @Test
  void split_shouldSurfaceReportedError() throws Exception {
    respond(200, "{\"error\":\"ffmpeg exited with 1\"}");

    assertThatThrownBy(() -> chunker.split("ep", "https://cdn/ep.mp3", "bucket"))
        .isInstanceOf(ChunkingException.class)
        .hasMessage("Chunking failed: ffmpeg exited with 1");
  }

  @Test
  void split_shouldFailOnNonOkStatus() throws Exception {
    when(response.statusCode()).thenReturn(502);
    doReturn(response).when(httpClient).send(any(), any());

    assertThatThrownBy(() -> chunker.split("ep", "https://cdn/ep.mp3", "bucket"))
        .isInstanceOf(ChunkingException.class)
        .hasMessage("Chunking service returned status 502");
  }

  @Test
  void split_shouldWrapIoFailure() throws Exception {
    doThrow(new IOException("connection refused")).when(httpClient).send(any(), any());

    assertThatThrownBy(() -> chunker.split("ep", "https://cdn/ep.mp3", "bucket"))
        .isInstanceOf(ChunkingException.class)
        .hasMessageContaining("connection refused");
  }

  private void respond(int status, String json) throws Exception {
    when(response.statusCode()).thenReturn(status);
    when(response.body()).thenReturn(json.getBytes(StandardCharsets.UTF_8));
    doReturn(response).when(httpClient).send(any(), any());
  }
}
