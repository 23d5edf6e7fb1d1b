package com.scholary.podcast.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.podcast.feed.FeedException;
import com.scholary.podcast.ingestion.PodcastNotFoundException;
import com.scholary.podcast.job.JobNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

class ApiExceptionHandlerTest {

  private final ApiExceptionHandler handler = new ApiExceptionHandler();

  @Test
  void handleNotFound_shouldReturn404WithMessage() {
    ResponseEntity<ApiExceptionHandler.ApiError> job =
        handler.handleNotFound(new JobNotFoundException("job_x"));
    ResponseEntity<ApiExceptionHandler.ApiError> podcast =
        handler.handleNotFound(new PodcastNotFoundException("p1"));

    assertThat(job.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(job.getBody().message()).isEqualTo("Job not found: job_x");
    assertThat(podcast.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    assertThat(podcast.getBody().error()).isEqualTo("PodcastNotFoundException");
  }

  @Test
  void handleInvalidRequest_shouldReturn400() {
    ResponseEntity<ApiExceptionHandler.ApiError> response =
        handler.handleInvalidRequest(new IllegalArgumentException("No episodes found in RSS feed"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody().message()).isEqualTo("No episodes found in RSS feed");
    assertThat(response.getBody().timestamp()).isNotNull();
  }

  @Test
  void handleFeed_shouldReturn400ForUnreadableFeed() {
    ResponseEntity<ApiExceptionHandler.ApiError> response =
        handler.handleFeed(new FeedException(FeedException.Kind.PARSE, "Malformed feed"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
  }
}
