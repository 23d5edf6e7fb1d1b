package com.scholary.podcast.api;

import com.scholary.podcast.ingestion.FeedIngestor;
import com.scholary.podcast.ingestion.IngestionResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Manual trigger for feed polling. */
@RestController
@RequestMapping("/api/ingestion")
@Tag(name = "Ingestion", description = "Discover new episodes from subscribed feeds")
public class IngestionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(IngestionController.class);

  private final FeedIngestor feedIngestor;

  public IngestionController(FeedIngestor feedIngestor) {
    this.feedIngestor = feedIngestor;
  }

  @PostMapping("/poll")
  @Operation(
      summary = "Poll podcast feeds",
      description =
          "Polls one podcast when podcastId is given, otherwise every active podcast. New "
              + "episodes are registered and their transcription workflow is started.")
  public IngestionResult poll(@RequestBody(required = false) PollRequest request) {
    String podcastId = request != null ? request.podcastId() : null;
    LOGGER.info("Manual poll requested: podcastId={}", podcastId);
    return feedIngestor.ingest(podcastId);
  }
}
