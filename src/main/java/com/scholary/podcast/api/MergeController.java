package com.scholary.podcast.api;

import com.scholary.podcast.service.MergeOutcome;
import com.scholary.podcast.service.MergeRequest;
import com.scholary.podcast.service.TranscriptMergeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Merge stage of the external workflow.
 *
 * <p>Called once every chunk transcript of an episode is stored. The outcome is returned with 200
 * even when the episode failed; the failure is recorded on the episode.
 */
@RestController
@RequestMapping("/api/transcripts")
@Tag(name = "Transcripts", description = "Merge chunk transcripts into the final transcript")
public class MergeController {

  private final TranscriptMergeService mergeService;

  public MergeController(TranscriptMergeService mergeService) {
    this.mergeService = mergeService;
  }

  @PostMapping("/merge")
  @Operation(summary = "Merge stored chunk transcripts of an episode")
  public MergeOutcome merge(@RequestBody MergeRequest request) {
    return mergeService.mergeStoredChunks(request);
  }
}
