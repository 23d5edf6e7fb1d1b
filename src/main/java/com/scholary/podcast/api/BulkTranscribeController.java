package com.scholary.podcast.api;

import com.scholary.podcast.job.BulkJob;
import com.scholary.podcast.job.BulkJobManager;
import com.scholary.podcast.whisper.WhisperService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Developer endpoints for bulk transcription of a feed.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Starting a job and returning immediately
 *   <li>Polling job progress and listing recent jobs
 *   <li>Cooperative cancellation between episodes
 * </ul>
 */
@RestController
@RequestMapping("/api/dev/bulk-transcribe")
@Tag(name = "Bulk Transcribe", description = "Sequential transcription of a whole podcast feed")
public class BulkTranscribeController {

  private static final Logger LOGGER = LoggerFactory.getLogger(BulkTranscribeController.class);

  private final BulkJobManager jobManager;
  private final WhisperService whisperService;

  public BulkTranscribeController(BulkJobManager jobManager, WhisperService whisperService) {
    this.jobManager = jobManager;
    this.whisperService = whisperService;
  }

  @PostMapping
  @Operation(
      summary = "Start a bulk transcription job",
      description =
          "Parses the feed, creates a job with the earliest episodes and processes them one at a "
              + "time in the background. Poll the returned job for progress.")
  public ResponseEntity<BulkJob> startJob(@Valid @RequestBody BulkTranscribeRequest request) {
    LOGGER.info(
        "Bulk transcribe request: rssUrl={}, maxEpisodes={}",
        request.rssUrl(),
        request.maxEpisodes());
    BulkJob job = jobManager.createJob(request.rssUrl(), request.maxEpisodes());
    jobManager.startJob(job.getJobId());
    return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
  }

  @GetMapping
  @Operation(summary = "List recent bulk jobs")
  public JobListResponse listJobs() {
    List<BulkJob> jobs = jobManager.listJobs();
    return new JobListResponse(jobs, jobs.size());
  }

  @GetMapping("/{jobId}")
  @Operation(summary = "Get bulk job status and per-episode progress")
  public BulkJob getJob(@PathVariable String jobId) {
    return jobManager.getJob(jobId);
  }

  @PostMapping("/{jobId}/cancel")
  @Operation(
      summary = "Cancel a running bulk job",
      description = "The episode currently being transcribed finishes; no further episode starts.")
  public CancelJobResponse cancelJob(@PathVariable String jobId) {
    boolean cancelled = jobManager.cancelJob(jobId);
    String message =
        cancelled
            ? "Cancellation requested; the job stops before its next episode"
            : "Job is not running";
    return new CancelJobResponse(jobId, cancelled, message);
  }

  @GetMapping("/health")
  @Operation(summary = "Check the ASR backend")
  public ResponseEntity<HealthResponse> health() {
    boolean healthy = whisperService.isHealthy();
    HealthResponse body = new HealthResponse(healthy ? "UP" : "DOWN", healthy);
    return healthy
        ? ResponseEntity.ok(body)
        : ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
  }
}
