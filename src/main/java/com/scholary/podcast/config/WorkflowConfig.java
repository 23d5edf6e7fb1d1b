package com.scholary.podcast.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.podcast.cache.ChunkCache;
import com.scholary.podcast.episode.EpisodeStatusUpdater;
import com.scholary.podcast.service.ChunkTranscriptionCoordinator;
import com.scholary.podcast.service.EpisodeTranscriptionPipeline;
import com.scholary.podcast.service.TranscriptMergeService;
import com.scholary.podcast.workflow.AudioChunker;
import com.scholary.podcast.workflow.HttpAudioChunker;
import com.scholary.podcast.workflow.LocalWorkflowTrigger;
import com.scholary.podcast.workflow.StepFunctionsWorkflowTrigger;
import com.scholary.podcast.workflow.WorkflowProperties;
import com.scholary.podcast.workflow.WorkflowTrigger;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sfn.SfnClient;

/**
 * Selects how new episodes are transcribed.
 *
 * <p>{@code workflow.mode=local} runs the split/transcribe/merge pipeline in this process; {@code
 * workflow.mode=step-functions} starts a Step Functions execution per episode.
 */
@Configuration
@EnableConfigurationProperties(WorkflowProperties.class)
public class WorkflowConfig {

  @Configuration
  @ConditionalOnProperty(prefix = "workflow", name = "mode", havingValue = "local", matchIfMissing = true)
  static class Local {

    @Bean
    public AudioChunker audioChunker(WorkflowProperties properties, ObjectMapper objectMapper) {
      HttpClient httpClient =
          HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build();
      return new HttpAudioChunker(
          httpClient,
          objectMapper,
          properties.chunkerBaseUrl(),
          Duration.ofSeconds(properties.chunkerTimeoutSeconds()));
    }

    @Bean
    public EpisodeTranscriptionPipeline episodeTranscriptionPipeline(
        AudioChunker audioChunker,
        ChunkTranscriptionCoordinator coordinator,
        TranscriptMergeService mergeService,
        EpisodeStatusUpdater statusUpdater,
        ChunkCache chunkCache) {
      return new EpisodeTranscriptionPipeline(
          audioChunker, coordinator, mergeService, statusUpdater, chunkCache);
    }

    @Bean
    public WorkflowTrigger workflowTrigger(
        EpisodeTranscriptionPipeline pipeline,
        @Qualifier("workflowExecutor") Executor workflowExecutor) {
      return new LocalWorkflowTrigger(pipeline, workflowExecutor);
    }
  }

  @Configuration
  @ConditionalOnProperty(prefix = "workflow", name = "mode", havingValue = "step-functions")
  static class StepFunctions {

    @Bean(destroyMethod = "close")
    public SfnClient sfnClient(WorkflowProperties properties) {
      Region region =
          properties.region() != null && !properties.region().isEmpty()
              ? Region.of(properties.region())
              : Region.US_EAST_1;
      return SfnClient.builder().region(region).build();
    }

    @Bean
    public WorkflowTrigger workflowTrigger(
        SfnClient sfnClient, WorkflowProperties properties, ObjectMapper objectMapper) {
      if (properties.stateMachineArn() == null || properties.stateMachineArn().isBlank()) {
        throw new IllegalStateException(
            "workflow.stateMachineArn is required when workflow.mode=step-functions");
      }
      return new StepFunctionsWorkflowTrigger(sfnClient, properties.stateMachineArn(), objectMapper);
    }
  }
}
