package com.scholary.podcast.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sfn.SfnClient;
import software.amazon.awssdk.services.sfn.model.StartExecutionRequest;
import software.amazon.awssdk.services.sfn.model.StartExecutionResponse;

/**
 * Starts one AWS Step Functions execution per episode.
 *
 * <p>Execution input is {@code {"episode_id", "audio_url", "s3_bucket"}}; the execution is named
 * {@code episode-<id prefix>-<epoch seconds>}, which stays inside the 80 character name limit.
 */
public class StepFunctionsWorkflowTrigger implements WorkflowTrigger {

  private static final Logger LOGGER = LoggerFactory.getLogger(StepFunctionsWorkflowTrigger.class);

  private static final int ID_PREFIX_LENGTH = 16;

  private final SfnClient sfnClient;
  private final String stateMachineArn;
  private final ObjectMapper objectMapper;

  public StepFunctionsWorkflowTrigger(
      SfnClient sfnClient, String stateMachineArn, ObjectMapper objectMapper) {
    this.sfnClient = sfnClient;
    this.stateMachineArn = stateMachineArn;
    this.objectMapper = objectMapper;
  }

  @Override
  public WorkflowHandle start(String episodeId, String audioUrl, String bucket) {
    Map<String, String> input = new LinkedHashMap<>();
    input.put("episode_id", episodeId);
    input.put("audio_url", audioUrl);
    input.put("s3_bucket", bucket);

    String name = executionName(episodeId, Instant.now().getEpochSecond());
    try {
      StartExecutionResponse response =
          sfnClient.startExecution(
              StartExecutionRequest.builder()
                  .stateMachineArn(stateMachineArn)
                  .name(name)
                  .input(objectMapper.writeValueAsString(input))
                  .build());

      LOGGER.info(
          "Started workflow execution: episodeId={}, executionArn={}",
          episodeId,
          response.executionArn());
      return new WorkflowHandle(response.executionArn(), response.startDate());

    } catch (JsonProcessingException e) {
      throw new WorkflowTriggerException("Failed to serialize workflow input", e);
    } catch (SdkException e) {
      throw new WorkflowTriggerException(
          "Failed to start Step Functions execution: " + e.getMessage(), e);
    }
  }

  static String executionName(String episodeId, long epochSeconds) {
    String prefix =
        episodeId.length() > ID_PREFIX_LENGTH ? episodeId.substring(0, ID_PREFIX_LENGTH) : episodeId;
    return "episode-" + prefix + "-" + epochSeconds;
  }
}
