package com.scholary.podcast.transcript;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Concatenates chunk transcripts into one text with periodic timestamp markers.
 *
 * <p>Chunks are ordered by index regardless of input order, and the full index range {@code [0,
 * n-1]} must be present. A marker line {@code [HH:MM:SS]} precedes a chunk when at least {@code
 * interval} seconds have passed since the last marked chunk; the first kept chunk is always marked.
 * Chunks with blank text are dropped without a marker or separator.
 *
 * <p>Pure: no I/O, safe to share between threads.
 */
public class TranscriptMerger {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptMerger.class);

  public static final int DEFAULT_TIMESTAMP_INTERVAL_SECONDS = 300;

  private final int timestampIntervalSeconds;

  public TranscriptMerger() {
    this(DEFAULT_TIMESTAMP_INTERVAL_SECONDS);
  }

  public TranscriptMerger(int timestampIntervalSeconds) {
    if (timestampIntervalSeconds <= 0) {
      throw new IllegalArgumentException("timestampIntervalSeconds must be positive");
    }
    this.timestampIntervalSeconds = timestampIntervalSeconds;
  }

  /**
   * Merge chunk transcripts.
   *
   * @param chunks chunk results in any order
   * @param addTimestamps whether to emit marker lines
   * @param expectedTotal optional chunk count hint; a mismatch is only logged
   * @return merged text and word count
   * @throws IllegalArgumentException if no chunks were given
   * @throws MissingChunkException naming the first absent index
   */
  public MergedTranscript merge(
      List<ChunkResultWithTiming> chunks, boolean addTimestamps, Integer expectedTotal) {
    if (chunks == null || chunks.isEmpty()) {
      throw new IllegalArgumentException("No transcripts provided");
    }

    List<ChunkResultWithTiming> sorted = new ArrayList<>(chunks);
    sorted.sort(Comparator.comparingInt(ChunkResultWithTiming::chunkIndex));

    BitSet present = new BitSet(sorted.size());
    for (ChunkResultWithTiming chunk : sorted) {
      if (chunk.chunkIndex() >= 0) {
        present.set(chunk.chunkIndex());
      }
    }
    int firstMissing = present.nextClearBit(0);
    if (firstMissing < sorted.size()) {
      throw new MissingChunkException(firstMissing);
    }

    if (expectedTotal != null && expectedTotal != sorted.size()) {
      LOGGER.warn(
          "Expected {} chunks but received {}; merging what was received",
          expectedTotal,
          sorted.size());
    }

    StringBuilder text = new StringBuilder();
    int wordCount = 0;
    // guarantees a marker before the first kept chunk, whatever its start time
    double lastMarked = Double.NEGATIVE_INFINITY;

    for (ChunkResultWithTiming chunk : sorted) {
      String chunkText = chunk.text() == null ? "" : chunk.text().strip();
      if (chunkText.isEmpty()) {
        LOGGER.debug("Skipping empty chunk {}", chunk.chunkIndex());
        continue;
      }

      if (addTimestamps && chunk.startTimeSeconds() - lastMarked >= timestampIntervalSeconds) {
        text.append('\n').append(formatTimestamp(chunk.startTimeSeconds())).append('\n');
        lastMarked = chunk.startTimeSeconds();
      }

      text.append(chunkText).append("\n\n");
      wordCount += countWords(chunkText);
    }

    String merged = text.toString().strip();
    LOGGER.info("Merged {} chunks: {} words", sorted.size(), wordCount);
    return new MergedTranscript(merged, wordCount);
  }

  /** Format whole seconds as {@code [HH:MM:SS]}; hours are not wrapped at 24. */
  static String formatTimestamp(double seconds) {
    long total = (long) seconds;
    long hours = total / 3600;
    long minutes = (total % 3600) / 60;
    long secs = total % 60;
    return String.format("[%02d:%02d:%02d]", hours, minutes, secs);
  }

  static int countWords(String text) {
    String trimmed = text.strip();
    if (trimmed.isEmpty()) {
      return 0;
    }
    return trimmed.split("\\s+").length;
  }
}
