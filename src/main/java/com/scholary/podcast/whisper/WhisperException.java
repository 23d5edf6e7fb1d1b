package com.scholary.podcast.whisper;

/**
 * Exception thrown when Whisper API calls fail.
 *
 * <p>The kind decides whether the failure is worth retrying.
 */
public class WhisperException extends RuntimeException {

  public enum Kind {
    TIMEOUT(true),
    RATE_LIMITED(true),
    SERVICE_ERROR(true),
    CLIENT_ERROR(false);

    private final boolean transientFailure;

    Kind(boolean transientFailure) {
      this.transientFailure = transientFailure;
    }
  }

  private final Kind kind;

  public WhisperException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public WhisperException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isTransient() {
    return kind.transientFailure;
  }
}
