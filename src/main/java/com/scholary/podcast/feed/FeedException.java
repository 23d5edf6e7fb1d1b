package com.scholary.podcast.feed;

/** Feed could not be fetched or parsed. Never retried. */
public class FeedException extends RuntimeException {

  public enum Kind {
    FETCH,
    PARSE
  }

  private final Kind kind;

  public FeedException(Kind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public FeedException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public Kind getKind() {
    return kind;
  }
}
