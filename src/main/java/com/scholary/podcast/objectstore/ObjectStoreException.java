package com.scholary.podcast.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Everything except {@link ObjectNotFoundException} is treated as transient by the retry
 * policy.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }

  public boolean isTransient() {
    return true;
  }
}
