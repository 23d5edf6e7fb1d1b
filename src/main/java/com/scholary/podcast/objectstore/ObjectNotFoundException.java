package com.scholary.podcast.objectstore;

/** The requested object does not exist. Not retryable. */
public class ObjectNotFoundException extends ObjectStoreException {

  public ObjectNotFoundException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public boolean isTransient() {
    return false;
  }
}
