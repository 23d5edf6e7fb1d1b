package com.scholary.podcast.objectstore;

/**
 * Abstraction for object storage operations.
 *
 * <p>Chunk audio, chunk transcripts and final transcripts all live in the object store. They are
 * small enough to move as byte arrays.
 */
public interface ObjectStoreClient {

  /**
   * Retrieve an object's content.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return the object bytes
   * @throws ObjectNotFoundException if the object doesn't exist
   * @throws ObjectStoreException if retrieval fails
   */
  byte[] getObjectBytes(String bucket, String key);

  /**
   * Store an object, replacing any existing object under the same key.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param data the object content
   * @param contentType the MIME type of the object
   * @throws ObjectStoreException if the upload fails
   */
  void putObject(String bucket, String key, byte[] data, String contentType);
}
