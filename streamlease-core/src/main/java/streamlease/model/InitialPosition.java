package streamlease.model;

/**
 * Where to start reading a shard that has no checkpoint yet.
 */
public enum InitialPosition {
  /** Only records that arrive after the first read. */
  LATEST,
  /** The oldest record still retained by the stream. */
  TRIM_HORIZON
}
