package streamlease.model;

public enum StreamStatus {
  CREATING,
  ACTIVE,
  UPDATING,
  DELETING
}
