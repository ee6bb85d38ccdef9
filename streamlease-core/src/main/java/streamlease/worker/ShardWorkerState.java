package streamlease.worker;

public enum ShardWorkerState {
  ACQUIRING,
  PROCESSING,
  DRAINING,
  LEASE_LOST,
  SHUTDOWN
}
