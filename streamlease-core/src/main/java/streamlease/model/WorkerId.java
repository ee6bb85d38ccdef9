package streamlease.model;

import org.immutables.value.Value;
import streamlease.util.LocalHost;
import streamlease.util.strings.RandomId;

/**
 * Identifies one consumer process: {@code <hostname>:<random token>}. Generated once at startup.
 */
@Value.Immutable(intern = true)
public abstract class WorkerId {
  public static WorkerId of(String id) {
    return ImmutableWorkerId.of(id);
  }

  public static WorkerId generate() {
    return of(LocalHost.getLocalHostname() + ':' + RandomId.newRandomId());
  }

  @Value.Parameter
  public abstract String id();

  @Override
  public String toString() {
    return id();
  }
}
