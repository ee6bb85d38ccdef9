package streamlease.util;

import java.net.InetAddress;

/**
 * Applies a simplistic algorithm for guessing the hostname of the local host:
 * <p/>
 * If a HOSTNAME environment-variable is set, then use that.
 * <p/>
 * Otherwise, try {@link InetAddress#getLocalHost}.{@link InetAddress#getCanonicalHostName() getCanonicalHostName}
 * (which relies on a reverse-DNS lookup, so not always reliable/accurate).
 */
public final class LocalHost {
  private static final String HOSTNAME = lookupHostname();

  private LocalHost() { }

  public static String getLocalHostname() {
    return HOSTNAME;
  }

  private static String lookupHostname() {
    String hostname = System.getenv("HOSTNAME");
    if (hostname != null && !hostname.isBlank()) return hostname;
    try {
      return InetAddress.getLocalHost().getCanonicalHostName();
    } catch (Exception e) {
      return "unknown_hostname";
    }
  }
}
