package streamlease.model;

import java.math.BigInteger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A shard-assigned record position. Backends may hand out values wider than 64 bits, so the value is held
 * as an arbitrary-precision non-negative integer and compared numerically.
 */
public final class SequenceNumber implements Comparable<SequenceNumber> {
  private final BigInteger value;

  private SequenceNumber(BigInteger value) {
    checkArgument(value.signum() >= 0, "Sequence numbers must not be negative: %s", value);
    this.value = value;
  }

  public static SequenceNumber of(String value) {
    try {
      return new SequenceNumber(new BigInteger(value));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid sequence number: " + value, e);
    }
  }

  public static SequenceNumber of(long value) {
    return new SequenceNumber(BigInteger.valueOf(value));
  }

  public BigInteger value() {
    return value;
  }

  public boolean isAfter(SequenceNumber other) {
    return compareTo(other) > 0;
  }

  @Override
  public int compareTo(SequenceNumber o) {
    return value.compareTo(o.value);
  }

  @Override
  public boolean equals(Object o) {
    return this == o || (o instanceof SequenceNumber that && value.equals(that.value));
  }

  @Override
  public int hashCode() {
    return value.hashCode();
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
