package streamlease.util.strings;

import com.google.common.io.BaseEncoding;

import java.nio.ByteBuffer;
import java.util.UUID;

public class RandomId {
  private static final int UUID_BYTE_LENGTH = 2 * Long.BYTES;
  private static final BaseEncoding RANDOM_ID_ENCODING = BaseEncoding.base32Hex().lowerCase().omitPadding();

  private RandomId() { }

  public static String newRandomId() {
    return RANDOM_ID_ENCODING.encode(toBytes(UUID.randomUUID()));
  }

  public static byte[] toBytes(UUID identifier) {
    return ByteBuffer.allocate(UUID_BYTE_LENGTH)
            .putLong(identifier.getMostSignificantBits())
            .putLong(identifier.getLeastSignificantBits())
            .array();
  }
}
