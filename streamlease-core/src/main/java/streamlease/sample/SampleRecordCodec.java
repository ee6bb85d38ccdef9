package streamlease.sample;

import streamlease.exceptions.RecordDecodeException;
import streamlease.spi.RecordDecoder;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

public class SampleRecordCodec implements RecordDecoder<SampleRecord> {
  static final String DATA_PREFIX = "testData-";
  static final String PARTITION_KEY_PREFIX = "partitionKey-";

  public static byte[] encode(long createTimeMillis) {
    return (DATA_PREFIX + createTimeMillis).getBytes(StandardCharsets.UTF_8);
  }

  public static String partitionKey(long createTimeMillis) {
    return PARTITION_KEY_PREFIX + createTimeMillis;
  }

  @Override
  public SampleRecord decode(byte[] data) throws RecordDecodeException {
    String text;
    try {
      text = StandardCharsets.UTF_8.newDecoder()
              .onMalformedInput(CodingErrorAction.REPORT)
              .onUnmappableCharacter(CodingErrorAction.REPORT)
              .decode(ByteBuffer.wrap(data))
              .toString();
    } catch (CharacterCodingException e) {
      throw new RecordDecodeException("Payload is not valid UTF-8", e);
    }

    if (!text.startsWith(DATA_PREFIX)) {
      throw new RecordDecodeException("Unexpected payload format: " + text);
    }
    try {
      return SampleRecord.of(text, Long.parseLong(text.substring(DATA_PREFIX.length())));
    } catch (NumberFormatException e) {
      throw new RecordDecodeException("Unexpected payload format: " + text, e);
    }
  }
}
