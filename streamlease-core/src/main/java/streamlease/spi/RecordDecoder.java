package streamlease.spi;

import streamlease.exceptions.RecordDecodeException;

@FunctionalInterface
public interface RecordDecoder<T> {
  T decode(byte[] data) throws RecordDecodeException;
}
