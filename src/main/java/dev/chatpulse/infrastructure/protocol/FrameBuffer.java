package dev.chatpulse.infrastructure.protocol;

import java.util.Objects;

/**
 * Expandable accumulation buffer for partially received packets.
 * <p>Backed by one array with manual read/write indices; all positions in the public API are relative to
 * the reader index. Reading the last byte rewinds both indices so steady streaming never grows the array.</p>
 */
final class FrameBuffer {
  private static final int DEFAULT_CAPACITY = 4096;
  private static final int MAX_CAPACITY = 16 * 1024 * 1024; // a body length field tops out below 1 MiB

  private byte[] data;
  private int readIndex;
  private int writeIndex;

  FrameBuffer() {
    this(DEFAULT_CAPACITY);
  }

  FrameBuffer(int initialCapacity) {
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("initialCapacity must be positive");
    }
    data = new byte[Math.min(MAX_CAPACITY, initialCapacity)];
  }

  /** Appends {@code src} in full. */
  void write(byte[] src) {
    Objects.requireNonNull(src, "src");
    if (src.length == 0) {
      return;
    }
    ensureWritable(src.length);
    System.arraycopy(src, 0, data, writeIndex, src.length);
    writeIndex += src.length;
  }

  int readableBytes() {
    return writeIndex - readIndex;
  }

  /** Returns the byte at {@code offset} past the reader index. */
  byte byteAt(int offset) {
    if (offset < 0 || offset >= readableBytes()) {
      throw new IndexOutOfBoundsException("offset " + offset + " outside readable " + readableBytes());
    }
    return data[readIndex + offset];
  }

  /**
   * Finds {@code needle} at or after relative position {@code from}.
   *
   * @return relative index or {@code -1} when not found
   */
  int indexOf(byte[] needle, int from) {
    int limit = writeIndex - needle.length;
    outer:
    for (int i = readIndex + Math.max(0, from); i <= limit; i++) {
      for (int j = 0; j < needle.length; j++) {
        if (data[i + j] != needle[j]) {
          continue outer;
        }
      }
      return i - readIndex;
    }
    return -1;
  }

  /** Drops {@code length} readable bytes. */
  void discard(int length) {
    if (length < 0 || length > readableBytes()) {
      throw new IllegalArgumentException("length out of bounds: " + length);
    }
    readIndex += length;
    if (readIndex == writeIndex) {
      readIndex = 0;
      writeIndex = 0;
    }
  }

  /** Removes and returns {@code length} readable bytes. */
  byte[] take(int length) {
    if (length < 0 || length > readableBytes()) {
      throw new IllegalArgumentException("length out of bounds: " + length);
    }
    byte[] out = new byte[length];
    System.arraycopy(data, readIndex, out, 0, length);
    discard(length);
    return out;
  }

  void clear() {
    readIndex = 0;
    writeIndex = 0;
  }

  private void ensureWritable(int minWritableBytes) {
    if (data.length - writeIndex >= minWritableBytes) {
      return;
    }
    int readable = readableBytes();
    if (readIndex > 0) {
      System.arraycopy(data, readIndex, data, 0, readable);
      readIndex = 0;
      writeIndex = readable;
      if (data.length - writeIndex >= minWritableBytes) {
        return;
      }
    }
    int required = readable + minWritableBytes;
    if (required > MAX_CAPACITY) {
      throw new IllegalStateException("frame buffer would exceed max capacity: " + required);
    }
    int newCapacity = data.length;
    while (newCapacity < required) {
      newCapacity = Math.min(MAX_CAPACITY, newCapacity << 1);
    }
    byte[] next = new byte[newCapacity];
    System.arraycopy(data, 0, next, 0, readable);
    data = next;
  }
}
