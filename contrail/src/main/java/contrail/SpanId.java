/*
 * Copyright 2024 The Contrail Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package contrail;

import java.io.Serializable;
import java.time.Instant;
import java.util.Arrays;
import java.util.Base64;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Identifies a span across threads, processes and stores.
 *
 * <p>The 16 bytes are an 8-byte big-endian timestamp in epoch nanoseconds followed by 8 random
 * bytes. Identifiers made by {@link #next()} strictly increase within a JVM, even under concurrent
 * callers, and are ordered by creation time across processes. {@link #compareTo(SpanId)} is
 * unsigned lexicographic byte order, so sorting by id sorts by creation time.
 *
 * <p>The {@link #toString() display form} is URL-safe base64 without padding, for example
 * {@code "F5E4pfb6Ll9T4Kx9rCTW6g"}.
 */
public final class SpanId implements Comparable<SpanId>, Serializable {
  static final int LENGTH = 16;
  static final AtomicLong LAST_TIMESTAMP = new AtomicLong();
  static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
  static final Base64.Decoder DECODER = Base64.getUrlDecoder();

  /** Returns a new time-ordered identifier. */
  public static SpanId next() {
    Instant now = Instant.now();
    long epochNanos = now.getEpochSecond() * 1_000_000_000L + now.getNano();
    // the clock may not advance between calls, or may step backwards
    long timestamp = LAST_TIMESTAMP.updateAndGet(last -> Math.max(last + 1, epochNanos));
    long random = ThreadLocalRandom.current().nextLong();
    byte[] bytes = new byte[LENGTH];
    writeLong(bytes, 0, timestamp);
    writeLong(bytes, 8, random);
    return new SpanId(bytes);
  }

  /** Returns the identifier with the given 16 bytes. */
  public static SpanId fromBytes(byte[] bytes) {
    if (bytes == null) throw new NullPointerException("bytes == null");
    if (bytes.length != LENGTH) {
      throw new IllegalArgumentException("span ID must be 16 bytes, was " + bytes.length);
    }
    return new SpanId(bytes.clone());
  }

  /** Parses the {@link #toString() display form}. */
  public static SpanId fromString(String value) {
    if (value == null) throw new NullPointerException("value == null");
    if (value.indexOf('=') != -1) {
      throw new IllegalArgumentException("span ID must not be padded: " + value);
    }
    byte[] bytes;
    try {
      bytes = DECODER.decode(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("malformed span ID: " + value, e);
    }
    if (bytes.length != LENGTH) throw new IllegalArgumentException("malformed span ID: " + value);
    return new SpanId(bytes);
  }

  final byte[] bytes;

  SpanId(byte[] bytes) {
    this.bytes = bytes;
  }

  /** Returns a copy of the 16 bytes of this identifier. */
  public byte[] toBytes() {
    return bytes.clone();
  }

  /** Nanoseconds since epoch when this identifier was made. */
  public long epochNanos() {
    long result = 0;
    for (int i = 0; i < 8; i++) {
      result = (result << 8) | (bytes[i] & 0xff);
    }
    return result;
  }

  @Override public int compareTo(SpanId that) {
    return Arrays.compareUnsigned(bytes, that.bytes);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SpanId)) return false;
    return Arrays.equals(bytes, ((SpanId) o).bytes);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(bytes);
  }

  @Override public String toString() {
    return ENCODER.encodeToString(bytes);
  }

  static void writeLong(byte[] data, int offset, long value) {
    for (int i = 7; i >= 0; i--) {
      data[offset + i] = (byte) (value & 0xff);
      value >>>= 8;
    }
  }

  private static final long serialVersionUID = 1L;
}
