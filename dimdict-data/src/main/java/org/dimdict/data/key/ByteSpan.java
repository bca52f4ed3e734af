/**
 * dimdict: Dimension Dictionary.
 *
 * Copyright (C) 2015 Bastian Gloeckle
 *
 * This file is part of dimdict.
 *
 * dimdict is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package org.dimdict.data.key;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import com.google.common.io.BaseEncoding;

/**
 * An immutable view on a range of a byte array.
 * 
 * <p>
 * Spans that are stored inside a dictionary always point into an {@link Arena} owned by that dictionary. Spans that
 * are handed in by callers (e.g. keys that should be looked up) may point anywhere, the dictionary copies them into
 * its own arena before storing them.
 * 
 * <p>
 * {@link #equals(Object)} and {@link #hashCode()} work on the content of the span. The hash code is computed lazily
 * and then remembered.
 *
 * @author Bastian Gloeckle
 */
public final class ByteSpan {
  private final byte[] buffer;
  private final int offset;
  private final int length;

  /** 0 = not computed yet. */
  private int hash;

  /* package */ ByteSpan(byte[] buffer, int offset, int length) {
    if (offset < 0 || length < 0 || offset + length > buffer.length)
      throw new IndexOutOfBoundsException(
          "Span [" + offset + ", " + (offset + length) + ") out of buffer of length " + buffer.length);
    this.buffer = buffer;
    this.offset = offset;
    this.length = length;
  }

  /**
   * Wrap the given array without copying it. The caller must not change the array afterwards.
   */
  public static ByteSpan wrap(byte[] bytes) {
    return new ByteSpan(bytes, 0, bytes.length);
  }

  /**
   * @return A span containing the UTF-8 bytes of the given String.
   */
  public static ByteSpan ofUtf8(String s) {
    return wrap(s.getBytes(StandardCharsets.UTF_8));
  }

  public int length() {
    return length;
  }

  public byte byteAt(int idx) {
    if (idx < 0 || idx >= length)
      throw new IndexOutOfBoundsException("Index " + idx + " of span with length " + length);
    return buffer[offset + idx];
  }

  /**
   * @return A copy of the bytes of this span.
   */
  public byte[] toByteArray() {
    return Arrays.copyOfRange(buffer, offset, offset + length);
  }

  /**
   * @return The bytes of this span interpreted as UTF-8.
   */
  public String toUtf8String() {
    return new String(buffer, offset, length, StandardCharsets.UTF_8);
  }

  /* package */ byte[] getBuffer() {
    return buffer;
  }

  /* package */ int getOffset() {
    return offset;
  }

  @Override
  public int hashCode() {
    int h = hash;
    if (h == 0) {
      h = 1;
      for (int i = offset; i < offset + length; i++)
        h = 31 * h + buffer[i];
      hash = h;
    }
    return h;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (!(obj instanceof ByteSpan))
      return false;
    ByteSpan other = (ByteSpan) obj;
    if (length != other.length)
      return false;
    if (hash != 0 && other.hash != 0 && hash != other.hash)
      return false;
    return Arrays.equals(buffer, offset, offset + length, other.buffer, other.offset, other.offset + other.length);
  }

  @Override
  public String toString() {
    return "ByteSpan[" + BaseEncoding.base16().encode(buffer, offset, length) + "]";
  }
}
