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

import org.testng.Assert;
import org.testng.annotations.Test;

/**
 *
 * @author Bastian Gloeckle
 */
public class ArenaTest {
  @Test
  public void copiesAreIndependentOfSourceTest() {
    // GIVEN
    Arena arena = new Arena(8);
    byte[] src = new byte[] { 1, 2, 3 };

    // WHEN
    ByteSpan copy = arena.copyOf(src, 0, 3);
    src[0] = 99;

    // THEN
    Assert.assertEquals(copy.toByteArray(), new byte[] { 1, 2, 3 }, "Copy should not change with source");
  }

  @Test
  public void chunksGrowTest() {
    // GIVEN
    Arena arena = new Arena(4);

    // WHEN
    ByteSpan a = arena.copyOf(ByteSpan.ofUtf8("abc"));
    ByteSpan b = arena.copyOf(ByteSpan.ofUtf8("defgh"));
    ByteSpan c = arena.copyOf(ByteSpan.ofUtf8("x"));

    // THEN
    Assert.assertEquals(a.toUtf8String(), "abc");
    Assert.assertEquals(b.toUtf8String(), "defgh");
    Assert.assertEquals(c.toUtf8String(), "x");
    Assert.assertEquals(arena.getNumberOfChunks(), 2, "Expected second chunk to be allocated");
    Assert.assertEquals(arena.getBytesUsed(), 9L);
    Assert.assertEquals(arena.getBytesAllocated(), 4L + 8L, "Second chunk should be doubled in size");
  }

  @Test
  public void oversizedCopyTest() {
    // GIVEN
    Arena arena = new Arena(2);
    byte[] big = new byte[100];
    big[99] = 7;

    // WHEN
    ByteSpan span = arena.copyOf(big, 0, big.length);

    // THEN
    Assert.assertEquals(span.length(), 100);
    Assert.assertEquals(span.byteAt(99), (byte) 7);
    Assert.assertTrue(arena.getBytesAllocated() >= 100);
  }

  @Test
  public void copiedSpanEqualsOriginalTest() {
    // GIVEN
    Arena arena = new Arena();
    ByteSpan orig = ByteSpan.ofUtf8("hello");

    // WHEN
    ByteSpan copy = arena.copyOf(orig);

    // THEN
    Assert.assertEquals(copy, orig);
    Assert.assertEquals(copy.hashCode(), orig.hashCode());
  }
}
