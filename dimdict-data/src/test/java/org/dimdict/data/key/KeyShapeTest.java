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

import java.net.InetAddress;
import java.util.Arrays;
import java.util.List;

import org.dimdict.data.attribute.AttributeUnderlyingType;
import org.dimdict.data.attribute.TypeMismatchException;
import org.dimdict.data.structure.DictionaryAttribute;
import org.testng.Assert;
import org.testng.annotations.Test;

import com.google.common.net.InetAddresses;

/**
 * Tests for {@link KeyShape} and {@link KeysExtractor}.
 *
 * @author Bastian Gloeckle
 */
public class KeyShapeTest {
  private static final List<DictionaryAttribute> SIMPLE_KEY =
      Arrays.asList(DictionaryAttribute.of("id", AttributeUnderlyingType.UINT64));

  private static final List<DictionaryAttribute> COMPLEX_KEY =
      Arrays.asList(DictionaryAttribute.of("name", AttributeUnderlyingType.STRING),
          DictionaryAttribute.of("ip", AttributeUnderlyingType.IPV4),
          DictionaryAttribute.of("num", AttributeUnderlyingType.INT32));

  @Test
  public void shardIsInRangeAndStableTest() {
    for (int shards = 1; shards <= 16; shards++) {
      for (long key = -50; key < 50; key++) {
        int shard = KeyShape.SIMPLE.getShard(key, shards);
        Assert.assertTrue(shard >= 0 && shard < shards, "Shard out of range for key " + key);
        Assert.assertEquals(KeyShape.SIMPLE.getShard(key, shards), shard, "Shard not deterministic");
      }
    }
  }

  @Test
  public void shardsAreUsedTest() {
    // GIVEN
    int shards = 8;
    boolean[] used = new boolean[shards];

    // WHEN
    for (long key = 0; key < 1000; key++)
      used[KeyShape.SIMPLE.getShard(key, shards)] = true;

    // THEN
    for (int i = 0; i < shards; i++)
      Assert.assertTrue(used[i], "Shard " + i + " received no keys");
  }

  @Test
  public void complexKeysEqualForEqualValuesTest() {
    // GIVEN
    Object[] names = new Object[] { "a", "a", "b" };
    Object[] ips = new Object[] { "10.0.0.1", InetAddresses.forString("10.0.0.1"), "10.0.0.1" };
    Object[] nums = new Object[] { 5, 5L, 5 };

    // WHEN
    KeysExtractor<ByteSpan> extractor = KeyShape.COMPLEX.newExtractor(COMPLEX_KEY, Arrays.asList(names, ips, nums));

    // THEN
    Assert.assertEquals(extractor.getNumberOfRows(), 3);
    Assert.assertEquals(extractor.getKey(0), extractor.getKey(1), "Equal key values should result in equal keys");
    Assert.assertNotEquals(extractor.getKey(0), extractor.getKey(2), "Different values should differ");
    Assert.assertEquals(KeyShape.COMPLEX.getShard(extractor.getKey(0), 7),
        KeyShape.COMPLEX.getShard(extractor.getKey(1), 7));
  }

  @Test
  public void complexKeyDecodeTest() {
    // GIVEN
    KeysExtractor<ByteSpan> extractor = KeyShape.COMPLEX.newExtractor(COMPLEX_KEY,
        Arrays.asList(new Object[] { "x" }, new Object[] { "192.168.1.2" }, new Object[] { -3 }));

    // WHEN
    Object[] decoded = KeyShape.COMPLEX.decode(extractor.getKey(0), COMPLEX_KEY);

    // THEN
    Assert.assertEquals(decoded[0], "x");
    Assert.assertEquals(decoded[1], (InetAddress) InetAddresses.forString("192.168.1.2"));
    Assert.assertEquals(decoded[2], -3L);
  }

  @Test
  public void complexKeyPrefixesDoNotCollideTest() {
    // GIVEN two keys whose concatenated strings are equal
    List<DictionaryAttribute> keyAttrs = Arrays.asList(DictionaryAttribute.of("a", AttributeUnderlyingType.STRING),
        DictionaryAttribute.of("b", AttributeUnderlyingType.STRING));

    // WHEN
    KeysExtractor<ByteSpan> extractor = KeyShape.COMPLEX.newExtractor(keyAttrs,
        Arrays.asList(new Object[] { "ab", "a" }, new Object[] { "c", "bc" }));

    // THEN
    Assert.assertNotEquals(extractor.getKey(0), extractor.getKey(1));
  }

  @Test
  public void copyToArenaTest() {
    // GIVEN
    Arena arena = new Arena();
    KeysExtractor<ByteSpan> extractor =
        KeyShape.COMPLEX.newExtractor(COMPLEX_KEY.subList(0, 1), Arrays.<Object[]> asList(new Object[] { "k" }));

    // WHEN
    ByteSpan copy = KeyShape.COMPLEX.copyToArena(extractor.getKey(0), arena);

    // THEN
    Assert.assertEquals(copy, extractor.getKey(0));
    Assert.assertEquals(arena.getBytesUsed(), (long) copy.length());
    Assert.assertEquals(KeyShape.SIMPLE.copyToArena(5L, arena), (Long) 5L);
  }

  @Test(expectedExceptions = TypeMismatchException.class)
  public void nullKeyTest() {
    KeyShape.SIMPLE.newExtractor(SIMPLE_KEY, Arrays.<Object[]> asList(new Object[] { 1L, null }));
  }

  @Test(expectedExceptions = TypeMismatchException.class)
  public void wrongKeyTypeTest() {
    KeyShape.SIMPLE.newExtractor(SIMPLE_KEY, Arrays.<Object[]> asList(new Object[] { "abc" }));
  }
}
