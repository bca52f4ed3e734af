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

import java.util.List;

import org.dimdict.data.structure.DictionaryAttribute;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;

/**
 * Operations that depend on the shape of the keys of a dictionary, see {@link DictionaryKeyType}.
 * 
 * <p>
 * There are exactly two instances: {@link #SIMPLE} with {@link Long} keys and {@link #COMPLEX} with {@link ByteSpan}
 * keys.
 * 
 * <p>
 * The shard of a key is computed with CRC32C, while the hash tables of the shards use their own hash functions (see
 * org.dimdict.data.container). If both used the same function, all keys of one shard would cluster in a part of the
 * buckets of the tables of that shard.
 *
 * @param <K>
 *          Java type of the keys.
 * @author Bastian Gloeckle
 */
public abstract class KeyShape<K> {
  public static final KeyShape<Long> SIMPLE = new SimpleKeyShape();

  public static final KeyShape<ByteSpan> COMPLEX = new ComplexKeyShape();

  private static final HashFunction SHARD_HASH = Hashing.crc32c();

  private KeyShape() {
  }

  public static KeyShape<?> of(DictionaryKeyType keyType) {
    return (keyType == DictionaryKeyType.SIMPLE) ? SIMPLE : COMPLEX;
  }

  public abstract DictionaryKeyType getKeyType();

  /**
   * @return Hash of the key that is used to find the shard of the key.
   */
  public abstract int shardHash(K key);

  /**
   * @return The shard of the given key, in range 0..shards-1. Depends on the value of the key only.
   */
  public int getShard(K key, int shards) {
    if (shards == 1)
      return 0;
    return (int) (Integer.toUnsignedLong(shardHash(key)) % shards);
  }

  /**
   * @return A key equal to the given one that does not reference any memory outside of the given arena.
   */
  public abstract K copyToArena(K key, Arena arena);

  /**
   * @return An extractor providing the keys of the given key columns.
   */
  public abstract KeysExtractor<K> newExtractor(List<DictionaryAttribute> keyAttributes, List<Object[]> keyColumns);

  /**
   * @return The values of the key columns that the given key was built from.
   */
  public abstract Object[] decode(K key, List<DictionaryAttribute> keyAttributes);

  private static class SimpleKeyShape extends KeyShape<Long> {
    @Override
    public DictionaryKeyType getKeyType() {
      return DictionaryKeyType.SIMPLE;
    }

    @Override
    public int shardHash(Long key) {
      return SHARD_HASH.hashLong(key).asInt();
    }

    @Override
    public Long copyToArena(Long key, Arena arena) {
      return key;
    }

    @Override
    public KeysExtractor<Long> newExtractor(List<DictionaryAttribute> keyAttributes, List<Object[]> keyColumns) {
      return new KeysExtractor.SimpleKeysExtractor(keyAttributes, keyColumns);
    }

    @Override
    public Object[] decode(Long key, List<DictionaryAttribute> keyAttributes) {
      return new Object[] { key };
    }

    @Override
    public String toString() {
      return "SimpleKeyShape";
    }
  }

  private static class ComplexKeyShape extends KeyShape<ByteSpan> {
    @Override
    public DictionaryKeyType getKeyType() {
      return DictionaryKeyType.COMPLEX;
    }

    @Override
    public int shardHash(ByteSpan key) {
      return SHARD_HASH.hashBytes(key.getBuffer(), key.getOffset(), key.length()).asInt();
    }

    @Override
    public ByteSpan copyToArena(ByteSpan key, Arena arena) {
      return arena.copyOf(key);
    }

    @Override
    public KeysExtractor<ByteSpan> newExtractor(List<DictionaryAttribute> keyAttributes,
        List<Object[]> keyColumns) {
      return new KeysExtractor.ComplexKeysExtractor(keyAttributes, keyColumns);
    }

    @Override
    public Object[] decode(ByteSpan key, List<DictionaryAttribute> keyAttributes) {
      return KeysExtractor.ComplexKeysExtractor.decode(key, keyAttributes);
    }

    @Override
    public String toString() {
      return "ComplexKeyShape";
    }
  }
}
