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

import org.dimdict.data.attribute.TypeMismatchException;
import org.dimdict.data.structure.DictionaryAttribute;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;

/**
 * Turns the key columns of a {@link org.dimdict.data.block.Block} (or of a lookup request) into one key per row.
 * 
 * <p>
 * Complex keys are encoded into byte spans that point into an {@link Arena} owned by the extractor. These keys are
 * valid as long as the extractor is reachable, a dictionary copies them into its own arena before storing them.
 *
 * @param <K>
 *          Java type of the keys, see {@link KeyShape}.
 * @author Bastian Gloeckle
 */
public abstract class KeysExtractor<K> {
  protected final int numberOfRows;

  protected KeysExtractor(List<DictionaryAttribute> keyAttributes, List<Object[]> keyColumns) {
    if (keyColumns.size() != keyAttributes.size())
      throw new IllegalArgumentException(
          "Expected " + keyAttributes.size() + " key columns, but got " + keyColumns.size());
    this.numberOfRows = keyColumns.isEmpty() ? 0 : keyColumns.get(0).length;
    for (Object[] col : keyColumns)
      if (col.length != numberOfRows)
        throw new IllegalArgumentException("All key columns need to have the same number of rows.");
  }

  public int getNumberOfRows() {
    return numberOfRows;
  }

  /**
   * @return The key of the given row.
   */
  public abstract K getKey(int row);

  /* package */ static class SimpleKeysExtractor extends KeysExtractor<Long> {
    private final long[] keys;

    /* package */ SimpleKeysExtractor(List<DictionaryAttribute> keyAttributes, List<Object[]> keyColumns) {
      super(keyAttributes, keyColumns);
      keys = new long[numberOfRows];
      Object[] column = keyColumns.get(0);
      DictionaryAttribute keyAttribute = keyAttributes.get(0);
      for (int i = 0; i < numberOfRows; i++) {
        if (column[i] == null)
          throw new TypeMismatchException("Key column '" + keyAttribute.getName() + "' contains null in row " + i);
        keys[i] = (Long) keyAttribute.getType().normalize(column[i]);
      }
    }

    @Override
    public Long getKey(int row) {
      return keys[row];
    }
  }

  /* package */ static class ComplexKeysExtractor extends KeysExtractor<ByteSpan> {
    private final Arena arena = new Arena();
    private final ByteSpan[] keys;

    /* package */ ComplexKeysExtractor(List<DictionaryAttribute> keyAttributes, List<Object[]> keyColumns) {
      super(keyAttributes, keyColumns);
      keys = new ByteSpan[numberOfRows];
      for (int row = 0; row < numberOfRows; row++) {
        ByteArrayDataOutput out = ByteStreams.newDataOutput();
        for (int col = 0; col < keyAttributes.size(); col++) {
          DictionaryAttribute keyAttribute = keyAttributes.get(col);
          Object value = keyAttribute.getType().normalize(keyColumns.get(col)[row]);
          if (value == null)
            throw new TypeMismatchException(
                "Key column '" + keyAttribute.getName() + "' contains null in row " + row);
          keyAttribute.getType().write(value, out);
        }
        byte[] encoded = out.toByteArray();
        keys[row] = arena.copyOf(encoded, 0, encoded.length);
      }
    }

    @Override
    public ByteSpan getKey(int row) {
      return keys[row];
    }

    /* package */ static Object[] decode(ByteSpan key, List<DictionaryAttribute> keyAttributes) {
      ByteArrayDataInput in = ByteStreams.newDataInput(key.getBuffer(), key.getOffset());
      Object[] res = new Object[keyAttributes.size()];
      for (int i = 0; i < res.length; i++)
        res[i] = keyAttributes.get(i).getType().read(in);
      return res;
    }
  }
}
