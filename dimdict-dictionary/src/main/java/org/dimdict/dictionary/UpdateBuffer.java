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
package org.dimdict.dictionary;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.dimdict.data.block.Block;
import org.dimdict.data.key.KeyShape;
import org.dimdict.data.key.KeysExtractor;
import org.dimdict.data.structure.DictionaryAttribute;
import org.dimdict.data.structure.DictionaryStructure;

/**
 * All rows a dictionary received from a source with update field, with only the newest row of each key.
 * 
 * <p>
 * Copies of a dictionary start from this buffer instead of loading the whole source again.
 *
 * @author Bastian Gloeckle
 */
/* package */ class UpdateBuffer<K> {
  private final DictionaryStructure structure;
  private final KeyShape<K> keyShape;
  private final List<String> columnNames = new ArrayList<>();
  private final Map<K, Object[]> rows;

  /* package */ UpdateBuffer(DictionaryStructure structure, KeyShape<K> keyShape) {
    this(structure, keyShape, new LinkedHashMap<>());
  }

  private UpdateBuffer(DictionaryStructure structure, KeyShape<K> keyShape, Map<K, Object[]> rows) {
    this.structure = structure;
    this.keyShape = keyShape;
    this.rows = rows;
    for (DictionaryAttribute keyAttr : structure.getKeyAttributes())
      columnNames.add(keyAttr.getName());
    for (DictionaryAttribute attr : structure.getAttributes())
      columnNames.add(attr.getName());
  }

  /**
   * Merge the rows of the given block into this buffer, replacing buffered rows with the same key.
   * 
   * @throws IllegalArgumentException
   *           If the block misses columns.
   */
  public void merge(Block block) throws IllegalArgumentException {
    List<Object[]> keyColumns = new ArrayList<>();
    for (DictionaryAttribute keyAttr : structure.getKeyAttributes())
      keyColumns.add(block.getColumn(keyAttr.getName()));
    KeysExtractor<K> keys = keyShape.newExtractor(structure.getKeyAttributes(), keyColumns);

    int[] colIdx = new int[columnNames.size()];
    for (int col = 0; col < colIdx.length; col++)
      colIdx[col] = block.getColumnIndex(columnNames.get(col));

    for (int row = 0; row < block.getNumberOfRows(); row++) {
      Object[] values = new Object[colIdx.length];
      for (int col = 0; col < colIdx.length; col++)
        values[col] = block.getColumn(colIdx[col])[row];
      rows.put(keys.getKey(row), values);
    }
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public int size() {
    return rows.size();
  }

  /**
   * @return A block containing all buffered rows.
   */
  public Block toBlock() {
    List<Object[]> columns = new ArrayList<>(columnNames.size());
    for (int col = 0; col < columnNames.size(); col++)
      columns.add(new Object[rows.size()]);
    int row = 0;
    for (Object[] values : rows.values()) {
      for (int col = 0; col < values.length; col++)
        columns.get(col)[row] = values[col];
      row++;
    }
    return new Block(columnNames, columns);
  }

  public UpdateBuffer<K> copy() {
    return new UpdateBuffer<>(structure, keyShape, new LinkedHashMap<>(rows));
  }
}
