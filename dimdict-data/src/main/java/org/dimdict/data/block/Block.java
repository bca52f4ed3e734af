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
package org.dimdict.data.block;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A batch of rows in columnar form: a list of named columns, each holding one value per row.
 * 
 * <p>
 * Blocks are what sources provide when loading a dictionary and what a dictionary provides when its content is read.
 * The arrays of the columns are not copied, whoever creates a block must not change them afterwards.
 *
 * @author Bastian Gloeckle
 */
public class Block {
  private final List<String> columnNames;
  private final List<Object[]> columns;
  private final int numberOfRows;

  public Block(List<String> columnNames, List<Object[]> columns) {
    if (columnNames.size() != columns.size())
      throw new IllegalArgumentException(
          "Got " + columnNames.size() + " column names but " + columns.size() + " columns.");
    if (columnNames.stream().distinct().count() != columnNames.size())
      throw new IllegalArgumentException("Duplicate column names in " + columnNames);

    int rows = columns.isEmpty() ? 0 : columns.get(0).length;
    for (int i = 0; i < columns.size(); i++)
      if (columns.get(i).length != rows)
        throw new IllegalArgumentException("Column '" + columnNames.get(i) + "' has " + columns.get(i).length
            + " rows, but expected " + rows + " rows.");

    this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    this.numberOfRows = rows;
  }

  public int getNumberOfRows() {
    return numberOfRows;
  }

  public List<String> getColumnNames() {
    return columnNames;
  }

  public Object[] getColumn(int idx) {
    return columns.get(idx);
  }

  /**
   * @throws IllegalArgumentException
   *           If there is no column with the given name.
   */
  public Object[] getColumn(String name) throws IllegalArgumentException {
    return columns.get(getColumnIndex(name));
  }

  /**
   * @return index of the column with the given name.
   * @throws IllegalArgumentException
   *           If there is no column with the given name.
   */
  public int getColumnIndex(String name) throws IllegalArgumentException {
    int idx = columnNames.indexOf(name);
    if (idx == -1)
      throw new IllegalArgumentException("Block does not contain column '" + name + "', available: " + columnNames);
    return idx;
  }

  @Override
  public String toString() {
    return "Block[rows=" + numberOfRows + ",columns=" + columnNames + "]";
  }
}
