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

import java.util.Collections;
import java.util.List;

/**
 * Result of looking up one attribute for a list of keys.
 * 
 * <p>
 * For each requested key there is one value: the value stored in the dictionary, or the default value if the key was
 * not found. If the attribute is nullable, there is additionally a null map telling which of the found keys have a
 * null value. The value of those is the null value of the attribute.
 *
 * @param <T>
 *          type of the values.
 * @author Bastian Gloeckle
 */
public class ColumnResult<T> {
  private final List<T> values;
  private final boolean[] nullMap;

  public ColumnResult(List<T> values, boolean[] nullMap) {
    this.values = Collections.unmodifiableList(values);
    this.nullMap = nullMap;
  }

  public List<T> getValues() {
    return values;
  }

  public T getValue(int row) {
    return values.get(row);
  }

  public int size() {
    return values.size();
  }

  /**
   * @return <code>true</code> if the attribute is nullable and this result therefore has a null map.
   */
  public boolean hasNullMap() {
    return nullMap != null;
  }

  public boolean isNull(int row) {
    return nullMap != null && nullMap[row];
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (int i = 0; i < values.size(); i++) {
      if (i > 0)
        sb.append(", ");
      sb.append(isNull(i) ? "NULL" : values.get(i));
    }
    return sb.append("]").toString();
  }
}
