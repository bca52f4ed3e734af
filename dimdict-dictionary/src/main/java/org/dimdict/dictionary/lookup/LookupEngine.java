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
package org.dimdict.dictionary.lookup;

import java.util.ArrayList;
import java.util.List;

import org.dimdict.data.attribute.TypeMismatchException;
import org.dimdict.data.key.KeysExtractor;
import org.dimdict.data.storage.AttributeStore;
import org.dimdict.data.storage.DictionaryStorage;
import org.dimdict.data.structure.DictionaryAttribute;
import org.dimdict.dictionary.ColumnResult;
import org.dimdict.dictionary.DefaultValues;
import org.dimdict.dictionary.metrics.DictionaryMetrics;

/**
 * Answers lookups of keys in a {@link DictionaryStorage} and counts them in the {@link DictionaryMetrics}.
 * 
 * <p>
 * Lookups only read the storage and can therefore be executed concurrently.
 *
 * @author Bastian Gloeckle
 */
public class LookupEngine<K> {
  private final DictionaryMetrics metrics;

  public LookupEngine(DictionaryMetrics metrics) {
    this.metrics = metrics;
  }

  /**
   * Look up the values of one attribute.
   * 
   * @param resultClass
   *          Class the caller expects the values to have.
   * @param defaults
   *          Provides the values of keys that are not contained.
   * @throws TypeMismatchException
   *           If the values of the attribute are not of resultClass or if a default value does not match the type of
   *           the attribute.
   * @throws IllegalArgumentException
   *           If defaults do not match the number of keys.
   */
  public <T> ColumnResult<T> getColumn(DictionaryStorage<K> storage, int attributeIdx, Class<T> resultClass,
      KeysExtractor<K> keys, DefaultValues defaults) throws TypeMismatchException, IllegalArgumentException {
    AttributeStore<K> store = storage.getAttributeStore(attributeIdx);
    DictionaryAttribute attribute = store.getAttribute();
    if (!resultClass.isAssignableFrom(attribute.getType().getValueClass()))
      throw new TypeMismatchException("Attribute '" + attribute.getName() + "' has type " + attribute.getType()
          + " with values of " + attribute.getType().getValueClass().getName() + ", which cannot be provided as "
          + resultClass.getName());

    int rows = keys.getNumberOfRows();
    defaults.validate(rows);

    List<T> values = new ArrayList<>(rows);
    boolean[] nullMap = store.isNullable() ? new boolean[rows] : null;
    long found = 0;
    for (int row = 0; row < rows; row++) {
      K key = keys.getKey(row);
      int shard = storage.getShard(key);
      Object value = store.getValue(shard, key);
      if (value == null)
        value = defaults.getDefault(row, attribute);
      else {
        found++;
        if (nullMap != null && store.isNull(shard, key))
          nullMap[row] = true;
      }
      values.add(resultClass.cast(value));
    }

    metrics.recordQueries(rows, found);
    return new ColumnResult<>(values, nullMap);
  }

  /**
   * @return For each key <code>true</code> if it is contained in the storage.
   */
  public boolean[] hasKeys(DictionaryStorage<K> storage, KeysExtractor<K> keys) {
    int rows = keys.getNumberOfRows();
    boolean[] res = new boolean[rows];
    long found = 0;
    for (int row = 0; row < rows; row++) {
      res[row] = storage.contains(keys.getKey(row));
      if (res[row])
        found++;
    }
    metrics.recordQueries(rows, found);
    return res;
  }
}
