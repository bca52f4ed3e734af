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

import java.util.List;

import org.dimdict.data.attribute.TypeMismatchException;
import org.dimdict.data.key.DictionaryKeyType;
import org.dimdict.data.structure.DictionaryStructure;
import org.dimdict.loader.BlockReader;
import org.dimdict.loader.DictionarySource;
import org.dimdict.loader.LoadException;

/**
 * An in-memory mapping from keys to the values of a set of attributes, loaded from a {@link DictionarySource}.
 * 
 * <p>
 * Keys are passed as key columns: one array per key column of the {@link DictionaryStructure}, each holding one value
 * per requested key. Dictionaries with simple keys have exactly one key column.
 * 
 * <p>
 * All query methods can be called concurrently. Loading and updating must not run concurrently to queries, callers
 * usually load a new copy (see {@link #copy()}) and swap it in when it is loaded.
 *
 * @author Bastian Gloeckle
 */
public interface Dictionary {
  public String getDictionaryName();

  /**
   * @return Name of the kind of this dictionary, e.g. "Hashed".
   */
  public String getTypeName();

  public DictionaryStructure getStructure();

  public DictionarySource getSource();

  public DictionaryLifetime getLifetime();

  public DictionaryKeyType getKeyType();

  /**
   * @throws IllegalArgumentException
   *           If there is no such attribute.
   */
  public boolean isInjective(String attributeName) throws IllegalArgumentException;

  /**
   * Load the data from the source. Depending on the source this replaces all data or applies the changes of the source.
   */
  public void loadData() throws LoadException;

  /**
   * Merge the rows that changed in the source into this dictionary. Rows of keys that did not change stay untouched.
   * 
   * @throws IllegalStateException
   *           If the source does not provide changed rows, see {@link DictionarySource#hasUpdateField()}.
   */
  public void updateData() throws LoadException, IllegalStateException;

  /**
   * Replace all data of this dictionary with newly loaded data.
   */
  public void reload() throws LoadException;

  /**
   * @return A new, loaded dictionary with the same name, structure and configuration.
   */
  public Dictionary copy() throws LoadException;

  /**
   * Look up the values of an attribute.
   * 
   * @param resultClass
   *          The class the caller expects for the values.
   * @throws TypeMismatchException
   *           If the values of the attribute are not of the requested class or the keys cannot be used.
   * @throws IllegalArgumentException
   *           If there is no such attribute or the key columns do not match the structure.
   */
  public <T> ColumnResult<T> getColumn(String attributeName, Class<T> resultClass, List<Object[]> keyColumns,
      DefaultValues defaults) throws TypeMismatchException, IllegalArgumentException;

  /**
   * @return for each key <code>true</code> if it is contained.
   */
  public boolean[] hasKeys(List<Object[]> keyColumns) throws TypeMismatchException, IllegalArgumentException;

  /**
   * @return <code>true</code> if this dictionary has simple keys and a hierarchical attribute.
   */
  public boolean hasHierarchy();

  /**
   * @return For each key the key followed by its ancestors, empty for keys that are not contained.
   * @throws UnsupportedHierarchyQueryException
   *           If {@link #hasHierarchy()} is false.
   */
  public long[][] getHierarchy(long[] keys) throws UnsupportedHierarchyQueryException;

  /**
   * @return <code>true</code> if the key is contained and the ancestor is the key itself or one of its ancestors.
   * @throws UnsupportedHierarchyQueryException
   *           If {@link #hasHierarchy()} is false.
   */
  public boolean isInHierarchy(long key, long ancestor) throws UnsupportedHierarchyQueryException;

  /**
   * Vectorized form of {@link #isInHierarchy(long, long)}.
   */
  public boolean[] isInHierarchy(long[] keys, long[] ancestors)
      throws UnsupportedHierarchyQueryException, IllegalArgumentException;

  /**
   * @param level
   *          Maximum distance of the returned descendants, 0 for no limit.
   * @return All descendants of the key.
   * @throws UnsupportedHierarchyQueryException
   *           If {@link #hasHierarchy()} is false.
   */
  public long[] getDescendants(long key, int level) throws UnsupportedHierarchyQueryException;

  /**
   * Read the whole content of the dictionary.
   * 
   * @param columnNames
   *          Names of key columns and attributes to read.
   * @param numStreams
   *          Number of independent readers to return, which can be used concurrently.
   * @throws IllegalArgumentException
   *           If a column does not exist.
   */
  public List<BlockReader> read(List<String> columnNames, int maxBlockSize, int numStreams)
      throws IllegalArgumentException;

  public long getBytesAllocated();

  public long getHierarchicalIndexBytesAllocated();

  public long getElementCount();

  public long getBucketCount();

  public double getLoadFactor();

  public long getQueryCount();

  public long getFoundCount();

  public double getFoundRate();

  public double getHitRate();
}
