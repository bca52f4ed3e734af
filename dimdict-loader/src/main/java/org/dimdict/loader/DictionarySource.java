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
package org.dimdict.loader;

/**
 * The external source of the data of a dictionary.
 * 
 * <p>
 * Each block a source provides contains one column per key column and one column per attribute of the dictionary, found
 * by name.
 *
 * @author Bastian Gloeckle
 */
public interface DictionarySource {
  /**
   * @return A reader providing all rows of the source.
   * @throws LoadException
   *           If the source cannot be read.
   */
  public BlockReader loadAll() throws LoadException;

  /**
   * @return <code>true</code> if the source can provide only the rows that changed since the last call to
   *         {@link #loadUpdatedAll()}.
   */
  public boolean hasUpdateField();

  /**
   * Only valid if {@link #hasUpdateField()}. The first call provides all rows.
   * 
   * @return A reader providing the rows that changed since the last call.
   * @throws LoadException
   *           If the source cannot be read.
   */
  public BlockReader loadUpdatedAll() throws LoadException;

  /**
   * @return A new source that reads the same data as this one, but is independent of this one.
   */
  public DictionarySource copy();

  /**
   * @return Estimated number of rows a call to {@link #loadAll()} would provide, 0 if unknown.
   */
  public default long getEstimatedRowCount() {
    return 0;
  }
}
