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

import java.io.Closeable;

import org.dimdict.data.block.Block;

/**
 * Pull interface providing {@link Block}s one after the other.
 *
 * @author Bastian Gloeckle
 */
public interface BlockReader extends Closeable {
  /**
   * @return The next block or <code>null</code> if there are no more blocks.
   * @throws LoadException
   *           If the next block cannot be provided.
   */
  public Block read() throws LoadException;

  @Override
  public void close();
}
