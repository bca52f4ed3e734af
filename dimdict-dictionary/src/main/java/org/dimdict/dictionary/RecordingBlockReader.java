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
import java.util.List;

import org.dimdict.data.block.Block;
import org.dimdict.loader.BlockReader;
import org.dimdict.loader.LoadException;

/**
 * {@link BlockReader} that remembers all blocks read from a delegate.
 *
 * @author Bastian Gloeckle
 */
/* package */ class RecordingBlockReader implements BlockReader {
  private final BlockReader delegate;
  private final List<Block> blocksRead = new ArrayList<>();

  /* package */ RecordingBlockReader(BlockReader delegate) {
    this.delegate = delegate;
  }

  @Override
  public Block read() throws LoadException {
    Block res = delegate.read();
    if (res != null)
      blocksRead.add(res);
    return res;
  }

  public List<Block> getBlocksRead() {
    return blocksRead;
  }

  @Override
  public void close() {
    delegate.close();
  }
}
