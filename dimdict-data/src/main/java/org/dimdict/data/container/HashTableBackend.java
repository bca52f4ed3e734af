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
package org.dimdict.data.container;

import it.unimi.dsi.fastutil.Hash;

/**
 * The kind of hash tables a dictionary uses for its shards. Both behave the same, they only trade memory for speed.
 *
 * @author Bastian Gloeckle
 */
public enum HashTableBackend {
  /**
   * Open addressing tables that are kept at most half full. Short probe sequences, but twice the number of buckets than
   * elements.
   */
  DENSE(Hash.FAST_LOAD_FACTOR, false),

  /**
   * Open addressing tables that are filled up to 90% and trimmed to the smallest possible size after each load. Longer
   * probe sequences for misses, but far fewer empty buckets.
   */
  SPARSE(0.9f, true);

  private float loadFactor;
  private boolean trimAfterLoad;

  private HashTableBackend(float loadFactor, boolean trimAfterLoad) {
    this.loadFactor = loadFactor;
    this.trimAfterLoad = trimAfterLoad;
  }

  public float getLoadFactor() {
    return loadFactor;
  }

  public boolean isTrimAfterLoad() {
    return trimAfterLoad;
  }
}
