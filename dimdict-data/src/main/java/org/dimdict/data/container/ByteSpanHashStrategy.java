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

import org.dimdict.data.key.ByteSpan;

import it.unimi.dsi.fastutil.Hash;

/**
 * Hashing of {@link ByteSpan} keys inside hash tables. fastutil mixes the result of {@link ByteSpan#hashCode()} before
 * using it, which keeps it independent from the CRC32C used for sharding.
 *
 * @author Bastian Gloeckle
 */
/* package */ class ByteSpanHashStrategy implements Hash.Strategy<ByteSpan> {
  /* package */ static final ByteSpanHashStrategy INSTANCE = new ByteSpanHashStrategy();

  private ByteSpanHashStrategy() {
  }

  @Override
  public int hashCode(ByteSpan span) {
    return (span == null) ? 0 : span.hashCode();
  }

  @Override
  public boolean equals(ByteSpan a, ByteSpan b) {
    if (a == null)
      return b == null;
    return a.equals(b);
  }
}
