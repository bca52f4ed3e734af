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

/**
 * Bounds of the time a loaded dictionary should be used before it is reloaded.
 * 
 * <p>
 * Dictionaries do not reload themselves, this is only information for whoever schedules reloads.
 *
 * @author Bastian Gloeckle
 */
public class DictionaryLifetime {
  private final long minSeconds;
  private final long maxSeconds;

  /**
   * @param maxSeconds
   *          0 if the dictionary should never be reloaded.
   */
  public DictionaryLifetime(long minSeconds, long maxSeconds) {
    if (minSeconds < 0 || maxSeconds < 0)
      throw new IllegalArgumentException("Lifetime needs to be non-negative: " + minSeconds + ".." + maxSeconds);
    if (maxSeconds != 0 && minSeconds > maxSeconds)
      throw new IllegalArgumentException("Minimum lifetime " + minSeconds + " exceeds maximum " + maxSeconds);
    this.minSeconds = minSeconds;
    this.maxSeconds = maxSeconds;
  }

  public long getMinSeconds() {
    return minSeconds;
  }

  public long getMaxSeconds() {
    return maxSeconds;
  }

  /**
   * @return <code>true</code> if the dictionary should never be reloaded.
   */
  public boolean isInfinite() {
    return maxSeconds == 0;
  }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof DictionaryLifetime))
      return false;
    DictionaryLifetime other = (DictionaryLifetime) obj;
    return minSeconds == other.minSeconds && maxSeconds == other.maxSeconds;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(minSeconds) * 31 + Long.hashCode(maxSeconds);
  }

  @Override
  public String toString() {
    return "[" + minSeconds + "s.." + maxSeconds + "s]";
  }
}
