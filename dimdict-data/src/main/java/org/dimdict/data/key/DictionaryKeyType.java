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
package org.dimdict.data.key;

/**
 * Shape of the keys of a dictionary, fixed for the whole lifetime of a dictionary instance.
 *
 * @author Bastian Gloeckle
 */
public enum DictionaryKeyType {
  /** A single 64 bit unsigned integer key column. */
  SIMPLE,

  /** One or more key columns of any type, encoded into a single opaque byte span. */
  COMPLEX
}
