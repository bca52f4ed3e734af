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

/**
 * Constants for estimating the memory used by containers.
 *
 * @author Bastian Gloeckle
 */
/* package */ class ContainerSizes {
  /** Size of an object reference, assuming no compressed oops. */
  /* package */ static final int REFERENCE_BYTES = 8;

  /** Object header and fields of a {@link org.dimdict.data.key.ByteSpan}, without the referenced bytes. */
  /* package */ static final int BYTE_SPAN_OBJECT_BYTES = 32;

  private ContainerSizes() {
  }
}
