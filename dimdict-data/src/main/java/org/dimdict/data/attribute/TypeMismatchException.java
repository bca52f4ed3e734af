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
package org.dimdict.data.attribute;

/**
 * A value does not match the type of the attribute it belongs to, or a caller requested values of an attribute as a
 * type that the attribute does not provide.
 *
 * @author Bastian Gloeckle
 */
public class TypeMismatchException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public TypeMismatchException(String msg) {
    super(msg);
  }

  public TypeMismatchException(String msg, Throwable cause) {
    super(msg, cause);
  }
}
