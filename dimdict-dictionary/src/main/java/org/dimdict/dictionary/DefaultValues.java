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

import org.dimdict.data.attribute.TypeMismatchException;
import org.dimdict.data.structure.DictionaryAttribute;

/**
 * Policy which value to report for requested keys that are not contained in a dictionary.
 *
 * @author Bastian Gloeckle
 */
public abstract class DefaultValues {
  private DefaultValues() {
  }

  /**
   * Use the null value of the requested attribute, see {@link DictionaryAttribute#getNullValue()}.
   */
  public static DefaultValues attributeNullValue() {
    return new SingleDefaultValue(null);
  }

  /**
   * Use the same value for all keys that are not found.
   */
  public static DefaultValues single(Object value) {
    return new SingleDefaultValue(value);
  }

  /**
   * Use values[i] if the i'th requested key is not found. A <code>null</code> entry means the null value of the
   * attribute.
   */
  public static DefaultValues positional(Object[] values) {
    return new PositionalDefaultValues(values);
  }

  /**
   * @return The default value of the given row, converted to the type of the attribute.
   * @throws TypeMismatchException
   *           If the default value cannot be used for the attribute.
   */
  public abstract Object getDefault(int row, DictionaryAttribute attribute) throws TypeMismatchException;

  /**
   * @throws IllegalArgumentException
   *           If this policy cannot provide values for the given number of requested keys.
   */
  public abstract void validate(int numberOfRows) throws IllegalArgumentException;

  protected Object resolve(Object value, DictionaryAttribute attribute) {
    if (value == null)
      return attribute.getNullValue();
    return attribute.getType().normalize(value);
  }

  private static class SingleDefaultValue extends DefaultValues {
    private final Object value;

    SingleDefaultValue(Object value) {
      this.value = value;
    }

    @Override
    public Object getDefault(int row, DictionaryAttribute attribute) {
      return resolve(value, attribute);
    }

    @Override
    public void validate(int numberOfRows) {
    }
  }

  private static class PositionalDefaultValues extends DefaultValues {
    private final Object[] values;

    PositionalDefaultValues(Object[] values) {
      this.values = values;
    }

    @Override
    public Object getDefault(int row, DictionaryAttribute attribute) {
      return resolve(values[row], attribute);
    }

    @Override
    public void validate(int numberOfRows) {
      if (values.length != numberOfRows)
        throw new IllegalArgumentException(
            "Got " + values.length + " default values, but " + numberOfRows + " keys were requested.");
    }
  }
}
