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
package org.dimdict.data.structure;

import org.dimdict.data.attribute.AttributeUnderlyingType;
import org.dimdict.data.attribute.TypeMismatchException;

/**
 * Declaration of a single column of a dictionary, either a key column or an attribute.
 * 
 * <p>
 * Instances are immutable, the with* methods return changed copies.
 *
 * @author Bastian Gloeckle
 */
public class DictionaryAttribute {
  private final String name;
  private final AttributeUnderlyingType type;
  private final Object nullValue;
  private final boolean nullable;
  private final boolean injective;
  private final boolean hierarchical;

  /**
   * @param nullValue
   *          The value stored for rows that have no value for this attribute, also used as default for lookups of
   *          missing keys when the caller does not provide a default. Is normalized to the type.
   * @throws TypeMismatchException
   *           if nullValue does not match the type.
   */
  public DictionaryAttribute(String name, AttributeUnderlyingType type, Object nullValue, boolean nullable,
      boolean injective, boolean hierarchical) throws TypeMismatchException {
    if (name == null || name.isEmpty())
      throw new IllegalArgumentException("Attribute name must not be empty.");
    this.name = name;
    this.type = type;
    Object normalizedNullValue = type.normalize(nullValue);
    this.nullValue = (normalizedNullValue == null) ? type.getDefaultValue() : normalizedNullValue;
    this.nullable = nullable;
    this.injective = injective;
    this.hierarchical = hierarchical;
  }

  /**
   * Non-nullable, non-injective, non-hierarchical attribute with the default null value of the type.
   */
  public static DictionaryAttribute of(String name, AttributeUnderlyingType type) {
    return new DictionaryAttribute(name, type, null, false, false, false);
  }

  public DictionaryAttribute withNullValue(Object nullValue) {
    return new DictionaryAttribute(name, type, nullValue, nullable, injective, hierarchical);
  }

  public DictionaryAttribute withNullable(boolean nullable) {
    return new DictionaryAttribute(name, type, nullValue, nullable, injective, hierarchical);
  }

  public DictionaryAttribute withInjective(boolean injective) {
    return new DictionaryAttribute(name, type, nullValue, nullable, injective, hierarchical);
  }

  public DictionaryAttribute withHierarchical(boolean hierarchical) {
    return new DictionaryAttribute(name, type, nullValue, nullable, injective, hierarchical);
  }

  public String getName() {
    return name;
  }

  public AttributeUnderlyingType getType() {
    return type;
  }

  public Object getNullValue() {
    return nullValue;
  }

  public boolean isNullable() {
    return nullable;
  }

  /**
   * @return <code>true</code> if different keys always have different values of this attribute.
   */
  public boolean isInjective() {
    return injective;
  }

  /**
   * @return <code>true</code> if the value of this attribute is the key of the parent of a row.
   */
  public boolean isHierarchical() {
    return hierarchical;
  }

  @Override
  public String toString() {
    return "DictionaryAttribute[name=" + name + ",type=" + type + ",nullable=" + nullable + ",hierarchical="
        + hierarchical + "]";
  }
}
