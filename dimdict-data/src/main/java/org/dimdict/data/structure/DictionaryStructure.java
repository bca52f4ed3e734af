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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.dimdict.data.attribute.AttributeUnderlyingType;
import org.dimdict.data.key.DictionaryKeyType;

/**
 * Static description of a dictionary: its key columns and its attributes.
 * 
 * <p>
 * A {@link DictionaryKeyType#SIMPLE} dictionary has exactly one key column of type
 * {@link AttributeUnderlyingType#UINT64}, a {@link DictionaryKeyType#COMPLEX} one has one or more key columns of any
 * type that can be used in keys. At most one attribute may be hierarchical, it has to be of an integer type.
 *
 * @author Bastian Gloeckle
 */
public class DictionaryStructure {
  private final DictionaryKeyType keyType;
  private final List<DictionaryAttribute> keyAttributes;
  private final List<DictionaryAttribute> attributes;
  private final Map<String, Integer> attributeIndex = new HashMap<>();
  private final int hierarchicalAttributeIndex;

  private DictionaryStructure(DictionaryKeyType keyType, List<DictionaryAttribute> keyAttributes,
      List<DictionaryAttribute> attributes) {
    this.keyType = keyType;
    this.keyAttributes = Collections.unmodifiableList(new ArrayList<>(keyAttributes));
    this.attributes = Collections.unmodifiableList(new ArrayList<>(attributes));

    Set<String> allNames = new HashSet<>();
    for (DictionaryAttribute key : keyAttributes) {
      if (!key.getType().isUsableInKey())
        throw new IllegalArgumentException("Key column '" + key.getName() + "' has type " + key.getType()
            + " which cannot be used in keys.");
      if (!allNames.add(key.getName()))
        throw new IllegalArgumentException("Duplicate column name '" + key.getName() + "'");
    }

    int hierarchicalIdx = -1;
    for (int i = 0; i < attributes.size(); i++) {
      DictionaryAttribute attr = attributes.get(i);
      if (!allNames.add(attr.getName()))
        throw new IllegalArgumentException("Duplicate column name '" + attr.getName() + "'");
      attributeIndex.put(attr.getName(), i);
      if (attr.isHierarchical()) {
        if (hierarchicalIdx != -1)
          throw new IllegalArgumentException("Only one hierarchical attribute is allowed, found '"
              + attributes.get(hierarchicalIdx).getName() + "' and '" + attr.getName() + "'");
        if (!attr.getType().isInteger())
          throw new IllegalArgumentException(
              "Hierarchical attribute '" + attr.getName() + "' must be of an integer type, but is " + attr.getType());
        hierarchicalIdx = i;
      }
    }
    this.hierarchicalAttributeIndex = hierarchicalIdx;
  }

  /**
   * Structure of a dictionary with a single integer key column.
   */
  public static DictionaryStructure simple(String idName, List<DictionaryAttribute> attributes) {
    return new DictionaryStructure(DictionaryKeyType.SIMPLE,
        Collections.singletonList(DictionaryAttribute.of(idName, AttributeUnderlyingType.UINT64)), attributes);
  }

  /**
   * Structure of a dictionary whose keys consist of the given columns.
   */
  public static DictionaryStructure complex(List<DictionaryAttribute> keyAttributes,
      List<DictionaryAttribute> attributes) {
    if (keyAttributes.isEmpty())
      throw new IllegalArgumentException("Complex keys need at least one key column.");
    return new DictionaryStructure(DictionaryKeyType.COMPLEX, keyAttributes, attributes);
  }

  public DictionaryKeyType getKeyType() {
    return keyType;
  }

  public List<DictionaryAttribute> getKeyAttributes() {
    return keyAttributes;
  }

  public List<DictionaryAttribute> getAttributes() {
    return attributes;
  }

  /**
   * @throws IllegalArgumentException
   *           if there is no such attribute.
   */
  public DictionaryAttribute getAttribute(String name) throws IllegalArgumentException {
    return attributes.get(getAttributeIndex(name));
  }

  /**
   * @throws IllegalArgumentException
   *           if there is no such attribute.
   */
  public int getAttributeIndex(String name) throws IllegalArgumentException {
    Integer res = attributeIndex.get(name);
    if (res == null)
      throw new IllegalArgumentException(
          "No attribute '" + name + "' available, available are " + attributeIndex.keySet());
    return res;
  }

  public boolean hasAttribute(String name) {
    return attributeIndex.containsKey(name);
  }

  /**
   * @return Index of the hierarchical attribute in {@link #getAttributes()} or -1 if there is none.
   */
  public int getHierarchicalAttributeIndex() {
    return hierarchicalAttributeIndex;
  }
}
