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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import com.google.common.io.ByteArrayDataInput;
import com.google.common.io.ByteArrayDataOutput;
import com.google.common.net.InetAddresses;

/**
 * The type of the values of an attribute.
 * 
 * <p>
 * Each type is backed by one Java class which the values of an attribute of that type have when they are returned from
 * a dictionary (see {@link #getValueClass()}). When loading, values are converted to that class by
 * {@link #normalize(Object)}. All integer types up to 64 bit are represented as {@link Long}, unsigned 64 bit values
 * are held in the bits of the long.
 *
 * @author Bastian Gloeckle
 */
public enum AttributeUnderlyingType {
  UINT8(Category.INTEGER, 0, 0xFFL), //
  UINT16(Category.INTEGER, 0, 0xFFFFL), //
  UINT32(Category.INTEGER, 0, 0xFFFF_FFFFL), //
  UINT64(Category.INTEGER, Long.MIN_VALUE, Long.MAX_VALUE), //
  INT8(Category.INTEGER, Byte.MIN_VALUE, Byte.MAX_VALUE), //
  INT16(Category.INTEGER, Short.MIN_VALUE, Short.MAX_VALUE), //
  INT32(Category.INTEGER, Integer.MIN_VALUE, Integer.MAX_VALUE), //
  INT64(Category.INTEGER, Long.MIN_VALUE, Long.MAX_VALUE), //
  UINT128(Category.BIG_INTEGER, 0, 0), //
  UINT256(Category.BIG_INTEGER, 0, 0), //
  INT128(Category.BIG_INTEGER, 0, 0), //
  INT256(Category.BIG_INTEGER, 0, 0), //
  DECIMAL32(Category.DECIMAL, 0, 0), //
  DECIMAL64(Category.DECIMAL, 0, 0), //
  DECIMAL128(Category.DECIMAL, 0, 0), //
  DECIMAL256(Category.DECIMAL, 0, 0), //
  /** Ticks since epoch, the precision is up to the user of the dictionary. */
  DATETIME64(Category.INTEGER, Long.MIN_VALUE, Long.MAX_VALUE), //
  FLOAT32(Category.FLOAT32, 0, 0), //
  FLOAT64(Category.FLOAT64, 0, 0), //
  UUID(Category.UUID, 0, 0), //
  IPV4(Category.IPV4, 0, 0), //
  IPV6(Category.IPV6, 0, 0), //
  STRING(Category.STRING, 0, 0), //
  ARRAY(Category.ARRAY, 0, 0);

  private static enum Category {
    INTEGER(Long.class), BIG_INTEGER(BigInteger.class), DECIMAL(BigDecimal.class), FLOAT32(Float.class),
    FLOAT64(Double.class), UUID(java.util.UUID.class), IPV4(Inet4Address.class), IPV6(Inet6Address.class),
    STRING(String.class), ARRAY(List.class);

    private Class<?> valueClass;

    private Category(Class<?> valueClass) {
      this.valueClass = valueClass;
    }
  }

  private Category category;
  private long minValue;
  private long maxValue;

  private AttributeUnderlyingType(Category category, long minValue, long maxValue) {
    this.category = category;
    this.minValue = minValue;
    this.maxValue = maxValue;
  }

  /**
   * @return The Java class of the values of this type.
   */
  public Class<?> getValueClass() {
    return category.valueClass;
  }

  /**
   * @return <code>true</code> for all types whose values are {@link Long}s.
   */
  public boolean isInteger() {
    return category == Category.INTEGER;
  }

  /**
   * @return <code>true</code> if values of this type are stored in the arena of a dictionary instead of in the hash
   *         tables directly.
   */
  public boolean isArenaBacked() {
    return category == Category.STRING;
  }

  /**
   * @return <code>true</code> if values of this type can be used in (complex) keys.
   */
  public boolean isUsableInKey() {
    return category != Category.ARRAY;
  }

  /**
   * @return The value that is used for this type if nothing else is configured.
   */
  public Object getDefaultValue() {
    switch (category) {
    case INTEGER:
      return 0L;
    case BIG_INTEGER:
      return BigInteger.ZERO;
    case DECIMAL:
      return BigDecimal.ZERO;
    case FLOAT32:
      return 0f;
    case FLOAT64:
      return 0d;
    case UUID:
      return new java.util.UUID(0L, 0L);
    case IPV4:
      return InetAddresses.forString("0.0.0.0");
    case IPV6:
      return InetAddresses.forString("::");
    case STRING:
      return "";
    case ARRAY:
      return Collections.emptyList();
    }
    throw new IllegalStateException("Unknown category " + category);
  }

  /**
   * Convert a raw value (e.g. provided by a source) to the value class of this type.
   * 
   * @return The converted value or <code>null</code> if the input is <code>null</code>.
   * @throws TypeMismatchException
   *           If the value cannot be represented by this type.
   */
  public Object normalize(Object raw) throws TypeMismatchException {
    if (raw == null)
      return null;

    switch (category) {
    case INTEGER:
      return normalizeInteger(raw);
    case BIG_INTEGER:
      if (raw instanceof BigInteger)
        return raw;
      if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte)
        return BigInteger.valueOf(((Number) raw).longValue());
      break;
    case DECIMAL:
      if (raw instanceof BigDecimal)
        return raw;
      if (raw instanceof BigInteger)
        return new BigDecimal((BigInteger) raw);
      if (raw instanceof Number) {
        try {
          return new BigDecimal(raw.toString());
        } catch (NumberFormatException e) {
          throw new TypeMismatchException("Value '" + raw + "' cannot be represented as " + this, e);
        }
      }
      break;
    case FLOAT32:
      if (raw instanceof Number)
        return ((Number) raw).floatValue();
      break;
    case FLOAT64:
      if (raw instanceof Number)
        return ((Number) raw).doubleValue();
      break;
    case UUID:
      if (raw instanceof java.util.UUID)
        return raw;
      if (raw instanceof CharSequence) {
        try {
          return java.util.UUID.fromString(raw.toString());
        } catch (IllegalArgumentException e) {
          throw new TypeMismatchException("Invalid UUID '" + raw + "'", e);
        }
      }
      break;
    case IPV4:
    case IPV6:
      return normalizeAddress(raw);
    case STRING:
      if (raw instanceof CharSequence)
        return raw.toString();
      break;
    case ARRAY:
      if (raw instanceof Collection)
        return Collections.unmodifiableList(new ArrayList<>((Collection<?>) raw));
      if (raw instanceof Object[]) {
        List<Object> res = new ArrayList<>();
        Collections.addAll(res, (Object[]) raw);
        return Collections.unmodifiableList(res);
      }
      break;
    }
    throw new TypeMismatchException(
        "Value '" + raw + "' of class " + raw.getClass().getName() + " cannot be used as " + this);
  }

  private Object normalizeInteger(Object raw) {
    long value;
    if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte)
      value = ((Number) raw).longValue();
    else if (raw instanceof BigInteger && ((BigInteger) raw).bitLength() <= 64 && ((BigInteger) raw).signum() >= 0
        && this == UINT64)
      value = ((BigInteger) raw).longValue();
    else if (raw instanceof BigInteger && ((BigInteger) raw).bitLength() < 64)
      value = ((BigInteger) raw).longValue();
    else
      throw new TypeMismatchException(
          "Value '" + raw + "' of class " + raw.getClass().getName() + " cannot be used as " + this);

    if (value < minValue || value > maxValue)
      throw new TypeMismatchException("Value " + value + " is out of range of " + this);
    return value;
  }

  private Object normalizeAddress(Object raw) {
    InetAddress address;
    if (raw instanceof InetAddress)
      address = (InetAddress) raw;
    else if (raw instanceof CharSequence) {
      try {
        address = InetAddresses.forString(raw.toString());
      } catch (IllegalArgumentException e) {
        throw new TypeMismatchException("Invalid IP address '" + raw + "'", e);
      }
    } else
      throw new TypeMismatchException(
          "Value '" + raw + "' of class " + raw.getClass().getName() + " cannot be used as " + this);

    if (!category.valueClass.isInstance(address))
      throw new TypeMismatchException("Address " + InetAddresses.toAddrString(address) + " is not a valid " + this);
    return address;
  }

  /**
   * Write a normalized value in binary form, used for encoding complex keys.
   */
  public void write(Object value, ByteArrayDataOutput out) {
    switch (category) {
    case INTEGER:
      out.writeLong((Long) value);
      return;
    case BIG_INTEGER:
      writeBytes(((BigInteger) value).toByteArray(), out);
      return;
    case DECIMAL:
      out.writeInt(((BigDecimal) value).scale());
      writeBytes(((BigDecimal) value).unscaledValue().toByteArray(), out);
      return;
    case FLOAT32:
      out.writeFloat((Float) value);
      return;
    case FLOAT64:
      out.writeDouble((Double) value);
      return;
    case UUID:
      out.writeLong(((java.util.UUID) value).getMostSignificantBits());
      out.writeLong(((java.util.UUID) value).getLeastSignificantBits());
      return;
    case IPV4:
    case IPV6:
      out.write(((InetAddress) value).getAddress());
      return;
    case STRING:
      writeBytes(((String) value).getBytes(StandardCharsets.UTF_8), out);
      return;
    case ARRAY:
      break;
    }
    throw new TypeMismatchException("Values of type " + this + " cannot be encoded.");
  }

  /**
   * Read a value that was written using {@link #write(Object, ByteArrayDataOutput)}.
   */
  public Object read(ByteArrayDataInput in) {
    switch (category) {
    case INTEGER:
      return in.readLong();
    case BIG_INTEGER:
      return new BigInteger(readBytes(in));
    case DECIMAL:
      int scale = in.readInt();
      return new BigDecimal(new BigInteger(readBytes(in)), scale);
    case FLOAT32:
      return in.readFloat();
    case FLOAT64:
      return in.readDouble();
    case UUID:
      return new java.util.UUID(in.readLong(), in.readLong());
    case IPV4:
    case IPV6:
      byte[] addr = new byte[category == Category.IPV4 ? 4 : 16];
      in.readFully(addr);
      try {
        return InetAddress.getByAddress(addr);
      } catch (UnknownHostException e) {
        throw new TypeMismatchException("Invalid encoded address", e);
      }
    case STRING:
      return new String(readBytes(in), StandardCharsets.UTF_8);
    case ARRAY:
      break;
    }
    throw new TypeMismatchException("Values of type " + this + " cannot be decoded.");
  }

  private static void writeBytes(byte[] bytes, ByteArrayDataOutput out) {
    out.writeInt(bytes.length);
    out.write(bytes);
  }

  private static byte[] readBytes(ByteArrayDataInput in) {
    byte[] res = new byte[in.readInt()];
    in.readFully(res);
    return res;
  }
}
