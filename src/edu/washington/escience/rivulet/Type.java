package edu.washington.escience.rivulet;

import java.io.Serializable;

/**
 * Class representing a type in Rivulet. Types are static objects defined by this class; hence, the Type constructor is
 * private.
 */
public enum Type implements Serializable {
  /**
   * boolean type.
   * */
  BOOLEAN_TYPE("Boolean", Boolean.class, 1) {
    @Override
    public Boolean fromString(final String str) {
      return Boolean.valueOf(str);
    }
  },

  /**
   * int type.
   * */
  INT_TYPE("Int", Integer.class, Integer.SIZE) {
    @Override
    public Integer fromString(final String str) {
      return Integer.valueOf(str);
    }
  },

  /**
   * long type.
   * */
  LONG_TYPE("Long", Long.class, Long.SIZE) {
    @Override
    public Long fromString(final String str) {
      if (str.endsWith("L") || str.endsWith("l")) {
        return Long.valueOf(str.substring(0, str.length() - 1));
      }
      return Long.valueOf(str);
    }
  },

  /**
   * double type.
   * */
  DOUBLE_TYPE("Double", Double.class, Double.SIZE) {
    @Override
    public Double fromString(final String str) {
      return Double.valueOf(str);
    }
  },

  /**
   * String type.
   * */
  STRING_TYPE("String", String.class, 0) {
    @Override
    public String fromString(final String str) {
      return str;
    }
  };

  /** The short name of this type, used in generated names and messages. */
  private final String name;
  /** The boxed Java class of values of this type. */
  private final Class<?> javaObjectType;
  /** Number of bits of one value of this type, 0 for variable-width types. */
  private final int bitWidth;

  /**
   * @param name the short name.
   * @param javaObjectType the boxed Java class.
   * @param bitWidth the width of one value in bits.
   */
  Type(final String name, final Class<?> javaObjectType, final int bitWidth) {
    this.name = name;
    this.javaObjectType = javaObjectType;
    this.bitWidth = bitWidth;
  }

  /**
   * Parse a value of this type from its string representation.
   *
   * @param str the string.
   * @return the boxed value.
   */
  public abstract Comparable<?> fromString(final String str);

  /**
   * @return the short name of this type, e.g. "Int".
   */
  public String getName() {
    return name;
  }

  /**
   * @return the boxed Java class of values of this type.
   */
  public Class<?> toJavaObjectType() {
    return javaObjectType;
  }

  /**
   * @return the number of bits of one value, 0 for variable-width types.
   */
  public int getBitWidth() {
    return bitWidth;
  }

  /**
   * @return true if this is a numeric type.
   */
  public boolean isNumeric() {
    return this == INT_TYPE || this == LONG_TYPE || this == DOUBLE_TYPE;
  }

  /**
   * @return true if this is an integral numeric type.
   */
  public boolean isInteger() {
    return this == INT_TYPE || this == LONG_TYPE;
  }
}
