package edu.washington.escience.rivulet.util;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import edu.washington.escience.rivulet.column.Column;

/**
 * Hashes the grouping key of one row for the hash grouper. A null cell is hashed as a marker byte, and a
 * non-null cell as a different marker followed by its value.
 */
public final class HashUtils {
  /** Utility classes have no constructors. */
  private HashUtils() {}

  /** picked from http://planetmath.org/goodhashtableprimes. */
  private static final int SEED = 243;

  /** The hash function. */
  private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128(SEED);

  /** Marker hashed in place of a null value. */
  private static final byte NULL_MARKER = 0;

  /** Marker hashed ahead of a non-null value. */
  private static final byte VALUE_MARKER = 1;

  /**
   * @param columns key columns; the hash depends on their order.
   * @param row the row whose key to hash.
   * @return a 32-bit murmur3 hash of the key
   */
  public static int hashSubRow(final List<? extends Column<?>> columns, final int row) {
    Objects.requireNonNull(columns, "columns");
    Hasher hasher = HASH_FUNCTION.newHasher();
    for (Column<?> column : columns) {
      addValue(hasher, column, row);
    }
    return hasher.hash().asInt();
  }

  /**
   * Feeds one cell, preceded by its null marker, into {@code hasher}.
   */
  private static Hasher addValue(final Hasher hasher, final Column<?> column, final int row) {
    if (column.isNull(row)) {
      return hasher.putByte(NULL_MARKER);
    }
    hasher.putByte(VALUE_MARKER);
    switch (column.getType()) {
      case BOOLEAN_TYPE:
        return hasher.putBoolean(column.getBoolean(row));
      case DOUBLE_TYPE:
        return hasher.putDouble(column.getDouble(row));
      case INT_TYPE:
        return hasher.putInt(column.getInt(row));
      case LONG_TYPE:
        return hasher.putLong(column.getLong(row));
      case STRING_TYPE:
        return hasher.putString(column.getString(row), StandardCharsets.UTF_8);
      default:
        throw new UnsupportedOperationException("Hashing a column of type " + column.getType());
    }
  }
}
