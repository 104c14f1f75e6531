package edu.washington.escience.rivulet;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import net.jcip.annotations.Immutable;

/**
 * Schema describes the columns of a batch: an ordered list of (name, type) pairs.
 */
@Immutable
public final class Schema implements Serializable {

  /** Required for Java serialization. */
  private static final long serialVersionUID = 1L;

  /** Column types, in order. */
  @JsonProperty private final ImmutableList<Type> columnTypes;

  /** Column names, aligned with {@link #columnTypes}. */
  @JsonProperty private final ImmutableList<String> columnNames;

  /**
   * @param first supplies the leading columns.
   * @param second supplies the trailing columns.
   * @return a schema with the columns of {@code first} followed by those of {@code second}.
   */
  public static Schema merge(final Schema first, final Schema second) {
    return new Schema(
        ImmutableList.<Type>builder().addAll(first.columnTypes).addAll(second.columnTypes).build(),
        ImmutableList.<String>builder().addAll(first.columnNames).addAll(second.columnNames).build());
  }

  /**
   * @param types column types, in order.
   * @param names column names, aligned with {@code types}.
   * @return the schema.
   */
  public static Schema of(final List<Type> types, final List<String> names) {
    return new Schema(types, names);
  }

  /**
   * Shorthand for tests and plan builders: {@code ofFields("k", Type.INT_TYPE, "v", Type.DOUBLE_TYPE)}.
   *
   * @param fields name, type, name, type, ...
   * @return the schema.
   */
  public static Schema ofFields(final Object... fields) {
    Preconditions.checkArgument(fields.length % 2 == 0, "expected alternating names and types");
    final ImmutableList.Builder<Type> types = ImmutableList.builder();
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    for (int i = 0; i < fields.length; i += 2) {
      names.add((String) fields[i]);
      types.add((Type) fields[i + 1]);
    }
    return new Schema(types.build(), names.build());
  }

  /**
   * Both lists are copied. Duplicate names are allowed; lookups by name resolve to the first match.
   *
   * @param columnTypes column types, in order.
   * @param columnNames column names, aligned with {@code columnTypes}.
   */
  @JsonCreator
  public Schema(
      @JsonProperty("columnTypes") final List<Type> columnTypes,
      @JsonProperty("columnNames") final List<String> columnNames) {
    Objects.requireNonNull(columnTypes, "columnTypes");
    Objects.requireNonNull(columnNames, "columnNames");
    Preconditions.checkArgument(
        columnTypes.size() == columnNames.size(),
        "Invalid Schema: length of columnTypes (%s) and columnNames (%s) must match",
        columnTypes.size(),
        columnNames.size());
    this.columnTypes = ImmutableList.copyOf(columnTypes);
    this.columnNames = ImmutableList.copyOf(columnNames);
  }

  /**
   * @param name a column name.
   * @return position of the first column called {@code name}.
   * @throws DbException INVALID if no column is called {@code name}.
   */
  public int getColumnIndex(final String name) throws DbException {
    final int idx = columnNames.indexOf(Objects.requireNonNull(name, "name"));
    if (idx < 0) {
      throw DbException.invalid("No column named %s in schema %s", name, this);
    }
    return idx;
  }

  /**
   * @param index a column position.
   * @return the name at that position.
   */
  public String getColumnName(final int index) {
    return columnNames.get(index);
  }

  /**
   * @return the column names of this schema.
   */
  public ImmutableList<String> getColumnNames() {
    return columnNames;
  }

  /**
   * @param index a column position.
   * @return the type at that position.
   */
  public Type getColumnType(final int index) {
    return columnTypes.get(index);
  }

  /**
   * @return the column types of this schema.
   */
  public ImmutableList<Type> getColumnTypes() {
    return columnTypes;
  }

  /**
   * Projection by position, as used by the aggregate nodes to describe key columns.
   *
   * @param index column positions to keep, in output order; repeats are allowed.
   * @return the projected schema.
   */
  public Schema getSubSchema(final int[] index) {
    final ImmutableList.Builder<Type> types = ImmutableList.builder();
    final ImmutableList.Builder<String> names = ImmutableList.builder();
    for (final int i : index) {
      types.add(columnTypes.get(i));
      names.add(columnNames.get(i));
    }
    return new Schema(types.build(), names.build());
  }

  /**
   * @return the number of columns in this Schema.
   */
  public int numColumns() {
    return columnTypes.size();
  }

  @Override
  public boolean equals(final Object o) {
    if (!(o instanceof Schema)) {
      return false;
    }
    final Schema other = (Schema) o;
    return columnTypes.equals(other.columnTypes) && columnNames.equals(other.columnNames);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columnTypes, columnNames);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("(");
    for (int i = 0; i < numColumns(); ++i) {
      if (i > 0) {
        sb.append(", ");
      }
      sb.append(columnNames.get(i)).append(" (").append(columnTypes.get(i).getName()).append(')');
    }
    return sb.append(')').toString();
  }

  /**
   * @return the column names joined by commas, for log messages.
   */
  public String namesToString() {
    return Joiner.on(", ").join(columnNames);
  }
}
