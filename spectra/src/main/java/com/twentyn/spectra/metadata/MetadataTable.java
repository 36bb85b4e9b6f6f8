/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.twentyn.spectra.metadata;

import com.twentyn.spectra.IndexOutOfRangeException;
import com.twentyn.spectra.LengthMismatchException;
import com.twentyn.spectra.UnsupportedSpectraOperationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Column-oriented metadata for an ordered list of spectra.  Row i holds the metadata of spectrum i.
 *
 * Only fields that have been populated are physically stored.  Core fields ({@link CoreField}) are always readable:
 * when they are not stored they read as a column of nulls, null being the missing-value sentinel for every field.
 * Values assigned to core fields are coerced to the field's {@link FieldType}; extra fields hold whatever the caller
 * assigns.
 *
 * Tables are mutable through {@link #setColumn(String, List)} and {@link #removeColumn(String)}; every other
 * operation returns a new table that shares no column lists with this one.
 */
public class MetadataTable {
  private final int rowCount;
  private final LinkedHashMap<String, List<Object>> columns;

  public MetadataTable(int rowCount) {
    if (rowCount < 0) {
      throw new IllegalArgumentException(String.format("Row count must be >= 0, got %d", rowCount));
    }
    this.rowCount = rowCount;
    this.columns = new LinkedHashMap<>();
  }

  private MetadataTable(int rowCount, LinkedHashMap<String, List<Object>> columns) {
    this.rowCount = rowCount;
    this.columns = columns;
  }

  /**
   * Builds a table from per-spectrum rows.  The field set is the union of the rows' keys; rows lacking a field get the
   * missing sentinel.
   * @param rows One map per spectrum, in spectrum order.
   * @return A new table.
   */
  public static MetadataTable fromRows(List<? extends Map<String, ?>> rows) {
    Set<String> fields = new LinkedHashSet<>();
    for (Map<String, ?> row : rows) {
      fields.addAll(row.keySet());
    }

    MetadataTable table = new MetadataTable(rows.size());
    for (String field : fields) {
      List<Object> values = new ArrayList<>(rows.size());
      for (Map<String, ?> row : rows) {
        values.add(row.get(field));
      }
      table.setColumn(field, values);
    }
    return table;
  }

  public int size() {
    return rowCount;
  }

  /**
   * @return All readable fields: every core field followed by the stored extra fields in insertion order.
   */
  public Set<String> fieldNames() {
    Set<String> names = new LinkedHashSet<>(CoreField.names());
    names.addAll(columns.keySet());
    return Collections.unmodifiableSet(names);
  }

  /**
   * @return Only the fields that hold stored values (core or extra).
   */
  public Set<String> storedFieldNames() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(columns.keySet()));
  }

  public Set<String> extraFieldNames() {
    Set<String> names = new LinkedHashSet<>();
    for (String name : columns.keySet()) {
      if (!CoreField.isCoreField(name)) {
        names.add(name);
      }
    }
    return Collections.unmodifiableSet(names);
  }

  public boolean hasField(String field) {
    return CoreField.isCoreField(field) || columns.containsKey(field);
  }

  /**
   * Reads a column.  Fields that are not stored (core or otherwise) read as all-missing.
   * @param field The field name.
   * @return An unmodifiable list of rowCount values.
   */
  public List<Object> get(String field) {
    List<Object> column = columns.get(field);
    if (column == null) {
      return Collections.nCopies(rowCount, null);
    }
    return Collections.unmodifiableList(column);
  }

  public List<Object> get(CoreField field) {
    return get(field.getName());
  }

  public Object getValue(int row, String field) {
    checkRow(row);
    List<Object> column = columns.get(field);
    return column == null ? null : column.get(row);
  }

  /**
   * @param row A row index.
   * @return All readable fields of that row, in {@link #fieldNames()} order.
   */
  public Map<String, Object> row(int row) {
    checkRow(row);
    Map<String, Object> result = new LinkedHashMap<>();
    for (String field : fieldNames()) {
      List<Object> column = columns.get(field);
      result.put(field, column == null ? null : column.get(row));
    }
    return result;
  }

  /**
   * Replaces or adds a column.
   * @param field The field name; must not be a peak-bearing field.
   * @param values Exactly one value per row.
   * @throws LengthMismatchException If values.size() != size().
   * @throws com.twentyn.spectra.TypeMismatchException If a core field value cannot be coerced.
   */
  public void setColumn(String field, List<?> values) {
    if (CoreField.isPeakField(field)) {
      throw new UnsupportedSpectraOperationException(String.format(
          "Peak field '%s' cannot be stored as metadata", field));
    }
    if (values.size() != rowCount) {
      throw new LengthMismatchException(field, rowCount, values.size());
    }
    CoreField coreField = CoreField.fromName(field);
    List<Object> column = new ArrayList<>(rowCount);
    for (Object value : values) {
      column.add(coreField == null ? value : coreField.coerce(value));
    }
    columns.put(field, column);
  }

  /**
   * Assigns the same value to every row.
   */
  public void setColumn(String field, Object scalar) {
    setColumn(field, Collections.nCopies(rowCount, scalar));
  }

  /**
   * Overwrites the values of one field for some rows.
   * @param field The field to update.
   * @param rows The rows to overwrite.
   * @param values One value per entry in rows.
   */
  public void setValues(String field, int[] rows, List<?> values) {
    if (values.size() != rows.length) {
      throw new LengthMismatchException(field, rows.length, values.size());
    }
    List<Object> column = new ArrayList<>(get(field));
    CoreField coreField = CoreField.fromName(field);
    for (int i = 0; i < rows.length; i++) {
      checkRow(rows[i]);
      Object value = values.get(i);
      column.set(rows[i], coreField == null ? value : coreField.coerce(value));
    }
    setColumn(field, column);
  }

  /**
   * Drops a stored column.  Core fields can be dropped from storage but remain readable as missing.
   * @return True if a column was removed.
   */
  public boolean removeColumn(String field) {
    return columns.remove(field) != null;
  }

  /**
   * Row projection.  Order and duplicates in rows are kept.
   * @param rows Row indices into this table.
   * @return A new table with rows.length rows.
   */
  public MetadataTable project(int[] rows) {
    IndexOutOfRangeException.checkIndices(rows, rowCount);
    LinkedHashMap<String, List<Object>> projected = new LinkedHashMap<>();
    for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
      List<Object> source = entry.getValue();
      List<Object> column = new ArrayList<>(rows.length);
      for (int row : rows) {
        column.add(source.get(row));
      }
      projected.put(entry.getKey(), column);
    }
    return new MetadataTable(rows.length, projected);
  }

  /**
   * Column projection.  Every requested field gets a stored column; fields this table does not hold are filled with
   * the missing sentinel.
   * @param fields The fields to keep.
   * @return A new table with the same number of rows.
   */
  public MetadataTable select(Collection<String> fields) {
    LinkedHashMap<String, List<Object>> selected = new LinkedHashMap<>();
    for (String field : fields) {
      if (CoreField.isPeakField(field)) {
        continue;
      }
      selected.put(field, new ArrayList<>(get(field)));
    }
    return new MetadataTable(rowCount, selected);
  }

  public MetadataTable copy() {
    LinkedHashMap<String, List<Object>> copied = new LinkedHashMap<>();
    for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
      copied.put(entry.getKey(), new ArrayList<>(entry.getValue()));
    }
    return new MetadataTable(rowCount, copied);
  }

  /**
   * Concatenates tables row-wise in argument order.  The stored field set of the result is the union of the inputs'
   * stored fields; rows from a table lacking a field read as missing for it.
   * @param tables The tables to concatenate.
   * @return A new table whose size is the sum of the inputs' sizes.
   */
  public static MetadataTable concat(List<MetadataTable> tables) {
    int total = 0;
    Set<String> fields = new LinkedHashSet<>();
    for (MetadataTable table : tables) {
      total += table.size();
      fields.addAll(table.columns.keySet());
    }

    LinkedHashMap<String, List<Object>> merged = new LinkedHashMap<>();
    for (String field : fields) {
      List<Object> column = new ArrayList<>(total);
      for (MetadataTable table : tables) {
        // Explicit fill: tables without the field contribute missing values for all their rows.
        column.addAll(table.get(field));
      }
      merged.put(field, column);
    }
    return new MetadataTable(total, merged);
  }

  private void checkRow(int row) {
    if (row < 0 || row >= rowCount) {
      throw new IndexOutOfRangeException(row, rowCount);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetadataTable)) {
      return false;
    }
    MetadataTable that = (MetadataTable) o;
    return rowCount == that.rowCount && columns.equals(that.columns);
  }

  @Override
  public int hashCode() {
    return 31 * rowCount + columns.hashCode();
  }

  @Override
  public String toString() {
    return String.format("MetadataTable(rows=%d, fields=%s)", rowCount, columns.keySet());
  }
}
