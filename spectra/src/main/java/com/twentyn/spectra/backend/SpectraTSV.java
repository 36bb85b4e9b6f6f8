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

package com.twentyn.spectra.backend;

import com.twentyn.spectra.metadata.CoreField;
import com.twentyn.spectra.metadata.MetadataTable;
import com.twentyn.spectra.peaks.PeakMatrix;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The tab-separated layout spectra are exported to: one row per spectrum, one column per metadata field, followed by
 * {@code mz} and {@code intensity} columns holding ';'-separated numbers.  Missing values are empty cells.
 */
public class SpectraTSV {
  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true).withHeader();
  public static final char PEAK_SEPARATOR = ';';

  /**
   * Streams spectra into a TSV file.  The metadata columns are fixed when the writer is created; fields a row does
   * not have are written as empty cells.
   */
  public static class Writer implements AutoCloseable {
    private final List<String> fields;
    private final CSVPrinter printer;
    private int written = 0;

    public Writer(File destination, Collection<String> metadataFields) throws IOException {
      this.fields = new ArrayList<>(metadataFields);
      List<String> header = new ArrayList<>(fields);
      header.add(CoreField.PEAK_FIELD_MZ);
      header.add(CoreField.PEAK_FIELD_INTENSITY);
      this.printer = new CSVPrinter(Files.newBufferedWriter(destination.toPath(), StandardCharsets.UTF_8),
          TSV_FORMAT.withHeader(header.toArray(new String[header.size()])));
    }

    public void append(Map<String, Object> metadataRow, PeakMatrix peaks) throws IOException {
      List<String> values = new ArrayList<>(fields.size() + 2);
      for (String field : fields) {
        Object value = metadataRow.get(field);
        values.add(value == null ? null : value.toString());
      }
      values.add(joinPeakArray(peaks.getMz()));
      values.add(joinPeakArray(peaks.getIntensity()));
      printer.printRecord(values);
      written++;
    }

    public void append(MetadataTable metadata, List<PeakMatrix> peaks) throws IOException {
      if (metadata.size() != peaks.size()) {
        throw new IllegalArgumentException(String.format(
            "Metadata has %d rows but %d peak matrices were supplied", metadata.size(), peaks.size()));
      }
      for (int i = 0; i < metadata.size(); i++) {
        append(metadata.row(i), peaks.get(i));
      }
      printer.flush();
    }

    public int getWritten() {
      return written;
    }

    @Override
    public void close() throws IOException {
      printer.close();
    }
  }

  /**
   * Reads a file in the layout {@link Writer} produces.  Metadata values come back as strings; core fields are
   * coerced to their types by {@link MetadataTable#fromRows(List)}.
   * @param file The TSV file.
   * @return The spectra's metadata and peaks, in file order.
   * @throws IOException If the file cannot be read.
   * @throws IllegalArgumentException If a row's peak columns are missing, not numeric or of unequal length.  The
   *   message names the line.
   */
  public static Pair<MetadataTable, List<PeakMatrix>> read(File file) throws IOException {
    List<Map<String, Object>> rows = new ArrayList<>();
    List<PeakMatrix> peaks = new ArrayList<>();
    try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8);
         CSVParser parser = new CSVParser(reader, TSV_FORMAT)) {
      List<String> header = parser.getHeaderNames();
      if (!header.contains(CoreField.PEAK_FIELD_MZ) || !header.contains(CoreField.PEAK_FIELD_INTENSITY)) {
        throw new IllegalArgumentException(String.format("header has no %s and %s columns",
            CoreField.PEAK_FIELD_MZ, CoreField.PEAK_FIELD_INTENSITY));
      }
      for (CSVRecord record : parser) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String field : header) {
          if (CoreField.isPeakField(field)) {
            continue;
          }
          String value = record.isSet(field) ? record.get(field) : null;
          // Empty cells are missing values.
          row.put(field, StringUtils.isEmpty(value) ? null : value);
        }
        rows.add(row);

        // The header is line 1.
        long line = record.getRecordNumber() + 1;
        try {
          peaks.add(new PeakMatrix(
              parsePeakArray(record.isSet(CoreField.PEAK_FIELD_MZ) ? record.get(CoreField.PEAK_FIELD_MZ) : null),
              parsePeakArray(record.isSet(CoreField.PEAK_FIELD_INTENSITY) ?
                  record.get(CoreField.PEAK_FIELD_INTENSITY) : null)));
        } catch (IllegalArgumentException e) {
          throw new IllegalArgumentException(String.format("malformed peaks on line %d: %s", line, e.getMessage()), e);
        }
      }
    }
    return Pair.of(MetadataTable.fromRows(rows), peaks);
  }

  static String joinPeakArray(double[] values) {
    List<String> parts = new ArrayList<>(values.length);
    for (double v : values) {
      parts.add(Double.toString(v));
    }
    return StringUtils.join(parts, PEAK_SEPARATOR);
  }

  static double[] parsePeakArray(String joined) {
    if (StringUtils.isBlank(joined)) {
      return new double[0];
    }
    String[] parts = StringUtils.split(joined, PEAK_SEPARATOR);
    double[] values = new double[parts.length];
    for (int i = 0; i < parts.length; i++) {
      values[i] = Double.parseDouble(parts[i].trim());
    }
    return values;
  }
}
