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

import com.twentyn.spectra.IndexOutOfRangeException;
import com.twentyn.spectra.SourceUnavailableException;
import com.twentyn.spectra.SpectraException;
import com.twentyn.spectra.UnsupportedFormatException;
import com.twentyn.spectra.metadata.CoreField;
import com.twentyn.spectra.metadata.MetadataTable;
import com.twentyn.spectra.peaks.PeakMatrix;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Holds all metadata and peaks on the heap.  Every field is writable and there is no I/O on reads; memory use grows
 * with the number of peaks.
 *
 * Subsets copy the (immutable) peak matrix references, so writes to a subset are never visible to the backend it
 * was taken from.
 */
public class InMemoryBackend implements SpectraBackend {
  private static final Logger LOGGER = LogManager.getFormatterLogger(InMemoryBackend.class);

  public static final String DATA_STORAGE_MEMORY = "<memory>";

  public static class Factory implements BackendFactory {
    /**
     * Reads a TSV file in the layout written by {@link #export(SpectraView, File, ExportFormat)}; see
     * {@link SpectraTSV}.
     */
    @Override
    public SpectraBackend initialize(String source, BackendOptions options) {
      File file = new File(source);
      if (!file.isFile() || !file.canRead()) {
        throw new SourceUnavailableException(source, "not a readable file");
      }

      Pair<MetadataTable, List<PeakMatrix>> contents;
      try {
        contents = SpectraTSV.read(file);
      } catch (IOException e) {
        LOGGER.error("Unable to read TSV spectra from %s: %s", source, e.getMessage());
        throw new SourceUnavailableException(source, e);
      } catch (IllegalArgumentException e) {
        LOGGER.error("Malformed TSV spectra in %s: %s", source, e.getMessage());
        throw new SourceUnavailableException(source, e.getMessage());
      }
      LOGGER.info("Loaded %d spectra from %s", contents.getLeft().size(), source);
      return fromData(contents.getLeft(), contents.getRight(), options);
    }

    @Override
    public SpectraBackend fromData(MetadataTable metadata, List<PeakMatrix> peaks, BackendOptions options) {
      return new InMemoryBackend(metadata, peaks);
    }

    @Override
    public void export(SpectraView view, File destination, ExportFormat format) {
      if (format != ExportFormat.TSV) {
        throw new UnsupportedFormatException(InMemoryBackend.class.getSimpleName(), format);
      }

      MetadataTable metadata = view.getMetadata();
      try (SpectraTSV.Writer writer = new SpectraTSV.Writer(destination, metadata.fieldNames())) {
        writer.append(metadata, view.peaks());
      } catch (IOException e) {
        LOGGER.error("Unable to write TSV spectra to %s: %s", destination.getAbsolutePath(), e.getMessage());
        throw new SpectraException(String.format("Export to %s failed", destination.getAbsolutePath()), e);
      }
      LOGGER.info("Exported %d spectra to %s", metadata.size(), destination.getAbsolutePath());
    }
  }

  private final MetadataTable metadata;
  private final List<PeakMatrix> peaks;

  public InMemoryBackend(MetadataTable metadata, List<PeakMatrix> peaks) {
    if (metadata.size() != peaks.size()) {
      throw new IllegalArgumentException(String.format(
          "Metadata has %d rows but %d peak matrices were supplied", metadata.size(), peaks.size()));
    }
    this.metadata = metadata.copy();
    this.peaks = new ArrayList<>(peaks);
    fillDataStorage();
  }

  private void fillDataStorage() {
    List<Object> storage = new ArrayList<>(metadata.get(CoreField.DATA_STORAGE));
    for (int i = 0; i < storage.size(); i++) {
      if (storage.get(i) == null) {
        storage.set(i, DATA_STORAGE_MEMORY);
      }
    }
    metadata.setColumn(CoreField.DATA_STORAGE.getName(), storage);
  }

  @Override
  public int spectrumCount() {
    return peaks.size();
  }

  @Override
  public Set<String> fieldNames() {
    return metadata.fieldNames();
  }

  @Override
  public MetadataTable metadata(Set<String> fields) {
    return metadata.select(fields);
  }

  @Override
  public List<PeakMatrix> peaks(int[] indices) {
    IndexOutOfRangeException.checkIndices(indices, peaks.size());
    List<PeakMatrix> result = new ArrayList<>(indices.length);
    for (int index : indices) {
      result.add(peaks.get(index));
    }
    return result;
  }

  @Override
  public boolean supportsWrite() {
    return true;
  }

  @Override
  public void write(int[] indices, SpectraUpdate update) {
    IndexOutOfRangeException.checkIndices(indices, peaks.size());
    if (update.hasPeaks()) {
      List<PeakMatrix> newPeaks = update.getPeaks();
      if (newPeaks.size() != indices.length) {
        throw new IllegalArgumentException(String.format(
            "Got %d peak matrices for %d indices", newPeaks.size(), indices.length));
      }
      for (int i = 0; i < indices.length; i++) {
        peaks.set(indices[i], newPeaks.get(i));
      }
    }
    for (Map.Entry<String, List<?>> entry : update.getFields().entrySet()) {
      metadata.setValues(entry.getKey(), indices, entry.getValue());
    }
  }

  @Override
  public void reset() {
    // Nothing is cached.
  }

  @Override
  public SpectraBackend subset(int[] indices) {
    return new InMemoryBackend(metadata.project(indices), peaks(indices));
  }

  @Override
  public String getName() {
    return "InMemoryBackend";
  }

  @Override
  public void close() {
  }

  @Override
  public String toString() {
    return String.format("InMemoryBackend(spectra=%d)", peaks.size());
  }
}
