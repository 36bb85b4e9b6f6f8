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

package com.twentyn.spectra.backend.mzml;

import com.twentyn.spectra.IndexOutOfRangeException;
import com.twentyn.spectra.SourceUnavailableException;
import com.twentyn.spectra.SpectraException;
import com.twentyn.spectra.UnsupportedFormatException;
import com.twentyn.spectra.UnsupportedSpectraOperationException;
import com.twentyn.spectra.backend.BackendFactory;
import com.twentyn.spectra.backend.BackendOptions;
import com.twentyn.spectra.backend.ExportFormat;
import com.twentyn.spectra.backend.SpectraBackend;
import com.twentyn.spectra.backend.SpectraUpdate;
import com.twentyn.spectra.backend.SpectraView;
import com.twentyn.spectra.metadata.CoreField;
import com.twentyn.spectra.metadata.MetadataTable;
import com.twentyn.spectra.peaks.PeakMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.xml.parsers.ParserConfigurationException;
import javax.xml.stream.XMLStreamException;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binds a collection to an mzML file.  Metadata is read once, when the backend is initialized, and kept in memory;
 * peaks are streamed out of the file again on every request, skipping spectra that were not asked for.
 *
 * The file is never modified, so this backend is read-only.  Subsets share the file and only remap positions.
 */
public class MzMLBackend implements SpectraBackend {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MzMLBackend.class);

  public static final String TRANSIENT_FILE_SUFFIX = ".mzML";
  public static final String DEFAULT_FILE_NAME = "spectra.mzML";

  public static class Factory implements BackendFactory {
    @Override
    public SpectraBackend initialize(String source, BackendOptions options) {
      File file = new File(source);
      if (!file.isFile() || !file.canRead()) {
        throw new SourceUnavailableException(source, "not a readable file");
      }
      return open(file, null);
    }

    /**
     * Writes the data to an mzML file and binds a backend to it.  The file goes into the options' directory when one
     * is set, and must not exist yet; otherwise a transient file is created that is deleted when the returned backend
     * is closed.  The returned backend keeps the supplied metadata, including fields mzML cannot hold; only
     * {@code dataStorage} (and a missing {@code dataOrigin}) is set to the new file.
     */
    @Override
    public SpectraBackend fromData(MetadataTable metadata, List<PeakMatrix> peaks, BackendOptions options) {
      if (metadata.size() != peaks.size()) {
        throw new IllegalArgumentException(String.format(
            "Metadata has %d rows but %d peak matrices were supplied", metadata.size(), peaks.size()));
      }
      File destination;
      File owned = null;
      try {
        if (options.getDirectory() != null) {
          if (!options.getDirectory().isDirectory() && !options.getDirectory().mkdirs()) {
            throw new IOException(String.format("Unable to create directory %s", options.getDirectory()));
          }
          destination = new File(options.getDirectory(), DEFAULT_FILE_NAME);
          if (destination.exists()) {
            // Another backend may still be streaming peaks out of it.
            String msg = String.format("mzML file %s already exists", destination.getAbsolutePath());
            LOGGER.error(msg);
            throw new SpectraException(msg);
          }
        } else {
          destination = File.createTempFile(options.getConfiguration().getPeakStoreTempPrefix(), TRANSIENT_FILE_SUFFIX);
          owned = destination;
        }
      } catch (IOException e) {
        LOGGER.error("Unable to create an mzML file for %d spectra: %s", metadata.size(), e.getMessage());
        throw new SpectraException("Unable to create mzML storage", e);
      }
      writeMzML(metadata, peaks, destination);
      MzMLBackend written = open(destination, owned);
      if (written.spectrumCount() != metadata.size()) {
        written.close();
        throw new SpectraException(String.format("Wrote %d spectra to %s but read back %d",
            metadata.size(), destination.getAbsolutePath(), written.spectrumCount()));
      }

      String path = destination.getAbsolutePath();
      MetadataTable table = metadata.copy();
      table.setColumn(CoreField.DATA_STORAGE.getName(), path);
      List<Object> origins = new ArrayList<>(table.get(CoreField.DATA_ORIGIN));
      for (int i = 0; i < origins.size(); i++) {
        if (origins.get(i) == null) {
          origins.set(i, path);
        }
      }
      table.setColumn(CoreField.DATA_ORIGIN.getName(), origins);
      return new MzMLBackend(destination, table, written.ordinals, owned);
    }

    @Override
    public void export(SpectraView view, File destination, ExportFormat format) {
      if (format != ExportFormat.MZML) {
        throw new UnsupportedFormatException(MzMLBackend.class.getSimpleName(), format);
      }
      writeMzML(view.getMetadata(), view.peaks(), destination);
      LOGGER.info("Exported %d spectra to %s", view.size(), destination.getAbsolutePath());
    }

    private static void writeMzML(MetadataTable metadata, List<PeakMatrix> peaks, File destination) {
      try (MzMLWriter writer = new MzMLWriter(destination)) {
        writer.write(metadata, peaks);
      } catch (IOException | XMLStreamException e) {
        LOGGER.error("Unable to write mzML to %s: %s", destination.getAbsolutePath(), e.getMessage());
        throw new SpectraException(String.format("Export to %s failed", destination.getAbsolutePath()), e);
      }
    }

    private static MzMLBackend open(File file, File ownedFile) {
      String path = file.getAbsolutePath();
      List<Map<String, Object>> rows = new ArrayList<>();
      try {
        MzMLSpectrumParser parser = new MzMLSpectrumParser(false);
        try (MzMLParser<MzMLSpectrum>.SpectrumIterator iter = parser.getIterator(path)) {
          while (iter.hasNext()) {
            MzMLSpectrum spectrum = iter.next();
            Map<String, Object> row = new HashMap<>(spectrum.getMetadata());
            row.put(CoreField.DATA_ORIGIN.getName(), path);
            row.put(CoreField.DATA_STORAGE.getName(), path);
            rows.add(row);
          }
        }
      } catch (ParserConfigurationException | IOException | XMLStreamException | SpectraException e) {
        LOGGER.error("Unable to read mzML file %s: %s", path, e.getMessage());
        throw new SourceUnavailableException(path, e);
      }

      MetadataTable metadata = new MetadataTable(rows.size());
      for (CoreField field : CoreField.values()) {
        List<Object> column = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
          column.add(row.get(field.getName()));
        }
        metadata.setColumn(field.getName(), column);
      }
      int[] ordinals = new int[rows.size()];
      for (int i = 0; i < ordinals.length; i++) {
        ordinals[i] = i;
      }
      LOGGER.info("Indexed %d spectra in %s", ordinals.length, path);
      return new MzMLBackend(file, metadata, ordinals, ownedFile);
    }
  }

  private final File file;
  private final MetadataTable metadata;
  // Position of each spectrum among the file's spectrum elements.
  private final int[] ordinals;
  private final File ownedFile;

  MzMLBackend(File file, MetadataTable metadata, int[] ordinals, File ownedFile) {
    this.file = file;
    this.metadata = metadata;
    this.ordinals = ordinals;
    this.ownedFile = ownedFile;
  }

  public File getFile() {
    return file;
  }

  @Override
  public int spectrumCount() {
    return ordinals.length;
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
    IndexOutOfRangeException.checkIndices(indices, ordinals.length);
    if (indices.length == 0) {
      return new ArrayList<>();
    }

    Map<Integer, PeakMatrix> byOrdinal = new HashMap<>();
    for (int index : indices) {
      byOrdinal.put(ordinals[index], null);
    }
    int[] wanted = new int[byOrdinal.size()];
    int w = 0;
    for (Integer ordinal : byOrdinal.keySet()) {
      wanted[w++] = ordinal;
    }
    Arrays.sort(wanted);

    int found = 0;
    MzMLSpectrumParser parser = new MzMLSpectrumParser(true);
    try (MzMLParser<MzMLSpectrum>.SpectrumIterator iter =
             parser.getIterator(file.getAbsolutePath(), ordinal -> Arrays.binarySearch(wanted, ordinal) >= 0)) {
      // Stop streaming as soon as the last requested spectrum has been read.
      while (found < wanted.length && iter.hasNext()) {
        MzMLSpectrum spectrum = iter.next();
        byOrdinal.put(spectrum.getOrdinal(), spectrum.getPeaks());
        found++;
      }
    } catch (ParserConfigurationException | IOException | XMLStreamException e) {
      LOGGER.error("Unable to read peaks from %s: %s", file.getAbsolutePath(), e.getMessage());
      throw new SpectraException(String.format("Unable to read peaks from %s", file.getAbsolutePath()), e);
    }
    if (found < wanted.length) {
      LOGGER.error("Found %d of %d requested spectra in %s", found, wanted.length, file.getAbsolutePath());
      throw new SpectraException(String.format(
          "mzML file %s has fewer spectra than when it was opened", file.getAbsolutePath()));
    }

    List<PeakMatrix> result = new ArrayList<>(indices.length);
    for (int index : indices) {
      result.add(byOrdinal.get(ordinals[index]));
    }
    return result;
  }

  @Override
  public boolean supportsWrite() {
    return false;
  }

  @Override
  public void write(int[] indices, SpectraUpdate update) {
    throw new UnsupportedSpectraOperationException(String.format(
        "%s is read-only; move the spectra to a writable backend first", getName()));
  }

  @Override
  public void reset() {
    // Nothing is cached: peaks always come straight from the file.
  }

  @Override
  public SpectraBackend subset(int[] indices) {
    IndexOutOfRangeException.checkIndices(indices, ordinals.length);
    int[] remapped = new int[indices.length];
    for (int i = 0; i < indices.length; i++) {
      remapped[i] = ordinals[indices[i]];
    }
    return new MzMLBackend(file, metadata.project(indices), remapped, null);
  }

  @Override
  public String getName() {
    return String.format("MzMLBackend(%s)", file.getName());
  }

  @Override
  public void close() {
    if (ownedFile != null && ownedFile.exists() && !ownedFile.delete()) {
      LOGGER.warn("Unable to delete transient mzML file %s", ownedFile.getAbsolutePath());
    }
  }

  @Override
  public String toString() {
    return String.format("MzMLBackend(file=%s, spectra=%d)", file.getAbsolutePath(), ordinals.length);
  }
}
