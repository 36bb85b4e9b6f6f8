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

package com.twentyn.spectra.backend.rocksdb;

import com.twentyn.spectra.IndexOutOfRangeException;
import com.twentyn.spectra.SourceUnavailableException;
import com.twentyn.spectra.SpectraException;
import com.twentyn.spectra.UnsupportedFormatException;
import com.twentyn.spectra.backend.BackendFactory;
import com.twentyn.spectra.backend.BackendOptions;
import com.twentyn.spectra.backend.ExportFormat;
import com.twentyn.spectra.backend.SpectraBackend;
import com.twentyn.spectra.backend.SpectraUpdate;
import com.twentyn.spectra.backend.SpectraView;
import com.twentyn.spectra.metadata.CoreField;
import com.twentyn.spectra.metadata.MetadataTable;
import com.twentyn.spectra.peaks.PeakMatrix;
import com.twentyn.spectra.utils.rocksdb.DBUtil;
import com.twentyn.spectra.utils.rocksdb.RocksDBAndHandles;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.rocksdb.RocksDBException;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Keeps peaks in a RocksDB store on disk and metadata in memory.  The metadata of the spectra a store was created
 * with is also persisted in the store, so it can be re-opened with {@link Factory#initialize(String, BackendOptions)}.
 *
 * Every backend built over a store is a view: an in-memory metadata table plus the peak id of each of its spectra.
 * Subsets share the store and copy only the id mapping.  Peak writes go to fresh ids, so a write through one view is
 * never observed by another.  Only the view returned by the factory persists its writes back to the store's metadata,
 * and only it closes the store.
 */
public class RocksDBPeaksBackend implements SpectraBackend {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RocksDBPeaksBackend.class);

  public static class Factory implements BackendFactory {
    /**
     * Opens a peak store directory written by {@link #fromData(MetadataTable, List, BackendOptions)} or by an export.
     */
    @Override
    public SpectraBackend initialize(String source, BackendOptions options) {
      File directory = new File(source);
      if (!directory.isDirectory()) {
        throw new SourceUnavailableException(source, "not a peak store directory");
      }

      RocksDBAndHandles<PeakColumnFamilies> dbAndHandles;
      PeakStore store;
      try {
        dbAndHandles = DBUtil.openExistingRocksDB(directory, PeakColumnFamilies.values());
        store = new PeakStore(dbAndHandles, directory, false,
            options.getConfiguration().getPeakStoreWriteBatchSize());
      } catch (RocksDBException e) {
        LOGGER.error("Unable to open peak store at %s: %s", source, e.getMessage());
        throw new SourceUnavailableException(source, e);
      }

      PeakStoreManifest manifest;
      try {
        manifest = store.readManifest();
      } catch (SpectraException e) {
        store.close();
        throw new SourceUnavailableException(source, e);
      }
      if (manifest == null) {
        store.close();
        throw new SourceUnavailableException(source, "peak store has no spectra metadata");
      }
      RocksDBPeaksBackend backend = open(store, manifest);
      LOGGER.info("Opened peak store %s with %d spectra", source, backend.spectrumCount());
      return backend;
    }

    /**
     * Writes the data into a new peak store.  The store is created in the options' directory, which must not hold
     * anything yet; without one, a transient directory is created and deleted when the returned backend is closed.
     */
    @Override
    public SpectraBackend fromData(MetadataTable metadata, List<PeakMatrix> peaks, BackendOptions options) {
      File directory = options.getDirectory();
      boolean owned = false;
      try {
        if (directory == null) {
          directory = Files.createTempDirectory(options.getConfiguration().getPeakStoreTempPrefix()).toFile();
          owned = true;
        } else {
          String[] existing = directory.list();
          if (existing != null && existing.length > 0) {
            String msg = String.format("Peak store directory %s is not empty", directory.getAbsolutePath());
            LOGGER.error(msg);
            throw new SpectraException(msg);
          }
          Files.createDirectories(directory.toPath());
        }
      } catch (IOException e) {
        LOGGER.error("Unable to create peak store directory: %s", e.getMessage());
        throw new SpectraException("Unable to create peak store directory", e);
      }

      PeakStore store;
      try {
        RocksDBAndHandles<PeakColumnFamilies> dbAndHandles =
            DBUtil.createNewRocksDB(directory, PeakColumnFamilies.values());
        store = new PeakStore(dbAndHandles, directory, owned,
            options.getConfiguration().getPeakStoreWriteBatchSize());
      } catch (RocksDBException e) {
        LOGGER.error("Unable to create peak store at %s: %s", directory.getAbsolutePath(), e.getMessage());
        throw new SpectraException(String.format("Unable to create peak store at %s", directory.getAbsolutePath()), e);
      }
      return create(store, metadata, peaks);
    }

    /**
     * Writes a collection to a new peak store at the destination directory.
     */
    @Override
    public void export(SpectraView view, File destination, ExportFormat format) {
      if (format != ExportFormat.PEAK_STORE) {
        throw new UnsupportedFormatException(RocksDBPeaksBackend.class.getSimpleName(), format);
      }
      try (SpectraBackend written =
               fromData(view.getMetadata(), view.peaks(), BackendOptions.defaults().withDirectory(destination))) {
        LOGGER.info("Exported %d spectra to %s", written.spectrumCount(), destination.getAbsolutePath());
      }
    }
  }

  /**
   * Fills an empty store and returns the root view over it.
   * @param store A store with no spectra manifest yet.
   * @param metadata The spectra's metadata.
   * @param peaks The spectra's peaks.
   * @return A view that owns the store.
   */
  public static RocksDBPeaksBackend create(PeakStore store, MetadataTable metadata, List<PeakMatrix> peaks) {
    if (metadata.size() != peaks.size()) {
      throw new IllegalArgumentException(String.format(
          "Metadata has %d rows but %d peak matrices were supplied", metadata.size(), peaks.size()));
    }
    long[] ids = store.allocateIds(peaks.size());
    store.putPeaks(ids, peaks);

    MetadataTable table = metadata.copy();
    table.setColumn(CoreField.DATA_STORAGE.getName(), storageKey(store));
    RocksDBPeaksBackend backend = new RocksDBPeaksBackend(store, ids, table, true);
    backend.persistManifest();
    LOGGER.info("Wrote %d spectra to peak store %s", peaks.size(), storageKey(store));
    return backend;
  }

  /**
   * Builds the root view described by a store's manifest.
   */
  public static RocksDBPeaksBackend open(PeakStore store, PeakStoreManifest manifest) {
    if (manifest.getPeakIds().length != manifest.getRows().size()) {
      throw new SpectraException(String.format("Corrupt peak store manifest: %d peak ids for %d rows",
          manifest.getPeakIds().length, manifest.getRows().size()));
    }
    MetadataTable table = MetadataTable.fromRows(manifest.getRows());
    // Storage moves with the directory, so the key is always where the store was opened from.
    table.setColumn(CoreField.DATA_STORAGE.getName(), storageKey(store));
    return new RocksDBPeaksBackend(store, manifest.getPeakIds().clone(), table, true);
  }

  private static String storageKey(PeakStore store) {
    return store.getDirectory() == null ? "<peak store>" : store.getDirectory().getAbsolutePath();
  }

  private final PeakStore store;
  private final long[] peakIds;
  private final MetadataTable metadata;
  private final boolean root;

  RocksDBPeaksBackend(PeakStore store, long[] peakIds, MetadataTable metadata, boolean root) {
    this.store = store;
    this.peakIds = peakIds;
    this.metadata = metadata;
    this.root = root;
  }

  public PeakStore getStore() {
    return store;
  }

  @Override
  public int spectrumCount() {
    return peakIds.length;
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
    IndexOutOfRangeException.checkIndices(indices, peakIds.length);
    return store.getPeaks(idsFor(indices));
  }

  @Override
  public boolean supportsWrite() {
    return true;
  }

  @Override
  public void write(int[] indices, SpectraUpdate update) {
    IndexOutOfRangeException.checkIndices(indices, peakIds.length);
    if (update.hasPeaks()) {
      List<PeakMatrix> newPeaks = update.getPeaks();
      if (newPeaks.size() != indices.length) {
        throw new IllegalArgumentException(String.format(
            "Got %d peak matrices for %d indices", newPeaks.size(), indices.length));
      }
      /* Old arrays stay in the store: other views may still point at them. */
      long[] fresh = store.allocateIds(indices.length);
      store.putPeaks(fresh, newPeaks);
      for (int i = 0; i < indices.length; i++) {
        peakIds[indices[i]] = fresh[i];
      }
    }
    for (Map.Entry<String, List<?>> entry : update.getFields().entrySet()) {
      metadata.setValues(entry.getKey(), indices, entry.getValue());
    }
    if (root) {
      persistManifest();
    }
  }

  private void persistManifest() {
    List<Map<String, Object>> rows = new ArrayList<>(metadata.size());
    for (int i = 0; i < metadata.size(); i++) {
      rows.add(metadata.row(i));
    }
    store.writeManifest(new PeakStoreManifest(peakIds.clone(), rows));
  }

  @Override
  public void reset() {
    // Peaks are read straight from the store; there is nothing to drop.
  }

  @Override
  public SpectraBackend subset(int[] indices) {
    IndexOutOfRangeException.checkIndices(indices, peakIds.length);
    return new RocksDBPeaksBackend(store, idsFor(indices), metadata.project(indices), false);
  }

  private long[] idsFor(int[] indices) {
    long[] ids = new long[indices.length];
    for (int i = 0; i < indices.length; i++) {
      ids[i] = peakIds[indices[i]];
    }
    return ids;
  }

  @Override
  public String getName() {
    return String.format("RocksDBPeaksBackend(%s)", storageKey(store));
  }

  /**
   * Closes the store when called on the view the factory returned; a no-op on subsets.
   */
  @Override
  public void close() {
    if (root) {
      store.close();
    }
  }

  @Override
  public String toString() {
    return String.format("RocksDBPeaksBackend(store=%s, spectra=%d, root=%s)", storageKey(store), peakIds.length, root);
  }
}
