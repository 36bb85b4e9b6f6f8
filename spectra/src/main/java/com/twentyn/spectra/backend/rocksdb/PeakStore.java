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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.twentyn.spectra.SpectraException;
import com.twentyn.spectra.peaks.PeakMatrix;
import com.twentyn.spectra.utils.rocksdb.RocksDBAndHandles;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.rocksdb.RocksDBException;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A RocksDB store of peak arrays shared by every backend view created over it.
 *
 * Peak arrays are addressed by ids handed out from a monotonic counter and are never overwritten: rewriting a
 * spectrum stores its new peaks under fresh ids.  Views therefore only ever see the arrays their own id mapping points
 * to.  Reads may run concurrently; writes from several views must be serialized by the caller.
 */
public class PeakStore {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PeakStore.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final byte[] MANIFEST_KEY = "manifest".getBytes(StandardCharsets.UTF_8);

  private final RocksDBAndHandles<PeakColumnFamilies> dbAndHandles;
  private final File directory;
  private final boolean ownsDirectory;
  private final int writeBatchSize;
  private final AtomicLong nextId;
  private volatile boolean closed = false;

  /**
   * @param dbAndHandles An open DB with all {@link PeakColumnFamilies}.
   * @param directory The directory the DB lives in, or null if it has none (as in tests).
   * @param ownsDirectory True if the directory is transient and should be deleted when the store is closed.
   * @param writeBatchSize The number of spectra to put in each RocksDB write batch.
   */
  public PeakStore(RocksDBAndHandles<PeakColumnFamilies> dbAndHandles, File directory, boolean ownsDirectory,
                   int writeBatchSize) throws RocksDBException {
    if (writeBatchSize < 1) {
      throw new IllegalArgumentException(String.format("Write batch size must be >= 1, got %d", writeBatchSize));
    }
    this.dbAndHandles = dbAndHandles;
    this.directory = directory;
    this.ownsDirectory = ownsDirectory;
    this.writeBatchSize = writeBatchSize;
    this.nextId = new AtomicLong(findNextId());
  }

  private long findNextId() throws RocksDBException {
    long max = -1L;
    try (RocksDBAndHandles.RocksDBIterator iter = dbAndHandles.newIterator(PeakColumnFamilies.MZ_ARRAYS)) {
      iter.reset();
      while (iter.isValid()) {
        max = Math.max(max, ByteArrays.keyToLong(iter.key()));
        iter.next();
      }
    }
    return max + 1;
  }

  public File getDirectory() {
    return directory;
  }

  public boolean ownsDirectory() {
    return ownsDirectory;
  }

  public boolean isClosed() {
    return closed;
  }

  /**
   * Reserves a contiguous block of fresh peak ids.
   * @param count The number of ids needed.
   * @return The ids, in ascending order.
   */
  public long[] allocateIds(int count) {
    long first = nextId.getAndAdd(count);
    long[] ids = new long[count];
    for (int i = 0; i < count; i++) {
      ids[i] = first + i;
    }
    return ids;
  }

  public void putPeaks(long[] ids, List<PeakMatrix> peaks) {
    checkOpen();
    if (ids.length != peaks.size()) {
      throw new IllegalArgumentException(String.format("Got %d ids for %d peak matrices", ids.length, peaks.size()));
    }
    try {
      for (int start = 0; start < ids.length; start += writeBatchSize) {
        int end = Math.min(ids.length, start + writeBatchSize);
        RocksDBAndHandles.RocksDBWriteBatch<PeakColumnFamilies> batch = dbAndHandles.makeWriteBatch();
        for (int i = start; i < end; i++) {
          byte[] key = ByteArrays.longToKey(ids[i]);
          batch.put(PeakColumnFamilies.MZ_ARRAYS, key, ByteArrays.doubleArrayToBytes(peaks.get(i).getMz()));
          batch.put(PeakColumnFamilies.INTENSITY_ARRAYS, key,
              ByteArrays.doubleArrayToBytes(peaks.get(i).getIntensity()));
        }
        batch.write();
      }
    } catch (RocksDBException e) {
      LOGGER.error("Unable to write %d peak arrays to %s: %s", ids.length, describe(), e.getMessage());
      throw new SpectraException(String.format("Peak store write to %s failed", describe()), e);
    }
  }

  public List<PeakMatrix> getPeaks(long[] ids) {
    checkOpen();
    List<PeakMatrix> result = new ArrayList<>(ids.length);
    try {
      for (long id : ids) {
        byte[] key = ByteArrays.longToKey(id);
        byte[] mz = dbAndHandles.get(PeakColumnFamilies.MZ_ARRAYS, key);
        byte[] intensity = dbAndHandles.get(PeakColumnFamilies.INTENSITY_ARRAYS, key);
        if (mz == null || intensity == null) {
          String msg = String.format("Peak id %d is missing from %s", id, describe());
          LOGGER.error(msg);
          throw new SpectraException(msg);
        }
        result.add(new PeakMatrix(ByteArrays.bytesToDoubleArray(mz), ByteArrays.bytesToDoubleArray(intensity)));
      }
    } catch (RocksDBException e) {
      LOGGER.error("Unable to read peak arrays from %s: %s", describe(), e.getMessage());
      throw new SpectraException(String.format("Peak store read from %s failed", describe()), e);
    }
    return result;
  }

  public void writeManifest(PeakStoreManifest manifest) {
    checkOpen();
    try {
      dbAndHandles.put(PeakColumnFamilies.SPECTRA_METADATA, MANIFEST_KEY, OBJECT_MAPPER.writeValueAsBytes(manifest));
    } catch (IOException | RocksDBException e) {
      LOGGER.error("Unable to write spectra metadata to %s: %s", describe(), e.getMessage());
      throw new SpectraException(String.format("Metadata write to %s failed", describe()), e);
    }
  }

  /**
   * @return The stored manifest, or null if the store has none.
   */
  public PeakStoreManifest readManifest() {
    checkOpen();
    try {
      byte[] bytes = dbAndHandles.get(PeakColumnFamilies.SPECTRA_METADATA, MANIFEST_KEY);
      return bytes == null ? null : OBJECT_MAPPER.readValue(bytes, PeakStoreManifest.class);
    } catch (IOException | RocksDBException e) {
      LOGGER.error("Unable to read spectra metadata from %s: %s", describe(), e.getMessage());
      throw new SpectraException(String.format("Metadata read from %s failed", describe()), e);
    }
  }

  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    dbAndHandles.close();
    if (ownsDirectory && directory != null) {
      try {
        FileUtils.deleteDirectory(directory);
        LOGGER.debug("Deleted transient peak store %s", directory.getAbsolutePath());
      } catch (IOException e) {
        LOGGER.warn("Unable to delete transient peak store %s: %s", directory.getAbsolutePath(), e.getMessage());
      }
    }
  }

  private void checkOpen() {
    if (closed) {
      throw new SpectraException(String.format("Peak store %s has been closed", describe()));
    }
  }

  private String describe() {
    return directory == null ? "<unbound peak store>" : directory.getAbsolutePath();
  }
}
