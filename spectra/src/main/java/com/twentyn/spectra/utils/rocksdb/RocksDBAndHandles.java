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

package com.twentyn.spectra.utils.rocksdb;

import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.FlushOptions;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.RocksIterator;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class RocksDBAndHandles<T extends ColumnFamilyEnumeration<T>> {
  RocksDB db;
  Map<T, ColumnFamilyHandle> columnFamilyHandleMap;
  // Every handle opened with the DB, including the default family; all must be closed before the DB is.
  List<ColumnFamilyHandle> openHandles = new ArrayList<>();

  WriteOptions writeOptions = null;

  // Here to hijack the DB interface for easy testing or alternate implementations.
  protected RocksDBAndHandles() {

  }

  public RocksDBAndHandles(RocksDB db, Map<T, ColumnFamilyHandle> columnFamilyHandleMap,
                           List<ColumnFamilyHandle> openHandles) {
    this.db = db;
    this.columnFamilyHandleMap = columnFamilyHandleMap;
    this.openHandles = openHandles;
  }

  public void close() {
    for (ColumnFamilyHandle handle : openHandles) {
      handle.close();
    }
    if (writeOptions != null) {
      writeOptions.close();
    }
    this.db.close();
  }

  public WriteOptions getWriteOptions() {
    return writeOptions;
  }

  public void setWriteOptions(WriteOptions writeOptions) {
    this.writeOptions = writeOptions;
  }

  public RocksDB getDb() {
    return db;
  }

  protected ColumnFamilyHandle getHandle(T columnFamilyLabel) {
    return this.columnFamilyHandleMap.get(columnFamilyLabel);
  }

  public void put(T columnFamily, byte[] key, byte[] val) throws RocksDBException {
    if (writeOptions != null) {
      this.db.put(getHandle(columnFamily), writeOptions, key, val);
    } else {
      this.db.put(getHandle(columnFamily), key, val);
    }
  }

  public byte[] get(T columnFamily, byte[] key) throws RocksDBException {
    return this.db.get(getHandle(columnFamily), key);
  }

  public void delete(T columnFamily, byte[] key) throws RocksDBException {
    this.db.delete(getHandle(columnFamily), key);
  }

  public void flush(boolean waitForFlush) throws RocksDBException {
    try (FlushOptions options = new FlushOptions()) {
      options.setWaitForFlush(waitForFlush);
      for (ColumnFamilyHandle handle : columnFamilyHandleMap.values()) {
        db.flush(options, handle);
      }
    }
  }

  // Wrap cursors for easier testing.
  public RocksDBIterator newIterator(T columnFamily) throws RocksDBException {
    return new RocksDBIterator(this.db.newIterator(getHandle(columnFamily)));
  }

  // Wrap write batches for easier CF management and testing.
  public RocksDBWriteBatch<T> makeWriteBatch() {
    return new RocksDBWriteBatch<T>(this, RocksDBWriteBatch.RESERVED_BYTES);
  }

  /* ----------------------------------------
   * Proxy classes for write batches and cursors.  These proxies allow us to condense the API to the parts we care about
   * and create hooks we can override for testing without using an actual DB.
   */

  public static class RocksDBWriteBatch<T extends ColumnFamilyEnumeration<T>> {
    protected static final int RESERVED_BYTES = 1 << 18;
    WriteBatch batch;
    RocksDBAndHandles<T> parent;

    protected RocksDBWriteBatch() {
      // Just for testing.
    }

    protected RocksDBWriteBatch(RocksDBAndHandles<T> parent, int reservedBytes) {
      this.parent = parent;
      this.batch = new WriteBatch(reservedBytes);
    }

    public void put(T columnFamily, byte[] key, byte[] val) throws RocksDBException {
      batch.put(parent.getHandle(columnFamily), key, val);
    }

    public void delete(T columnFamily, byte[] key) throws RocksDBException {
      batch.delete(parent.getHandle(columnFamily), key);
    }

    public void write() throws RocksDBException {
      try {
        if (parent.getWriteOptions() != null) {
          parent.getDb().write(parent.getWriteOptions(), batch);
        } else {
          // WriteOptions is a native handle, so only make one once we know we're talking to a real DB.
          try (WriteOptions writeOptions = new WriteOptions()) {
            parent.getDb().write(writeOptions, batch);
          }
        }
      } finally {
        batch.close();
      }
    }
  }

  /* RocksDB's iterators don't implement Iterable because they talk about byte arrays instead of objects.  Their API is
   * also a little backwards: rather than calling `hasNext` and then `next`, you call `next` and then `isValid` to check
   * if you've gone off the end of the store. */
  public static class RocksDBIterator implements AutoCloseable {
    RocksIterator rocksIter;

    protected RocksDBIterator() {
      // Just for testing.
    }

    protected RocksDBIterator(RocksIterator rocksIter) {
      this.rocksIter = rocksIter;
      this.rocksIter.seekToFirst();
    }

    public void reset() { // Easy synonym so users don't have to think about seeking.
      seekToFirst();
    }

    public void seekToFirst() {
      rocksIter.seekToFirst();
    }

    public void next() {
      rocksIter.next();
    }

    public boolean isValid() {
      return rocksIter.isValid();
    }

    public byte[] value() {
      return rocksIter.value();
    }

    public byte[] key() {
      return rocksIter.key();
    }

    @Override
    public void close() {
      rocksIter.close();
    }
  }
}
