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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.rocksdb.ColumnFamilyDescriptor;
import org.rocksdb.ColumnFamilyHandle;
import org.rocksdb.CompressionType;
import org.rocksdb.DBOptions;
import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;

import java.io.File;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class DBUtil {
  private static final Logger LOGGER = LogManager.getFormatterLogger(DBUtil.class);
  private static final Charset UTF8 = StandardCharsets.UTF_8;

  public static final String DEFAULT_ROCKSDB_COLUMN_FAMILY = "default";

  /* Options objects are native handles, so they're built per call rather than held in static fields: loading this
   * class must not require the native library. */
  private static Options makeCreateOptions() {
    return new Options()
        .setCreateIfMissing(true)
        .setAllowMmapReads(true)
        .setWriteBufferSize(1 << 26)
        .setArenaBlockSize(1 << 20)
        .setCompressionType(CompressionType.SNAPPY_COMPRESSION); // Peak arrays compress reasonably well.
  }

  private static DBOptions makeOpenOptions() {
    return new DBOptions()
        .setCreateIfMissing(false)
        .setAllowMmapReads(true);
  }

  /**
   * Create a new rocks DB at a particular location on disk.
   * @param pathToStore A path to the directory where the store will be created.
   * @param columnFamilies Column families to create in the DB.
   * @param <T> A type (probably an enum) that represents a set of column families.
   * @return A DB and map of column family labels (as T) to handles.
   * @throws RocksDBException
   */
  public static <T extends ColumnFamilyEnumeration<T>> RocksDBAndHandles<T> createNewRocksDB(
      File pathToStore, T[] columnFamilies) throws RocksDBException {
    RocksDB.loadLibrary();
    Map<T, ColumnFamilyHandle> columnFamilyHandles = new HashMap<>();

    // The DB keeps a reference to its options, so they live as long as it does.
    RocksDB db = RocksDB.open(makeCreateOptions(), pathToStore.getAbsolutePath());

    for (T cf : columnFamilies) {
      LOGGER.debug("Creating column family %s", cf.getName());
      ColumnFamilyHandle cfh =
          db.createColumnFamily(new ColumnFamilyDescriptor(cf.getName().getBytes(UTF8)));
      columnFamilyHandles.put(cf, cfh);
    }

    return new RocksDBAndHandles<T>(db, columnFamilyHandles, new ArrayList<>(columnFamilyHandles.values()));
  }

  /**
   * Open an existing RocksDB store.
   * @param pathToStore A path to the RocksDB directory to use.
   * @param columnFamilies A list of column families to open.  Must be exhaustive, non-empty, and non-null.
   * @return A DB and map of column family labels (as T) to handles.
   * @throws RocksDBException
   */
  public static <T extends ColumnFamilyEnumeration<T>> RocksDBAndHandles<T> openExistingRocksDB(
      File pathToStore, T[] columnFamilies) throws RocksDBException {
    if (columnFamilies == null || columnFamilies.length == 0) {
      throw new IllegalArgumentException("Cannot open a RocksDB with an empty list of column families.");
    }
    RocksDB.loadLibrary();

    List<ColumnFamilyDescriptor> columnFamilyDescriptors = new ArrayList<>(columnFamilies.length + 1);
    // Must also open the "default" family or RocksDB will refuse to open the store.
    columnFamilyDescriptors.add(new ColumnFamilyDescriptor(DEFAULT_ROCKSDB_COLUMN_FAMILY.getBytes(UTF8)));
    for (T family : columnFamilies) {
      columnFamilyDescriptors.add(new ColumnFamilyDescriptor(family.getName().getBytes(UTF8)));
    }
    List<ColumnFamilyHandle> columnFamilyHandles = new ArrayList<>(columnFamilyDescriptors.size());

    RocksDB db = RocksDB.open(
        makeOpenOptions(), pathToStore.getAbsolutePath(), columnFamilyDescriptors, columnFamilyHandles);
    Map<T, ColumnFamilyHandle> columnFamilyHandleMap = new HashMap<>(columnFamilies.length);

    for (int i = 0; i < columnFamilyDescriptors.size(); i++) {
      ColumnFamilyDescriptor cfd = columnFamilyDescriptors.get(i);
      ColumnFamilyHandle cfh = columnFamilyHandles.get(i);
      String familyName = new String(cfd.getName(), UTF8);
      T descriptorFamily = columnFamilies[0].getFamilyByName(familyName); // Use any instance to get the next family.
      if (descriptorFamily == null) {
        if (!DEFAULT_ROCKSDB_COLUMN_FAMILY.equals(familyName)) {
          String msg = String.format("Found unexpected family name '%s' when trying to open RocksDB at %s",
              familyName, pathToStore.getAbsolutePath());
          LOGGER.error(msg);
          for (ColumnFamilyHandle handle : columnFamilyHandles) {
            handle.close();
          }
          db.close();
          // Crash if we don't recognize the contents of this DB.
          throw new IllegalStateException(msg);
        }
        // Just skip this column family if it doesn't map to something we know but is expected.
        continue;
      }

      columnFamilyHandleMap.put(descriptorFamily, cfh);
    }

    return new RocksDBAndHandles<T>(db, columnFamilyHandleMap, columnFamilyHandles);
  }
}
