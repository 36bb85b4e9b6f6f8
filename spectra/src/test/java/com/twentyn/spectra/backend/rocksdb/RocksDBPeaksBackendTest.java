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

import com.twentyn.spectra.SourceUnavailableException;
import com.twentyn.spectra.Spectra;
import com.twentyn.spectra.SpectraException;
import com.twentyn.spectra.UnsupportedFormatException;
import com.twentyn.spectra.backend.BackendOptions;
import com.twentyn.spectra.backend.ExportFormat;
import com.twentyn.spectra.backend.SpectraBackend;
import com.twentyn.spectra.backend.SpectraUpdate;
import com.twentyn.spectra.metadata.CoreField;
import com.twentyn.spectra.metadata.MetadataTable;
import com.twentyn.spectra.peaks.PeakMatrix;
import com.twentyn.spectra.utils.rocksdb.MockRocksDBAndHandles;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

public class RocksDBPeaksBackendTest {
  private static final double DELTA = 0.0000001;

  public static final List<PeakMatrix> PEAKS = Arrays.asList(
      new PeakMatrix(new double[]{100.0, 100.5}, new double[]{1.0, 2.0}),
      new PeakMatrix(new double[]{200.0}, new double[]{20.0}),
      new PeakMatrix(new double[]{300.0, 300.5, 301.0}, new double[]{3.0, 30.0, 300.0})
  );

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private MockRocksDBAndHandles<PeakColumnFamilies> fakeDB;
  private PeakStore store;
  private MetadataTable metadata;

  @Before
  public void setup() throws Exception {
    fakeDB = new MockRocksDBAndHandles<>(PeakColumnFamilies.values());
    store = new PeakStore(fakeDB, null, false, 2);
    metadata = new MetadataTable(3);
    metadata.setColumn("msLevel", Arrays.asList(1, 2, 2));
    metadata.setColumn("rtime", Arrays.asList(1.0, 2.0, 3.0));
    metadata.setColumn("instrument", Arrays.asList("qtof", null, "qtof"));
  }

  private static int[] all(SpectraBackend backend) {
    int[] indices = new int[backend.spectrumCount()];
    for (int i = 0; i < indices.length; i++) {
      indices[i] = i;
    }
    return indices;
  }

  @Test
  public void testCreateStoresPeaksInBatches() throws Exception {
    RocksDBPeaksBackend backend = RocksDBPeaksBackend.create(store, metadata, PEAKS);
    assertEquals(3, backend.spectrumCount());
    assertEquals("Three spectra with a batch size of two need two batches", 2, fakeDB.getBatchWrites());
    assertEquals(3, fakeDB.getFakeDB().get(PeakColumnFamilies.MZ_ARRAYS).size());
    assertEquals(3, fakeDB.getFakeDB().get(PeakColumnFamilies.INTENSITY_ARRAYS).size());
    assertEquals(PEAKS, backend.peaks(all(backend)));
    assertEquals(Collections.nCopies(3, "<peak store>"),
        backend.metadata(backend.fieldNames()).get(CoreField.DATA_STORAGE));
  }

  @Test
  public void testManifestReopensSameSpectra() throws Exception {
    RocksDBPeaksBackend.create(store, metadata, PEAKS);

    PeakStore reopened = new PeakStore(fakeDB, null, false, 2);
    PeakStoreManifest manifest = reopened.readManifest();
    assertNotNull(manifest);
    assertEquals(3, manifest.getPeakIds().length);
    assertArrayEquals("New ids continue after the stored ones", new long[]{3L}, reopened.allocateIds(1));

    RocksDBPeaksBackend backend = RocksDBPeaksBackend.open(reopened, manifest);
    MetadataTable read = backend.metadata(backend.fieldNames());
    assertEquals(Arrays.asList(1, 2, 2), read.get(CoreField.MS_LEVEL));
    assertEquals(Arrays.asList(1.0, 2.0, 3.0), read.get(CoreField.RTIME));
    assertEquals(Arrays.asList("qtof", null, "qtof"), read.get("instrument"));
    assertEquals(PEAKS, backend.peaks(all(backend)));
  }

  @Test
  public void testWritesGoToFreshIds() throws Exception {
    RocksDBPeaksBackend root = RocksDBPeaksBackend.create(store, metadata, PEAKS);
    SpectraBackend view = root.subset(new int[]{0, 1, 2});
    PeakMatrix replacement = new PeakMatrix(new double[]{1.0}, new double[]{1.0});

    view.write(new int[]{1}, SpectraUpdate.ofPeaks(Collections.singletonList(replacement)));
    assertEquals(replacement, view.peaks(new int[]{1}).get(0));
    assertEquals("Other views keep reading the old peaks", PEAKS.get(1), root.peaks(new int[]{1}).get(0));
    assertEquals(4, fakeDB.getFakeDB().get(PeakColumnFamilies.MZ_ARRAYS).size());
  }

  @Test
  public void testRootWritesArePersisted() throws Exception {
    RocksDBPeaksBackend root = RocksDBPeaksBackend.create(store, metadata, PEAKS);
    PeakMatrix replacement = new PeakMatrix(new double[]{1.0}, new double[]{1.0});
    root.write(new int[]{2}, SpectraUpdate.ofPeaks(Collections.singletonList(replacement))
        .withField("instrument", Collections.singletonList("orbitrap")));

    PeakStoreManifest manifest = store.readManifest();
    assertEquals(3L, manifest.getPeakIds()[2]);
    assertEquals("orbitrap", manifest.getRows().get(2).get("instrument"));

    RocksDBPeaksBackend reopened = RocksDBPeaksBackend.open(store, manifest);
    assertEquals(replacement, reopened.peaks(new int[]{2}).get(0));
  }

  @Test
  public void testOnlyTheRootClosesTheStore() throws Exception {
    RocksDBPeaksBackend root = RocksDBPeaksBackend.create(store, metadata, PEAKS);
    root.subset(new int[]{0}).close();
    assertFalse(store.isClosed());

    root.close();
    assertTrue(store.isClosed());
    assertTrue(fakeDB.isClosed());
    // Closing twice is harmless.
    root.close();
  }

  @Test(expected = SpectraException.class)
  public void testReadAfterCloseFails() throws Exception {
    RocksDBPeaksBackend root = RocksDBPeaksBackend.create(store, metadata, PEAKS);
    root.close();
    root.peaks(new int[]{0});
  }

  @Test(expected = SpectraException.class)
  public void testMissingPeakIdFails() throws Exception {
    store.getPeaks(new long[]{42L});
  }

  @Test
  public void testSubsetKeepsOrderAndDuplicates() throws Exception {
    RocksDBPeaksBackend root = RocksDBPeaksBackend.create(store, metadata, PEAKS);
    SpectraBackend subset = root.subset(new int[]{2, 0, 2});
    assertEquals(Arrays.asList(PEAKS.get(2), PEAKS.get(0), PEAKS.get(2)), subset.peaks(all(subset)));
    assertEquals(Arrays.asList(3.0, 1.0, 3.0), subset.metadata(subset.fieldNames()).get(CoreField.RTIME));
  }

  @Test
  public void testByteEncodings() throws Exception {
    double[] values = {0.0, -1.5, 1e300, Double.MIN_VALUE};
    assertArrayEquals(values, ByteArrays.bytesToDoubleArray(ByteArrays.doubleArrayToBytes(values)), DELTA);
    assertEquals(1234567890123L, ByteArrays.keyToLong(ByteArrays.longToKey(1234567890123L)));
  }

  @Test(expected = SourceUnavailableException.class)
  public void testInitializeRequiresDirectory() throws Exception {
    new RocksDBPeaksBackend.Factory().initialize(tempFolder.newFile("not-a-store").getAbsolutePath(),
        BackendOptions.defaults());
  }

  @Test(expected = SpectraException.class)
  public void testFromDataRefusesNonEmptyDirectory() throws Exception {
    tempFolder.newFile("occupied");
    new RocksDBPeaksBackend.Factory().fromData(metadata, PEAKS,
        BackendOptions.defaults().withDirectory(tempFolder.getRoot()));
  }

  @Test(expected = UnsupportedFormatException.class)
  public void testOnlyPeakStoresAreExported() throws Exception {
    RocksDBPeaksBackend root = RocksDBPeaksBackend.create(store, metadata, PEAKS);
    new RocksDBPeaksBackend.Factory().export(Spectra.of(root), tempFolder.newFile(), ExportFormat.TSV);
  }

  @Test
  public void testMoveApplyAndReopenOnDisk() throws Exception {
    File directory = new File(tempFolder.getRoot(), "store");
    Spectra queued = Spectra.fromData(metadata, PEAKS).replaceIntensitiesBelow(10.0, 0.0);
    List<PeakMatrix> expected = queued.peaks();

    Spectra moved = queued.setBackend(new RocksDBPeaksBackend.Factory(),
        BackendOptions.defaults().withDirectory(directory));
    try {
      assertEquals(expected, moved.peaks());
      assertEquals(Collections.nCopies(3, directory.getAbsolutePath()), moved.dataStorage());
      assertEquals(Arrays.asList("qtof", null, "qtof"), moved.get("instrument"));

      Spectra applied = moved.filterIntensity(1.0, Double.POSITIVE_INFINITY).applyProcessing();
      assertTrue(applied.getProcessingQueues().get(0).isEmpty());
      assertEquals(Arrays.asList(
          new PeakMatrix(new double[]{}, new double[]{}),
          new PeakMatrix(new double[]{200.0}, new double[]{20.0}),
          new PeakMatrix(new double[]{300.5, 301.0}, new double[]{30.0, 300.0})
      ), applied.peaks());
      // Applied peaks live under fresh ids; the moved collection still reads its own.
      assertEquals(expected, moved.peaks());
    } finally {
      moved.close();
    }

    try (Spectra reopened = Spectra.fromSources(new RocksDBPeaksBackend.Factory(), BackendOptions.defaults(),
        directory.getAbsolutePath())) {
      assertEquals(expected, reopened.peaks());
      assertEquals(moved.fieldNames(), reopened.fieldNames());
      assertEquals(Arrays.asList("qtof", null, "qtof"), reopened.get("instrument"));
      assertEquals(moved.rtime(), reopened.rtime());
      assertEquals(moved.msLevel(), reopened.msLevel());
      assertEquals(moved.dataStorage(), reopened.dataStorage());
    }
  }
}
