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

import com.twentyn.spectra.SourceUnavailableException;
import com.twentyn.spectra.SpectraException;
import com.twentyn.spectra.UnsupportedSpectraOperationException;
import com.twentyn.spectra.backend.BackendOptions;
import com.twentyn.spectra.backend.SpectraBackend;
import com.twentyn.spectra.backend.SpectraUpdate;
import com.twentyn.spectra.metadata.CoreField;
import com.twentyn.spectra.metadata.MetadataTable;
import com.twentyn.spectra.peaks.PeakMatrix;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class MzMLBackendTest {
  private static final double DELTA = 0.0000001;

  public static final double[][] MZS = {
      {100.0, 200.5, 300.25},
      {50.5, 75.25, 150.0, 199.0},
      {60.0, 120.0},
  };
  public static final double[][] INTENSITIES = {
      {10.0, 20.0, 30.0},
      {1.5, 100.0, 3.0, 40.0},
      {5.0, 6.0},
  };

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  private File mzMLFile;
  private MzMLBackend.Factory factory;

  @Before
  public void setup() throws Exception {
    mzMLFile = new File(this.getClass().getResource("/small.mzML").toURI());
    factory = new MzMLBackend.Factory();
  }

  private static int[] all(SpectraBackend backend) {
    int[] indices = new int[backend.spectrumCount()];
    for (int i = 0; i < indices.length; i++) {
      indices[i] = i;
    }
    return indices;
  }

  @Test
  public void testMetadataIsReadFromFile() throws Exception {
    SpectraBackend backend = factory.initialize(mzMLFile.getAbsolutePath(), BackendOptions.defaults());
    assertEquals(3, backend.spectrumCount());
    MetadataTable metadata = backend.metadata(backend.fieldNames());

    assertEquals(Arrays.asList(1, 2, 2), metadata.get(CoreField.MS_LEVEL));
    assertEquals(Arrays.asList(false, true, true), metadata.get(CoreField.CENTROIDED));
    assertEquals(Arrays.asList(1, 1, 1), metadata.get(CoreField.POLARITY));
    assertEquals(Arrays.asList(1, 2, 3), metadata.get(CoreField.ACQUISITION_NUM));
    assertEquals(Arrays.asList(1, 2, 3), metadata.get(CoreField.SCAN_INDEX));
    assertEquals(Arrays.asList(null, 1, 1), metadata.get(CoreField.PREC_SCAN_NUM));
    assertEquals(Arrays.asList(null, 200.5, 300.25), metadata.get(CoreField.PRECURSOR_MZ));
    assertEquals(Arrays.asList(null, 2, 3), metadata.get(CoreField.PRECURSOR_CHARGE));
    assertEquals(Arrays.asList(null, 20.0, 30.0), metadata.get(CoreField.PRECURSOR_INTENSITY));
    assertEquals(Arrays.asList(null, 35.0, 30.0), metadata.get(CoreField.COLLISION_ENERGY));
    assertNull(metadata.getValue(0, CoreField.SMOOTHED.getName()));

    // Scan start times are stored in minutes in the file.
    List<Object> rtime = metadata.get(CoreField.RTIME);
    assertEquals(30.0, (Double) rtime.get(0), DELTA);
    assertEquals(36.0, (Double) rtime.get(1), DELTA);
    assertEquals(42.0, (Double) rtime.get(2), DELTA);

    assertEquals(199.5, (Double) metadata.getValue(1, CoreField.ISOLATION_WINDOW_LOWER_MZ.getName()), DELTA);
    assertEquals(200.5, (Double) metadata.getValue(1, CoreField.ISOLATION_WINDOW_TARGET_MZ.getName()), DELTA);
    assertEquals(202.0, (Double) metadata.getValue(1, CoreField.ISOLATION_WINDOW_UPPER_MZ.getName()), DELTA);
    assertNull(metadata.getValue(0, CoreField.ISOLATION_WINDOW_LOWER_MZ.getName()));

    assertEquals(Collections.nCopies(3, mzMLFile.getAbsolutePath()), metadata.get(CoreField.DATA_ORIGIN));
    assertEquals(Collections.nCopies(3, mzMLFile.getAbsolutePath()), metadata.get(CoreField.DATA_STORAGE));
  }

  @Test
  public void testPeaksAreDecodedForEveryEncoding() throws Exception {
    // The fixture mixes 64-bit uncompressed, 32-bit zlib and 64-bit zlib arrays.
    SpectraBackend backend = factory.initialize(mzMLFile.getAbsolutePath(), BackendOptions.defaults());
    List<PeakMatrix> peaks = backend.peaks(all(backend));
    for (int i = 0; i < MZS.length; i++) {
      assertArrayEquals(String.format("m/z values of spectrum %d", i), MZS[i], peaks.get(i).getMz(), DELTA);
      assertArrayEquals(String.format("Intensities of spectrum %d", i),
          INTENSITIES[i], peaks.get(i).getIntensity(), DELTA);
    }
  }

  @Test
  public void testPeaksFollowRequestOrder() throws Exception {
    SpectraBackend backend = factory.initialize(mzMLFile.getAbsolutePath(), BackendOptions.defaults());
    List<PeakMatrix> peaks = backend.peaks(new int[]{2, 0, 2});
    assertEquals(3, peaks.size());
    assertArrayEquals(MZS[2], peaks.get(0).getMz(), DELTA);
    assertArrayEquals(MZS[0], peaks.get(1).getMz(), DELTA);
    assertArrayEquals(MZS[2], peaks.get(2).getMz(), DELTA);
    assertTrue(backend.peaks(new int[0]).isEmpty());
  }

  @Test
  public void testSubsetRemapsIndices() throws Exception {
    SpectraBackend backend = factory.initialize(mzMLFile.getAbsolutePath(), BackendOptions.defaults());
    SpectraBackend subset = backend.subset(new int[]{2, 1});
    assertEquals(2, subset.spectrumCount());
    assertArrayEquals(MZS[2], subset.peaks(new int[]{0}).get(0).getMz(), DELTA);
    assertEquals(Arrays.asList(3, 2), subset.metadata(subset.fieldNames()).get(CoreField.ACQUISITION_NUM));

    SpectraBackend nested = subset.subset(new int[]{1});
    assertArrayEquals(MZS[1], nested.peaks(new int[]{0}).get(0).getMz(), DELTA);
  }

  @Test
  public void testBackendIsReadOnly() throws Exception {
    SpectraBackend backend = factory.initialize(mzMLFile.getAbsolutePath(), BackendOptions.defaults());
    assertFalse(backend.supportsWrite());
    try {
      backend.write(new int[]{0}, SpectraUpdate.ofPeaks(Collections.singletonList(PeakMatrix.EMPTY)));
      throw new AssertionError("Writing to an mzML backend should fail");
    } catch (UnsupportedSpectraOperationException e) {
      assertTrue(e.getMessage().contains("read-only"));
    }
  }

  @Test
  public void testFromDataWritesReadableFile() throws Exception {
    SpectraBackend source = factory.initialize(mzMLFile.getAbsolutePath(), BackendOptions.defaults());
    MetadataTable metadata = source.metadata(source.fieldNames());
    metadata.setColumn("instrument", "qtof");

    File dir = tempFolder.newFolder("written");
    SpectraBackend written = factory.fromData(metadata, source.peaks(all(source)),
        BackendOptions.defaults().withDirectory(dir));
    File writtenFile = new File(dir, MzMLBackend.DEFAULT_FILE_NAME);
    assertTrue(writtenFile.isFile());

    MetadataTable reread = written.metadata(written.fieldNames());
    assertEquals("Fields mzML cannot hold stay in memory", Collections.nCopies(3, "qtof"), reread.get("instrument"));
    assertEquals(Arrays.asList(1, 2, 2), reread.get(CoreField.MS_LEVEL));
    assertEquals(Arrays.asList(null, 2, 3), reread.get(CoreField.PRECURSOR_CHARGE));
    assertEquals(36.0, (Double) reread.getValue(1, CoreField.RTIME.getName()), DELTA);
    assertEquals(299.75, (Double) reread.getValue(2, CoreField.ISOLATION_WINDOW_LOWER_MZ.getName()), 0.0001);
    assertEquals(300.75, (Double) reread.getValue(2, CoreField.ISOLATION_WINDOW_UPPER_MZ.getName()), 0.0001);
    assertEquals(Collections.nCopies(3, writtenFile.getAbsolutePath()), reread.get(CoreField.DATA_STORAGE));

    List<PeakMatrix> peaks = written.peaks(all(written));
    for (int i = 0; i < MZS.length; i++) {
      assertArrayEquals(MZS[i], peaks.get(i).getMz(), DELTA);
      assertArrayEquals(INTENSITIES[i], peaks.get(i).getIntensity(), DELTA);
    }

    written.close();
    assertTrue("Files in a caller-supplied directory are kept", writtenFile.exists());
  }

  @Test
  public void testFromDataRefusesExistingFile() throws Exception {
    SpectraBackend source = factory.initialize(mzMLFile.getAbsolutePath(), BackendOptions.defaults());
    File dir = tempFolder.newFolder("shared");
    SpectraBackend first = factory.fromData(source.metadata(source.fieldNames()), source.peaks(all(source)),
        BackendOptions.defaults().withDirectory(dir));

    List<PeakMatrix> others = Collections.nCopies(3, new PeakMatrix(new double[]{1.0}, new double[]{99.0}));
    try {
      factory.fromData(source.metadata(source.fieldNames()), others, BackendOptions.defaults().withDirectory(dir));
      fail("Writing over a file another backend reads from should fail");
    } catch (SpectraException e) {
      assertTrue(e.getMessage().contains("already exists"));
    }

    List<PeakMatrix> peaks = first.peaks(all(first));
    for (int i = 0; i < MZS.length; i++) {
      assertArrayEquals(INTENSITIES[i], peaks.get(i).getIntensity(), DELTA);
    }
  }

  @Test
  public void testFromDataKeepsOriginsAndFillsMissingOnes() throws Exception {
    SpectraBackend source = factory.initialize(mzMLFile.getAbsolutePath(), BackendOptions.defaults());
    MetadataTable metadata = source.metadata(source.fieldNames());
    metadata.setValues(CoreField.DATA_ORIGIN.getName(), new int[]{1}, Collections.singletonList(null));

    File dir = tempFolder.newFolder("origins");
    SpectraBackend written = factory.fromData(metadata, source.peaks(all(source)),
        BackendOptions.defaults().withDirectory(dir));
    String path = new File(dir, MzMLBackend.DEFAULT_FILE_NAME).getAbsolutePath();
    assertEquals(Arrays.asList(mzMLFile.getAbsolutePath(), path, mzMLFile.getAbsolutePath()),
        written.metadata(written.fieldNames()).get(CoreField.DATA_ORIGIN));
  }

  @Test
  public void testTransientFileIsDeletedOnClose() throws Exception {
    SpectraBackend source = factory.initialize(mzMLFile.getAbsolutePath(), BackendOptions.defaults());
    MzMLBackend written = (MzMLBackend) factory.fromData(source.metadata(source.fieldNames()),
        source.peaks(all(source)), BackendOptions.defaults());
    File transientFile = written.getFile();
    assertTrue(transientFile.exists());

    written.subset(new int[]{0}).close();
    assertTrue("Subsets do not own the file", transientFile.exists());
    written.close();
    assertFalse(transientFile.exists());
  }

  @Test(expected = SourceUnavailableException.class)
  public void testMissingFile() throws Exception {
    factory.initialize(new File(tempFolder.getRoot(), "missing.mzML").getAbsolutePath(), BackendOptions.defaults());
  }

  @Test(expected = SourceUnavailableException.class)
  public void testMalformedFile() throws Exception {
    File bad = tempFolder.newFile("bad.mzML");
    Files.write(bad.toPath(), "<mzML><run><spectrumList><spectrum>".getBytes(StandardCharsets.UTF_8));
    factory.initialize(bad.getAbsolutePath(), BackendOptions.defaults());
  }

  @Test
  public void testScanNumberExtraction() throws Exception {
    assertEquals(Integer.valueOf(42), MzMLSpectrumParser.scanNumber("controllerType=0 controllerNumber=1 scan=42"));
    assertNull(MzMLSpectrumParser.scanNumber("index=3"));
    assertNull(MzMLSpectrumParser.scanNumber(""));
  }

  @Test
  public void testBinaryArrayEncoding() throws Exception {
    // Taken from the fixture's first m/z array.
    assertArrayEquals(MZS[0], MzMLParser.decodeBinaryArray("AAAAAAAAWUAAAAAAABBpQAAAAAAAxHJA", true, false), DELTA);
    assertEquals("AAAAAAAAWUAAAAAAABBpQAAAAAAAxHJA", MzMLWriter.encodeBinaryArray(MZS[0]));
  }
}
