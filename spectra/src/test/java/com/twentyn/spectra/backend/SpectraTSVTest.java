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
import org.apache.commons.lang3.tuple.Pair;
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
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class SpectraTSVTest {
  private static final double DELTA = 0.0000001;

  @Rule
  public TemporaryFolder tempFolder = new TemporaryFolder();

  @Test
  public void testWriterLayout() throws Exception {
    File tsv = tempFolder.newFile("layout.tsv");
    MetadataTable metadata = new MetadataTable(2);
    metadata.setColumn("instrument", Arrays.asList("qtof", null));
    List<PeakMatrix> peaks = Arrays.asList(
        new PeakMatrix(new double[]{100.0, 200.5}, new double[]{1.0, 2.0}),
        new PeakMatrix(new double[]{}, new double[]{}));

    try (SpectraTSV.Writer writer = new SpectraTSV.Writer(tsv, Collections.singletonList("instrument"))) {
      writer.append(metadata, peaks);
      assertEquals(2, writer.getWritten());
    }

    List<String> lines = Files.readAllLines(tsv.toPath(), StandardCharsets.UTF_8);
    assertEquals(Arrays.asList(
        "instrument\tmz\tintensity",
        "qtof\t100.0;200.5\t1.0;2.0",
        "\t\t"
    ), lines);
  }

  @Test
  public void testReadCoercesCoreFieldsAndKeepsMissingValues() throws Exception {
    File tsv = tempFolder.newFile("spectra.tsv");
    Files.write(tsv.toPath(), String.join("\n",
        "msLevel\trtime\tinstrument\tmz\tintensity",
        "1\t12.5\tqtof\t100.0;101.0\t5.0;6.0",
        "2\t\t\t\t",
        "").getBytes(StandardCharsets.UTF_8));

    Pair<MetadataTable, List<PeakMatrix>> contents = SpectraTSV.read(tsv);
    MetadataTable metadata = contents.getLeft();
    assertEquals(2, metadata.size());
    assertEquals(Arrays.asList(1, 2), metadata.get(CoreField.MS_LEVEL));
    assertEquals(12.5, (Double) metadata.getValue(0, CoreField.RTIME.getName()), DELTA);
    assertNull(metadata.getValue(1, CoreField.RTIME.getName()));
    assertEquals(Arrays.asList("qtof", null), metadata.get("instrument"));

    assertArrayEquals(new double[]{100.0, 101.0}, contents.getRight().get(0).getMz(), DELTA);
    assertArrayEquals(new double[]{5.0, 6.0}, contents.getRight().get(0).getIntensity(), DELTA);
    assertEquals(0, contents.getRight().get(1).getMz().length);
  }

  @Test
  public void testMalformedPeaksNameTheLine() throws Exception {
    File tsv = tempFolder.newFile("bad.tsv");
    Files.write(tsv.toPath(), "msLevel\tmz\tintensity\n1\t1.0\t2.0\n2\t1.0;x\t1.0;2.0\n"
        .getBytes(StandardCharsets.UTF_8));
    try {
      SpectraTSV.read(tsv);
      fail("Non-numeric peaks should be rejected");
    } catch (IllegalArgumentException e) {
      assertTrue(e.getMessage(), e.getMessage().contains("line 3"));
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testPeakColumnsAreRequired() throws Exception {
    File tsv = tempFolder.newFile("nopeaks.tsv");
    Files.write(tsv.toPath(), "msLevel\trtime\n1\t2.0\n".getBytes(StandardCharsets.UTF_8));
    SpectraTSV.read(tsv);
  }
}
