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

package com.twentyn.spectra.peaks;

import org.apache.commons.lang3.tuple.Pair;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class PeakMatrixTest {
  private static final double DELTA = 0.0000001;

  @Test(expected = IllegalArgumentException.class)
  public void testUnequalLengthsAreRejected() throws Exception {
    new PeakMatrix(new double[]{1.0, 2.0}, new double[]{1.0});
  }

  @Test
  public void testArraysAreCopied() throws Exception {
    double[] mz = {100.0, 200.0};
    double[] intensity = {1.0, 2.0};
    PeakMatrix matrix = new PeakMatrix(mz, intensity);
    mz[0] = -1.0;
    assertEquals("Changing the input array must not change the matrix", 100.0, matrix.mzAt(0), DELTA);

    double[] out = matrix.getIntensity();
    out[1] = -1.0;
    assertEquals("Changing a returned array must not change the matrix", 2.0, matrix.intensityAt(1), DELTA);
  }

  @Test
  public void testSelectKeepsOrderAndDuplicates() throws Exception {
    PeakMatrix matrix = new PeakMatrix(new double[]{1.0, 2.0, 3.0}, new double[]{10.0, 20.0, 30.0});
    PeakMatrix selected = matrix.select(new int[]{2, 0, 2});
    assertArrayEquals(new double[]{3.0, 1.0, 3.0}, selected.getMz(), DELTA);
    assertArrayEquals(new double[]{30.0, 10.0, 30.0}, selected.getIntensity(), DELTA);
  }

  @Test
  public void testTotalIntensity() throws Exception {
    assertEquals(0.0, PeakMatrix.EMPTY.totalIntensity(), DELTA);
    assertTrue(PeakMatrix.EMPTY.isEmpty());
    PeakMatrix matrix = new PeakMatrix(new double[]{1.0, 2.0}, new double[]{1.5, 2.5});
    assertEquals(4.0, matrix.totalIntensity(), DELTA);
  }

  @Test
  public void testPairConversion() throws Exception {
    List<Pair<Double, Double>> pairs = Arrays.asList(Pair.of(50.0, 5.0), Pair.of(60.0, 6.0));
    PeakMatrix matrix = PeakMatrix.fromPairs(pairs);
    assertEquals(2, matrix.size());
    assertEquals(pairs, matrix.toPairs());
  }

  @Test
  public void testEquality() throws Exception {
    PeakMatrix a = new PeakMatrix(new double[]{1.0}, new double[]{2.0});
    PeakMatrix b = new PeakMatrix(new double[]{1.0}, new double[]{2.0});
    PeakMatrix c = new PeakMatrix(new double[]{1.0}, new double[]{3.0});
    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
  }
}
