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

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The peaks of one spectrum: two parallel arrays of mass/charge and intensity values of equal length.
 *
 * Instances are immutable.  Arrays are copied on the way in and on the way out, so processing steps can never
 * modify a matrix that a backend or another collection still holds.
 */
public final class PeakMatrix implements Serializable {
  private static final long serialVersionUID = 4610245189374662210L;

  public static final PeakMatrix EMPTY = new PeakMatrix(new double[0], new double[0]);

  private final double[] mz;
  private final double[] intensity;

  public PeakMatrix(double[] mz, double[] intensity) {
    if (mz == null || intensity == null) {
      throw new IllegalArgumentException("m/z and intensity arrays must not be null");
    }
    if (mz.length != intensity.length) {
      throw new IllegalArgumentException(String.format(
          "m/z and intensity arrays must have same length (%d vs %d)", mz.length, intensity.length));
    }
    this.mz = mz.clone();
    this.intensity = intensity.clone();
  }

  /**
   * Builds a matrix from {mass/charge, intensity} pairs, the representation the act LC-MS parsers used.
   * @param pairs The {m/z, intensity} pairs in peak order.
   * @return A new peak matrix.
   */
  public static PeakMatrix fromPairs(List<Pair<Double, Double>> pairs) {
    double[] mz = new double[pairs.size()];
    double[] intensity = new double[pairs.size()];
    for (int i = 0; i < pairs.size(); i++) {
      mz[i] = pairs.get(i).getLeft();
      intensity[i] = pairs.get(i).getRight();
    }
    return new PeakMatrix(mz, intensity);
  }

  public int size() {
    return mz.length;
  }

  public boolean isEmpty() {
    return mz.length == 0;
  }

  public double[] getMz() {
    return mz.clone();
  }

  public double[] getIntensity() {
    return intensity.clone();
  }

  public double mzAt(int i) {
    return mz[i];
  }

  public double intensityAt(int i) {
    return intensity[i];
  }

  /**
   * @return The sum of all intensities, 0 for an empty matrix.
   */
  public double totalIntensity() {
    double total = 0.0;
    for (double i : intensity) {
      total += i;
    }
    return total;
  }

  /**
   * Keeps the peaks at the given positions, in the given order.
   * @param positions Row positions into this matrix.
   * @return A new matrix holding only those peaks.
   */
  public PeakMatrix select(int[] positions) {
    double[] newMz = new double[positions.length];
    double[] newIntensity = new double[positions.length];
    for (int i = 0; i < positions.length; i++) {
      newMz[i] = mz[positions[i]];
      newIntensity[i] = intensity[positions[i]];
    }
    return new PeakMatrix(newMz, newIntensity);
  }

  public List<Pair<Double, Double>> toPairs() {
    List<Pair<Double, Double>> pairs = new ArrayList<>(mz.length);
    for (int i = 0; i < mz.length; i++) {
      pairs.add(Pair.of(mz[i], intensity[i]));
    }
    return pairs;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof PeakMatrix)) {
      return false;
    }
    PeakMatrix that = (PeakMatrix) o;
    return Arrays.equals(mz, that.mz) && Arrays.equals(intensity, that.intensity);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(mz) + Arrays.hashCode(intensity);
  }

  @Override
  public String toString() {
    return String.format("PeakMatrix(size=%d)", mz.length);
  }
}
