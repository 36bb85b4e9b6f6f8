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

package com.twentyn.spectra.processing;

import com.twentyn.spectra.peaks.PeakMatrix;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in peak transformations.  Each one is exposed both as a reusable {@link PeakFunction} constant (for callers
 * that bind their own parameters) and as a factory method returning a ready {@link ProcessingStep}.
 */
public class PeakFunctions {
  public static final String PARAM_THRESHOLD = "threshold";
  public static final String PARAM_VALUE = "value";
  public static final String PARAM_LOWER = "lower";
  public static final String PARAM_UPPER = "upper";
  public static final String PARAM_KEEP = "keep";
  public static final String PARAM_MZ = "mz";
  public static final String PARAM_TOLERANCE = "tolerance";
  public static final String PARAM_PPM = "ppm";
  public static final String PARAM_TOTAL = "total";
  public static final String PARAM_HALF_WINDOW_SIZE = "halfWindowSize";

  // Brent accuracy on the m/z axis when looking for spline maxima.
  private static final double APEX_ABSOLUTE_ACCURACY = 0.0001;
  private static final int APEX_MAX_EVALUATIONS = 10000;

  public static final PeakFunction REPLACE_INTENSITIES_BELOW = (peaks, params) -> {
    double threshold = getDouble(params, PARAM_THRESHOLD);
    double value = getDouble(params, PARAM_VALUE);
    double[] intensity = peaks.getIntensity();
    for (int i = 0; i < intensity.length; i++) {
      if (intensity[i] < threshold) {
        intensity[i] = value;
      }
    }
    return new PeakMatrix(peaks.getMz(), intensity);
  };

  public static final PeakFunction FILTER_INTENSITY = (peaks, params) -> {
    double lower = getDouble(params, PARAM_LOWER);
    double upper = getDouble(params, PARAM_UPPER);
    int[] keep = new int[peaks.size()];
    int n = 0;
    for (int i = 0; i < peaks.size(); i++) {
      double intensity = peaks.intensityAt(i);
      if (intensity >= lower && intensity <= upper) {
        keep[n++] = i;
      }
    }
    return peaks.select(Arrays.copyOf(keep, n));
  };

  public static final PeakFunction FILTER_MZ_RANGE = (peaks, params) -> {
    double lower = getDouble(params, PARAM_LOWER);
    double upper = getDouble(params, PARAM_UPPER);
    boolean keepMatches = getBoolean(params, PARAM_KEEP);
    int[] keep = new int[peaks.size()];
    int n = 0;
    for (int i = 0; i < peaks.size(); i++) {
      double mz = peaks.mzAt(i);
      boolean inRange = mz >= lower && mz <= upper;
      if (inRange == keepMatches) {
        keep[n++] = i;
      }
    }
    return peaks.select(Arrays.copyOf(keep, n));
  };

  public static final PeakFunction FILTER_MZ_VALUES = (peaks, params) -> {
    double[] targets = ((double[]) params.get(PARAM_MZ)).clone();
    Arrays.sort(targets);
    double tolerance = getDouble(params, PARAM_TOLERANCE);
    double ppm = getDouble(params, PARAM_PPM);
    boolean keepMatches = getBoolean(params, PARAM_KEEP);

    int[] keep = new int[peaks.size()];
    int n = 0;
    for (int i = 0; i < peaks.size(); i++) {
      boolean matched = matchesAny(peaks.mzAt(i), targets, tolerance, ppm);
      if (matched == keepMatches) {
        keep[n++] = i;
      }
    }
    return peaks.select(Arrays.copyOf(keep, n));
  };

  public static final PeakFunction SCALE_INTENSITIES = (peaks, params) -> {
    double total = getDouble(params, PARAM_TOTAL);
    double sum = peaks.totalIntensity();
    if (peaks.isEmpty() || sum == 0.0) {
      return peaks;
    }
    double[] intensity = peaks.getIntensity();
    for (int i = 0; i < intensity.length; i++) {
      intensity[i] = intensity[i] / sum * total;
    }
    return new PeakMatrix(peaks.getMz(), intensity);
  };

  public static final PeakFunction SMOOTH = (peaks, params) -> {
    int halfWindow = getInt(params, PARAM_HALF_WINDOW_SIZE);
    double[] source = peaks.getIntensity();
    double[] smoothed = new double[source.length];
    for (int i = 0; i < source.length; i++) {
      int from = Math.max(0, i - halfWindow);
      int to = Math.min(source.length - 1, i + halfWindow);
      double sum = 0.0;
      for (int j = from; j <= to; j++) {
        sum += source[j];
      }
      smoothed[i] = sum / (to - from + 1);
    }
    return new PeakMatrix(peaks.getMz(), smoothed);
  };

  /* Fits a cubic spline through the profile and moves every peak that sits between a rising and a falling slope onto
   * the spline's maximum.  First and last peaks are kept as is. */
  public static final PeakFunction REFINE_APEXES = (peaks, params) -> {
    if (peaks.size() < 3) {
      return peaks;
    }
    double[] x = peaks.getMz();
    double[] y = peaks.getIntensity();
    ensureSortedOnMz(x);

    PolynomialSplineFunction f = new SplineInterpolator().interpolate(x, y);
    UnivariateFunction d = f.derivative();
    BrentSolver solver = new BrentSolver(APEX_ABSOLUTE_ACCURACY);

    double[] mz = x.clone();
    double[] intensity = y.clone();
    for (int i = 1; i < x.length - 1; i++) {
      double mzBefore = x[i - 1];
      double mzAfter = x[i + 1];
      if (Math.signum(d.value(mzBefore)) == 1 && Math.signum(d.value(mzAfter)) == -1) {
        double root = solver.solve(APEX_MAX_EVALUATIONS, d, mzBefore, mzAfter);
        mz[i] = root;
        intensity[i] = f.value(root);
      }
    }
    return new PeakMatrix(mz, intensity);
  };

  public static ProcessingStep replaceIntensitiesBelow(double threshold, double value) {
    return new ProcessingStep("replaceIntensitiesBelow", REPLACE_INTENSITIES_BELOW,
        params(PARAM_THRESHOLD, threshold, PARAM_VALUE, value));
  }

  public static ProcessingStep filterIntensity(double lower, double upper) {
    return new ProcessingStep("filterIntensity", FILTER_INTENSITY, params(PARAM_LOWER, lower, PARAM_UPPER, upper));
  }

  public static ProcessingStep filterMzRange(double lower, double upper, boolean keep) {
    return new ProcessingStep("filterMzRange", FILTER_MZ_RANGE,
        params(PARAM_LOWER, lower, PARAM_UPPER, upper, PARAM_KEEP, keep));
  }

  public static ProcessingStep filterMzValues(double[] mz, double tolerance, double ppm, boolean keep) {
    return new ProcessingStep("filterMzValues", FILTER_MZ_VALUES,
        params(PARAM_MZ, mz.clone(), PARAM_TOLERANCE, tolerance, PARAM_PPM, ppm, PARAM_KEEP, keep));
  }

  public static ProcessingStep scaleIntensities(double total) {
    return new ProcessingStep("scaleIntensities", SCALE_INTENSITIES, params(PARAM_TOTAL, total));
  }

  public static ProcessingStep smooth(int halfWindowSize) {
    if (halfWindowSize < 0) {
      throw new IllegalArgumentException(String.format("Half window size must be >= 0, got %d", halfWindowSize));
    }
    return new ProcessingStep("smooth", SMOOTH, params(PARAM_HALF_WINDOW_SIZE, halfWindowSize));
  }

  public static ProcessingStep refineApexes() {
    return new ProcessingStep("refineApexes", REFINE_APEXES, params());
  }

  /**
   * Tolerance check shared with collection-level m/z matching: a peak matches a target if it lies within
   * {@code tolerance + ppm * target / 1e6} of it.
   * @param mz The peak m/z.
   * @param sortedTargets Target m/z values, sorted ascending.
   * @param tolerance Absolute tolerance.
   * @param ppm Relative tolerance in parts per million.
   * @return True if any target matches.
   */
  static boolean matchesAny(double mz, double[] sortedTargets, double tolerance, double ppm) {
    if (sortedTargets.length == 0) {
      return false;
    }
    int pos = Arrays.binarySearch(sortedTargets, mz);
    if (pos >= 0) {
      return true;
    }
    int insertion = -pos - 1;
    // Only the neighbours on either side of the insertion point can be closest.
    for (int i = Math.max(0, insertion - 1); i <= Math.min(sortedTargets.length - 1, insertion); i++) {
      double target = sortedTargets[i];
      if (Math.abs(mz - target) <= tolerance + ppm * target / 1e6) {
        return true;
      }
    }
    return false;
  }

  private static void ensureSortedOnMz(double[] mz) {
    for (int i = 0; i < mz.length - 1; i++) {
      if (mz[i] >= mz[i + 1]) {
        throw new IllegalArgumentException(String.format(
            "m/z values not sorted: %d: %f >= %d: %f", i, mz[i], i + 1, mz[i + 1]));
      }
    }
  }

  private static Map<String, Object> params(Object... keysAndValues) {
    Map<String, Object> params = new LinkedHashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      params.put((String) keysAndValues[i], keysAndValues[i + 1]);
    }
    return params;
  }

  private static double getDouble(Map<String, Object> params, String key) {
    Object value = params.get(key);
    if (!(value instanceof Number)) {
      throw new IllegalArgumentException(String.format("Missing numeric parameter '%s'", key));
    }
    return ((Number) value).doubleValue();
  }

  private static int getInt(Map<String, Object> params, String key) {
    Object value = params.get(key);
    if (!(value instanceof Number)) {
      throw new IllegalArgumentException(String.format("Missing integer parameter '%s'", key));
    }
    return ((Number) value).intValue();
  }

  private static boolean getBoolean(Map<String, Object> params, String key) {
    Object value = params.get(key);
    return value == null ? true : (Boolean) value;
  }
}
