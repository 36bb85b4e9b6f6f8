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

import com.twentyn.spectra.peaks.PeakMatrix;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * New values for some spectra, passed to {@link SpectraBackend#write(int[], SpectraUpdate)}.  Carries replacement
 * peaks, replacement metadata fields, or both.
 */
public class SpectraUpdate {
  private List<PeakMatrix> peaks = null;
  private final Map<String, List<?>> fields = new LinkedHashMap<>();

  public static SpectraUpdate ofPeaks(List<PeakMatrix> peaks) {
    return new SpectraUpdate().withPeaks(peaks);
  }

  public static SpectraUpdate ofField(String field, List<?> values) {
    return new SpectraUpdate().withField(field, values);
  }

  public SpectraUpdate withPeaks(List<PeakMatrix> peaks) {
    this.peaks = peaks;
    return this;
  }

  public SpectraUpdate withField(String field, List<?> values) {
    fields.put(field, values);
    return this;
  }

  public boolean hasPeaks() {
    return peaks != null;
  }

  public List<PeakMatrix> getPeaks() {
    return peaks;
  }

  public Map<String, List<?>> getFields() {
    return Collections.unmodifiableMap(fields);
  }
}
