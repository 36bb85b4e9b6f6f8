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

import com.twentyn.spectra.peaks.PeakMatrix;

import java.util.Collections;
import java.util.Map;

/**
 * One {@code <spectrum>} element read from an mzML file: its position in the file, its native id, the core metadata
 * found in its cvParams and (when requested) its decoded peaks.
 */
public class MzMLSpectrum {
  private final int ordinal;
  private final String id;
  private final Map<String, Object> metadata;
  private final PeakMatrix peaks;

  public MzMLSpectrum(int ordinal, String id, Map<String, Object> metadata, PeakMatrix peaks) {
    this.ordinal = ordinal;
    this.id = id;
    this.metadata = Collections.unmodifiableMap(metadata);
    this.peaks = peaks;
  }

  public int getOrdinal() {
    return ordinal;
  }

  public String getId() {
    return id;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  /**
   * @return The decoded peaks, or null if the parser was asked to skip binary data.
   */
  public PeakMatrix getPeaks() {
    return peaks;
  }
}
