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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * The JSON document a peak store keeps about the spectra it was written with, in row order.
 */
public class PeakStoreManifest {
  @JsonProperty("peak_ids")
  private long[] peakIds;

  // One map per spectrum; missing values are serialized as explicit nulls so the field set survives a round trip.
  @JsonProperty("rows")
  private List<Map<String, Object>> rows;

  @JsonCreator
  public PeakStoreManifest(@JsonProperty("peak_ids") long[] peakIds,
                           @JsonProperty("rows") List<Map<String, Object>> rows) {
    this.peakIds = peakIds;
    this.rows = rows;
  }

  public long[] getPeakIds() {
    return peakIds;
  }

  public List<Map<String, Object>> getRows() {
    return rows;
  }
}
