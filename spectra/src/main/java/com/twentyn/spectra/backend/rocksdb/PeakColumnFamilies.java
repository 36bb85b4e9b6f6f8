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

import com.twentyn.spectra.utils.rocksdb.ColumnFamilyEnumeration;

import java.util.HashMap;
import java.util.Map;

public enum PeakColumnFamilies implements ColumnFamilyEnumeration<PeakColumnFamilies> {
  /* Peak id (a `long`, as 8 big-endian bytes) to the spectrum's m/z values, packed as raw doubles.  Ids are never
   * reused: a rewritten spectrum gets a fresh id, so every id maps to one immutable array for the life of the store. */
  MZ_ARRAYS("mz_arrays"),
  // Peak id to intensities, packed the same way and always the same length as the matching m/z array.
  INTENSITY_ARRAYS("intensity_arrays"),
  /* Fixed keys to JSON documents describing the spectra the store was written with: their metadata rows and the peak
   * id of each row. */
  SPECTRA_METADATA("spectra_metadata"),
  ;

  private static final Map<String, PeakColumnFamilies> reverseNameMap =
      new HashMap<String, PeakColumnFamilies>() {{
        for (PeakColumnFamilies cf : PeakColumnFamilies.values()) {
          put(cf.getName(), cf);
        }
      }};

  private String name;

  PeakColumnFamilies(String name) {
    this.name = name;
  }

  public String getName() {
    return name;
  }

  @Override
  public PeakColumnFamilies getFamilyByName(String name) {
    return reverseNameMap.get(name);
  }
}
