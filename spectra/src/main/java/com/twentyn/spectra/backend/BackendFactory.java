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

import com.twentyn.spectra.UnsupportedFormatException;
import com.twentyn.spectra.metadata.MetadataTable;
import com.twentyn.spectra.peaks.PeakMatrix;

import java.io.File;
import java.util.List;

/**
 * Creates backends of one kind, either bound to external storage or pre-loaded with materialized data, and exports
 * collections to the storage formats that kind can read back.
 */
public interface BackendFactory {

  /**
   * Binds a backend to external storage.
   * @param source The storage location (a file or directory path).
   * @param options Backend options.
   * @return A backend reading from the source.
   * @throws com.twentyn.spectra.SourceUnavailableException If the source cannot be opened.
   */
  SpectraBackend initialize(String source, BackendOptions options);

  /**
   * Builds a backend holding the given data.
   * @param metadata The metadata, one row per spectrum.
   * @param peaks The peaks, one matrix per spectrum.
   * @param options Backend options.
   * @return A backend whose spectra equal the input.
   */
  SpectraBackend fromData(MetadataTable metadata, List<PeakMatrix> peaks, BackendOptions options);

  /**
   * Writes a collection to a destination this kind of backend can later {@link #initialize(String, BackendOptions)}
   * from.  Fields the format cannot represent are dropped.
   * @param view The spectra to write, with their processing already applied.
   * @param destination Where to write.
   * @param format The destination format.
   * @throws UnsupportedFormatException If this backend kind cannot write the format.
   */
  default void export(SpectraView view, File destination, ExportFormat format) {
    throw new UnsupportedFormatException(getClass().getSimpleName(), format);
  }
}
