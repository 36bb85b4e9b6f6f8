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

import com.twentyn.spectra.metadata.MetadataTable;
import com.twentyn.spectra.peaks.PeakMatrix;

import java.io.Closeable;
import java.util.List;
import java.util.Set;

/**
 * The storage contract every spectra backend implements.  Collection code only ever talks to backends through this
 * interface; it never depends on which implementation is bound.
 *
 * Backends may be shared by several collections for reading.  Unless an implementation says otherwise, concurrent
 * writes to one backend (or to storage shared by several backends) are not safe and must be serialized by the caller.
 */
public interface SpectraBackend extends Closeable {

  int spectrumCount();

  /**
   * @return The metadata fields this backend can answer.  Always includes every core field.
   */
  Set<String> fieldNames();

  /**
   * Projects the backend's metadata onto a set of fields.  Unknown or unsupported fields are returned as all-missing
   * columns; this never fails.
   * @param fields The fields to return.
   * @return A table with spectrumCount() rows and one stored column per requested field.
   */
  MetadataTable metadata(Set<String> fields);

  /**
   * Reads raw (unprocessed) peaks.
   * @param indices Spectrum indices; order and duplicates are kept.
   * @return One peak matrix per index, in the order requested.
   * @throws com.twentyn.spectra.IndexOutOfRangeException If any index is < 0 or >= spectrumCount().
   */
  List<PeakMatrix> peaks(int[] indices);

  boolean supportsWrite();

  /**
   * Overwrites peaks and/or metadata of the given spectra.
   * @param indices The spectra to update.
   * @param update The new values, one per index for every field it carries.
   * @throws com.twentyn.spectra.UnsupportedSpectraOperationException If this backend or one of the updated fields is
   *   read-only.
   */
  void write(int[] indices, SpectraUpdate update);

  /**
   * Discards backend-level caches.  Data overwritten by {@link #write(int[], SpectraUpdate)} is never restored.
   */
  void reset();

  /**
   * Scopes this backend to some of its spectra.  Implementations that keep peaks outside the heap remap indices and
   * share storage instead of copying peaks.
   * @param indices The spectra to keep, in order; duplicates are allowed.
   * @return A backend whose spectrum i is this backend's spectrum indices[i].
   */
  SpectraBackend subset(int[] indices);

  /**
   * @return A short human readable name for logs and error messages.
   */
  String getName();

  /**
   * Releases handles held by this backend.  Storage the backend did not create is left untouched; transient storage
   * it created and owns is deleted.
   */
  @Override
  void close();
}
