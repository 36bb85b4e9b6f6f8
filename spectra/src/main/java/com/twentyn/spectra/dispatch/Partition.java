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

package com.twentyn.spectra.dispatch;

import java.util.Arrays;

/**
 * A group of collection rows that share one backend segment and one data storage value.  Rows are kept in
 * collection order; localIndices[i] is the position of rows[i] within the segment's backend.
 */
public class Partition {
  private final int segment;
  private final String storageKey;
  private final int[] rows;
  private final int[] localIndices;

  public Partition(int segment, String storageKey, int[] rows, int[] localIndices) {
    if (rows.length != localIndices.length) {
      throw new IllegalArgumentException(String.format(
          "Partition has %d rows but %d local indices", rows.length, localIndices.length));
    }
    this.segment = segment;
    this.storageKey = storageKey;
    this.rows = rows;
    this.localIndices = localIndices;
  }

  public int getSegment() {
    return segment;
  }

  /**
   * @return The data storage value shared by the rows, or null for rows with no storage value.
   */
  public String getStorageKey() {
    return storageKey;
  }

  public int[] getRows() {
    return rows;
  }

  public int[] getLocalIndices() {
    return localIndices;
  }

  public int size() {
    return rows.length;
  }

  /**
   * @return A description naming the segment, storage key and the span of rows, for error reports.
   */
  public String describe() {
    if (rows.length == 0) {
      return String.format("segment %d, storage '%s', no rows", segment, storageKey);
    }
    return String.format("segment %d, storage '%s', %d rows in [%d, %d]",
        segment, storageKey, rows.length, rows[0], rows[rows.length - 1]);
  }

  @Override
  public String toString() {
    return String.format("Partition(%s, rows=%s)", describe(), Arrays.toString(rows));
  }
}
