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

package com.twentyn.spectra;

public class IndexOutOfRangeException extends SpectraException {
  private final int index;
  private final int length;

  public IndexOutOfRangeException(int index, int length) {
    super(String.format("Index %d is out of range for %d spectra", index, length));
    this.index = index;
    this.length = length;
  }

  public int getIndex() {
    return index;
  }

  public int getLength() {
    return length;
  }

  /**
   * Checks every index against a collection length.
   * @param indices The indices to check.
   * @param length The number of spectra the indices address.
   * @throws IndexOutOfRangeException On the first index that is negative or >= length.
   */
  public static void checkIndices(int[] indices, int length) {
    for (int index : indices) {
      if (index < 0 || index >= length) {
        throw new IndexOutOfRangeException(index, length);
      }
    }
  }
}
