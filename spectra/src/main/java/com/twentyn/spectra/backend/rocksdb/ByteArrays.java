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

import java.nio.ByteBuffer;

/**
 * Raw byte encodings for peak store keys and values.  Values are written directly as their binary representations
 * rather than through object streams, which keeps peak arrays compact.
 */
class ByteArrays {
  private ByteArrays() {
  }

  static byte[] longToKey(long id) {
    return ByteBuffer.allocate(Long.BYTES).putLong(id).array();
  }

  static long keyToLong(byte[] key) {
    if (key.length != Long.BYTES) {
      throw new IllegalArgumentException(String.format("Peak keys are %d bytes, got %d", Long.BYTES, key.length));
    }
    return ByteBuffer.wrap(key).getLong();
  }

  /**
   * Convert an array of doubles to a (compact) array of bytes.
   * @param vals The values to serialize as raw bytes.
   * @return A byte array of exactly vals.length * 8 bytes.
   */
  static byte[] doubleArrayToBytes(double[] vals) {
    ByteBuffer buffer = ByteBuffer.allocate(vals.length * Double.BYTES); // Don't waste any bits!
    for (double v : vals) {
      buffer.putDouble(v);
    }
    return buffer.array();
  }

  /**
   * Convert bytes written by {@link #doubleArrayToBytes(double[])} back to doubles.
   * @param bytes The bytes to read.
   * @return The decoded values.
   */
  static double[] bytesToDoubleArray(byte[] bytes) {
    if (bytes.length % Double.BYTES != 0) {
      throw new IllegalArgumentException(String.format(
          "Peak array byte length %d is not a multiple of %d", bytes.length, Double.BYTES));
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes);
    double[] vals = new double[bytes.length / Double.BYTES];
    for (int i = 0; i < vals.length; i++) {
      vals[i] = buffer.getDouble();
    }
    return vals;
  }
}
