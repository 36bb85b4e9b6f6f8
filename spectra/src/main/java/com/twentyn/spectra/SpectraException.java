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

/**
 * Base class for every failure raised by the spectra container.  Each subclass is a distinct error kind that
 * callers can catch and recover from (retry, fall back to another backend, skip the offending indices).
 *
 * Failures raised while the {@link com.twentyn.spectra.dispatch.Dispatcher} reads a partition carry a description of
 * that partition's rows, available from {@link #getPartitionDescription()}.
 */
public class SpectraException extends RuntimeException {
  private String partitionDescription = null;

  public SpectraException(String message) {
    super(message);
  }

  public SpectraException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Tags this failure with the partition it came from.  Returns this instance so it can be rethrown directly.
   * @param description A human readable description of the partition's rows and storage key.
   * @return This exception.
   */
  public SpectraException tagPartition(String description) {
    this.partitionDescription = description;
    return this;
  }

  /**
   * @return The partition that raised this failure, or null if it was not raised inside a partition read.
   */
  public String getPartitionDescription() {
    return partitionDescription;
  }

  @Override
  public String getMessage() {
    if (partitionDescription == null) {
      return super.getMessage();
    }
    return String.format("%s [partition %s]", super.getMessage(), partitionDescription);
  }
}
