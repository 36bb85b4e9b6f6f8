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

import com.twentyn.spectra.SpectraConfiguration;

import java.io.File;

/**
 * Options passed to {@link BackendFactory} calls.  Backends ignore options that do not apply to them.
 */
public class BackendOptions {
  private File directory = null;
  private SpectraConfiguration configuration = SpectraConfiguration.getDefault();

  public static BackendOptions defaults() {
    return new BackendOptions();
  }

  /**
   * @return The directory an on-disk backend should create its storage in, or null to use a transient directory.
   */
  public File getDirectory() {
    return directory;
  }

  public BackendOptions withDirectory(File directory) {
    this.directory = directory;
    return this;
  }

  public SpectraConfiguration getConfiguration() {
    return configuration;
  }

  public BackendOptions withConfiguration(SpectraConfiguration configuration) {
    this.configuration = configuration;
    return this;
  }
}
