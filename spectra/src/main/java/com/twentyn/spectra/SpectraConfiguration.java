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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Tunables for dispatching and on-disk storage.  Defaults live in the classpath resource
 * {@value #DEFAULT_CONFIGURATION_RESOURCE}; a user file with the same keys can override them.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SpectraConfiguration {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectraConfiguration.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final String DEFAULT_CONFIGURATION_RESOURCE = "/spectra-configuration.json";

  private static SpectraConfiguration defaultConfiguration = null;

  @JsonProperty("parallelism")
  private int parallelism = 0;

  @JsonProperty("peak_store_temp_prefix")
  private String peakStoreTempPrefix = "spectra-peaks";

  @JsonProperty("peak_store_write_batch_size")
  private int peakStoreWriteBatchSize = 1000;

  public SpectraConfiguration() {
  }

  public static synchronized SpectraConfiguration getDefault() {
    if (defaultConfiguration == null) {
      defaultConfiguration = loadDefault();
    }
    return defaultConfiguration;
  }

  private static SpectraConfiguration loadDefault() {
    try (InputStream is = SpectraConfiguration.class.getResourceAsStream(DEFAULT_CONFIGURATION_RESOURCE)) {
      if (is == null) {
        LOGGER.warn("No %s on the classpath, using built-in defaults", DEFAULT_CONFIGURATION_RESOURCE);
        return new SpectraConfiguration();
      }
      return OBJECT_MAPPER.readValue(is, SpectraConfiguration.class);
    } catch (IOException e) {
      LOGGER.error("Unable to read default configuration: %s", e.getMessage());
      throw new UncheckedIOException(e);
    }
  }

  public static SpectraConfiguration fromFile(File file) throws IOException {
    return OBJECT_MAPPER.readValue(file, SpectraConfiguration.class);
  }

  /**
   * @return The configured number of dispatcher workers; 0 means one per available processor.
   */
  public int getParallelism() {
    return parallelism;
  }

  public void setParallelism(int parallelism) {
    this.parallelism = parallelism;
  }

  /**
   * @return The worker count to actually use, with 0 resolved to the number of processors.
   */
  public int getEffectiveParallelism() {
    return parallelism > 0 ? parallelism : Runtime.getRuntime().availableProcessors();
  }

  public String getPeakStoreTempPrefix() {
    return peakStoreTempPrefix;
  }

  public void setPeakStoreTempPrefix(String peakStoreTempPrefix) {
    this.peakStoreTempPrefix = peakStoreTempPrefix;
  }

  public int getPeakStoreWriteBatchSize() {
    return peakStoreWriteBatchSize;
  }

  public void setPeakStoreWriteBatchSize(int peakStoreWriteBatchSize) {
    this.peakStoreWriteBatchSize = peakStoreWriteBatchSize;
  }
}
