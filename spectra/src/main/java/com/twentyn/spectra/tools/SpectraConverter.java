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

package com.twentyn.spectra.tools;

import com.twentyn.spectra.Spectra;
import com.twentyn.spectra.SpectraConfiguration;
import com.twentyn.spectra.SpectraException;
import com.twentyn.spectra.backend.BackendOptions;
import com.twentyn.spectra.backend.ExportFormat;
import com.twentyn.spectra.backend.InMemoryBackend;
import com.twentyn.spectra.backend.mzml.MzMLBackend;
import com.twentyn.spectra.backend.rocksdb.RocksDBPeaksBackend;
import com.twentyn.spectra.dispatch.Dispatcher;
import com.twentyn.spectra.utils.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.joda.time.DateTime;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads one or more mzML files and writes their spectra into a RocksDB peak store, optionally restricted to one MS
 * level and optionally also dumped as TSV.
 */
public class SpectraConverter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectraConverter.class);

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_OUTPUT = "o";
  public static final String OPTION_TSV = "t";
  public static final String OPTION_MS_LEVEL = "l";
  public static final String OPTION_CONFIG = "c";

  public static final String HELP_MESSAGE = String.join(" ",
      "This class converts mzML files into a RocksDB peak store that can be re-opened as a spectra collection.",
      "Spectra from several files are combined in the order the files are given."
  );

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("mzML file")
        .desc("An mzML file to convert; may be repeated")
        .hasArgs()
        .valueSeparator(',')
        .required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("directory")
        .desc("The peak store directory to create; must not exist")
        .hasArg()
        .required()
        .longOpt("output")
    );
    add(Option.builder(OPTION_TSV)
        .argName("tsv file")
        .desc("Also write the converted spectra to this TSV file")
        .hasArg()
        .longOpt("tsv")
    );
    add(Option.builder(OPTION_MS_LEVEL)
        .argName("level")
        .desc("Only convert spectra of this MS level")
        .hasArg()
        .longOpt("ms-level")
    );
    add(Option.builder(OPTION_CONFIG)
        .argName("json file")
        .desc("A JSON configuration file overriding the bundled defaults")
        .hasArg()
        .longOpt("config")
    );
  }};

  private static final CLIUtil CLI_UTIL = new CLIUtil(SpectraConverter.class, HELP_MESSAGE, OPTION_BUILDERS);

  private final SpectraConfiguration configuration;

  public SpectraConverter(SpectraConfiguration configuration) {
    this.configuration = configuration;
  }

  public static void main(String[] args) throws Exception {
    CommandLine cl = CLI_UTIL.parseCommandLine(args);

    File output = new File(cl.getOptionValue(OPTION_OUTPUT));
    if (output.exists()) {
      CLI_UTIL.failWithMessage("Output directory %s already exists", output.getAbsolutePath());
    }
    List<String> inputs = Arrays.asList(cl.getOptionValues(OPTION_INPUT));
    for (String input : inputs) {
      if (!new File(input).isFile()) {
        CLI_UTIL.failWithMessage("Input file %s does not exist", input);
      }
    }

    Integer msLevel = null;
    if (cl.hasOption(OPTION_MS_LEVEL)) {
      try {
        msLevel = Integer.valueOf(cl.getOptionValue(OPTION_MS_LEVEL));
      } catch (NumberFormatException e) {
        CLI_UTIL.failWithMessage("MS level must be an integer, got %s", cl.getOptionValue(OPTION_MS_LEVEL));
      }
    }
    File tsv = cl.hasOption(OPTION_TSV) ? new File(cl.getOptionValue(OPTION_TSV)) : null;

    SpectraConfiguration configuration = cl.hasOption(OPTION_CONFIG) ?
        SpectraConfiguration.fromFile(new File(cl.getOptionValue(OPTION_CONFIG))) :
        SpectraConfiguration.getDefault();

    try {
      new SpectraConverter(configuration).convert(inputs, output, tsv, msLevel);
    } catch (SpectraException | IOException e) {
      LOGGER.error("Conversion failed: %s", e.getMessage());
      System.exit(1);
    }
  }

  /**
   * Converts mzML files into a new peak store.
   * @param inputs The mzML files, in the order their spectra should appear.
   * @param output The peak store directory to create.
   * @param tsv An optional TSV file to also write, or null.
   * @param msLevel The MS level to keep, or null to keep every spectrum.
   * @return The number of spectra written.
   */
  public int convert(List<String> inputs, File output, File tsv, Integer msLevel) throws IOException {
    if (output.exists()) {
      throw new IOException(String.format("Output directory %s already exists", output.getAbsolutePath()));
    }
    DateTime start = DateTime.now();
    BackendOptions options = BackendOptions.defaults().withConfiguration(configuration);

    try (Dispatcher dispatcher = Dispatcher.fromConfiguration(configuration);
         Spectra source = Spectra.fromSources(new MzMLBackend.Factory(), options,
             inputs.toArray(new String[inputs.size()])).withDispatcher(dispatcher)) {
      LOGGER.info("Read metadata for %d spectra from %d files", source.size(), inputs.size());
      Spectra selected = msLevel == null ? source : source.filterMsLevel(msLevel);

      try (Spectra stored = selected.setBackend(new RocksDBPeaksBackend.Factory(), options.withDirectory(output))) {
        if (tsv != null) {
          stored.export(new InMemoryBackend.Factory(), tsv, ExportFormat.TSV);
        }
        DateTime end = DateTime.now();
        LOGGER.info("Converted %d spectra into %s in %dms", stored.size(), output.getAbsolutePath(),
            end.getMillis() - start.getMillis());
        return stored.size();
      }
    }
  }
}
