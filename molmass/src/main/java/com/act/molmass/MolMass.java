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

package com.act.molmass;

import com.act.molmass.elements.ElementTable;
import com.act.molmass.elements.ElementsSqlScript;
import com.act.molmass.formula.Formula;
import com.act.molmass.formula.FormulaException;
import com.act.molmass.report.AnalysisConfig;
import com.act.molmass.report.AnalysisReport;
import com.act.molmass.report.FormulaAnalyzer;
import com.act.molmass.report.TsvExporter;
import com.act.molmass.spectrum.Spectrum;
import com.act.molmass.utils.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point: analyzes chemical formulas and prints their masses, composition and mass distribution.
 */
public class MolMass {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MolMass.class);

  public static final String OPTION_JSON = "j";
  public static final String OPTION_SPECTRUM_TSV = "s";
  public static final String OPTION_COMPOSITION_TSV = "c";
  public static final String OPTION_MAX_ATOMS = "m";
  public static final String OPTION_MIN_FRACTION = "f";
  public static final String OPTION_MIN_INTENSITY = "i";
  public static final String OPTION_CONFIG = "C";
  public static final String OPTION_SQL = "q";
  public static final String OPTION_VALIDATE = "v";

  public static final int EXIT_FAILED = 2;

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class calculates the average, monoisotopic and nominal mass, the elemental composition and the ",
      "mass distribution of chemical formulas given as arguments, e.g. C8H10N4O2, CuSO4.5H2O, [SO4]2-, ",
      "peptide(MDRGEQGLLK) or \"O: 0.26, 30Si: 0.74\".  Reports are written to stdout, logs to stderr."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_JSON)
        .desc("Print the analysis as JSON instead of text")
        .longOpt("json")
    );
    add(Option.builder(OPTION_SPECTRUM_TSV)
        .desc("Print the mass distribution of each formula as TSV")
        .longOpt("spectrum-tsv")
    );
    add(Option.builder(OPTION_COMPOSITION_TSV)
        .desc("Print the elemental composition of each formula as TSV")
        .longOpt("composition-tsv")
    );
    add(Option.builder(OPTION_MAX_ATOMS)
        .argName("count")
        .desc(String.format("Only compute mass distributions of formulas with fewer atoms (default: %d)",
            AnalysisConfig.DEFAULT_MAX_ATOMS))
        .hasArg()
        .longOpt("max-atoms")
    );
    add(Option.builder(OPTION_MIN_FRACTION)
        .argName("fraction")
        .desc("Drop isotopic species below this fraction while computing mass distributions (default: 1e-9)")
        .hasArg()
        .longOpt("min-fraction")
    );
    add(Option.builder(OPTION_MIN_INTENSITY)
        .argName("percent")
        .desc("Leave out peaks below this percentage of the most abundant peak")
        .hasArg()
        .longOpt("min-intensity")
    );
    add(Option.builder(OPTION_CONFIG)
        .argName("file")
        .desc("A JSON file of analysis settings; command line options take precedence")
        .hasArg()
        .longOpt("config")
    );
    add(Option.builder(OPTION_SQL)
        .desc("Print an SQL script that creates a database of the elements")
        .longOpt("sql")
    );
    add(Option.builder(OPTION_VALIDATE)
        .desc("Check the consistency of the element data")
        .longOpt("validate")
    );
  }};

  private static final CLIUtil CLI_UTIL = new CLIUtil(MolMass.class, HELP_MESSAGE, OPTION_BUILDERS);

  private final ElementTable elementTable;
  private final FormulaAnalyzer analyzer;
  private final PrintStream out;

  public MolMass(AnalysisConfig config, ElementTable elementTable, PrintStream out) {
    this.elementTable = elementTable;
    this.analyzer = new FormulaAnalyzer(config, elementTable);
    this.out = out;
  }

  public static void main(String[] args) throws Exception {
    CommandLine cl = CLI_UTIL.parseCommandLine(args);
    if (cl.getArgList().isEmpty() && !cl.hasOption(OPTION_SQL) && !cl.hasOption(OPTION_VALIDATE)) {
      CLI_UTIL.failWithMessage("No formula given");
    }

    AnalysisConfig config = null;
    try {
      config = buildConfig(cl);
    } catch (NumberFormatException e) {
      CLI_UTIL.failWithMessage("Invalid number: %s", e.getMessage());
    } catch (IOException e) {
      LOGGER.error("Unable to read config file %s: %s", cl.getOptionValue(OPTION_CONFIG), e.getMessage());
      System.exit(CLIUtil.EXIT_USAGE);
    }

    int status = new MolMass(config, ElementTable.getInstance(), System.out).run(cl);
    System.exit(status);
  }

  /**
   * Reads the config file, if any, and applies the command line overrides.
   */
  public static AnalysisConfig buildConfig(CommandLine cl) throws IOException {
    AnalysisConfig config = cl.hasOption(OPTION_CONFIG) ?
        AnalysisConfig.readFromFile(new File(cl.getOptionValue(OPTION_CONFIG))) : new AnalysisConfig();
    if (cl.hasOption(OPTION_MAX_ATOMS)) {
      config.setMaxAtoms(Integer.valueOf(cl.getOptionValue(OPTION_MAX_ATOMS)));
    }
    if (cl.hasOption(OPTION_MIN_FRACTION)) {
      config.setMinFraction(Double.valueOf(cl.getOptionValue(OPTION_MIN_FRACTION)));
    }
    if (cl.hasOption(OPTION_MIN_INTENSITY)) {
      config.setMinIntensity(Double.valueOf(cl.getOptionValue(OPTION_MIN_INTENSITY)));
    }
    return config;
  }

  /**
   * Performs what the command line asks for.
   * @return The exit status: 0 on success, {@link #EXIT_FAILED} if any formula or the element data was invalid.
   */
  public int run(CommandLine cl) throws IOException {
    int status = CLIUtil.EXIT_OK;

    if (cl.hasOption(OPTION_VALIDATE)) {
      try {
        elementTable.validate();
        LOGGER.info("All %d elements passed validation", elementTable.size());
      } catch (IllegalStateException e) {
        LOGGER.error("Element data is invalid: %s", e.getMessage());
        status = EXIT_FAILED;
      }
    }

    if (cl.hasOption(OPTION_SQL)) {
      out.print(new ElementsSqlScript(elementTable).generate());
    }

    List<String> formulas = cl.getArgList();
    if (formulas.isEmpty()) {
      return status;
    }

    if (cl.hasOption(OPTION_JSON)) {
      List<AnalysisReport> reports = new ArrayList<>(formulas.size());
      for (String formula : formulas) {
        AnalysisReport report = analyzer.report(formula);
        if (report.isFailed()) {
          LOGGER.error("Unable to analyze %s: %s", formula, report.getError());
          status = EXIT_FAILED;
        }
        reports.add(report);
      }
      out.println(AnalysisReport.toJson(reports));
      return status;
    }

    if (cl.hasOption(OPTION_SPECTRUM_TSV) || cl.hasOption(OPTION_COMPOSITION_TSV)) {
      for (String formula : formulas) {
        Formula f;
        try {
          f = analyzer.formula(formula);
        } catch (FormulaException e) {
          LOGGER.error("Unable to analyze %s: %s", formula, e.getMessage());
          status = EXIT_FAILED;
          continue;
        }
        StringBuilder table = new StringBuilder();
        if (cl.hasOption(OPTION_COMPOSITION_TSV)) {
          TsvExporter.writeComposition(f.composition(), table);
        }
        if (cl.hasOption(OPTION_SPECTRUM_TSV)) {
          Spectrum spectrum = analyzer.spectrum(f);
          if (spectrum != null) {
            TsvExporter.writeSpectrum(spectrum, table);
          }
        }
        out.print(table);
      }
      return status;
    }

    List<String> reports = new ArrayList<>(formulas.size());
    for (String formula : formulas) {
      String report = analyzer.analyze(formula);
      if (FormulaAnalyzer.hasError(report)) {
        status = EXIT_FAILED;
      }
      reports.add(report);
    }
    out.println(StringUtils.join(reports, "\n\n"));
    return status;
  }

  public static CLIUtil getCliUtil() {
    return CLI_UTIL;
  }
}
