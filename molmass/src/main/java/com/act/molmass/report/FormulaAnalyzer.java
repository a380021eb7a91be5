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

package com.act.molmass.report;

import com.act.molmass.elements.ElementTable;
import com.act.molmass.formula.Formula;
import com.act.molmass.formula.FormulaException;
import com.act.molmass.formula.FormulaNormalizer;
import com.act.molmass.formula.FormulaParser;
import com.act.molmass.mass.Composition;
import com.act.molmass.mass.MolecularIsotope;
import com.act.molmass.spectrum.Spectrum;
import com.act.molmass.spectrum.SpectrumEntry;
import com.act.molmass.utils.Precision;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Analyzes formulas into human readable reports: masses, elemental composition and, for formulas that are not too
 * large, the mass distribution.
 */
public class FormulaAnalyzer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FormulaAnalyzer.class);

  public static final String ERROR_PREFIX = "Error: ";

  private static final int MAX_ECHOED_LENGTH = 50;
  private static final int MASS_WIDTH = 9;

  private final AnalysisConfig config;
  private final FormulaNormalizer normalizer;
  private final FormulaParser parser;

  public FormulaAnalyzer() {
    this(new AnalysisConfig(), ElementTable.getInstance());
  }

  /**
   * True if a report from {@link #analyze(String)} contains an error line, wherever it occurs in the report.
   */
  public static boolean hasError(String report) {
    for (String line : StringUtils.split(report, '\n')) {
      if (line.startsWith(ERROR_PREFIX)) {
        return true;
      }
    }
    return false;
  }

  public FormulaAnalyzer(AnalysisConfig config, ElementTable elementTable) {
    this.config = config;
    this.normalizer = config.buildNormalizer(elementTable);
    this.parser = new FormulaParser(elementTable);
  }

  public AnalysisConfig getConfig() {
    return config;
  }

  public Formula formula(String input) throws FormulaException {
    return new Formula(input, normalizer, parser, config.getAllowEmpty());
  }

  /**
   * The mass distribution of a formula, or null if the formula has too many atoms for it to be computed.
   */
  public Spectrum spectrum(Formula formula) {
    if (formula.getAtoms() >= config.getMaxAtoms()) {
      LOGGER.warn("Skipping mass distribution of %s: %d atoms, limit is %d",
          formula.getFormula(), formula.getAtoms(), config.getMaxAtoms());
      return null;
    }
    return formula.spectrum(config.getMinFraction(), config.getMinIntensity());
  }

  /**
   * Analyzes a formula into a multi-line text report.  Errors do not escape; they are reported on a single line
   * starting with "Error:".
   */
  public String analyze(String input) {
    List<String> lines = new ArrayList<>();
    try {
      Formula f = formula(input);
      String hill = f.getFormula();

      if (input.length() <= MAX_ECHOED_LENGTH) {
        lines.add("Formula: " + input);
      }
      if (!input.equals(hill)) {
        lines.add("Hill notation: " + hill);
      }
      if (!hill.equals(f.getEmpirical())) {
        lines.add("Empirical formula: " + f.getEmpirical());
      }

      String massFormat = "%." + Precision.precisionDigits(f.getMass(), MASS_WIDTH) + "f";
      MolecularIsotope isotope = f.getIsotope();
      lines.add("");
      lines.add("Nominal mass: " + f.getNominalMass());
      lines.add(format("Average mass: " + massFormat, f.getMass()));
      lines.add(format("Monoisotopic mass: " + massFormat + " (%.3f%%)",
          isotope.getMass(), isotope.getAbundance() * 100.0));
      if (f.getCharge() != 0) {
        lines.add(format("Mass to charge ratio: " + massFormat, f.getMz()));
      }
      lines.add("Number of atoms: " + f.getAtoms());

      Composition composition = f.composition();
      if (composition.size() > 1) {
        lines.add("");
        lines.add("Elemental Composition");
        lines.add("");
        lines.add(composition.toTable());
      }

      Spectrum spectrum = spectrum(f);
      if (spectrum != null && spectrum.size() > 1) {
        SpectrumEntry peak = spectrum.peak();
        lines.add("");
        lines.add("Mass Distribution");
        lines.add("");
        lines.add(format("Most abundant mass: " + massFormat + " (%.3f%%)",
            peak.getMass(), peak.getFraction() * 100.0));
        lines.add(format("Mean mass: " + massFormat, spectrum.mean()));
        lines.add("");
        lines.add(spectrum.toTable());
      }
    } catch (FormulaException | RuntimeException e) {
      LOGGER.debug("Analysis of %s failed: %s", input, e.getMessage());
      lines.add(ERROR_PREFIX + e.getMessage());
    }
    return String.join("\n", lines);
  }

  /**
   * Analyzes a formula into a structured report.  Errors are recorded in the report rather than thrown.
   */
  public AnalysisReport report(String input) {
    try {
      Formula f = formula(input);
      return AnalysisReport.of(input, f, spectrum(f));
    } catch (FormulaException | RuntimeException e) {
      LOGGER.debug("Analysis of %s failed: %s", input, e.getMessage());
      return AnalysisReport.failed(input, e.getMessage());
    }
  }

  private static String format(String template, Object... args) {
    return String.format(Locale.US, template, args);
  }
}
