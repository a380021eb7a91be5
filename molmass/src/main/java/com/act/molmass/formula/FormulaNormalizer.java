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

package com.act.molmass.formula;

import com.act.molmass.elements.ElementTable;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns free-form user input into a canonical formula that {@link FormulaParser} accepts.
 *
 * Besides plain formulas, the input may use abbreviations of chemical groups ("PhNH2"), deuterium ("D2O"), simple
 * arithmetic ("CuSO4.5H2O", "CuSO4+5*H2O"), charge suffixes ("SO4_2-", "Na+"), peptide and oligonucleotide
 * sequences ("MDRGEQGLLK", "ssdna(ATCG)") and lists of mass fractions ("O: 0.26, 30Si: 0.74").
 */
public class FormulaNormalizer {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FormulaNormalizer.class);

  private static final Pattern PREPROCESSOR = Pattern.compile("(peptide|ssdna|dsdna|ssrna|dsrna)\\((.*?)\\)");
  private static final Pattern DEUTERIUM = Pattern.compile("D(?![a-z])");
  private static final Pattern MULTIPLIED_TERM = Pattern.compile("^(\\d+)\\*?(.*)$");

  private final Map<String, String> groups;
  private final boolean parseGroups;
  private final boolean parseOligos;
  private final boolean parseFractions;
  private final boolean parseArithmetic;
  private final FractionExpander fractionExpander;

  public FormulaNormalizer() {
    this(ElementTable.getInstance(), ChemicalGroups.DEFAULT, true, true, true, true);
  }

  /**
   * @param elementTable Elements used to resolve mass fractions.
   * @param groups Abbreviations of chemical groups and their formulas.
   * @param parseGroups Whether group abbreviations are expanded.
   * @param parseOligos Whether peptide and oligonucleotide sequences are expanded.
   * @param parseFractions Whether lists of mass fractions are recognized.
   * @param parseArithmetic Whether "+", "*" and "." are expanded.
   */
  public FormulaNormalizer(ElementTable elementTable, Map<String, String> groups, boolean parseGroups,
                           boolean parseOligos, boolean parseFractions, boolean parseArithmetic) {
    // Longer abbreviations sharing a prefix must be replaced first, e.g. Valohp before Valoh before Val.
    TreeMap<String, String> ordered = new TreeMap<>(Collections.reverseOrder());
    ordered.putAll(groups);
    this.groups = Collections.unmodifiableMap(ordered);
    this.parseGroups = parseGroups;
    this.parseOligos = parseOligos;
    this.parseFractions = parseFractions;
    this.parseArithmetic = parseArithmetic;
    this.fractionExpander = new FractionExpander(elementTable);
  }

  public Map<String, String> getGroups() {
    return groups;
  }

  /**
   * @param input A formula as typed by a user.
   * @return The canonical formula: elements, isotopes, brackets and counts only, with an optional charge suffix.
   * @throws FormulaException if the input cannot be expanded.
   */
  public String normalize(String input) throws FormulaException {
    if (input == null) {
      throw new FormulaException("not a string");
    }
    String formula = StringUtils.deleteWhitespace(input);

    if (parseGroups) {
      for (Map.Entry<String, String> group : groups.entrySet()) {
        formula = StringUtils.replace(formula, group.getKey(), "(" + group.getValue() + ")");
      }
    }

    InputKind kind = InputKind.classify(formula, parseFractions, parseOligos);
    switch (kind) {
      case FRACTIONS:
        return fractionExpander.fromFractions(readFractions(formula));
      case DNA:
        return Sequences.fromOligo(formula, Sequences.OligoType.SSDNA);
      case RNA:
        return Sequences.fromOligo(formula, Sequences.OligoType.SSRNA);
      case PEPTIDE:
        return Sequences.fromPeptide(formula);
      case PLAIN:
      default:
        break;
    }

    if (parseOligos) {
      formula = expandPreprocessors(formula);
    }

    formula = DEUTERIUM.matcher(formula).replaceAll("[2H]");

    Pair<String, Integer> split = ChargeNotation.split(formula);
    formula = split.getLeft();
    int charge = split.getRight();

    if (parseArithmetic) {
      formula = expandArithmetic(formula);
    }
    int minus = formula.indexOf('-');
    if (minus >= 0) {
      throw new FormulaException("subtraction not allowed", formula, minus);
    }

    String result = ChargeNotation.join(formula, charge);
    LOGGER.debug("Normalized %s to %s", input, result);
    return result;
  }

  private Map<String, Double> readFractions(String formula) throws FormulaException {
    Map<String, Double> fractions = new LinkedHashMap<>();
    for (String item : StringUtils.splitPreserveAllTokens(formula, ',')) {
      String[] parts = StringUtils.splitPreserveAllTokens(item, ':');
      if (parts.length != 2) {
        throw new FormulaException("invalid list of mass fractions", formula, FormulaException.UNKNOWN_POSITION);
      }
      double fraction;
      try {
        fraction = Double.parseDouble(parts[1]);
      } catch (NumberFormatException e) {
        throw new FormulaException("invalid list of mass fractions", formula, FormulaException.UNKNOWN_POSITION);
      }
      if (!(fraction > 0.0) || Double.isInfinite(fraction)) {
        throw new FormulaException("invalid list of mass fractions", formula, FormulaException.UNKNOWN_POSITION);
      }
      fractions.put(parts[0], fraction);
    }
    return fractions;
  }

  private static String expandPreprocessors(String formula) throws FormulaException {
    Matcher matcher = PREPROCESSOR.matcher(formula);
    StringBuilder result = new StringBuilder();
    int last = 0;
    while (matcher.find()) {
      result.append(formula, last, matcher.start());
      String function = matcher.group(1);
      String sequence = matcher.group(2);
      if ("peptide".equals(function)) {
        result.append(Sequences.fromPeptide(sequence));
      } else {
        result.append(Sequences.fromOligo(sequence, Sequences.OligoType.fromFunctionName(function)));
      }
      last = matcher.end();
    }
    result.append(formula.substring(last));
    return result.toString();
  }

  /**
   * Expands "A+B", "A.B" and "A+n*B" into "AB", "AB" and "A(B)n".
   */
  private static String expandArithmetic(String formula) throws FormulaException {
    String expression = formula.replace('.', '+');
    if (expression.indexOf('+') < 0 && expression.indexOf('*') < 0) {
      return expression;
    }

    StringBuilder result = new StringBuilder();
    int offset = 0;
    for (String term : StringUtils.splitPreserveAllTokens(expression, '+')) {
      if (term.isEmpty() || Character.isLowerCase(term.charAt(0))) {
        throw new FormulaException("unexpected character", expression, offset);
      }
      Matcher matcher = MULTIPLIED_TERM.matcher(term);
      if (matcher.matches()) {
        String multiplied = matcher.group(2);
        int position = offset + matcher.start(2);
        if (multiplied.isEmpty() || Character.isLowerCase(multiplied.charAt(0))) {
          throw new FormulaException("unexpected character", expression, position);
        }
        if (multiplied.indexOf('*') >= 0) {
          throw new FormulaException("unexpected character", expression, position + multiplied.indexOf('*'));
        }
        result.append('(').append(multiplied).append(')').append(matcher.group(1));
      } else {
        if (term.indexOf('*') >= 0) {
          throw new FormulaException("unexpected character", expression, offset + term.indexOf('*'));
        }
        result.append(term);
      }
      offset += term.length() + 1;
    }
    return result.toString();
  }
}
