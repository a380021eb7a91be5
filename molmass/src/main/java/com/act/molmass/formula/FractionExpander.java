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

import com.act.molmass.elements.Element;
import com.act.molmass.elements.ElementTable;
import com.act.molmass.elements.Isotope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives a formula from the mass fractions of its elements, e.g. {H: 0.112, O: 0.888} -> "H2O".
 */
public class FractionExpander {
  public static final int DEFAULT_MAX_COUNT = 10;
  public static final double DEFAULT_PRECISION = 1e-4;

  private final ElementTable elementTable;

  public FractionExpander(ElementTable elementTable) {
    this.elementTable = elementTable;
  }

  public String fromFractions(Map<String, Double> fractions) throws FormulaException {
    return fromFractions(fractions, DEFAULT_MAX_COUNT, DEFAULT_PRECISION);
  }

  /**
   * Finds the smallest integer counts that reproduce the given mass fractions.
   * @param fractions Mass fractions by symbol.  Symbols are elements ("C"), deuterium ("D") or isotopes ("30Si" or
   *                  "[30Si]").  The fractions need not sum to 1.
   * @param maxCount Factors from 1 up to, but excluding, maxCount are tried to turn the ratios into integers.
   * @param precision Tolerated rounding error per symbol and unit of factor.
   * @return A formula with symbols in lexicographic order of their rendering.
   * @throws FormulaException on unknown elements or isotopes.
   */
  public String fromFractions(Map<String, Double> fractions, int maxCount, double precision)
      throws FormulaException {
    if (fractions.isEmpty()) {
      return "";
    }

    double sum = 0.0;
    for (Double fraction : fractions.values()) {
      sum += fraction;
    }

    Map<String, Double> numbers = new LinkedHashMap<>();
    for (Map.Entry<String, Double> entry : fractions.entrySet()) {
      String symbol = "D".equals(entry.getKey()) ? "2H" : entry.getKey();
      if (symbol.isEmpty()) {
        throw new FormulaException("unknown element ''");
      }
      double mass;
      if (Character.isUpperCase(symbol.charAt(0))) {
        Element element = elementTable.get(symbol);
        if (element == null) {
          throw new FormulaException(String.format("unknown element '%s'", symbol));
        }
        mass = element.getMass();
      } else {
        Isotope isotope = lookupIsotope(symbol);
        mass = isotope.getMass();
        symbol = String.format(Locale.US, "[%d%s]", isotope.getMassNumber(), isotopeSymbol(symbol));
      }
      numbers.put(symbol, entry.getValue() / (sum * mass));
    }

    double smallest = Collections.min(numbers.values());
    for (Map.Entry<String, Double> entry : numbers.entrySet()) {
      entry.setValue(entry.getValue() / smallest);
    }

    double tolerance = precision * numbers.size();
    double best = Double.MAX_VALUE;
    int factor = 1;
    for (int i = 1; i < maxCount; i++) {
      double error = 0.0;
      for (Double n : numbers.values()) {
        error += Math.abs(i * n - Math.round(i * n));
      }
      if (error < best) {
        best = error;
        factor = i;
        if (best < i * tolerance) {
          break;
        }
      }
    }

    StringBuilder formula = new StringBuilder();
    for (Map.Entry<String, Double> entry : new TreeMap<>(numbers).entrySet()) {
      long count = Math.round(factor * entry.getValue());
      formula.append(entry.getKey());
      if (count > 1) {
        formula.append(count);
      }
    }
    return formula.toString();
  }

  private Isotope lookupIsotope(String symbol) throws FormulaException {
    String bare = stripBrackets(symbol);
    int i = 0;
    while (i < bare.length() && Character.isDigit(bare.charAt(i))) {
      i++;
    }
    Element element = elementTable.get(bare.substring(i));
    // Mass numbers have at most three digits.
    if (i == 0 || i > 3 || element == null || !element.hasIsotope(Integer.valueOf(bare.substring(0, i)))) {
      throw new FormulaException(String.format("unknown isotope '[%s]'", bare));
    }
    return element.getIsotope(Integer.valueOf(bare.substring(0, i)));
  }

  private static String isotopeSymbol(String symbol) {
    String bare = stripBrackets(symbol);
    int i = 0;
    while (i < bare.length() && Character.isDigit(bare.charAt(i))) {
      i++;
    }
    return bare.substring(i);
  }

  private static String stripBrackets(String symbol) {
    if (symbol.startsWith("[") && symbol.endsWith("]") && symbol.length() > 1) {
      return symbol.substring(1, symbol.length() - 1);
    }
    return symbol;
  }
}
