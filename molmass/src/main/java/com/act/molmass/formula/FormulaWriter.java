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

import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Writes element counts as a formula string in Hill order.
 */
public final class FormulaWriter {

  /**
   * Templates for the four kinds of terms: a natural element, with and without count, and an isotope, with and
   * without count.
   */
  public enum FormulaFormat {
    PLAIN("%s", "%s%d", "[%d%s]", "[%d%s]%d"),
    HTML("%s", "%s<sub>%d</sub>", "<sup>%d</sup>%s", "<sup>%d</sup>%s<sub>%d</sub>"),
    ;

    private final String element;
    private final String elementCount;
    private final String isotope;
    private final String isotopeCount;

    FormulaFormat(String element, String elementCount, String isotope, String isotopeCount) {
      this.element = element;
      this.elementCount = elementCount;
      this.isotope = isotope;
      this.isotopeCount = isotopeCount;
    }

    String term(String symbol, int massNumber, int count) {
      if (massNumber == 0) {
        return count == 1 ?
            String.format(Locale.US, element, symbol) :
            String.format(Locale.US, elementCount, symbol, count);
      }
      return count == 1 ?
          String.format(Locale.US, isotope, massNumber, symbol) :
          String.format(Locale.US, isotopeCount, massNumber, symbol, count);
    }

    public String charge(int charge) {
      String suffix = ChargeNotation.format(charge);
      if (this == HTML && !suffix.isEmpty()) {
        return "<sup>" + suffix + "</sup>";
      }
      return suffix;
    }
  }

  private FormulaWriter() {
  }

  /**
   * Writes a formula in Hill order, e.g. {C: {0: 4, 12: 2}} with divisor 2 -> "C2[12C]".  Within an element the
   * natural distribution comes first, then explicit isotopes by ascending mass number.
   * @param elements Counts by symbol and mass number (0 for the natural distribution).
   * @param divisor All counts are divided by this number.
   * @param format The term templates to use.
   * @return The formula, without charge.
   */
  public static String fromElements(Map<String, ? extends Map<Integer, Integer>> elements, int divisor,
                                    FormulaFormat format) {
    StringBuilder formula = new StringBuilder();
    for (String symbol : HillOrder.sort(elements.keySet())) {
      SortedMap<Integer, Integer> isotopes = new TreeMap<>(elements.get(symbol));
      for (Map.Entry<Integer, Integer> entry : isotopes.entrySet()) {
        formula.append(format.term(symbol, entry.getKey(), entry.getValue() / divisor));
      }
    }
    return formula.toString();
  }

  public static String fromElements(Map<String, ? extends Map<Integer, Integer>> elements, int divisor) {
    return fromElements(elements, divisor, FormulaFormat.PLAIN);
  }

  public static String fromElements(Map<String, ? extends Map<Integer, Integer>> elements) {
    return fromElements(elements, 1, FormulaFormat.PLAIN);
  }
}
