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
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Parses a canonical formula, as produced by {@link FormulaNormalizer}, into element counts and charge.
 *
 * The formula is scanned from right to left so that counts are known before the symbols and groups they apply to.  A
 * stack holds the multiplier of each open parenthesis level.
 */
public class FormulaParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(FormulaParser.class);

  private static final String OPENING_BRACKETS = "([{<";
  private static final String CLOSING_BRACKETS = ")]}>";

  private final ElementTable elementTable;

  public FormulaParser(ElementTable elementTable) {
    this.elementTable = elementTable;
  }

  public FormulaParser() {
    this(ElementTable.getInstance());
  }

  public ElementTable getElementTable() {
    return elementTable;
  }

  public ParsedFormula parse(String formula) throws FormulaException {
    return parse(formula, false);
  }

  /**
   * @param formula A canonical formula, e.g. "[(CH3)2[13C]O]+".
   * @param allowEmpty Whether a formula without elements is acceptable.
   * @return The element counts and charge of the formula.
   * @throws FormulaException describing the first problem found, with its position in the formula body.
   */
  public ParsedFormula parse(String formula, boolean allowEmpty) throws FormulaException {
    Pair<String, Integer> split = ChargeNotation.split(formula);
    String body = split.getLeft();
    int charge = split.getRight();

    if (body.isEmpty()) {
      if (allowEmpty) {
        return new ParsedFormula(Collections.emptyMap(), charge);
      }
      throw new FormulaException("empty formula", formula, FormulaException.UNKNOWN_POSITION);
    }

    char first = body.charAt(0);
    if (!(isOpening(first) || (first >= '1' && first <= '9') || Character.isUpperCase(first))) {
      throw new FormulaException("unexpected character", body, 0);
    }

    // Insertion order is right to left; reversed below.
    Map<String, Map<Integer, Integer>> counts = new HashMap<>();
    List<String> order = new ArrayList<>();
    List<Integer> multipliers = new ArrayList<>();
    multipliers.add(1);
    Integer number = null;

    int i = body.length() - 1;
    while (i >= 0) {
      char c = body.charAt(i);
      if (isClosing(c)) {
        multipliers.add(multiply(number == null ? 1 : number, last(multipliers), body, i));
        number = null;
        i--;
      } else if (isOpening(c)) {
        if (multipliers.size() == 1 || number != null) {
          throw new FormulaException("missing closing parenthesis", body, i);
        }
        multipliers.remove(multipliers.size() - 1);
        i--;
      } else if (isDigit(c)) {
        int start = digitRunStart(body, i);
        number = parseCount(body, start, i + 1);
        i = start - 1;
      } else if (Character.isLowerCase(c) || Character.isUpperCase(c)) {
        int start = i;
        if (Character.isLowerCase(c)) {
          if (i == 0 || !Character.isUpperCase(body.charAt(i - 1))) {
            throw new FormulaException("unexpected character", body, i);
          }
          start = i - 1;
        }
        String symbol = body.substring(start, i + 1);
        Element element = elementTable.get(symbol);
        if (element == null) {
          throw new FormulaException("unknown symbol", body, start);
        }
        i = start - 1;

        int massNumber = ParsedFormula.NATURAL;
        if (i >= 0 && isDigit(body.charAt(i))) {
          int digits = digitRunStart(body, i);
          // Digits right after an opening bracket, or at the very beginning, are a mass number: [13C], 13C.
          if (digits == 0 || isOpening(body.charAt(digits - 1))) {
            String massText = body.substring(digits, i + 1);
            if (massText.length() > 3 || !element.hasIsotope(Integer.valueOf(massText))) {
              throw new FormulaException("unknown isotope", body, digits);
            }
            massNumber = Integer.parseInt(massText);
            i = digits - 1;
          }
        }

        int count = multiply(number == null ? 1 : number, last(multipliers), body, start);
        Map<Integer, Integer> isotopes = counts.get(symbol);
        if (isotopes == null) {
          isotopes = new TreeMap<>();
          counts.put(symbol, isotopes);
          order.add(symbol);
        }
        Integer previous = isotopes.getOrDefault(massNumber, 0);
        try {
          isotopes.put(massNumber, Math.addExact(previous, count));
        } catch (ArithmeticException e) {
          throw new FormulaException("count too large", body, start);
        }
        number = null;
      } else {
        throw new FormulaException("unexpected character", body, i);
      }
    }

    if (number != null) {
      throw new FormulaException("number preceding formula", body, 0);
    }
    if (multipliers.size() > 1) {
      throw new FormulaException("missing opening parenthesis", body, 0);
    }
    if (counts.isEmpty() && !allowEmpty) {
      throw new FormulaException("invalid formula", body, 0);
    }

    Collections.reverse(order);
    Map<String, Map<Integer, Integer>> elements = new LinkedHashMap<>();
    for (String symbol : order) {
      elements.put(symbol, counts.get(symbol));
    }
    ParsedFormula parsed;
    try {
      parsed = new ParsedFormula(elements, charge);
    } catch (ArithmeticException e) {
      throw new FormulaException("count too large", body, FormulaException.UNKNOWN_POSITION);
    }
    LOGGER.debug("Parsed %s into %s", formula, parsed);
    return parsed;
  }

  private static boolean isOpening(char c) {
    return OPENING_BRACKETS.indexOf(c) >= 0;
  }

  private static boolean isClosing(char c) {
    return CLOSING_BRACKETS.indexOf(c) >= 0;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static int last(List<Integer> stack) {
    return stack.get(stack.size() - 1);
  }

  private static int digitRunStart(String body, int end) {
    int start = end;
    while (start > 0 && isDigit(body.charAt(start - 1))) {
      start--;
    }
    return start;
  }

  private static int parseCount(String body, int start, int end) throws FormulaException {
    String digits = body.substring(start, end);
    long value;
    try {
      value = Long.parseLong(digits);
    } catch (NumberFormatException e) {
      throw new FormulaException("count too large", body, start);
    }
    if (value == 0) {
      throw new FormulaException("count is zero", body, start);
    }
    if (value > Integer.MAX_VALUE) {
      throw new FormulaException("count too large", body, start);
    }
    return (int) value;
  }

  private static int multiply(int count, int multiplier, String body, int position) throws FormulaException {
    try {
      return Math.multiplyExact(count, multiplier);
    } catch (ArithmeticException e) {
      throw new FormulaException("count too large", body, position);
    }
  }
}
