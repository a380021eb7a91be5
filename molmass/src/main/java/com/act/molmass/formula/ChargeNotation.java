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

import org.apache.commons.lang3.tuple.Pair;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads and writes the charge suffix of a formula, e.g. "[SO4]2-", "SO4_2-", "Na+" or "PO4---".
 */
public final class ChargeNotation {
  public static final String SEPARATOR = "_";

  // A count before the sign is only a charge when it directly follows a closing bracket or the separator, otherwise
  // it is the count of the last element ("O2-" is O2 with a single negative charge).
  private static final Pattern NUMBERED_CHARGE = Pattern.compile("(?<=[\\]_])(\\d+)([+-])$");
  private static final Pattern SIGN_CHARGE = Pattern.compile("(_?)([+-]+)$");

  private ChargeNotation() {
  }

  /**
   * Splits a trailing charge from a formula.
   * @param formula A formula, possibly carrying a charge suffix.
   * @return The formula without the suffix and the charge.  If a suffix was found, a single pair of brackets
   *         enclosing the whole remaining formula is removed as well.
   */
  public static Pair<String, Integer> split(String formula) {
    Matcher numbered = NUMBERED_CHARGE.matcher(formula);
    if (numbered.find()) {
      int charge = Integer.parseInt(numbered.group(1));
      if ("-".equals(numbered.group(2))) {
        charge = -charge;
      }
      String body = formula.substring(0, numbered.start());
      if (body.endsWith(SEPARATOR)) {
        body = body.substring(0, body.length() - 1);
      }
      return Pair.of(stripBrackets(body), charge);
    }

    Matcher signs = SIGN_CHARGE.matcher(formula);
    if (signs.find()) {
      int charge = 0;
      for (char c : signs.group(2).toCharArray()) {
        charge += c == '+' ? 1 : -1;
      }
      return Pair.of(stripBrackets(formula.substring(0, signs.start())), charge);
    }
    return Pair.of(formula, 0);
  }

  /**
   * Formats a charge as suffix: "" for 0, "+" or "-" for a single charge, "2+", "3-" etc. otherwise.  With a separator
   * the numbered form is prefixed by it, e.g. "_2-".
   */
  public static String format(int charge, String separator) {
    if (charge == 0) {
      return "";
    }
    String sign = charge > 0 ? "+" : "-";
    if (charge == 1 || charge == -1) {
      return sign;
    }
    return (separator == null ? "" : separator) + Math.abs(charge) + sign;
  }

  public static String format(int charge) {
    return format(charge, null);
  }

  /**
   * Attaches a charge to a formula: "[SO4]2-" without a separator, "SO4_2-" with one.  A zero charge leaves the
   * formula alone.
   */
  public static String join(String formula, int charge, String separator) {
    if (charge == 0) {
      return formula;
    }
    if (separator == null || separator.isEmpty()) {
      return "[" + formula + "]" + format(charge);
    }
    return formula + format(charge, separator);
  }

  public static String join(String formula, int charge) {
    return join(formula, charge, null);
  }

  // Removes "[" and "]" only if they enclose the whole formula, i.e. "[12C]C[13C]" is left alone.
  private static String stripBrackets(String formula) {
    if (formula.length() < 2 || formula.charAt(0) != '[' || formula.charAt(formula.length() - 1) != ']') {
      return formula;
    }
    int depth = 0;
    for (int i = 0; i < formula.length(); i++) {
      char c = formula.charAt(i);
      if (c == '[') {
        depth++;
      } else if (c == ']') {
        depth--;
        if (depth == 0 && i < formula.length() - 1) {
          return formula;
        }
      }
    }
    return formula.substring(1, formula.length() - 1);
  }
}
