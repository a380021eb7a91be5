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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The content of a formula: for each element symbol, the number of atoms per isotope selector, plus the charge.
 * Selector 0 stands for the natural isotope distribution, any other selector is the mass number of an explicit
 * isotope.  All counts are positive.
 */
public class ParsedFormula {
  public static final int NATURAL = 0;

  private final Map<String, SortedMap<Integer, Integer>> elements;
  private final int charge;
  private final int atoms;

  /**
   * @throws ArithmeticException if the total number of atoms does not fit in an int.
   */
  public ParsedFormula(Map<String, ? extends Map<Integer, Integer>> elements, int charge) {
    Map<String, SortedMap<Integer, Integer>> copy = new LinkedHashMap<>();
    int total = 0;
    for (Map.Entry<String, ? extends Map<Integer, Integer>> entry : elements.entrySet()) {
      copy.put(entry.getKey(), Collections.unmodifiableSortedMap(new TreeMap<>(entry.getValue())));
      for (Integer count : entry.getValue().values()) {
        total = Math.addExact(total, count);
      }
    }
    this.elements = Collections.unmodifiableMap(copy);
    this.charge = charge;
    this.atoms = total;
  }

  public Map<String, SortedMap<Integer, Integer>> getElements() {
    return elements;
  }

  public int getCharge() {
    return charge;
  }

  public int getCount(String symbol, int selector) {
    SortedMap<Integer, Integer> isotopes = elements.get(symbol);
    if (isotopes == null) {
      return 0;
    }
    return isotopes.getOrDefault(selector, 0);
  }

  public int getAtoms() {
    return atoms;
  }

  public boolean isEmpty() {
    return elements.isEmpty();
  }

  @Override
  public String toString() {
    return ChargeNotation.join(FormulaWriter.fromElements(elements), charge);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    ParsedFormula that = (ParsedFormula) o;

    if (charge != that.charge) return false;
    return elements.equals(that.elements);
  }

  @Override
  public int hashCode() {
    int result = elements.hashCode();
    result = 31 * result + charge;
    return result;
  }
}
