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

package com.act.molmass.mass;

import com.act.molmass.utils.Precision;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;

/**
 * The elemental composition of a formula, in Hill order.  A charged formula ends with an "e-" item accounting for
 * the electrons, so that masses sum to the formula mass and fractions sum to 1.
 */
public class Composition implements Iterable<CompositionItem> {
  public static final String ELECTRON_SYMBOL = "e-";

  private final List<CompositionItem> items;

  public Composition(List<CompositionItem> items) {
    this.items = Collections.unmodifiableList(new ArrayList<>(items));
  }

  public List<CompositionItem> getItems() {
    return items;
  }

  public int size() {
    return items.size();
  }

  public CompositionItem get(int index) {
    return items.get(index);
  }

  public CompositionItem get(String symbol) {
    for (CompositionItem item : items) {
      if (item.getSymbol().equals(symbol)) {
        return item;
      }
    }
    return null;
  }

  @Override
  public Iterator<CompositionItem> iterator() {
    return items.iterator();
  }

  /**
   * Sums of counts, masses and fractions, as a single item named "Total".
   */
  public CompositionItem total() {
    int count = 0;
    double mass = 0.0;
    double fraction = 0.0;
    for (CompositionItem item : items) {
      count += item.getCount();
      mass += item.getMass();
      fraction += item.getFraction();
    }
    return new CompositionItem("Total", count, mass, fraction);
  }

  /**
   * Renders the composition as text table:
   * <pre>
   * Element  Count  Relative mass  Fraction %
   * H            2       2.015882     11.1898
   * O            1      15.999405     88.8102
   * Total:       3      18.015287    100.0000
   * </pre>
   */
  public String toTable() {
    if (items.isEmpty()) {
      return "";
    }
    CompositionItem total = total();
    String row = "%-7s%7d%15." + Precision.precisionDigits(total.getMass(), 9) + "f%12.4f";
    List<String> lines = new ArrayList<>();
    lines.add("Element  Count  Relative mass  Fraction %");
    for (CompositionItem item : items) {
      lines.add(String.format(Locale.US, row, item.getSymbol(), item.getCount(), item.getMass(),
          item.getFraction() * 100.0));
    }
    if (items.size() > 1) {
      lines.add(String.format(Locale.US, row, "Total:", total.getCount(), total.getMass(),
          total.getFraction() * 100.0));
    }
    return String.join("\n", lines);
  }

  @Override
  public String toString() {
    return toTable();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return items.equals(((Composition) o).items);
  }

  @Override
  public int hashCode() {
    return items.hashCode();
  }
}
