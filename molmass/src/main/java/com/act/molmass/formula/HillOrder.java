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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Ordering of element symbols according to the Hill system:
 * Case 1) If the formula contains Carbon:
 * Carbon first, Hydrogen second, and all remaining elements in alphabetical order.
 * Case 2) If no Carbon is present, all elements in alphabetical order.
 */
public final class HillOrder {
  public static final String CARBON = "C";
  public static final String HYDROGEN = "H";

  private HillOrder() {
  }

  /**
   * @param containsCarbon Whether the formula whose symbols are compared contains Carbon, since the rules differ.
   * @return a Comparator between element symbols in the formula
   */
  public static Comparator<String> comparator(boolean containsCarbon) {
    if (containsCarbon) {
      // Case 1) the formula contains a Carbon
      return (String s1, String s2) -> {
        if (s1.equals(s2)) {
          return 0;
        } else if (s1.equals(CARBON)) {
          return -1;
        } else if (s2.equals(CARBON)) {
          return 1;
        } else if (s1.equals(HYDROGEN)) {
          return -1;
        } else if (s2.equals(HYDROGEN)) {
          return 1;
        } else {
          return s1.compareTo(s2);
        }
      };
    } else {
      // Case 2) all elements in alphabetical order, including Hydrogen
      return String::compareTo;
    }
  }

  public static List<String> sort(Collection<String> symbols) {
    List<String> sorted = new ArrayList<>(symbols);
    sorted.sort(comparator(symbols.contains(CARBON)));
    return sorted;
  }
}
