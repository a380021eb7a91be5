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

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One row of an elemental composition: the atoms of one element (or one isotope of it) and their share of the mass.
 */
public class CompositionItem {
  @JsonProperty("symbol")
  private final String symbol;
  @JsonProperty("count")
  private final int count;
  @JsonProperty("mass")
  private final double mass;
  @JsonProperty("fraction")
  private final double fraction;

  public CompositionItem(String symbol, int count, double mass, double fraction) {
    this.symbol = symbol;
    this.count = count;
    this.mass = mass;
    this.fraction = fraction;
  }

  // Element symbol, isotope like "13C", or "e-" for the electrons of a charged formula.
  public String getSymbol() {
    return symbol;
  }

  public int getCount() {
    return count;
  }

  public double getMass() {
    return mass;
  }

  public double getFraction() {
    return fraction;
  }

  @Override
  public String toString() {
    return String.format("%s, %d, %f, %f", symbol, count, mass, fraction);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    CompositionItem that = (CompositionItem) o;

    if (count != that.count) return false;
    if (Double.compare(that.mass, mass) != 0) return false;
    if (Double.compare(that.fraction, fraction) != 0) return false;
    return symbol.equals(that.symbol);
  }

  @Override
  public int hashCode() {
    int result = symbol.hashCode();
    result = 31 * result + count;
    result = 31 * result + Double.hashCode(mass);
    result = 31 * result + Double.hashCode(fraction);
    return result;
  }
}
