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

package com.act.molmass.elements;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single nuclide of an element: its relative atomic mass, its natural abundance (probability [0, 1]) and its
 * mass number (number of protons + neutrons).
 */
public class Isotope {

  @JsonProperty("massnumber")
  private Integer massNumber;

  @JsonProperty("mass")
  private Double mass;

  @JsonProperty("abundance")
  private Double abundance;

  private Isotope() { // For deserialization.
  }

  public Isotope(Double mass, Double abundance, Integer massNumber) {
    this.mass = mass;
    this.abundance = abundance;
    this.massNumber = massNumber;
  }

  public Integer getMassNumber() {
    return massNumber;
  }

  public Double getMass() {
    return mass;
  }

  public Double getAbundance() {
    return abundance;
  }

  @Override
  public String toString() {
    return String.format("%d, %.4f, %.6f%%", massNumber, mass, abundance * 100.0);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    Isotope that = (Isotope) o;

    if (!massNumber.equals(that.massNumber)) return false;
    if (!mass.equals(that.mass)) return false;
    return abundance.equals(that.abundance);
  }

  @Override
  public int hashCode() {
    int result = massNumber.hashCode();
    result = 31 * result + mass.hashCode();
    result = 31 * result + abundance.hashCode();
    return result;
  }
}
