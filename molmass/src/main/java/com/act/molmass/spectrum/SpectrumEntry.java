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

package com.act.molmass.spectrum;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A bin of a low resolution mass spectrum: all isotopic species sharing one mass number.
 */
public class SpectrumEntry {
  @JsonProperty("mass_number")
  private final int massNumber;
  @JsonProperty("mass")
  private final double mass;
  @JsonProperty("fraction")
  private final double fraction;
  @JsonProperty("intensity")
  private final double intensity;
  @JsonProperty("mz")
  private final double mz;

  public SpectrumEntry(int massNumber, double mass, double fraction, double intensity, double mz) {
    this.massNumber = massNumber;
    this.mass = mass;
    this.fraction = fraction;
    this.intensity = intensity;
    this.mz = mz;
  }

  public int getMassNumber() {
    return massNumber;
  }

  /**
   * Abundance weighted mean mass of the species in this bin.
   */
  public double getMass() {
    return mass;
  }

  public double getFraction() {
    return fraction;
  }

  /**
   * Fraction relative to the most abundant bin, in percent.
   */
  public double getIntensity() {
    return intensity;
  }

  public double getMz() {
    return mz;
  }

  @Override
  public String toString() {
    return String.format("%d, %f, %f, %f, %f", massNumber, mass, fraction, intensity, mz);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    SpectrumEntry that = (SpectrumEntry) o;

    if (massNumber != that.massNumber) return false;
    if (Double.compare(that.mass, mass) != 0) return false;
    if (Double.compare(that.fraction, fraction) != 0) return false;
    if (Double.compare(that.intensity, intensity) != 0) return false;
    return Double.compare(that.mz, mz) == 0;
  }

  @Override
  public int hashCode() {
    int result = massNumber;
    result = 31 * result + Double.hashCode(mass);
    result = 31 * result + Double.hashCode(fraction);
    result = 31 * result + Double.hashCode(intensity);
    result = 31 * result + Double.hashCode(mz);
    return result;
  }
}
