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

/**
 * The most abundant isotopic species of a molecule, built from the most abundant isotope of each element (or the
 * explicitly requested isotopes).
 */
public class MolecularIsotope {
  private final double mass;
  private final double abundance;
  private final int massNumber;
  private final int charge;

  public MolecularIsotope(double mass, double abundance, int massNumber, int charge) {
    this.mass = mass;
    this.abundance = abundance;
    this.massNumber = massNumber;
    this.charge = charge;
  }

  /**
   * Monoisotopic mass, corrected for the electrons gained or lost by the charge.
   */
  public double getMass() {
    return mass;
  }

  // Probability of this species among all isotopic species of the molecule.
  public double getAbundance() {
    return abundance;
  }

  public int getMassNumber() {
    return massNumber;
  }

  public int getCharge() {
    return charge;
  }

  public double getMz() {
    return MassCalculator.massChargeRatio(mass, charge);
  }

  @Override
  public String toString() {
    return String.format("%d, %.4f, %.6f%%", massNumber, mass, abundance * 100.0);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    MolecularIsotope that = (MolecularIsotope) o;

    if (Double.compare(that.mass, mass) != 0) return false;
    if (Double.compare(that.abundance, abundance) != 0) return false;
    if (massNumber != that.massNumber) return false;
    return charge == that.charge;
  }

  @Override
  public int hashCode() {
    int result = Double.hashCode(mass);
    result = 31 * result + Double.hashCode(abundance);
    result = 31 * result + massNumber;
    result = 31 * result + charge;
    return result;
  }
}
