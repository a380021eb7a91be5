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

/**
 * Sub-atomic particles whose masses matter for ion mass corrections.
 * Masses are relative (1/12 of the mass of 12C), charges are in coulomb.
 */
public enum Particle {
  ELECTRON("Electron", 5.48579909065e-4, -Particle.ELEMENTARY_CHARGE),
  PROTON("Proton", 1.007276466621, Particle.ELEMENTARY_CHARGE),
  NEUTRON("Neutron", 1.00866491595, 0.0),
  POSITRON("Positron", 5.48579909065e-4, Particle.ELEMENTARY_CHARGE),
  ;

  public static final double ELEMENTARY_CHARGE = 1.602176634e-19;

  private String particleName;
  private double mass;
  private double charge;

  Particle(String particleName, double mass, double charge) {
    this.particleName = particleName;
    this.mass = mass;
    this.charge = charge;
  }

  public String getParticleName() {
    return particleName;
  }

  public double getMass() {
    return mass;
  }

  public double getCharge() {
    return charge;
  }
}
