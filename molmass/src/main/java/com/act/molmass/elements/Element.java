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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A chemical element with its isotopic composition and physical properties.
 *
 * Instances are created by {@link ElementTable} from the bundled element data and are immutable once the table has
 * indexed them.  The nominal mass (mass number of the most abundant isotope) and the exact mass (abundance weighted
 * isotope mass) are derived once at indexing time.
 */
public class Element {

  @JsonProperty("number")
  private Integer number;

  @JsonProperty("symbol")
  private String symbol;

  @JsonProperty("name")
  private String name;

  @JsonProperty("group")
  private Integer group = 0;

  @JsonProperty("period")
  private Integer period = 0;

  @JsonProperty("block")
  private String block = "";

  @JsonProperty("series")
  private Integer series = 0;

  // Relative atomic mass, i.e. the standard atomic weight.
  @JsonProperty("mass")
  private Double mass = 0.0;

  // Pauling scale.
  @JsonProperty("eleneg")
  private Double electronegativity = 0.0;

  // eV
  @JsonProperty("eleaffin")
  private Double electronAffinity = 0.0;

  // Angstrom
  @JsonProperty("covrad")
  private Double covalentRadius = 0.0;

  @JsonProperty("atmrad")
  private Double atomicRadius = 0.0;

  @JsonProperty("vdwrad")
  private Double vanDerWaalsRadius = 0.0;

  // K
  @JsonProperty("tboil")
  private Double boilingPoint = 0.0;

  @JsonProperty("tmelt")
  private Double meltingPoint = 0.0;

  // g/cm3 at 295K for solids and liquids, g/L for gases.
  @JsonProperty("density")
  private Double density = 0.0;

  @JsonProperty("eleconfig")
  private String electronConfiguration = "";

  @JsonProperty("oxistates")
  private String oxidationStates = "";

  // eV
  @JsonProperty("ionenergy")
  private List<Double> ionizationEnergies = new ArrayList<>();

  @JsonProperty("isotopes")
  private List<Isotope> isotopeList = new ArrayList<>();

  private SortedMap<Integer, Isotope> isotopes;
  private Integer nominalMass;
  private Double exactMass;

  private Element() { // For deserialization.
  }

  public Element(Integer number, String symbol, String name, Double mass, List<Isotope> isotopes) {
    this.number = number;
    this.symbol = symbol;
    this.name = name;
    this.mass = mass;
    this.isotopeList = new ArrayList<>(isotopes);
    index();
  }

  /**
   * Builds the mass number lookup and the derived masses.  Called once, before the element is handed out.
   */
  void index() {
    SortedMap<Integer, Isotope> byMassNumber = new TreeMap<>();
    for (Isotope isotope : isotopeList) {
      byMassNumber.put(isotope.getMassNumber(), isotope);
    }
    this.isotopes = Collections.unmodifiableSortedMap(byMassNumber);

    int mostAbundant = 0;
    double maxAbundance = 0.0;
    double weightedMass = 0.0;
    for (Isotope isotope : byMassNumber.values()) {
      if (isotope.getAbundance() > maxAbundance) {
        maxAbundance = isotope.getAbundance();
        mostAbundant = isotope.getMassNumber();
      }
      weightedMass += isotope.getMass() * isotope.getAbundance();
    }
    this.nominalMass = mostAbundant;
    this.exactMass = weightedMass;
    this.ionizationEnergies = Collections.unmodifiableList(ionizationEnergies);
  }

  public Integer getNumber() {
    return number;
  }

  public String getSymbol() {
    return symbol;
  }

  public String getName() {
    return name;
  }

  public Integer getProtons() {
    return number;
  }

  public Integer getElectrons() {
    return number;
  }

  /**
   * Number of neutrons in the most abundant isotope.
   */
  public Integer getNeutrons() {
    return nominalMass - number;
  }

  public Integer getGroup() {
    return group;
  }

  public Integer getPeriod() {
    return period;
  }

  public String getBlock() {
    return block;
  }

  public Integer getSeries() {
    return series;
  }

  public Double getMass() {
    return mass;
  }

  /**
   * Mass number of the most abundant naturally occurring isotope.
   */
  public Integer getNominalMass() {
    return nominalMass;
  }

  /**
   * Relative atomic mass calculated from the isotopic composition.
   */
  public Double getExactMass() {
    return exactMass;
  }

  public Double getElectronegativity() {
    return electronegativity;
  }

  public Double getElectronAffinity() {
    return electronAffinity;
  }

  public Double getCovalentRadius() {
    return covalentRadius;
  }

  public Double getAtomicRadius() {
    return atomicRadius;
  }

  public Double getVanDerWaalsRadius() {
    return vanDerWaalsRadius;
  }

  public Double getBoilingPoint() {
    return boilingPoint;
  }

  public Double getMeltingPoint() {
    return meltingPoint;
  }

  public Double getDensity() {
    return density;
  }

  public String getElectronConfiguration() {
    return electronConfiguration;
  }

  public String getOxidationStates() {
    return oxidationStates;
  }

  public List<Double> getIonizationEnergies() {
    return ionizationEnergies;
  }

  public SortedMap<Integer, Isotope> getIsotopes() {
    return isotopes;
  }

  public Isotope getIsotope(Integer massNumber) {
    return isotopes.get(massNumber);
  }

  public boolean hasIsotope(Integer massNumber) {
    return isotopes.containsKey(massNumber);
  }

  /**
   * The most abundant naturally occurring isotope.
   */
  public Isotope getMostAbundantIsotope() {
    return isotopes.get(nominalMass);
  }

  @Override
  public String toString() {
    return name;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    Element that = (Element) o;

    if (!symbol.equals(that.getSymbol())) return false;
    return number.equals(that.getNumber());
  }

  @Override
  public int hashCode() {
    int result = symbol.hashCode();
    result = 31 * result + number.hashCode();
    return result;
  }
}
