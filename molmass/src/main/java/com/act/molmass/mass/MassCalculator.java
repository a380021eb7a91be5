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

import com.act.molmass.elements.Element;
import com.act.molmass.elements.ElementTable;
import com.act.molmass.elements.Isotope;
import com.act.molmass.elements.Particle;
import com.act.molmass.formula.HillOrder;
import com.act.molmass.formula.ParsedFormula;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Masses of parsed formulas.  Masses are relative (1/12 of the mass of 12C) and are corrected for the electrons that
 * a charged formula has lost (positive charge) or gained (negative charge).
 */
public class MassCalculator {
  public static final double ELECTRON_MASS = Particle.ELECTRON.getMass();

  private final ElementTable elementTable;

  public MassCalculator(ElementTable elementTable) {
    this.elementTable = elementTable;
  }

  public MassCalculator() {
    this(ElementTable.getInstance());
  }

  public ElementTable getElementTable() {
    return elementTable;
  }

  /**
   * Mass to charge ratio: the mass itself for neutral formulas, otherwise mass / |charge|.
   */
  public static double massChargeRatio(double mass, int charge) {
    if (charge == 0) {
      return mass;
    }
    return mass / Math.abs(charge);
  }

  /**
   * Average relative molecular mass, which equals the molar mass in g/mol.  Natural elements contribute their standard
   * atomic weight, explicit isotopes their isotopic mass.
   */
  public double mass(ParsedFormula formula) {
    double result = 0.0;
    for (Map.Entry<String, SortedMap<Integer, Integer>> entry : formula.getElements().entrySet()) {
      Element element = elementTable.get(entry.getKey());
      for (Map.Entry<Integer, Integer> isotope : entry.getValue().entrySet()) {
        result += atomMass(element, isotope.getKey()) * isotope.getValue();
      }
    }
    return result - ELECTRON_MASS * formula.getCharge();
  }

  public double mz(ParsedFormula formula) {
    return massChargeRatio(mass(formula), formula.getCharge());
  }

  /**
   * The isotopic species made of the most abundant isotope of each natural element and the explicit isotopes.
   */
  public MolecularIsotope isotope(ParsedFormula formula) {
    double mass = 0.0;
    double abundance = 1.0;
    int massNumber = 0;
    for (Map.Entry<String, SortedMap<Integer, Integer>> entry : formula.getElements().entrySet()) {
      Element element = elementTable.get(entry.getKey());
      for (Map.Entry<Integer, Integer> selector : entry.getValue().entrySet()) {
        Isotope isotope = selector.getKey() == ParsedFormula.NATURAL ?
            element.getMostAbundantIsotope() : element.getIsotope(selector.getKey());
        int count = selector.getValue();
        mass += isotope.getMass() * count;
        massNumber += isotope.getMassNumber() * count;
        abundance *= Math.pow(isotope.getAbundance(), count);
      }
    }
    int charge = formula.getCharge();
    return new MolecularIsotope(mass - ELECTRON_MASS * charge, abundance, massNumber, charge);
  }

  /**
   * Elemental composition in Hill order.
   * @param formula The formula.
   * @param isotopic If true, explicit isotopes get their own items (e.g. "13C") following the natural element,
   *                 otherwise they are counted with their element.
   * @return The composition, ending with an "e-" item if the formula is charged.
   */
  public Composition composition(ParsedFormula formula, boolean isotopic) {
    double total = mass(formula);
    List<CompositionItem> items = new ArrayList<>();
    Map<String, SortedMap<Integer, Integer>> elements = formula.getElements();
    for (String symbol : HillOrder.sort(elements.keySet())) {
      Element element = elementTable.get(symbol);
      if (isotopic) {
        for (Map.Entry<Integer, Integer> selector : elements.get(symbol).entrySet()) {
          double mass = atomMass(element, selector.getKey()) * selector.getValue();
          String name = selector.getKey() == ParsedFormula.NATURAL ? symbol : selector.getKey() + symbol;
          items.add(new CompositionItem(name, selector.getValue(), mass, mass / total));
        }
      } else {
        int count = 0;
        double mass = 0.0;
        for (Map.Entry<Integer, Integer> selector : elements.get(symbol).entrySet()) {
          count += selector.getValue();
          mass += atomMass(element, selector.getKey()) * selector.getValue();
        }
        items.add(new CompositionItem(symbol, count, mass, mass / total));
      }
    }

    int charge = formula.getCharge();
    if (charge != 0) {
      double mass = -charge * ELECTRON_MASS;
      items.add(new CompositionItem(Composition.ELECTRON_SYMBOL, -charge, mass, mass / total));
    }
    return new Composition(items);
  }

  private static double atomMass(Element element, int selector) {
    if (selector == ParsedFormula.NATURAL) {
      return element.getMass();
    }
    return element.getIsotope(selector).getMass();
  }
}
