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

import com.act.molmass.elements.Element;
import com.act.molmass.elements.ElementTable;
import com.act.molmass.elements.Isotope;
import com.act.molmass.formula.ParsedFormula;
import com.act.molmass.mass.MassCalculator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Iterator;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Computes the mass distribution of a formula by convolving the isotope distributions of its atoms, one atom at a
 * time.  Bins are keyed by mass number; isotopic species that fall into the same bin are merged into a single
 * abundance weighted mass.
 */
public class SpectrumCalculator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumCalculator.class);

  public static final double DEFAULT_MIN_FRACTION = 1e-9;

  private final ElementTable elementTable;

  public SpectrumCalculator(ElementTable elementTable) {
    this.elementTable = elementTable;
  }

  public SpectrumCalculator() {
    this(ElementTable.getInstance());
  }

  public Spectrum spectrum(ParsedFormula formula) {
    return spectrum(formula, DEFAULT_MIN_FRACTION, null);
  }

  /**
   * @param formula The formula.
   * @param minFraction Bins with a smaller fraction are dropped after each atom is added.
   * @param minIntensity If not null, bins with an intensity (percent of the most abundant bin) below this value are
   *                     left out of the result.  Fractions are not renormalized.
   * @return The spectrum; empty for a formula without elements.
   */
  public Spectrum spectrum(ParsedFormula formula, double minFraction, Double minIntensity) {
    int charge = formula.getCharge();
    if (formula.isEmpty()) {
      return new Spectrum(new TreeMap<>(), charge);
    }

    // Mass number -> {mass, fraction}
    TreeMap<Integer, double[]> bins = new TreeMap<>();
    bins.put(0, new double[]{0.0, 1.0});

    for (Map.Entry<String, SortedMap<Integer, Integer>> entry : formula.getElements().entrySet()) {
      Element element = elementTable.get(entry.getKey());
      for (Map.Entry<Integer, Integer> selector : entry.getValue().entrySet()) {
        int count = selector.getValue();
        if (selector.getKey() != ParsedFormula.NATURAL) {
          bins = shift(bins, element.getIsotope(selector.getKey()), count);
        } else {
          for (int i = 0; i < count; i++) {
            bins = addAtom(bins, element);
            prune(bins, minFraction);
          }
        }
      }
    }

    double maxFraction = 0.0;
    for (double[] bin : bins.values()) {
      maxFraction = Math.max(maxFraction, bin[1]);
    }

    double electrons = MassCalculator.ELECTRON_MASS * charge;
    TreeMap<Integer, SpectrumEntry> entries = new TreeMap<>();
    for (Map.Entry<Integer, double[]> bin : bins.entrySet()) {
      double mass = bin.getValue()[0] - electrons;
      double fraction = bin.getValue()[1];
      double intensity = fraction / maxFraction * 100.0;
      if (minIntensity != null && intensity < minIntensity) {
        continue;
      }
      double mz = mass / Math.max(1, Math.abs(charge));
      entries.put(bin.getKey(), new SpectrumEntry(bin.getKey(), mass, fraction, intensity, mz));
    }
    LOGGER.debug("Spectrum of %s has %d bins", formula, entries.size());
    return new Spectrum(entries, charge);
  }

  private static TreeMap<Integer, double[]> shift(TreeMap<Integer, double[]> bins, Isotope isotope, int count) {
    TreeMap<Integer, double[]> shifted = new TreeMap<>();
    for (Map.Entry<Integer, double[]> bin : bins.entrySet()) {
      shifted.put(bin.getKey() + isotope.getMassNumber() * count,
          new double[]{bin.getValue()[0] + isotope.getMass() * count, bin.getValue()[1]});
    }
    return shifted;
  }

  private static TreeMap<Integer, double[]> addAtom(TreeMap<Integer, double[]> bins, Element element) {
    TreeMap<Integer, double[]> result = new TreeMap<>();
    for (Map.Entry<Integer, double[]> bin : bins.entrySet()) {
      double mass = bin.getValue()[0];
      double fraction = bin.getValue()[1];
      for (Isotope isotope : element.getIsotopes().values()) {
        double f = fraction * isotope.getAbundance();
        double m = mass + isotope.getMass();
        int key = bin.getKey() + isotope.getMassNumber();
        double[] existing = result.get(key);
        if (existing == null) {
          result.put(key, new double[]{m, f});
        } else {
          existing[0] = (existing[1] * existing[0] + f * m) / (existing[1] + f);
          existing[1] += f;
        }
      }
    }
    return result;
  }

  private static void prune(TreeMap<Integer, double[]> bins, double minFraction) {
    Iterator<double[]> iterator = bins.values().iterator();
    while (iterator.hasNext()) {
      if (iterator.next()[1] < minFraction) {
        iterator.remove();
      }
    }
  }
}
