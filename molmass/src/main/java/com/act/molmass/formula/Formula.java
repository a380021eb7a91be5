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

import com.act.molmass.elements.ElementTable;
import com.act.molmass.mass.Composition;
import com.act.molmass.mass.MassCalculator;
import com.act.molmass.mass.MolecularIsotope;
import com.act.molmass.spectrum.Spectrum;
import com.act.molmass.spectrum.SpectrumCalculator;
import org.apache.commons.lang3.tuple.Pair;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A chemical formula with its masses, elemental composition and mass distribution.
 *
 * The input is normalized and parsed once, on construction.  Derived values are computed on first access and kept;
 * instances are not safe for concurrent first access.
 */
public class Formula {
  private final String expanded;
  private final ParsedFormula parsed;
  private final MassCalculator massCalculator;
  private final SpectrumCalculator spectrumCalculator;

  private String hill;
  private String empirical;
  private Integer gcd;
  private Double mass;
  private MolecularIsotope isotope;
  private Composition composition;
  private Composition isotopicComposition;
  private final Map<Pair<Double, Double>, Spectrum> spectra = new HashMap<>();

  public Formula(String formula) throws FormulaException {
    this(formula, new FormulaNormalizer(), new FormulaParser(), false);
  }

  /**
   * @param formula The formula as typed by a user.
   * @param normalizer Expands groups, sequences, arithmetic and charges.
   * @param parser Reads the normalized formula; its element table is used for all masses.
   * @param allowEmpty Whether a formula without elements is acceptable.
   * @throws FormulaException if the formula is malformed.
   */
  public Formula(String formula, FormulaNormalizer normalizer, FormulaParser parser, boolean allowEmpty)
      throws FormulaException {
    this(normalizer.normalize(formula), parser, allowEmpty);
  }

  private Formula(String expanded, FormulaParser parser, boolean allowEmpty) throws FormulaException {
    this(expanded, parser.parse(expanded, allowEmpty), parser.getElementTable());
  }

  private Formula(String expanded, ParsedFormula parsed, ElementTable elementTable) {
    this.expanded = expanded;
    this.parsed = parsed;
    this.massCalculator = new MassCalculator(elementTable);
    this.spectrumCalculator = new SpectrumCalculator(elementTable);
  }

  /**
   * The normalized input, e.g. "CuSO4(H2O)5" for "CuSO4.5H2O".
   */
  public String getExpanded() {
    return expanded;
  }

  public ParsedFormula getParsed() {
    return parsed;
  }

  /**
   * The formula in Hill notation, with charge, e.g. "[O4S]2-".
   */
  public String getFormula() {
    if (hill == null) {
      hill = ChargeNotation.join(FormulaWriter.fromElements(parsed.getElements()), parsed.getCharge());
    }
    return hill;
  }

  /**
   * The formula with the simplest whole number ratio of atoms, in Hill notation.  The charge is not part of it.
   */
  public String getEmpirical() {
    if (empirical == null) {
      empirical = FormulaWriter.fromElements(parsed.getElements(), getGcd());
    }
    return empirical;
  }

  public String toHtml() {
    String body = FormulaWriter.fromElements(parsed.getElements(), 1, FormulaWriter.FormulaFormat.HTML);
    return body + FormulaWriter.FormulaFormat.HTML.charge(parsed.getCharge());
  }

  public int getAtoms() {
    return parsed.getAtoms();
  }

  public int getCharge() {
    return parsed.getCharge();
  }

  /**
   * Greatest common divisor of all atom counts; 1 for an empty formula.
   */
  public int getGcd() {
    if (gcd == null) {
      int result = 0;
      for (SortedMap<Integer, Integer> isotopes : parsed.getElements().values()) {
        for (Integer count : isotopes.values()) {
          result = gcd(result, count);
        }
      }
      gcd = result == 0 ? 1 : result;
    }
    return gcd;
  }

  /**
   * Average relative molecular mass, corrected for the charge.
   */
  public double getMass() {
    if (mass == null) {
      mass = massCalculator.mass(parsed);
    }
    return mass;
  }

  public double getMz() {
    return MassCalculator.massChargeRatio(getMass(), parsed.getCharge());
  }

  public MolecularIsotope getIsotope() {
    if (isotope == null) {
      isotope = massCalculator.isotope(parsed);
    }
    return isotope;
  }

  public double getMonoisotopicMass() {
    return getIsotope().getMass();
  }

  public int getNominalMass() {
    return getIsotope().getMassNumber();
  }

  public Composition composition() {
    return composition(true);
  }

  public Composition composition(boolean isotopic) {
    if (isotopic) {
      if (isotopicComposition == null) {
        isotopicComposition = massCalculator.composition(parsed, true);
      }
      return isotopicComposition;
    }
    if (composition == null) {
      composition = massCalculator.composition(parsed, false);
    }
    return composition;
  }

  public Spectrum spectrum() {
    return spectrum(SpectrumCalculator.DEFAULT_MIN_FRACTION, null);
  }

  public Spectrum spectrum(double minFraction, Double minIntensity) {
    Pair<Double, Double> key = Pair.of(minFraction, minIntensity);
    Spectrum spectrum = spectra.get(key);
    if (spectrum == null) {
      spectrum = spectrumCalculator.spectrum(parsed, minFraction, minIntensity);
      spectra.put(key, spectrum);
    }
    return spectrum;
  }

  /**
   * Combines two formulas; charges add up.
   */
  public Formula add(Formula other) {
    Map<String, Map<Integer, Integer>> elements = copyElements(parsed);
    for (Map.Entry<String, SortedMap<Integer, Integer>> entry : other.parsed.getElements().entrySet()) {
      Map<Integer, Integer> isotopes = elements.computeIfAbsent(entry.getKey(), k -> new TreeMap<>());
      for (Map.Entry<Integer, Integer> selector : entry.getValue().entrySet()) {
        isotopes.merge(selector.getKey(), selector.getValue(), Math::addExact);
      }
    }
    int charge = Math.addExact(parsed.getCharge(), other.parsed.getCharge());
    String text = ChargeNotation.join(
        "(" + FormulaWriter.fromElements(parsed.getElements()) + ")(" +
            FormulaWriter.fromElements(other.parsed.getElements()) + ")", charge);
    return derive(text, new ParsedFormula(elements, charge));
  }

  /**
   * Removes the atoms and charge of another formula from this one.
   * @throws IllegalArgumentException if other contains an element or isotope this formula lacks, or more of it.
   */
  public Formula subtract(Formula other) {
    Map<String, Map<Integer, Integer>> elements = copyElements(parsed);
    for (Map.Entry<String, SortedMap<Integer, Integer>> entry : other.parsed.getElements().entrySet()) {
      Map<Integer, Integer> isotopes = elements.get(entry.getKey());
      for (Map.Entry<Integer, Integer> selector : entry.getValue().entrySet()) {
        Integer count = isotopes == null ? null : isotopes.get(selector.getKey());
        if (count == null) {
          throw new IllegalArgumentException(String.format("Cannot subtract %s, not in %s",
              isotopeName(entry.getKey(), selector.getKey()), getFormula()));
        }
        int remaining = count - selector.getValue();
        if (remaining < 0) {
          throw new IllegalArgumentException(String.format("Cannot subtract %d %s from %s",
              selector.getValue(), isotopeName(entry.getKey(), selector.getKey()), getFormula()));
        }
        if (remaining == 0) {
          isotopes.remove(selector.getKey());
        } else {
          isotopes.put(selector.getKey(), remaining);
        }
      }
      if (isotopes.isEmpty()) {
        elements.remove(entry.getKey());
      }
    }
    ParsedFormula result = new ParsedFormula(elements, parsed.getCharge() - other.parsed.getCharge());
    return derive(result.toString(), result);
  }

  /**
   * Repeats the formula number times, charge included.
   * @throws IllegalArgumentException if number is smaller than 1.
   */
  public Formula multiply(int number) {
    if (number < 1) {
      throw new IllegalArgumentException(String.format("Cannot multiply formula by %d", number));
    }
    Map<String, Map<Integer, Integer>> elements = copyElements(parsed);
    for (Map<Integer, Integer> isotopes : elements.values()) {
      for (Map.Entry<Integer, Integer> selector : isotopes.entrySet()) {
        selector.setValue(Math.multiplyExact(selector.getValue(), number));
      }
    }
    int charge = Math.multiplyExact(parsed.getCharge(), number);
    String text = ChargeNotation.join(
        "(" + FormulaWriter.fromElements(parsed.getElements()) + ")" + number, charge);
    return derive(text, new ParsedFormula(elements, charge));
  }

  private Formula derive(String text, ParsedFormula result) {
    return new Formula(text, result, massCalculator.getElementTable());
  }

  private static Map<String, Map<Integer, Integer>> copyElements(ParsedFormula formula) {
    Map<String, Map<Integer, Integer>> elements = new LinkedHashMap<>();
    for (Map.Entry<String, SortedMap<Integer, Integer>> entry : formula.getElements().entrySet()) {
      elements.put(entry.getKey(), new TreeMap<>(entry.getValue()));
    }
    return elements;
  }

  private static String isotopeName(String symbol, int selector) {
    return selector == ParsedFormula.NATURAL ? symbol : "[" + selector + symbol + "]";
  }

  private static int gcd(int a, int b) {
    while (b != 0) {
      int t = a % b;
      a = b;
      b = t;
    }
    return a;
  }

  @Override
  public String toString() {
    return expanded;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return parsed.equals(((Formula) o).parsed);
  }

  @Override
  public int hashCode() {
    return parsed.hashCode();
  }
}
