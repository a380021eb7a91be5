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

import com.act.molmass.formula.FormulaParser;
import com.act.molmass.formula.ParsedFormula;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class SpectrumCalculatorTest {
  private static final double MASS_TOLERANCE = 1e-9;

  private FormulaParser parser;
  private SpectrumCalculator calculator;

  @Before
  public void setUp() throws Exception {
    parser = new FormulaParser();
    calculator = new SpectrumCalculator(parser.getElementTable());
  }

  private static void assertEntry(SpectrumEntry entry, int massNumber, double mass, double fraction) {
    assertEquals(massNumber, entry.getMassNumber());
    assertEquals(mass, entry.getMass(), MASS_TOLERANCE);
    assertEquals(fraction, entry.getFraction(), MASS_TOLERANCE);
  }

  @Test
  public void testHydrogen() throws Exception {
    Spectrum spectrum = calculator.spectrum(parser.parse("H"));
    assertEquals(2, spectrum.size());
    assertEntry(spectrum.get(1), 1, 1.00782503223, 0.999885);
    assertEntry(spectrum.get(2), 2, 2.01410177812, 0.000115);
    assertEquals(100.0, spectrum.get(1).getIntensity(), MASS_TOLERANCE);
    assertEquals(0.011501322652, spectrum.get(2).getIntensity(), MASS_TOLERANCE);
    assertEquals(spectrum.get(2).getMass(), spectrum.get(2).getMz(), 0.0);
    assertEquals(1.00794075406, spectrum.mean(), MASS_TOLERANCE);
  }

  @Test
  public void testProton() throws Exception {
    Spectrum spectrum = calculator.spectrum(parser.parse("[H]+"));
    assertEquals(1, spectrum.getCharge());
    assertEquals(1.007276452320935, spectrum.get(1).getMass(), MASS_TOLERANCE);
    assertEquals(2.013553198210935, spectrum.get(2).getMass(), MASS_TOLERANCE);
    assertEquals(spectrum.get(1).getMass(), spectrum.get(1).getMz(), 0.0);
  }

  @Test
  public void testWater() throws Exception {
    Spectrum spectrum = calculator.spectrum(parser.parse("H2O"));
    assertEquals(Arrays.asList(18, 19, 20, 21), new ArrayList<>(spectrum.getEntries().keySet()));
    assertEntry(spectrum.get(18), 18, 18.01056468403, 0.9973405720928632);
    assertEntry(spectrum.get(19), 19, 19.015557273801367, 0.000609327319299);
    assertEntry(spectrum.get(20), 20, 20.014809997233012, 0.0020496291099235);
    assertEquals(4.714508030000001e-07, spectrum.get(21).getFraction(), 1e-15);
    assertEquals(18.015286431832642, spectrum.mean(), MASS_TOLERANCE);
    assertEquals(spectrum.get(18), spectrum.peak());
  }

  @Test
  public void testExplicitIsotopeShiftsBins() throws Exception {
    Spectrum spectrum = calculator.spectrum(parser.parse("[2H]HO"));
    assertEquals(Pair.of(19, 22), spectrum.range());
    assertEntry(spectrum.get(19), 19, 19.01684142992, 0.99745527945);
    assertEquals(20.0215362109376, spectrum.get(20).getMass(), MASS_TOLERANCE);
    assertEquals(21.021086556430518, spectrum.get(21).getMass(), MASS_TOLERANCE);
    assertEquals(22.027363169100003, spectrum.get(22).getMass(), MASS_TOLERANCE);
    assertEquals(19.021447456494055, spectrum.mean(), MASS_TOLERANCE);

    Spectrum labeled = calculator.spectrum(parser.parse("C[13C]H4"));
    assertEquals(Pair.of(29, 31), labeled.range());
    assertEntry(labeled.get(29), 29, 29.034654963989993, 0.9888450004949368);
  }

  @Test
  public void testAnionWithMinimumIntensity() throws Exception {
    Spectrum spectrum = calculator.spectrum(parser.parse("[SO4]2-"), SpectrumCalculator.DEFAULT_MIN_FRACTION, 0.1);
    assertEquals(3, spectrum.size());
    assertEquals(Pair.of(96, 98), spectrum.range());

    SpectrumEntry peak = spectrum.peak();
    assertEquals(96, peak.getMassNumber());
    assertEquals(95.95282681249812, peak.getMass(), MASS_TOLERANCE);
    assertEquals(47.97641340624906, peak.getMz(), MASS_TOLERANCE);

    assertEquals(96.95299577311235, spectrum.get(97).getMass(), MASS_TOLERANCE);
    assertEquals(0.94192705518, spectrum.get(97).getIntensity(), MASS_TOLERANCE);
    assertEquals(48.476497886556174, spectrum.get(97).getMz(), MASS_TOLERANCE);
    assertEquals(5.29744274039, spectrum.get(98).getIntensity(), MASS_TOLERANCE);
    assertEquals(48.97496783461454, spectrum.get(98).getMz(), MASS_TOLERANCE);
    // Fractions are not renormalized after filtering.
    assertEquals(96.00309815456313, spectrum.mean(), MASS_TOLERANCE);
  }

  @Test
  public void testMinimumFractionPrunesBins() throws Exception {
    ParsedFormula sulfate = parser.parse("[SO4]2-");
    assertEquals(9, calculator.spectrum(sulfate).size());
    Spectrum pruned = calculator.spectrum(sulfate, 1e-4, null);
    assertTrue(pruned.size() < 9);
    for (SpectrumEntry entry : pruned) {
      assertTrue(entry.getFraction() >= 1e-4);
    }
  }

  @Test
  public void testEmptyFormula() throws Exception {
    Spectrum spectrum = calculator.spectrum(new ParsedFormula(Collections.emptyMap(), 0));
    assertTrue(spectrum.isEmpty());
  }
}
