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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.fail;

public class FormulaTest {
  private static final double MASS_TOLERANCE = 1e-6;

  @Test
  public void testEthanol() throws Exception {
    Formula ethanol = new Formula("EtOH");
    assertEquals("(C2H5)OH", ethanol.getExpanded());
    assertEquals("C2H6O", ethanol.getFormula());
    assertEquals("C2H6O", ethanol.getEmpirical());
    assertEquals(9, ethanol.getAtoms());
    assertEquals(46.068531, ethanol.getMass(), MASS_TOLERANCE);
    assertEquals(46.041864812949996, ethanol.getMonoisotopicMass(), MASS_TOLERANCE);
    assertEquals(0.9756627354527866, ethanol.getIsotope().getAbundance(), MASS_TOLERANCE);
    assertEquals(46, ethanol.getNominalMass());
    assertEquals(ethanol.getMass(), ethanol.getMz(), 0.0);
  }

  @Test
  public void testCaffeine() throws Exception {
    Formula caffeine = new Formula("C8H10N4O2");
    assertEquals("C8H10N4O2", caffeine.getFormula());
    assertEquals("C4H5N2O", caffeine.getEmpirical());
    assertEquals(2, caffeine.getGcd());
    assertEquals(194.190952, caffeine.getMass(), MASS_TOLERANCE);
    assertEquals(194.08037557916, caffeine.getMonoisotopicMass(), MASS_TOLERANCE);
    assertEquals(0.89882781, caffeine.getIsotope().getAbundance(), MASS_TOLERANCE);
    assertEquals(194, caffeine.getNominalMass());
  }

  @Test
  public void testCommonMasses() throws Exception {
    assertEquals(18.015287, new Formula("H2O").getMass(), MASS_TOLERANCE);
    assertEquals(20.02760855624, new Formula("D2O").getMass(), MASS_TOLERANCE);
    assertEquals(249.684855, new Formula("CuSO4.5H2O").getMass(), MASS_TOLERANCE);
    assertEquals(180.156162, new Formula("C6H12O6").getMass(), MASS_TOLERANCE);
  }

  @Test
  public void testDeuteratedWater() throws Exception {
    Formula heavyWater = new Formula("D2O");
    assertEquals("[2H]2O", heavyWater.getExpanded());
    assertEquals("[2H]2O", heavyWater.getFormula());
    assertEquals("<sup>2</sup>H<sub>2</sub>O", heavyWater.toHtml());
  }

  @Test
  public void testHydrateIsWrittenInHillOrder() throws Exception {
    Formula hydrate = new Formula("CuSO4.5H2O");
    assertEquals("CuSO4(H2O)5", hydrate.getExpanded());
    assertEquals("CuH10O9S", hydrate.getFormula());
    assertEquals(21, hydrate.getAtoms());
  }

  @Test
  public void testChargedFormulas() throws Exception {
    Formula sulfate = new Formula("SO4_2-");
    assertEquals("[SO4]2-", sulfate.getExpanded());
    assertEquals("[O4S]2-", sulfate.getFormula());
    assertEquals("O4S", sulfate.getEmpirical());
    assertEquals(1, sulfate.getGcd());
    assertEquals(-2, sulfate.getCharge());
    assertEquals(96.06351715981813, sulfate.getMass(), MASS_TOLERANCE);
    assertEquals(96.06351715981813 / 2, sulfate.getMz(), MASS_TOLERANCE);
    assertEquals("O<sub>4</sub>S<sup>2-</sup>", sulfate.toHtml());

    Formula ethylene = new Formula("[C2H4]2+");
    assertEquals(28.05214684018187, ethylene.getMass(), MASS_TOLERANCE);
    assertEquals(2, ethylene.getGcd());
    assertEquals("CH2", ethylene.getEmpirical());
  }

  @Test
  public void testFormulaReparsesToSameContent() throws Exception {
    for (String input : new String[] {"H2O", "[13C]H4+", "SO4_2-", "D2O", "CuSO4.5H2O", "12C", "C[13C]2H6O3_3-",
        "EtOH", "[C2H4]2+", "MDRGEQGLLK"}) {
      Formula formula = new Formula(input);
      Formula reparsed = new Formula(formula.getFormula());
      assertEquals(input, formula.getParsed(), reparsed.getParsed());
      assertEquals(input, formula.getFormula(), reparsed.getFormula());
    }
  }

  @Test
  public void testEmpiricalIgnoresCharge() throws Exception {
    Formula hydrogen = new Formula("H4+");
    assertEquals(4, hydrogen.getGcd());
    assertEquals("H", hydrogen.getEmpirical());

    Formula glucose = new Formula("[C6H12O6]+");
    assertEquals(6, glucose.getGcd());
    assertEquals("CH2O", glucose.getEmpirical());

    Formula labeled = new Formula("[13C]2C2H8_3-");
    assertEquals(2, labeled.getGcd());
    assertEquals("C[13C]H4", labeled.getEmpirical());
  }

  @Test
  public void testSequences() throws Exception {
    Formula peptide = new Formula("MDRGEQGLLK");
    assertEquals("C47H83N15O16S", peptide.getFormula());
    assertEquals(162, peptide.getAtoms());
    assertEquals(1146.319708, peptide.getMass(), MASS_TOLERANCE);

    Formula allAminoAcids = new Formula("GPAVLIMCFYWHKRQNEDST");
    assertEquals("C107H159N29O30S2", allAminoAcids.getFormula());
    assertEquals(327, allAminoAcids.getAtoms());
    assertEquals(2395.717936, allAminoAcids.getMass(), MASS_TOLERANCE);

    Formula dna = new Formula("CGCGAATTCGCG");
    assertEquals("C116H148N46O73P12", dna.getFormula());
    assertEquals(395, dna.getAtoms());
    assertEquals(3726.371155, dna.getMass(), MASS_TOLERANCE);

    Formula doubleStranded = new Formula("dsdna(ATCG)");
    assertEquals("C78H102N30O50P8", doubleStranded.getFormula());
    assertEquals(268, doubleStranded.getAtoms());
    assertEquals(2507.609138, doubleStranded.getMass(), MASS_TOLERANCE);

    Formula rna = new Formula("ssrna(AUCG)");
    assertEquals("C38H49N15O29P4", rna.getFormula());
    assertEquals(135, rna.getAtoms());
    assertEquals(1303.775567, rna.getMass(), MASS_TOLERANCE);
  }

  @Test
  public void testEmptyFormula() throws Exception {
    Formula empty = new Formula("", new FormulaNormalizer(), new FormulaParser(), true);
    assertEquals(0, empty.getAtoms());
    assertEquals(1, empty.getGcd());
    assertEquals("", empty.getFormula());
    assertEquals(0.0, empty.getMass(), 0.0);
    assertEquals(0, empty.spectrum().size());

    try {
      new Formula("");
      fail("Empty formulas are rejected by default");
    } catch (FormulaException e) {
      assertEquals("empty formula", e.getReason());
    }
  }

  @Test
  public void testAdd() throws Exception {
    Formula hydronium = new Formula("H2O").add(new Formula("H+"));
    assertEquals("[(H2O)(H)]+", hydronium.getExpanded());
    assertEquals("[H3O]+", hydronium.getFormula());
    assertEquals(1, hydronium.getCharge());
    assertEquals(new Formula("[H3O]+"), hydronium);
    assertEquals(new Formula("[H3O]+").getMass(), hydronium.getMass(), MASS_TOLERANCE);
  }

  @Test
  public void testSubtract() throws Exception {
    Formula methyl = new Formula("CH4").subtract(new Formula("H"));
    assertEquals("CH3", methyl.getFormula());
    assertEquals(new Formula("CH3"), methyl);

    Formula labeled = new Formula("[13C]CH4").subtract(new Formula("[13C]"));
    assertEquals("CH4", labeled.getFormula());

    Formula anion = new Formula("H2O").subtract(new Formula("H+"));
    assertEquals("[HO]-", anion.getFormula());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSubtractMissingElement() throws Exception {
    new Formula("CH4").subtract(new Formula("O"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testSubtractTooMany() throws Exception {
    new Formula("CH4").subtract(new Formula("H5"));
  }

  @Test
  public void testMultiply() throws Exception {
    Formula water = new Formula("H2O").multiply(3);
    assertEquals("(H2O)3", water.getExpanded());
    assertEquals("H6O3", water.getFormula());
    assertEquals("H2O", water.getEmpirical());
    assertEquals(3 * 18.015287, water.getMass(), 3 * MASS_TOLERANCE);

    Formula sulfate = new Formula("SO4_2-").multiply(2);
    assertEquals("[(O4S)2]4-", sulfate.getExpanded());
    assertEquals("[O8S2]4-", sulfate.getFormula());
    assertEquals("O4S", sulfate.getEmpirical());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMultiplyByZero() throws Exception {
    new Formula("H2O").multiply(0);
  }

  @Test
  public void testEquality() throws Exception {
    assertEquals(new Formula("H2O"), new Formula("HOH"));
    assertEquals(new Formula("H2O").hashCode(), new Formula("HOH").hashCode());
    assertNotEquals(new Formula("H2O"), new Formula("D2O"));
    assertNotEquals(new Formula("H2O"), new Formula("[H2O]+"));
  }

  @Test
  public void testSpectrumIsCached() throws Exception {
    Formula water = new Formula("H2O");
    assertEquals(water.spectrum(), water.spectrum());
    assertEquals(4, water.spectrum().size());
    assertEquals(water.composition(), water.composition(true));
  }
}
