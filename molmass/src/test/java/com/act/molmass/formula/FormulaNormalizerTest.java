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
import org.junit.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class FormulaNormalizerTest {

  private final FormulaNormalizer normalizer = new FormulaNormalizer();

  private void assertNormalized(String expected, String input) throws FormulaException {
    assertEquals(input, expected, normalizer.normalize(input));
  }

  private FormulaException assertFails(String input) {
    try {
      normalizer.normalize(input);
    } catch (FormulaException e) {
      return e;
    }
    fail(String.format("Expected %s to be rejected", input));
    return null;
  }

  @Test
  public void testPlainFormulaIsUnchanged() throws Exception {
    assertNormalized("H2O", "H2O");
    assertNormalized("H2O", " H2 O ");
    assertNormalized("[(CH3)3Si2]2NNa", "[(CH3)3Si2]2NNa");
  }

  @Test
  public void testGroupAbbreviations() throws Exception {
    assertNormalized("(C5H8NO2)", "Valohp");
    assertNormalized("H(C6H11NO)2OH", "HLeu2OH");
  }

  @Test
  public void testCustomGroups() throws Exception {
    Map<String, String> groups = new HashMap<>();
    groups.put("Ac", "C2H3O");
    FormulaNormalizer custom = new FormulaNormalizer(ElementTable.getInstance(), groups, true, true, true, true);
    assertEquals("(C2H3O)OH", custom.normalize("AcOH"));
    // The built-in table is not used.
    assertEquals("Valohp", custom.normalize("Valohp"));
  }

  @Test
  public void testDeuterium() throws Exception {
    assertNormalized("[2H]2O", "D2O");
    assertNormalized("[2H]HO", "DHO");
    // Dy is dysprosium, not deuterium.
    assertNormalized("Dy", "Dy");
  }

  @Test
  public void testArithmetic() throws Exception {
    assertNormalized("CuSO4(H2O)5", "CuSO4.5H2O");
    assertNormalized("CuSO4(H2O)5", "CuSO4+5*H2O");
    assertNormalized("(C6H5)NH2HCl", "PhNH2.HCl");
  }

  @Test
  public void testCharges() throws Exception {
    assertNormalized("[C8H14Br4H]+", "C8H14Br4+H+");
    assertNormalized("C8H14Br4", "C8H14Br4+-");
    assertNormalized("[C14H17N2O]-", "C14H17N2O_-");
    assertNormalized("[C56H75I4N13O2Pt2]2+", "C56H75I4N13O2Pt2++");
    assertNormalized("[C56H75I4N13O2Pt2]2+", "C56H75I4N13O2Pt2_2+");
    assertNormalized("[SO4]2-", "SO4_2-");
    assertNormalized("[SO4]2-", "[SO4]2-");
    assertNormalized("[[F]]2-", "[[F]]2-");
  }

  @Test
  public void testSequences() throws Exception {
    assertNormalized("((C10H12N5O5P)(C9H12N3O6P)H2O)", "ssdna(AC)");
    assertNormalized("((C2H3NO)2H2O)", "peptide(GG)");
    assertNormalized("((C10H12N5O6P)2(C9H11N2O8P)2(H2O)2)", "dsrna(AU)");
    assertNormalized(
        "((C4H5NO3)(C5H7NO3)(C2H3NO)2(C6H12N2O)(C6H11NO)2(C5H9NOS)(C5H8N2O2)(C6H12N4O)H2O)", "MDRGEQGLLK");
    // Sequences of only G are read as DNA.
    assertNormalized("((C10H12N5O6P)2H2O)", "GG");
  }

  @Test
  public void testFractions() throws Exception {
    assertNormalized("O2[30Si]3", "O: 0.26, 30Si: 0.74");
    assertNormalized("H2O", "H: 0.112, O: 0.888");
  }

  @Test
  public void testSwitchesDisableExpansions() throws Exception {
    FormulaNormalizer plain = new FormulaNormalizer(
        ElementTable.getInstance(), ChemicalGroups.DEFAULT, false, false, false, false);
    assertEquals("Valohp", plain.normalize("Valohp"));
    assertEquals("CuSO4.5H2O", plain.normalize("CuSO4.5H2O"));
    assertEquals("GG", plain.normalize("GG"));
    assertEquals("O:0.26,30Si:0.74", plain.normalize("O: 0.26, 30Si: 0.74"));
    assertEquals(Collections.emptyMap(), new FormulaNormalizer(ElementTable.getInstance(),
        Collections.emptyMap(), true, true, true, true).getGroups());
  }

  @Test
  public void testSubtractionIsNotAllowed() {
    FormulaException e = assertFails("(H2O)2-H2O");
    assertEquals("subtraction not allowed", e.getReason());
    assertEquals(6, e.getPosition());
    assertEquals("subtraction not allowed\n(H2O)2-H2O\n......^", e.getMessage());

    assertEquals("subtraction not allowed", assertFails("O2_-2").getReason());
  }

  @Test
  public void testMalformedArithmetic() {
    assertEquals("unexpected character", assertFails("C+a").getReason());
    assertEquals("unexpected character", assertFails("H2O++H").getReason());
    assertEquals("unexpected character", assertFails("H2*O").getReason());
  }

  @Test
  public void testMalformedFractions() {
    assertEquals("invalid list of mass fractions", assertFails("C: x, H: 1").getReason());
    assertEquals("unknown element 'Ox'", assertFails("Ox: 0.26, 30Si: 0.74").getReason());
    assertEquals("unknown isotope '[31Si]'", assertFails("O: 0.26, 31Si: 0.74").getReason());
  }

  @Test
  public void testNullIsRejected() {
    assertEquals("not a string", assertFails(null).getReason());
  }
}
