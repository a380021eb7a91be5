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

import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FormulaParserTest {

  private FormulaParser parser;

  @Before
  public void setUp() throws Exception {
    parser = new FormulaParser();
  }

  @Test
  public void testSimpleFormula() throws Exception {
    ParsedFormula water = parser.parse("H2O");
    assertEquals(2, water.getCount("H", ParsedFormula.NATURAL));
    assertEquals(1, water.getCount("O", ParsedFormula.NATURAL));
    assertEquals(0, water.getCount("C", ParsedFormula.NATURAL));
    assertEquals(3, water.getAtoms());
    assertEquals(0, water.getCharge());
  }

  @Test
  public void testRepeatedElementsAreSummed() throws Exception {
    ParsedFormula acid = parser.parse("CH3COOH");
    assertEquals(2, acid.getCount("C", ParsedFormula.NATURAL));
    assertEquals(4, acid.getCount("H", ParsedFormula.NATURAL));
    assertEquals(2, acid.getCount("O", ParsedFormula.NATURAL));
    assertEquals(8, acid.getAtoms());
  }

  @Test
  public void testNestedGroups() throws Exception {
    ParsedFormula parsed = parser.parse("[(CH3)3Si2]2NNa");
    assertEquals(6, parsed.getCount("C", ParsedFormula.NATURAL));
    assertEquals(18, parsed.getCount("H", ParsedFormula.NATURAL));
    assertEquals(4, parsed.getCount("Si", ParsedFormula.NATURAL));
    assertEquals("C6H18NNaSi4", parsed.toString());

    assertEquals(15, parser.parse("{(H2O)<H>}5").getCount("H", ParsedFormula.NATURAL));
  }

  @Test
  public void testHillOrderOfOutput() throws Exception {
    assertEquals("C2H5Br", parser.parse("BrC2H5").toString());
    assertEquals("BrH", parser.parse("HBr").toString());
  }

  @Test
  public void testIsotopes() throws Exception {
    ParsedFormula parsed = parser.parse("[12C]C[13C]2");
    assertEquals(1, parsed.getCount("C", ParsedFormula.NATURAL));
    assertEquals(1, parsed.getCount("C", 12));
    assertEquals(2, parsed.getCount("C", 13));
    assertEquals(4, parsed.getAtoms());
    assertEquals("C[12C][13C]2", parsed.toString());

    // A mass number may open the formula without brackets.
    assertEquals(1, parser.parse("13CH4").getCount("C", 13));
    assertEquals(2, parser.parse("2H2O").getCount("H", 2));
    // Elsewhere, digits before a symbol belong to the preceding term.
    assertEquals(2, parser.parse("H2O").getCount("H", ParsedFormula.NATURAL));
  }

  @Test
  public void testCharge() throws Exception {
    ParsedFormula sulfate = parser.parse("[SO4]2-");
    assertEquals(-2, sulfate.getCharge());
    assertEquals(4, sulfate.getCount("O", ParsedFormula.NATURAL));
    assertEquals("[O4S]2-", sulfate.toString());
    assertEquals(1, parser.parse("[12C]C[13C]+").getCharge());
  }

  @Test
  public void testEmptyFormula() throws Exception {
    assertTrue(parser.parse("", true).isEmpty());
    assertEquals(-1, parser.parse("[]-", true).getCharge());
    assertEquals("empty formula", expectFailure("").getReason());
  }

  @Test
  public void testErrorPositions() throws Exception {
    FormulaException e = expectFailure("[11C]");
    assertEquals("unknown isotope", e.getReason());
    assertEquals(1, e.getPosition());
    assertEquals("unknown isotope\n[11C]\n.^", e.getMessage());

    e = expectFailure("abc");
    assertEquals("unexpected character\nabc\n^", e.getMessage());

    e = expectFailure("C[H");
    assertEquals("missing closing parenthesis", e.getReason());
    assertEquals(1, e.getPosition());

    e = expectFailure("HXe2Qa");
    assertEquals("unknown symbol", e.getReason());
    assertEquals(4, e.getPosition());
  }

  @Test
  public void testErrorReasons() throws Exception {
    assertEquals("invalid formula", expectFailure("()").getReason());
    assertEquals("number preceding formula", expectFailure("2").getReason());
    assertEquals("missing opening parenthesis", expectFailure("H)2").getReason());
    assertEquals("count is zero", expectFailure("H0").getReason());
    assertEquals("count is zero", expectFailure("(H)0C").getReason());
    assertEquals("count too large", expectFailure("H99999999999").getReason());
    assertEquals("count too large", expectFailure("(H2000000000)2").getReason());
    assertEquals("unknown isotope", expectFailure("1C").getReason());
    assertEquals("unknown isotope", expectFailure("[1200C]").getReason());
    assertEquals("unknown symbol", expectFailure("Aa").getReason());
  }

  @Test
  public void testTotalAtomCountMustFitInt() throws Exception {
    assertEquals(2000000000, parser.parse("C1000000000H1000000000").getAtoms());
    assertEquals("count too large", expectFailure("C2000000000H2000000000").getReason());
    assertEquals("count too large", expectFailure("(CH)1500000000").getReason());
  }

  @Test
  public void testInvalidFormulas() {
    List<String> invalid = Arrays.asList(
        "()", "2", "a", "(a)", "C:H", "H:", "C[H", "H)2", "A", "Aa", "2lC", "1C", "[11C]", "H0", "()0", "(H)0C",
        "Ox: 0.26, 30Si: 0.74", "H^++", "[CHNOP[13C]]__2-", "O2_-2", "C+a");
    for (String formula : invalid) {
      try {
        parser.parse(formula);
        fail(String.format("Expected %s to be rejected", formula));
      } catch (FormulaException e) {
        assertTrue(formula, !e.getReason().isEmpty());
      }
    }
  }

  private FormulaException expectFailure(String formula) {
    try {
      parser.parse(formula);
    } catch (FormulaException e) {
      return e;
    }
    fail(String.format("Expected %s to be rejected", formula));
    return null;
  }
}
