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

package com.act.molmass.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class AnalysisReportTest {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private final FormulaAnalyzer analyzer = new FormulaAnalyzer();

  @Test
  public void testJson() throws Exception {
    JsonNode json = OBJECT_MAPPER.readTree(analyzer.report("SO4_2-").toJson());
    assertEquals("SO4_2-", json.get("input").asText());
    assertEquals("[SO4]2-", json.get("expanded").asText());
    assertEquals("[O4S]2-", json.get("formula").asText());
    assertEquals("O4S", json.get("empirical").asText());
    assertEquals(-2, json.get("charge").asInt());
    assertEquals(5, json.get("atoms").asInt());
    assertEquals(96.06351715981813, json.get("mass").asDouble(), 1e-9);
    assertEquals(96, json.get("nominal_mass").asInt());
    assertEquals(0.9407005719000737, json.get("monoisotopic_abundance").asDouble(), 1e-9);
    assertFalse(json.has("error"));
    assertFalse(json.has("failed"));

    JsonNode composition = json.get("composition");
    assertEquals(3, composition.size());
    assertEquals("O", composition.get(0).get("symbol").asText());
    assertEquals("e-", composition.get(2).get("symbol").asText());
    assertEquals(2, composition.get(2).get("count").asInt());

    JsonNode peak = json.get("spectrum").get(0);
    assertEquals(96, peak.get("mass_number").asInt());
    assertEquals(47.97641340624906, peak.get("mz").asDouble(), 1e-9);
    assertFalse(peak.has("massNumber"));
  }

  @Test
  public void testFailedReportCarriesOnlyInputAndError() throws Exception {
    JsonNode json = OBJECT_MAPPER.readTree(analyzer.report("H0").toJson());
    assertEquals(2, json.size());
    assertEquals("H0", json.get("input").asText());
    assertTrue(json.get("error").asText().startsWith("count is zero"));
  }

  @Test
  public void testJsonList() throws Exception {
    JsonNode json = OBJECT_MAPPER.readTree(
        AnalysisReport.toJson(Arrays.asList(analyzer.report("H2O"), analyzer.report("Xy"))));
    assertTrue(json.isArray());
    assertEquals(2, json.size());
    assertEquals("H2O", json.get(0).get("formula").asText());
    assertTrue(json.get(1).has("error"));
  }
}
