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

package com.act.molmass.utils;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertEquals;

public class TSVWriterTest {

  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private static Map<String, String> row(String... keysAndValues) {
    Map<String, String> row = new HashMap<>();
    for (int i = 0; i < keysAndValues.length; i += 2) {
      row.put(keysAndValues[i], keysAndValues[i + 1]);
    }
    return row;
  }

  @Test
  public void testColumnsFollowHeaderOrder() throws Exception {
    StringBuilder out = new StringBuilder();
    try (TSVWriter<String, String> writer = new TSVWriter<>(Arrays.asList("mass", "symbol"), out)) {
      writer.append(row("symbol", "H", "mass", "1.00794"));
      writer.append(row("symbol", "He"));
    }
    assertEquals("mass\tsymbol\n1.00794\tH\n\tHe\n", out.toString());
  }

  @Test
  public void testValuesWithTabsAreQuoted() throws Exception {
    StringBuilder out = new StringBuilder();
    try (TSVWriter<String, String> writer = new TSVWriter<>(Arrays.asList("a", "b"), out)) {
      writer.appendAll(Arrays.asList(row("a", "x", "b", "y\tz")));
    }
    assertEquals("a\tb\nx\t\"y\tz\"\n", out.toString());
  }

  @Test
  public void testToFile() throws Exception {
    File file = temporaryFolder.newFile("spectrum.tsv");
    try (TSVWriter<String, String> writer = TSVWriter.toFile(Arrays.asList("mass_number"), file)) {
      writer.append(row("mass_number", "18"));
    }
    assertEquals(Arrays.asList("mass_number", "18"), Files.readAllLines(file.toPath(), StandardCharsets.UTF_8));
  }
}
