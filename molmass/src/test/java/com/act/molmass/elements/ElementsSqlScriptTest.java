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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ElementsSqlScriptTest {

  private static int countOccurrences(String text, String pattern) {
    int count = 0;
    int index = text.indexOf(pattern);
    while (index >= 0) {
      count++;
      index = text.indexOf(pattern, index + pattern.length());
    }
    return count;
  }

  @Test
  public void testScriptCreatesAndPopulatesAllTables() {
    String sql = new ElementsSqlScript(ElementTable.getInstance()).generate();

    for (String table : new String[]{"period", "group", "block", "series", "element", "isotope", "eleconfig",
        "ionenergy"}) {
      assertTrue(table, sql.contains("CREATE TABLE \"" + table + "\""));
    }
    assertEquals(7, countOccurrences(sql, "INSERT INTO \"period\""));
    assertEquals(18, countOccurrences(sql, "INSERT INTO \"group\""));
    assertEquals(109, countOccurrences(sql, "INSERT INTO \"element\""));
    assertEquals(313, countOccurrences(sql, "INSERT INTO \"isotope\""));
    assertEquals(615, countOccurrences(sql, "INSERT INTO \"ionenergy\""));
  }

  @Test
  public void testElementRowFormat() {
    String sql = new ElementsSqlScript(ElementTable.getInstance()).generate();
    assertTrue(sql.contains("INSERT INTO \"element\" VALUES (6, 'C', 'Carbon', 2, 14, 'p', 1, 12.0107400000, "));
    assertTrue(sql.contains("INSERT INTO \"isotope\" VALUES (6, 13, 13.0033548351, 0.01070000);"));
    assertTrue(sql.contains("INSERT INTO \"eleconfig\" VALUES (26, 3, 'd', 6);"));
  }
}
