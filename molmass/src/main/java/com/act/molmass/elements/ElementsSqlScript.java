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

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Generates an SQL script that creates and populates tables of periods, groups, blocks, series, elements, isotopes,
 * electron configurations and ionization energies.  The dialect is plain enough for sqlite.
 */
public class ElementsSqlScript {

  private static final String SCHEMA = StringUtils.join(new String[]{
      "CREATE TABLE \"period\" (\n",
      "    \"number\" TINYINT NOT NULL PRIMARY KEY,\n",
      "    \"label\" CHAR NOT NULL UNIQUE,\n",
      "    \"description\" VARCHAR(64)\n",
      ");\n",
      "CREATE TABLE \"group\" (\n",
      "    \"number\" TINYINT NOT NULL PRIMARY KEY,\n",
      "    \"label\" VARCHAR(8) NOT NULL,\n",
      "    \"description\" VARCHAR(64)\n",
      ");\n",
      "CREATE TABLE \"block\" (\n",
      "    \"label\" CHAR NOT NULL PRIMARY KEY,\n",
      "    \"description\" VARCHAR(64)\n",
      ");\n",
      "CREATE TABLE \"series\" (\n",
      "    \"id\" TINYINT NOT NULL PRIMARY KEY,\n",
      "    \"label\" VARCHAR(32) NOT NULL,\n",
      "    \"description\" VARCHAR(256)\n",
      ");\n",
      "CREATE TABLE \"element\" (\n",
      "    \"number\" TINYINT NOT NULL PRIMARY KEY,\n",
      "    \"symbol\" VARCHAR(2) UNIQUE NOT NULL,\n",
      "    \"name\" VARCHAR(16) UNIQUE NOT NULL,\n",
      "    \"period\" TINYINT NOT NULL,\n",
      "    \"group\" TINYINT NOT NULL,\n",
      "    \"block\" CHAR NOT NULL,\n",
      "    \"series\" TINYINT NOT NULL,\n",
      "    \"mass\" REAL NOT NULL,\n",
      "    \"eleneg\" REAL,\n",
      "    \"covrad\" REAL,\n",
      "    \"atmrad\" REAL,\n",
      "    \"vdwrad\" REAL,\n",
      "    \"tboil\" REAL,\n",
      "    \"tmelt\" REAL,\n",
      "    \"density\" REAL,\n",
      "    \"eleaffin\" REAL,\n",
      "    \"eleconfig\" VARCHAR(32),\n",
      "    \"oxistates\" VARCHAR(32),\n",
      "    \"description\" VARCHAR(2048)\n",
      ");\n",
      "CREATE TABLE \"isotope\" (\n",
      "    \"element\" TINYINT NOT NULL,\n",
      "    \"massnum\" TINYINT NOT NULL,\n",
      "    \"mass\" REAL NOT NULL,\n",
      "    \"abundance\" REAL NOT NULL,\n",
      "    PRIMARY KEY (\"element\", \"massnum\")\n",
      ");\n",
      "CREATE TABLE \"eleconfig\" (\n",
      "    \"element\" TINYINT NOT NULL,\n",
      "    \"shell\" TINYINT NOT NULL,\n",
      "    \"subshell\" CHAR NOT NULL,\n",
      "    \"count\" TINYINT,\n",
      "    PRIMARY KEY (\"element\", \"shell\", \"subshell\")\n",
      ");\n",
      "CREATE TABLE \"ionenergy\" (\n",
      "    \"element\" TINYINT NOT NULL,\n",
      "    \"number\" TINYINT NOT NULL,\n",
      "    \"energy\" REAL NOT NULL,\n",
      "    PRIMARY KEY (\"element\", \"number\")\n",
      ");",
  }, "");

  private final ElementTable table;

  public ElementsSqlScript(ElementTable table) {
    this.table = table;
  }

  /**
   * Builds the full script: table definitions followed by one INSERT statement per row.
   * @return The SQL script, one statement per line after the schema.
   */
  public String generate() {
    List<String> statements = new ArrayList<>();
    statements.add(SCHEMA);

    for (Map.Entry<Integer, String> entry : PeriodicTableLabels.PERIODS.entrySet()) {
      statements.add(format("INSERT INTO \"period\" VALUES (%d, %s, NULL);",
          entry.getKey(), quote(entry.getValue())));
    }
    for (Map.Entry<Integer, Pair<String, String>> entry : PeriodicTableLabels.GROUPS.entrySet()) {
      statements.add(format("INSERT INTO \"group\" VALUES (%d, %s, %s);",
          entry.getKey(), quote(entry.getValue().getLeft()), quote(entry.getValue().getRight())));
    }
    for (Map.Entry<String, String> entry : PeriodicTableLabels.BLOCKS.entrySet()) {
      statements.add(format("INSERT INTO \"block\" VALUES (%s, %s);",
          quote(entry.getKey()), quote(entry.getValue())));
    }
    for (Map.Entry<Integer, String> entry : PeriodicTableLabels.SERIES.entrySet()) {
      statements.add(format("INSERT INTO \"series\" VALUES (%d, %s, '');",
          entry.getKey(), quote(entry.getValue())));
    }

    for (Element e : table.getElements()) {
      statements.add(format(
          "INSERT INTO \"element\" VALUES (%d, %s, %s, %d, %d, %s, %d, %.10f, %.4f, %.4f, %.4f, %.4f, %.4f, %.4f, " +
              "%.4f, %.8f, %s, %s, NULL);",
          e.getNumber(), quote(e.getSymbol()), quote(e.getName()), e.getPeriod(), e.getGroup(), quote(e.getBlock()),
          e.getSeries(), e.getMass(), e.getElectronegativity(), e.getCovalentRadius(), e.getAtomicRadius(),
          e.getVanDerWaalsRadius(), e.getBoilingPoint(), e.getMeltingPoint(), e.getDensity(),
          e.getElectronAffinity(), quote(e.getElectronConfiguration()), quote(e.getOxidationStates())));
    }

    for (Element e : table.getElements()) {
      for (Isotope isotope : e.getIsotopes().values()) {
        statements.add(format("INSERT INTO \"isotope\" VALUES (%d, %d, %.10f, %.8f);",
            e.getNumber(), isotope.getMassNumber(), isotope.getMass(), isotope.getAbundance()));
      }
    }

    for (Element e : table.getElements()) {
      for (Map.Entry<Pair<Integer, Character>, Integer> entry : table.getElectronConfiguration(e).entrySet()) {
        statements.add(format("INSERT INTO \"eleconfig\" VALUES (%d, %d, %s, %d);",
            e.getNumber(), entry.getKey().getLeft(), quote(entry.getKey().getRight().toString()), entry.getValue()));
      }
    }

    for (Element e : table.getElements()) {
      List<Double> energies = e.getIonizationEnergies();
      for (int i = 0; i < energies.size(); i++) {
        statements.add(format("INSERT INTO \"ionenergy\" VALUES (%d, %d, %.4f);",
            e.getNumber(), i + 1, energies.get(i)));
      }
    }

    return StringUtils.join(statements, "\n") + "\n";
  }

  private static String format(String template, Object... args) {
    return String.format(Locale.US, template, args);
  }

  private static String quote(String value) {
    return "'" + StringUtils.replace(value, "'", "''") + "'";
  }
}
