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

import com.act.molmass.mass.Composition;
import com.act.molmass.mass.CompositionItem;
import com.act.molmass.spectrum.Spectrum;
import com.act.molmass.spectrum.SpectrumEntry;
import com.act.molmass.utils.TSVWriter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports compositions and spectra as tab separated tables, one row per item or bin.
 */
public class TsvExporter {

  public enum CompositionColumn {
    SYMBOL("symbol"),
    COUNT("count"),
    MASS("mass"),
    FRACTION("fraction"),
    ;

    private final String columnName;

    CompositionColumn(String columnName) {
      this.columnName = columnName;
    }

    @Override
    public String toString() {
      return columnName;
    }
  }

  public enum SpectrumColumn {
    MASS_NUMBER("mass_number"),
    MASS("mass"),
    FRACTION("fraction"),
    INTENSITY("intensity"),
    MZ("mz"),
    ;

    private final String columnName;

    SpectrumColumn(String columnName) {
      this.columnName = columnName;
    }

    @Override
    public String toString() {
      return columnName;
    }
  }

  private TsvExporter() {
  }

  public static void writeComposition(Composition composition, Appendable out) throws IOException {
    List<Map<CompositionColumn, String>> rows = new ArrayList<>(composition.size());
    for (CompositionItem item : composition) {
      Map<CompositionColumn, String> row = new HashMap<>();
      row.put(CompositionColumn.SYMBOL, item.getSymbol());
      row.put(CompositionColumn.COUNT, Integer.toString(item.getCount()));
      row.put(CompositionColumn.MASS, Double.toString(item.getMass()));
      row.put(CompositionColumn.FRACTION, Double.toString(item.getFraction()));
      rows.add(row);
    }
    try (TSVWriter<CompositionColumn, String> writer =
             new TSVWriter<>(Arrays.asList(CompositionColumn.values()), out)) {
      writer.appendAll(rows);
    }
  }

  public static void writeSpectrum(Spectrum spectrum, Appendable out) throws IOException {
    List<Map<SpectrumColumn, String>> rows = new ArrayList<>(spectrum.size());
    for (SpectrumEntry entry : spectrum) {
      Map<SpectrumColumn, String> row = new HashMap<>();
      row.put(SpectrumColumn.MASS_NUMBER, Integer.toString(entry.getMassNumber()));
      row.put(SpectrumColumn.MASS, Double.toString(entry.getMass()));
      row.put(SpectrumColumn.FRACTION, Double.toString(entry.getFraction()));
      row.put(SpectrumColumn.INTENSITY, Double.toString(entry.getIntensity()));
      row.put(SpectrumColumn.MZ, Double.toString(entry.getMz()));
      rows.add(row);
    }
    try (TSVWriter<SpectrumColumn, String> writer =
             new TSVWriter<>(Arrays.asList(SpectrumColumn.values()), out)) {
      writer.appendAll(rows);
    }
  }
}
