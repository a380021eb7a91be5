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

import com.act.molmass.utils.Precision;
import org.apache.commons.lang3.tuple.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * A low resolution mass distribution, ordered by mass number.
 */
public class Spectrum implements Iterable<SpectrumEntry> {
  private final SortedMap<Integer, SpectrumEntry> entries;
  private final int charge;

  public Spectrum(SortedMap<Integer, SpectrumEntry> entries, int charge) {
    this.entries = Collections.unmodifiableSortedMap(new TreeMap<>(entries));
    this.charge = charge;
  }

  public SortedMap<Integer, SpectrumEntry> getEntries() {
    return entries;
  }

  public SpectrumEntry get(int massNumber) {
    return entries.get(massNumber);
  }

  public int getCharge() {
    return charge;
  }

  public int size() {
    return entries.size();
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  @Override
  public Iterator<SpectrumEntry> iterator() {
    return entries.values().iterator();
  }

  /**
   * The most abundant bin; the one with the lowest mass number if several share the maximum.
   * @throws IllegalStateException if the spectrum is empty.
   */
  public SpectrumEntry peak() {
    if (entries.isEmpty()) {
      throw new IllegalStateException("Empty spectrum has no peak");
    }
    SpectrumEntry peak = null;
    for (SpectrumEntry entry : entries.values()) {
      if (peak == null || entry.getFraction() > peak.getFraction()) {
        peak = entry;
      }
    }
    return peak;
  }

  /**
   * Smallest and largest mass number.
   * @throws IllegalStateException if the spectrum is empty.
   */
  public Pair<Integer, Integer> range() {
    if (entries.isEmpty()) {
      throw new IllegalStateException("Empty spectrum has no range");
    }
    return Pair.of(entries.firstKey(), entries.lastKey());
  }

  public double mean() {
    double mean = 0.0;
    for (SpectrumEntry entry : entries.values()) {
      mean += entry.getMass() * entry.getFraction();
    }
    return mean;
  }

  /**
   * Renders the spectrum as text table, with an m/z column for charged formulas.
   */
  public String toTable() {
    if (entries.isEmpty()) {
      return "";
    }
    int precision = Precision.precisionDigits(peak().getMass(), 9);
    String row = "%-6d%15." + precision + "f%13.6f%13.6f";
    List<String> lines = new ArrayList<>();
    if (charge == 0) {
      lines.add(String.format("%-6s%15s%13s%13s", "A", "Relative mass", "Fraction %", "Intensity %"));
    } else {
      row += "%15." + precision + "f";
      lines.add(String.format("%-6s%15s%13s%13s%15s", "A", "Relative mass", "Fraction %", "Intensity %", "m/z"));
    }
    for (SpectrumEntry entry : entries.values()) {
      if (charge == 0) {
        lines.add(String.format(Locale.US, row, entry.getMassNumber(), entry.getMass(), entry.getFraction() * 100.0,
            entry.getIntensity()));
      } else {
        lines.add(String.format(Locale.US, row, entry.getMassNumber(), entry.getMass(), entry.getFraction() * 100.0,
            entry.getIntensity(), entry.getMz()));
      }
    }
    return String.join("\n", lines);
  }

  @Override
  public String toString() {
    return toTable();
  }
}
