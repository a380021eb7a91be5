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

import org.apache.commons.lang3.tuple.Pair;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Labels of the periods, groups, blocks and chemical series used to classify elements.
 */
public final class PeriodicTableLabels {

  public static final Map<Integer, String> PERIODS = Collections.unmodifiableMap(new TreeMap<Integer, String>() {{
    put(1, "K");
    put(2, "L");
    put(3, "M");
    put(4, "N");
    put(5, "O");
    put(6, "P");
    put(7, "Q");
  }});

  // Group number -> (label, description).
  public static final Map<Integer, Pair<String, String>> GROUPS =
      Collections.unmodifiableMap(new TreeMap<Integer, Pair<String, String>>() {{
        put(1, Pair.of("IA", "Alkali metals"));
        put(2, Pair.of("IIA", "Alkaline earths"));
        put(3, Pair.of("IIIB", ""));
        put(4, Pair.of("IVB", ""));
        put(5, Pair.of("VB", ""));
        put(6, Pair.of("VIB", ""));
        put(7, Pair.of("VIIB", ""));
        put(8, Pair.of("VIIIB", ""));
        put(9, Pair.of("VIIIB", ""));
        put(10, Pair.of("VIIIB", ""));
        put(11, Pair.of("IB", "Coinage metals"));
        put(12, Pair.of("IIB", ""));
        put(13, Pair.of("IIIA", "Boron group"));
        put(14, Pair.of("IVA", "Carbon group"));
        put(15, Pair.of("VA", "Pnictogens"));
        put(16, Pair.of("VIA", "Chalcogens"));
        put(17, Pair.of("VIIA", "Halogens"));
        put(18, Pair.of("VIIIA", "Noble gases"));
      }});

  public static final Map<String, String> BLOCKS = Collections.unmodifiableMap(new LinkedHashMap<String, String>() {{
    put("s", "");
    put("g", "");
    put("f", "");
    put("d", "");
    put("p", "");
  }});

  public static final Map<Integer, String> SERIES = Collections.unmodifiableMap(new TreeMap<Integer, String>() {{
    put(1, "Nonmetals");
    put(2, "Noble gases");
    put(3, "Alkali metals");
    put(4, "Alkaline earth metals");
    put(5, "Metalloids");
    put(6, "Halogens");
    put(7, "Poor metals");
    put(8, "Transition metals");
    put(9, "Lanthanides");
    put(10, "Actinides");
  }});

  private PeriodicTableLabels() {
  }
}
