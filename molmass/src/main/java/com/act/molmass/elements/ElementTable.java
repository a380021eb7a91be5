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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The periodic table: an immutable registry of elements, looked up by symbol, atomic number or name.
 *
 * The process-wide instance is read from the bundled elements.json resource the first time it is requested and is
 * validated before use.  Corrupt element data fails initialization with an IllegalStateException.
 */
public class ElementTable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ElementTable.class);

  public static final String ELEMENTS_RESOURCE = "/elements.json";

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  private static final double MAX_ABUNDANCE_SUM_ERROR = 1e-9;
  private static final double MAX_AVERAGE_MASS_ERROR = 0.03;

  // Initialized on first use of getInstance(), which the JVM guarantees to happen exactly once.
  private static class Holder {
    private static final ElementTable INSTANCE = loadDefault();
  }

  private final List<Element> elements;
  private final Map<String, Element> bySymbol = new HashMap<>();
  private final Map<String, Element> byName = new HashMap<>();

  public ElementTable(List<Element> elements) {
    List<Element> ordered = new ArrayList<>(elements.size());
    for (Element element : elements) {
      if (element.getNumber() != ordered.size() + 1) {
        throw new IllegalStateException(String.format(
            "Elements must be listed in order of atomic number, found %s at position %d",
            element.getSymbol(), ordered.size() + 1));
      }
      ordered.add(element);
      bySymbol.put(element.getSymbol(), element);
      byName.put(element.getName(), element);
    }
    this.elements = Collections.unmodifiableList(ordered);
  }

  public static ElementTable getInstance() {
    return Holder.INSTANCE;
  }

  /**
   * Reads a JSON array of elements, as found in the bundled elements.json resource.
   * @param in A stream of element data.
   * @return A table containing the elements read from the stream.
   * @throws IOException
   */
  public static ElementTable load(InputStream in) throws IOException {
    List<Element> elements = OBJECT_MAPPER.readValue(in, new TypeReference<List<Element>>() {});
    for (Element element : elements) {
      element.index();
    }
    return new ElementTable(elements);
  }

  private static ElementTable loadDefault() {
    try (InputStream in = ElementTable.class.getResourceAsStream(ELEMENTS_RESOURCE)) {
      if (in == null) {
        throw new IllegalStateException(String.format("Unable to find element data resource %s", ELEMENTS_RESOURCE));
      }
      ElementTable table = load(in);
      table.validate();
      LOGGER.info("Loaded %d elements from %s", table.size(), ELEMENTS_RESOURCE);
      return table;
    } catch (IOException e) {
      throw new IllegalStateException(
          String.format("Unable to read element data resource %s: %s", ELEMENTS_RESOURCE, e.getMessage()), e);
    }
  }

  public List<Element> getElements() {
    return elements;
  }

  public int size() {
    return elements.size();
  }

  public boolean contains(String symbol) {
    return bySymbol.containsKey(symbol);
  }

  /**
   * Get an element by its symbol.
   * @return The element, or null if the symbol is unknown.
   */
  public Element get(String symbol) {
    return bySymbol.get(symbol);
  }

  /**
   * Get an element by its atomic number.
   * @return The element, or null if no element has this number.
   */
  public Element get(int number) {
    if (number < 1 || number > elements.size()) {
      return null;
    }
    return elements.get(number - 1);
  }

  public Element getByName(String name) {
    return byName.get(name);
  }

  /**
   * Parses the ground state electron configuration of an element into a map of (shell, subshell) -> electrons.  A
   * leading noble gas core like [He] is expanded using that element's configuration.
   * @param element The element whose configuration to parse.
   * @return An ordered map from (shell, subshell) to the number of electrons in that subshell.
   */
  public Map<Pair<Integer, Character>, Integer> getElectronConfiguration(Element element) {
    Map<Pair<Integer, Character>, Integer> configuration = new LinkedHashMap<>();
    String[] parts = StringUtils.split(element.getElectronConfiguration());
    int start = 0;
    if (parts.length > 0 && parts[0].startsWith("[")) {
      Element core = get(parts[0].substring(1, parts[0].length() - 1));
      if (core == null) {
        throw new IllegalStateException(String.format(
            "%s - unknown core %s in electron configuration", element.getSymbol(), parts[0]));
      }
      configuration.putAll(getElectronConfiguration(core));
      start = 1;
    }
    for (int i = start; i < parts.length; i++) {
      String part = parts[i];
      Integer shell = Character.getNumericValue(part.charAt(0));
      Character subshell = part.charAt(1);
      Integer electrons = part.length() > 2 ? Integer.valueOf(part.substring(2)) : 1;
      configuration.put(Pair.of(shell, subshell), electrons);
    }
    return configuration;
  }

  /**
   * Number of electrons per occupied shell, innermost first.
   */
  public List<Integer> getElectronShells(Element element) {
    int[] shells = new int[PeriodicTableLabels.PERIODS.size()];
    for (Map.Entry<Pair<Integer, Character>, Integer> entry : getElectronConfiguration(element).entrySet()) {
      shells[entry.getKey().getLeft() - 1] += entry.getValue();
    }
    List<Integer> result = new ArrayList<>();
    for (int electrons : shells) {
      if (electrons > 0) {
        result.add(electrons);
      }
    }
    return result;
  }

  /**
   * Checks the consistency of an element's data.
   * @param element The element to check.
   * @throws IllegalStateException if the data is inconsistent.
   */
  public void validate(Element element) {
    String symbol = element.getSymbol();
    if (!PeriodicTableLabels.PERIODS.containsKey(element.getPeriod()) ||
        !PeriodicTableLabels.GROUPS.containsKey(element.getGroup()) ||
        !PeriodicTableLabels.BLOCKS.containsKey(element.getBlock()) ||
        !PeriodicTableLabels.SERIES.containsKey(element.getSeries())) {
      throw new IllegalStateException(String.format("%s - unknown period, group, block or series", symbol));
    }

    int electrons = 0;
    for (Integer shell : getElectronShells(element)) {
      electrons += shell;
    }
    if (!element.getProtons().equals(electrons)) {
      throw new IllegalStateException(String.format("%s - number of protons must equal electrons", symbol));
    }

    List<Double> ionizationEnergies = element.getIonizationEnergies();
    for (int i = 1; i < ionizationEnergies.size(); i++) {
      if (ionizationEnergies.get(i) <= ionizationEnergies.get(i - 1)) {
        throw new IllegalStateException(String.format("%s - ionization energies not increasing", symbol));
      }
    }

    double mass = 0.0;
    double abundance = 0.0;
    for (Isotope isotope : element.getIsotopes().values()) {
      mass += isotope.getAbundance() * isotope.getMass();
      abundance += isotope.getAbundance();
    }
    if (Math.abs(mass - element.getMass()) > MAX_AVERAGE_MASS_ERROR) {
      throw new IllegalStateException(String.format(
          "%s - average of isotope masses (%.4f) != mass (%.4f)", symbol, mass, element.getMass()));
    }
    if (Math.abs(abundance - 1.0) > MAX_ABUNDANCE_SUM_ERROR) {
      throw new IllegalStateException(String.format("%s - sum of isotope abundances != 1.0", symbol));
    }
  }

  public void validate() {
    for (Element element : elements) {
      validate(element);
    }
  }

  @Override
  public String toString() {
    List<String> symbols = new ArrayList<>(elements.size());
    for (Element element : elements) {
      symbols.add(element.getSymbol());
    }
    return "[" + StringUtils.join(symbols, ", ") + "]";
  }
}
