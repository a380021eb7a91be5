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

import com.act.molmass.elements.ElementTable;
import com.act.molmass.formula.ChemicalGroups;
import com.act.molmass.formula.FormulaNormalizer;
import com.act.molmass.spectrum.SpectrumCalculator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Settings for formula analysis, read from a JSON file like:
 * <pre>
 * {
 *   "max_atoms": 500,
 *   "min_intensity": 0.1,
 *   "groups": {"Ac": "C2H3O"}
 * }
 * </pre>
 * Fields left out keep their defaults.
 */
public class AnalysisConfig {
  public static final int DEFAULT_MAX_ATOMS = 250;

  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  // Mass distributions are only computed for formulas with fewer atoms.
  @JsonProperty("max_atoms")
  private Integer maxAtoms = DEFAULT_MAX_ATOMS;

  @JsonProperty("min_fraction")
  private Double minFraction = SpectrumCalculator.DEFAULT_MIN_FRACTION;

  // Percent of the most abundant peak; null keeps all peaks.
  @JsonProperty("min_intensity")
  private Double minIntensity;

  @JsonProperty("allow_empty")
  private Boolean allowEmpty = false;

  @JsonProperty("parse_groups")
  private Boolean parseGroups = true;

  @JsonProperty("parse_oligos")
  private Boolean parseOligos = true;

  @JsonProperty("parse_fractions")
  private Boolean parseFractions = true;

  @JsonProperty("parse_arithmetic")
  private Boolean parseArithmetic = true;

  // Additional group abbreviations; these take precedence over the built-in ones.
  @JsonProperty("groups")
  private Map<String, String> groups = new HashMap<>();

  public AnalysisConfig() {
  }

  public static AnalysisConfig readFromFile(File file) throws IOException {
    return OBJECT_MAPPER.readValue(file, AnalysisConfig.class);
  }

  public FormulaNormalizer buildNormalizer(ElementTable elementTable) {
    Map<String, String> allGroups = new TreeMap<>(ChemicalGroups.DEFAULT);
    allGroups.putAll(groups);
    return new FormulaNormalizer(elementTable, allGroups, parseGroups, parseOligos, parseFractions, parseArithmetic);
  }

  public Integer getMaxAtoms() {
    return maxAtoms;
  }

  public void setMaxAtoms(Integer maxAtoms) {
    this.maxAtoms = maxAtoms;
  }

  public Double getMinFraction() {
    return minFraction;
  }

  public void setMinFraction(Double minFraction) {
    this.minFraction = minFraction;
  }

  public Double getMinIntensity() {
    return minIntensity;
  }

  public void setMinIntensity(Double minIntensity) {
    this.minIntensity = minIntensity;
  }

  public Boolean getAllowEmpty() {
    return allowEmpty;
  }

  public void setAllowEmpty(Boolean allowEmpty) {
    this.allowEmpty = allowEmpty;
  }

  public Boolean getParseGroups() {
    return parseGroups;
  }

  public void setParseGroups(Boolean parseGroups) {
    this.parseGroups = parseGroups;
  }

  public Boolean getParseOligos() {
    return parseOligos;
  }

  public void setParseOligos(Boolean parseOligos) {
    this.parseOligos = parseOligos;
  }

  public Boolean getParseFractions() {
    return parseFractions;
  }

  public void setParseFractions(Boolean parseFractions) {
    this.parseFractions = parseFractions;
  }

  public Boolean getParseArithmetic() {
    return parseArithmetic;
  }

  public void setParseArithmetic(Boolean parseArithmetic) {
    this.parseArithmetic = parseArithmetic;
  }

  public Map<String, String> getGroups() {
    return groups;
  }

  public void setGroups(Map<String, String> groups) {
    this.groups = groups;
  }
}
