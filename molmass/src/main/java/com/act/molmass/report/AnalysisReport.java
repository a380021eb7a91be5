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

import com.act.molmass.formula.Formula;
import com.act.molmass.mass.CompositionItem;
import com.act.molmass.spectrum.Spectrum;
import com.act.molmass.spectrum.SpectrumEntry;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.ArrayList;
import java.util.List;

/**
 * The analysis of one formula in a form that serializes to JSON.  A failed analysis carries only the input and the
 * error message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisReport {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  static {
    OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
  }

  @JsonProperty("input")
  private String input;

  @JsonProperty("expanded")
  private String expanded;

  @JsonProperty("formula")
  private String formula;

  @JsonProperty("empirical")
  private String empirical;

  @JsonProperty("charge")
  private Integer charge;

  @JsonProperty("atoms")
  private Integer atoms;

  @JsonProperty("mass")
  private Double mass;

  @JsonProperty("monoisotopic_mass")
  private Double monoisotopicMass;

  @JsonProperty("monoisotopic_abundance")
  private Double monoisotopicAbundance;

  @JsonProperty("nominal_mass")
  private Integer nominalMass;

  @JsonProperty("mz")
  private Double mz;

  @JsonProperty("composition")
  private List<CompositionItem> composition;

  @JsonProperty("spectrum")
  private List<SpectrumEntry> spectrum;

  @JsonProperty("error")
  private String error;

  private AnalysisReport() {
  }

  /**
   * @param input The formula as given.
   * @param f The parsed formula.
   * @param spectrum The mass distribution, or null if it was not computed.
   */
  public static AnalysisReport of(String input, Formula f, Spectrum spectrum) {
    AnalysisReport report = new AnalysisReport();
    report.input = input;
    report.expanded = f.getExpanded();
    report.formula = f.getFormula();
    report.empirical = f.getEmpirical();
    report.charge = f.getCharge();
    report.atoms = f.getAtoms();
    report.mass = f.getMass();
    report.monoisotopicMass = f.getMonoisotopicMass();
    report.monoisotopicAbundance = f.getIsotope().getAbundance();
    report.nominalMass = f.getNominalMass();
    report.mz = f.getMz();
    report.composition = new ArrayList<>(f.composition().getItems());
    if (spectrum != null) {
      report.spectrum = new ArrayList<>(spectrum.getEntries().values());
    }
    return report;
  }

  public static AnalysisReport failed(String input, String error) {
    AnalysisReport report = new AnalysisReport();
    report.input = input;
    report.error = error;
    return report;
  }

  public static String toJson(List<AnalysisReport> reports) throws JsonProcessingException {
    return OBJECT_MAPPER.writeValueAsString(reports);
  }

  public String toJson() throws JsonProcessingException {
    return OBJECT_MAPPER.writeValueAsString(this);
  }

  public String getInput() {
    return input;
  }

  public String getExpanded() {
    return expanded;
  }

  public String getFormula() {
    return formula;
  }

  public String getEmpirical() {
    return empirical;
  }

  public Integer getCharge() {
    return charge;
  }

  public Integer getAtoms() {
    return atoms;
  }

  public Double getMass() {
    return mass;
  }

  public Double getMonoisotopicMass() {
    return monoisotopicMass;
  }

  public Double getMonoisotopicAbundance() {
    return monoisotopicAbundance;
  }

  public Integer getNominalMass() {
    return nominalMass;
  }

  public Double getMz() {
    return mz;
  }

  public List<CompositionItem> getComposition() {
    return composition;
  }

  public List<SpectrumEntry> getSpectrum() {
    return spectrum;
  }

  public String getError() {
    return error;
  }

  @JsonIgnore
  public boolean isFailed() {
    return error != null;
  }
}
