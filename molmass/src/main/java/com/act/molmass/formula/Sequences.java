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

package com.act.molmass.formula;

import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Formulas of biopolymers given as sequences of one-letter residue codes: peptides of unmodified amino acids and
 * single or double stranded oligonucleotides.  Each strand carries a 5' monophosphate.
 */
public final class Sequences {

  /**
   * The kinds of oligonucleotides, named the way they are written in a formula, e.g. "dsdna(ATCG)".
   */
  public enum OligoType {
    SSDNA(false, false),
    DSDNA(false, true),
    SSRNA(true, false),
    DSRNA(true, true),
    ;

    private final boolean rna;
    private final boolean doubleStranded;

    OligoType(boolean rna, boolean doubleStranded) {
      this.rna = rna;
      this.doubleStranded = doubleStranded;
    }

    public boolean isRna() {
      return rna;
    }

    public boolean isDoubleStranded() {
      return doubleStranded;
    }

    public String getFunctionName() {
      return this.name().toLowerCase();
    }

    public static OligoType fromFunctionName(String name) {
      return OligoType.valueOf(name.toUpperCase());
    }
  }

  // Amino acid residues, i.e. amino acids - H2O.
  public static final Map<Character, String> AMINOACIDS = Collections.unmodifiableMap(
      new TreeMap<Character, String>() {{
        put('G', "C2H3NO"); // Glycine
        put('P', "C5H7NO"); // Proline
        put('A', "C3H5NO"); // Alanine
        put('V', "C5H9NO"); // Valine
        put('L', "C6H11NO"); // Leucine
        put('I', "C6H11NO"); // Isoleucine
        put('M', "C5H9NOS"); // Methionine
        put('C', "C3H5NOS"); // Cysteine
        put('F', "C9H9NO"); // Phenylalanine
        put('Y', "C9H9NO2"); // Tyrosine
        put('W', "C11H10N2O"); // Tryptophan
        put('H', "C6H7N3O"); // Histidine
        put('K', "C6H12N2O"); // Lysine
        put('R', "C6H12N4O"); // Arginine
        put('Q', "C5H8N2O2"); // Glutamine
        put('N', "C4H6N2O2"); // Asparagine
        put('E', "C5H7NO3"); // Glutamic acid
        put('D', "C4H5NO3"); // Aspartic acid
        put('S', "C3H5NO2"); // Serine
        put('T', "C4H7NO2"); // Threonine
      }});

  // Deoxynucleotide monophosphates - H2O.
  public static final Map<Character, String> DEOXYNUCLEOTIDES = Collections.unmodifiableMap(
      new TreeMap<Character, String>() {{
        put('A', "C10H12N5O5P");
        put('T', "C10H13N2O7P");
        put('C', "C9H12N3O6P");
        put('G', "C10H12N5O6P");
      }});

  // Nucleotide monophosphates - H2O.
  public static final Map<Character, String> NUCLEOTIDES = Collections.unmodifiableMap(
      new TreeMap<Character, String>() {{
        put('A', "C10H12N5O6P");
        put('U', "C9H11N2O8P");
        put('C', "C9H12N3O7P");
        put('G', "C10H12N5O7P");
      }});

  public static final Map<Character, Character> DNA_COMPLEMENTS = Collections.unmodifiableMap(
      new TreeMap<Character, Character>() {{
        put('A', 'T');
        put('T', 'A');
        put('C', 'G');
        put('G', 'C');
      }});

  public static final Map<Character, Character> RNA_COMPLEMENTS = Collections.unmodifiableMap(
      new TreeMap<Character, Character>() {{
        put('A', 'U');
        put('U', 'A');
        put('C', 'G');
        put('G', 'C');
      }});

  private Sequences() {
  }

  /**
   * Tallies the items of a sequence and writes the tally as formula, e.g. "AAG" -> "(C3H5NO)2(C2H3NO)" for amino
   * acids.  Items appear in ascending order of their codes; a count of 1 is omitted.
   * @param sequence The sequence of one-letter codes.
   * @param items The formula of each code.
   * @return A formula string.
   * @throws FormulaException if the sequence contains a code that is not in items.
   */
  public static String fromSequence(String sequence, Map<Character, String> items) throws FormulaException {
    TreeMap<Character, Integer> counts = new TreeMap<>();
    for (int i = 0; i < sequence.length(); i++) {
      Character item = sequence.charAt(i);
      if (!items.containsKey(item)) {
        throw new FormulaException("unknown sequence item", sequence, i);
      }
      counts.merge(item, 1, Integer::sum);
    }

    StringBuilder builder = new StringBuilder();
    for (Map.Entry<Character, Integer> entry : counts.entrySet()) {
      builder.append('(').append(items.get(entry.getKey())).append(')');
      if (entry.getValue() > 1) {
        builder.append(entry.getValue());
      }
    }
    return builder.toString();
  }

  /**
   * Formula of a linear peptide, e.g. "GG" -> "((C2H3NO)2H2O)".
   */
  public static String fromPeptide(String sequence) throws FormulaException {
    return "(" + fromSequence(StringUtils.deleteWhitespace(sequence), AMINOACIDS) + "H2O)";
  }

  /**
   * Formula of an oligonucleotide, e.g. "AC" as SSDNA -> "((C10H12N5O5P)(C9H12N3O6P)H2O)".  For double stranded types
   * the complementary strand is added.
   */
  public static String fromOligo(String sequence, OligoType type) throws FormulaException {
    String strand = StringUtils.deleteWhitespace(sequence);
    Map<Character, String> items = type.isRna() ? NUCLEOTIDES : DEOXYNUCLEOTIDES;
    if (!type.isDoubleStranded()) {
      return "(" + fromSequence(strand, items) + "H2O)";
    }

    Map<Character, Character> complements = type.isRna() ? RNA_COMPLEMENTS : DNA_COMPLEMENTS;
    StringBuilder complement = new StringBuilder(strand.length());
    for (int i = 0; i < strand.length(); i++) {
      Character base = complements.get(strand.charAt(i));
      if (base == null) {
        throw new FormulaException("unknown sequence item", strand, i);
      }
      complement.append(base);
    }
    return "(" + fromSequence(strand + complement, items) + "(H2O)2)";
  }
}
