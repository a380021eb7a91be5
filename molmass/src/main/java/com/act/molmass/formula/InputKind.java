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

import java.util.HashSet;
import java.util.Set;

/**
 * What a user-supplied formula string turns out to be, once whitespace and group abbreviations are dealt with.
 */
public enum InputKind {
  // "C: 0.5, H: 0.5"
  FRACTIONS,
  // "ATCG", a single strand of DNA
  DNA,
  // "AUCG"
  RNA,
  // "MDRGEQGLLK"
  PEPTIDE,
  PLAIN,
  ;

  private static final String DNA_BASES = "ATCG";
  private static final String DNA_MARKERS = "ATG";
  private static final String RNA_BASES = "AUCG";
  private static final String RNA_MARKERS = "AG";
  private static final String PEPTIDE_MARKERS = "AEGMLQRT";

  /**
   * Classifies a formula.  Fractions take precedence over sequences, DNA over RNA and RNA over peptides.  Sequences
   * are only considered for strings of more than one character.
   * @param formula A formula without whitespace.
   * @param fractions Whether lists of mass fractions are recognized.
   * @param sequences Whether oligonucleotide and peptide sequences are recognized.
   */
  public static InputKind classify(String formula, boolean fractions, boolean sequences) {
    if (fractions && formula.indexOf(':') >= 0 && formula.indexOf(',') >= 0) {
      return FRACTIONS;
    }
    if (!sequences || formula.length() <= 1) {
      return PLAIN;
    }

    Set<Character> characters = new HashSet<>();
    for (char c : formula.toCharArray()) {
      characters.add(c);
    }
    if (isSequence(characters, DNA_BASES, DNA_MARKERS)) {
      return DNA;
    }
    if (isSequence(characters, RNA_BASES, RNA_MARKERS)) {
      return RNA;
    }
    boolean aminoAcids = true;
    for (Character c : characters) {
      if (!Sequences.AMINOACIDS.containsKey(c)) {
        aminoAcids = false;
        break;
      }
    }
    if (aminoAcids && containsAny(characters, PEPTIDE_MARKERS)) {
      return PEPTIDE;
    }
    return PLAIN;
  }

  private static boolean isSequence(Set<Character> characters, String alphabet, String markers) {
    for (Character c : characters) {
      if (alphabet.indexOf(c) < 0) {
        return false;
      }
    }
    return containsAny(characters, markers);
  }

  private static boolean containsAny(Set<Character> characters, String markers) {
    for (char c : markers.toCharArray()) {
      if (characters.contains(c)) {
        return true;
      }
    }
    return false;
  }
}
