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

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Abbreviations of common chemical groups: amino acid residues (with their protected variants, suffix "p"),
 * protecting groups and a few organic substituents.  Each abbreviation expands to the formula of the group.
 */
public final class ChemicalGroups {

  public static final Map<String, String> DEFAULT = Collections.unmodifiableMap(new TreeMap<String, String>() {{
    put("Abu", "C4H7NO");
    put("Acet", "C2H3O");
    put("Acm", "C3H6NO");
    put("Adao", "C10H15O");
    put("Aib", "C4H7NO");
    put("Ala", "C3H5NO");
    put("Arg", "C6H12N4O");
    put("Argp", "C6H11N4O");
    put("Asn", "C4H6N2O2");
    put("Asnp", "C4H5N2O2");
    put("Asp", "C4H5NO3");
    put("Aspp", "C4H4NO3");
    put("Asu", "C8H13NO3");
    put("Asup", "C8H12NO3");
    put("Boc", "C5H9O2");
    put("Bom", "C8H9O");
    put("Bpy", "C10H8N2"); // Bipyridine
    put("Brz", "C8H6BrO2");
    put("Bu", "C4H9");
    put("Bum", "C5H11O");
    put("Bz", "C7H5O");
    put("Bzl", "C7H7");
    put("Bzlo", "C7H7O");
    put("Cha", "C9H15NO");
    put("Chxo", "C6H11O");
    put("Cit", "C6H11N3O2");
    put("Citp", "C6H10N3O2");
    put("Clz", "C8H6ClO2");
    put("Cp", "C5H5");
    put("Cy", "C6H11");
    put("Cys", "C3H5NOS");
    put("Cysp", "C3H4NOS");
    put("Dde", "C10H13O2");
    put("Dnp", "C6H3N2O4");
    put("Et", "C2H5");
    put("Fmoc", "C15H11O2");
    put("For", "CHO");
    put("Gln", "C5H8N2O2");
    put("Glnp", "C5H7N2O2");
    put("Glp", "C5H5NO2");
    put("Glu", "C5H7NO3");
    put("Glup", "C5H6NO3");
    put("Gly", "C2H3NO");
    put("Hci", "C7H13N3O2");
    put("Hcip", "C7H12N3O2");
    put("His", "C6H7N3O");
    put("Hisp", "C6H6N3O");
    put("Hser", "C4H7NO2");
    put("Hserp", "C4H6NO2");
    put("Hx", "C6H11");
    put("Hyp", "C5H7NO2");
    put("Hypp", "C5H6NO2");
    put("Ile", "C6H11NO");
    put("Ivdde", "C14H21O2");
    put("Leu", "C6H11NO");
    put("Lys", "C6H12N2O");
    put("Lysp", "C6H11N2O");
    put("Mbh", "C15H15O2");
    put("Me", "CH3");
    put("Mebzl", "C8H9");
    put("Meobzl", "C8H9O");
    put("Met", "C5H9NOS");
    put("Mmt", "C20H17O");
    put("Mtc", "C14H19O3S");
    put("Mtr", "C10H13O3S");
    put("Mts", "C9H11O2S");
    put("Mtt", "C20H17");
    put("Nle", "C6H11NO");
    put("Npys", "C5H3N2O2S");
    put("Nva", "C5H9NO");
    put("Odmab", "C20H26NO3");
    put("Orn", "C5H10N2O");
    put("Ornp", "C5H9N2O");
    put("Pbf", "C13H17O3S");
    put("Pen", "C5H9NOS");
    put("Penp", "C5H8NOS");
    put("Ph", "C6H5");
    put("Phe", "C9H9NO");
    put("Phepcl", "C9H8ClNO");
    put("Phg", "C8H7NO");
    put("Pmc", "C14H19O3S");
    put("Ppa", "C8H7O2");
    put("Pro", "C5H7NO");
    put("Prop", "C3H7");
    put("Py", "C5H5N");
    put("Pyr", "C5H5NO2");
    put("Sar", "C3H5NO");
    put("Ser", "C3H5NO2");
    put("Serp", "C3H4NO2");
    put("Sta", "C8H15NO2");
    put("Stap", "C8H14NO2");
    put("Tacm", "C6H12NO");
    put("Tbdms", "C6H15Si");
    put("Tbu", "C4H9");
    put("Tbuo", "C4H9O");
    put("Tbuthio", "C4H9S");
    put("Tfa", "C2F3O");
    put("Thi", "C7H7NOS");
    put("Thr", "C4H7NO2");
    put("Thrp", "C4H6NO2");
    put("Tips", "C9H21Si");
    put("Tms", "C3H9Si");
    put("Tos", "C7H7O2S");
    put("Trp", "C11H10N2O");
    put("Trpp", "C11H9N2O");
    put("Trt", "C19H15");
    put("Tyr", "C9H9NO2");
    put("Tyrp", "C9H8NO2");
    put("Val", "C5H9NO");
    put("Valoh", "C5H9NO2");
    put("Valohp", "C5H8NO2");
    put("Xan", "C13H9O");
  }});

  private ChemicalGroups() {
  }
}
