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

/**
 * Signals a malformed chemical formula.  Carries the formula being processed and, where known, the position of the
 * offending character so that the message can point at it.
 */
public class FormulaException extends Exception {
  public static final int UNKNOWN_POSITION = -1;

  private final String reason;
  private final String formula;
  private final int position;

  public FormulaException(String reason) {
    this(reason, "", UNKNOWN_POSITION);
  }

  public FormulaException(String reason, String formula, int position) {
    super(reason);
    this.reason = reason;
    this.formula = formula == null ? "" : formula;
    this.position = position;
  }

  public String getReason() {
    return reason;
  }

  public String getFormula() {
    return formula;
  }

  public int getPosition() {
    return position;
  }

  /**
   * The reason, followed by the formula and a caret under the offending character when the position is known:
   * <pre>
   * unknown isotope
   * [11C]
   * .^
   * </pre>
   */
  @Override
  public String getMessage() {
    if (position < 0) {
      return reason;
    }
    return String.format("%s\n%s\n%s^", reason, formula, StringUtils.repeat('.', position));
  }
}
