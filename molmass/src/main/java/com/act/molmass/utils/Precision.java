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

package com.act.molmass.utils;

/**
 * Helpers for printing masses in fixed width columns.
 */
public final class Precision {

  private Precision() {
  }

  /**
   * Number of digits after the decimal point that fit a number into a column of the given width, at least 1.
   * precisionDigits(1.23456789, 5) == 3, precisionDigits(12345.6789, 5) == 1.
   */
  public static int precisionDigits(double value, int width) {
    double magnitude = Math.log10(Math.abs(value));
    if (magnitude < 0 || Double.isNaN(magnitude)) {
      magnitude = 0;
    }
    int precision = width - (int) Math.floor(magnitude);
    // Room for the sign and the decimal point.
    precision -= value < 0 ? 3 : 2;
    return Math.max(precision, 1);
  }
}
