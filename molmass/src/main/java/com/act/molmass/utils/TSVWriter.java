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

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes rows of values keyed by column as tab separated text, headed by a line of column names.
 * @param <K> The column type; its toString() is the column name.
 * @param <V> The value type.
 */
public class TSVWriter<K, V> implements AutoCloseable {
  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t').
      withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  private final List<K> header;
  private CSVPrinter printer;

  /**
   * @param header The columns, in output order.
   * @param out Where to write, e.g. System.out.  Closing the writer closes out if it is Closeable.
   */
  public TSVWriter(List<K> header, Appendable out) throws IOException {
    this.header = header;
    String[] headerStrings = new String[header.size()];
    for (int i = 0; i < header.size(); i++) {
      headerStrings[i] = header.get(i).toString();
    }
    this.printer = new CSVPrinter(out, TSV_FORMAT.withHeader(headerStrings));
  }

  public static <K, V> TSVWriter<K, V> toFile(List<K> header, File file) throws IOException {
    return new TSVWriter<>(header, Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8));
  }

  public void append(Map<K, V> row) throws IOException {
    List<V> vals = new ArrayList<>(header.size());
    for (K field : header) {
      vals.add(row.get(field));
    }
    printer.printRecord(vals);
  }

  public void appendAll(Iterable<? extends Map<K, V>> rows) throws IOException {
    for (Map<K, V> row : rows) {
      append(row);
    }
    printer.flush();
  }

  @Override
  public void close() throws IOException {
    if (printer != null) {
      printer.close();
      printer = null;
    }
  }
}
