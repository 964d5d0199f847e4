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

package org.twentyn.construction.utils;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.File;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Writes product tables as tab separated text: one header line naming the columns, then one line per row.
 * @param <K> The column key type; its toString() is the column title.
 * @param <V> The cell value type.
 */
public class TSVWriter<K, V> implements AutoCloseable {
  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t')
      .withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  private final List<K> columns;
  private CSVPrinter printer;
  private int rowCount = 0;

  public TSVWriter(List<K> columns) {
    this.columns = columns;
  }

  public void open(File f) throws IOException {
    open(Files.newBufferedWriter(f.toPath(), StandardCharsets.UTF_8));
  }

  /**
   * Starts the table on an already open writer; the header is written immediately.
   */
  public void open(Writer writer) throws IOException {
    String[] titles = columns.stream().map(Object::toString).toArray(String[]::new);
    printer = new CSVPrinter(writer, TSV_FORMAT.withHeader(titles));
  }

  /**
   * Writes one row; columns missing from the map are left empty.
   */
  public void append(Map<K, V> row) throws IOException {
    printer.printRecord(columns.stream().map(row::get).collect(Collectors.toList()));
    rowCount++;
  }

  public void append(Collection<Map<K, V>> rows) throws IOException {
    for (Map<K, V> row : rows) {
      append(row);
    }
    flush();
  }

  public int getRowCount() {
    return rowCount;
  }

  public void flush() throws IOException {
    printer.flush();
  }

  @Override
  public void close() throws IOException {
    if (printer == null) {
      return;
    }
    printer.close();
    printer = null;
  }
}
