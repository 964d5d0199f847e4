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
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads tab separated rows with no header, the shape a Construction File takes when copied out of a spreadsheet.
 * Blank lines are skipped and trailing empty cells are dropped.
 */
public class TSVParser {
  public static final CSVFormat TSV_FORMAT = CSVFormat.newFormat('\t')
      .withRecordSeparator('\n').withQuote('"').withIgnoreEmptyLines(true);

  private List<List<String>> rows = null;

  public void parse(File file) throws IOException {
    try (InputStream inStream = new FileInputStream(file)) {
      parse(inStream);
    }
  }

  public void parse(InputStream inStream) throws IOException {
    List<List<String>> rows = new ArrayList<>();
    try (CSVParser parser = new CSVParser(new InputStreamReader(inStream, StandardCharsets.UTF_8), TSV_FORMAT)) {
      for (CSVRecord record : parser) {
        List<String> row = new ArrayList<>(record.size());
        for (String cell : record) {
          row.add(cell);
        }
        while (!row.isEmpty() && row.get(row.size() - 1).trim().isEmpty()) {
          row.remove(row.size() - 1);
        }
        if (!row.isEmpty()) {
          rows.add(row);
        }
      }
    }
    this.rows = rows;
  }

  public List<List<String>> getRows() {
    return this.rows;
  }
}
