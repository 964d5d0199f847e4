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

import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;

public class TSVParserTest {

  @Test
  public void testRowsWithoutHeader() throws Exception {
    String tsv = "PCR\tP6libF\tP6libR\tpTP1\tP6\n" +
        "\n" +
        "Assemble\tP6\tBsaI\tpP6\t\t\n" +
        "P6libF\tccaaaGGTCTCaGCTT\n";
    TSVParser parser = new TSVParser();
    parser.parse(new ByteArrayInputStream(tsv.getBytes(StandardCharsets.UTF_8)));

    List<List<String>> rows = parser.getRows();
    assertEquals(3, rows.size());
    assertEquals(Arrays.asList("PCR", "P6libF", "P6libR", "pTP1", "P6"), rows.get(0));
    assertEquals("Trailing empty cells are dropped", Arrays.asList("Assemble", "P6", "BsaI", "pP6"), rows.get(1));
    assertEquals(Arrays.asList("P6libF", "ccaaaGGTCTCaGCTT"), rows.get(2));
  }
}
