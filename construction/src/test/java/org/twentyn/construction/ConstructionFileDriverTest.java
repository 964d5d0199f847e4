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

package org.twentyn.construction;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.twentyn.construction.cf.ConstructionFile;
import org.twentyn.construction.cf.Product;
import org.twentyn.construction.sequence.Polynucleotide;

import java.io.File;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class ConstructionFileDriverTest {

  @Rule
  public TemporaryFolder temporaryFolder = new TemporaryFolder();

  private File write(String name, String contents) throws Exception {
    File file = temporaryFolder.newFile(name);
    Files.write(file.toPath(), contents.getBytes(StandardCharsets.UTF_8));
    return file;
  }

  @Test
  public void testReadTextFile() throws Exception {
    File input = write("cf.txt", "PCR P6libF P6libR on pTP1, P6\nAssemble P6 BsaI, pP6\nP6libF ACGTACGT\n");
    ConstructionFile cf = ConstructionFileDriver.readConstructionFile(input, false);
    assertEquals(2, cf.getSteps().size());
    assertEquals("ACGTACGT", cf.getSequences().get("P6libF"));
  }

  @Test
  public void testReadTsvFile() throws Exception {
    File input = write("cf.tsv", "PCR\tP6libF\tP6libR\ton\tpTP1\tP6\nAssemble\tP6\tBsaI\tpP6\n");
    ConstructionFile cf = ConstructionFileDriver.readConstructionFile(input, false);
    assertEquals(2, cf.getSteps().size());
    assertEquals("pP6", cf.getSteps().get(1).getOutput());
  }

  @Test
  public void testReadJsonFile() throws Exception {
    File input = write("cf.json", "{\"steps\": [{\"operation\": \"Blunt\", \"dna\": \"a\", \"output\": \"b\"}], " +
        "\"sequences\": {\"a\": \"acgt\"}}");
    ConstructionFile cf = ConstructionFileDriver.readConstructionFile(input, true);
    assertEquals(1, cf.getSteps().size());
    assertEquals("b", cf.getSteps().get(0).getOutput());
  }

  @Test
  public void testWriteTsv() throws Exception {
    List<Product> products = Arrays.asList(
        new Product("amp", Polynucleotide.dsDNA("ACGT")),
        new Product("pX", Polynucleotide.plasmid("GGGGCCCA")));
    StringWriter out = new StringWriter();
    ConstructionFileDriver.writeTsv(products, out);
    assertEquals("name\tlength\tgc\tsequence\n" +
        "amp\t4\t0.500\tACGT\n" +
        "pX\t8\t0.875\tGGGGCCCA\n", out.toString());
  }

  @Test
  public void testWriteJson() throws Exception {
    StringWriter out = new StringWriter();
    ConstructionFileDriver.writeJson(Arrays.asList(new Product("pX", Polynucleotide.plasmid("GGGGCCCA"))), out);
    String json = out.toString();
    assertTrue(json.contains("\"name\" : \"pX\""));
    assertTrue(json.contains("\"isCircular\" : true"));
  }
}
