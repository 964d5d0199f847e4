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

package org.twentyn.construction.simulation;

import org.junit.Before;
import org.junit.Test;
import org.twentyn.construction.enzymes.RestrictionEnzymeRegistry;
import org.twentyn.construction.sequence.Polynucleotide;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class AssemblerTest {

  private Assembler assembler;

  @Before
  public void setUp() throws Exception {
    assembler = new Assembler(RestrictionEnzymeRegistry.loadDefault());
  }

  @Test
  public void testEnzymeNameSelectsGoldenGate() throws Exception {
    List<Polynucleotide> parts = Arrays.asList(
        Polynucleotide.dsDNA("ccaaaGGTCTCAGCTTTGATCGATTCAACCTACTTCCCCTTCATAATCGGTACTAGAGACCacgac"),
        Polynucleotide.dsDNA("GGTCTCATACTCAAAATTTACTGACTGGACATGGTCACCACTTAAGTAAGCTTTGAGACC"));
    Polynucleotide product = assembler.assemble(parts, "bsai");
    assertTrue(product.isCircular());
    assertEquals("GCTTTGATCGATTCAACCTACTTCCCCTTCATAATCGGTACTCAAAATTTACTGACTGGACATGGTCACCACTTAAGTAA",
        product.getSequence());
  }

  @Test
  public void testAnythingElseIsGibson() throws Exception {
    String left = "ACGTTGCAACGTTGCAGGCC";
    String right = "TTGACCAGTAGGCATCAGCA";
    List<Polynucleotide> parts = Arrays.asList(
        Polynucleotide.dsDNA(left + "AAAAAAAAAA" + right),
        Polynucleotide.dsDNA(right + "CCCCCCCCCC" + left));
    Polynucleotide product = assembler.assemble(parts, Assembler.GIBSON);
    assertTrue(product.isCircular());
    assertEquals(Polynucleotide.plasmid("AAAAAAAAAA" + right + "CCCCCCCCCC" + left), product);
  }
}
