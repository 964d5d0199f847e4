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
import org.twentyn.construction.sequence.Modification;
import org.twentyn.construction.sequence.Polynucleotide;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class RestrictionCutterTest {

  private RestrictionCutter cutter;

  @Before
  public void setUp() throws Exception {
    cutter = new RestrictionCutter(RestrictionEnzymeRegistry.loadDefault());
  }

  @Test
  public void testCutLinearWithBamHI() throws Exception {
    Polynucleotide dna = Polynucleotide.dsDNA("ACAACCCCAAGGACCGGATCCGAGACCCTGCAGTGATCGTGG");
    Optional<List<Polynucleotide>> cut = cutter.cutOnce(dna, "BamHI");
    assertTrue(cut.isPresent());
    List<Polynucleotide> pieces = cut.get();
    assertEquals(2, pieces.size());

    Polynucleotide left = pieces.get(0);
    assertEquals("ACAACCCCAAGGACCG", left.getSequence());
    assertEquals("", left.getExt5());
    assertEquals("GATC", left.getExt3());
    assertEquals("The old end keeps its chemistry", Modification.HYDROXYL, left.getModExt5());
    assertEquals(Modification.PHOSPHATE, left.getModExt3());

    Polynucleotide right = pieces.get(1);
    assertEquals("CGAGACCCTGCAGTGATCGTGG", right.getSequence());
    assertEquals("GATC", right.getExt5());
    assertEquals("", right.getExt3());
    assertEquals(Modification.PHOSPHATE, right.getModExt5());
    assertEquals(Modification.HYDROXYL, right.getModExt3());
  }

  @Test
  public void testThreePrimeOverhangIsMarked() throws Exception {
    Polynucleotide dna = Polynucleotide.dsDNA("CGAGACCCTGCAGTGATCGTGG");
    List<Polynucleotide> pieces = cutter.cutOnce(dna, "PstI").get();
    assertEquals("CGAGACCC", pieces.get(0).getSequence());
    assertEquals("-TGCA", pieces.get(0).getExt3());
    assertEquals("GTGATCGTGG", pieces.get(1).getSequence());
    assertEquals("-TGCA", pieces.get(1).getExt5());
  }

  @Test
  public void testSiteOnBottomStrand() throws Exception {
    // GAGACC is BsaI on the bottom strand; it cuts to the left of the site.
    Polynucleotide dna = Polynucleotide.dsDNA("TTTTTTTTTTGAGACCTTTT");
    List<Polynucleotide> pieces = cutter.cutOnce(dna, "BsaI").get();
    assertEquals("TTTTT", pieces.get(0).getSequence());
    assertEquals("TTTT", pieces.get(0).getExt3());
    assertEquals("TGAGACCTTTT", pieces.get(1).getSequence());
    assertEquals("TTTT", pieces.get(1).getExt5());
  }

  @Test
  public void testCutCircleOpensIt() throws Exception {
    Polynucleotide plasmid = Polynucleotide.plasmid("AAAAAGAATTCTTTTT");
    List<Polynucleotide> pieces = cutter.cutOnce(plasmid, "EcoRI").get();
    assertEquals(1, pieces.size());
    Polynucleotide linear = pieces.get(0);
    assertFalse(linear.isCircular());
    assertEquals("CTTTTTAAAAAG", linear.getSequence());
    assertEquals("AATT", linear.getExt5());
    assertEquals("AATT", linear.getExt3());
    assertEquals(Modification.PHOSPHATE, linear.getModExt5());
    assertEquals(Modification.PHOSPHATE, linear.getModExt3());
  }

  @Test
  public void testSiteAcrossTheOrigin() throws Exception {
    Polynucleotide plasmid = Polynucleotide.plasmid("ATTCTTTTTTGA");
    Polynucleotide linear = cutter.cutOnce(plasmid, "EcoRI").get().get(0);
    assertEquals("CTTTTTTG", linear.getSequence());
    assertEquals("AATT", linear.getExt5());
  }

  @Test
  public void testNoSite() throws Exception {
    assertFalse(cutter.cutOnce(Polynucleotide.dsDNA("AAAAAAAAAAAAAAAA"), "EcoRI").isPresent());
  }

  @Test
  public void testSiteTooCloseToTheEnd() throws Exception {
    // The overhang would run off the end of the molecule.
    assertFalse(cutter.cutOnce(Polynucleotide.dsDNA("AAAAAAAAGGTCTCAA"), "BsaI").isPresent());
  }

  @Test
  public void testCutReportsWhereEachProductStarts() throws Exception {
    RestrictionEnzymeRegistry registry = RestrictionEnzymeRegistry.loadDefault();
    Optional<RestrictionCutter.Cut> linear = cutter.cut(
        Polynucleotide.dsDNA("ACAACCCCAAGGACCGGATCCGAGACCC"), registry.getEnzyme("BamHI"));
    assertTrue(linear.isPresent());
    assertEquals(Arrays.asList(0, 20), linear.get().getOffsets());

    Optional<RestrictionCutter.Cut> circular = cutter.cut(
        Polynucleotide.plasmid("AAAAAGAATTCTTTTTTTTTTGGGGG"), registry.getEnzyme("EcoRI"));
    assertTrue(circular.isPresent());
    assertEquals("The opened circle starts after the overhang", Collections.singletonList(10),
        circular.get().getOffsets());
    assertEquals("CTTTTTTTTTTGGGGGAAAAAG", circular.get().getProducts().get(0).getSequence());
  }
}
