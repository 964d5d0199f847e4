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

import org.junit.Test;
import org.twentyn.construction.sequence.InvalidSequenceException;
import org.twentyn.construction.sequence.Modification;
import org.twentyn.construction.sequence.Polynucleotide;
import org.twentyn.construction.sequence.SequenceUtils;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PCRSimulatorTest {

  private static final String FORWARD = "gacttGAATTCgcggccgctTCTAGAgTCCCTATCAGTGATAGAG";
  private static final String REVERSE = "catcaACTAGTaGTGCTCAGTATCTCTATCAC";
  private static final String TEMPLATE = "tccctatcagtgatagagattgacatccctatcagtgatagagatactgagcac";
  private static final String PRODUCT =
      "GACTTGAATTCGCGGCCGCTTCTAGAGTCCCTATCAGTGATAGAGATTGACATCCCTATCAGTGATAGAGATACTGAGCACTACTAGTTGATG";

  private final PCRSimulator simulator = new PCRSimulator();

  @Test
  public void testPcrAddsPrimerTails() throws Exception {
    assertEquals(PRODUCT, simulator.pcr(FORWARD, REVERSE, TEMPLATE));
  }

  @Test
  public void testTemplateMayBeTheOtherStrand() throws Exception {
    assertEquals(PRODUCT, simulator.pcr(FORWARD, REVERSE, SequenceUtils.reverseComplement(TEMPLATE)));
  }

  @Test
  public void testProductMaySpanTheTemplateOrigin() throws Exception {
    String template = "ATGCGTACGTTAGCCTAGGCATCGATCGGATCCTAGCTAGCTTACGGATCGATGCAAGCTTGGCACTGGCCGTCGTTTTAC";
    String forward = "GCACTGGCCGTCGTTTTA";
    String reverse = SequenceUtils.reverseComplement("GCGTACGTTAGCCTAGGC");
    assertEquals("GCACTGGCCGTCGTTTTACATGCGTACGTTAGCCTAGGC", simulator.pcr(forward, reverse, template));
  }

  @Test
  public void testPcrOnMoleculesGivesBluntDsDNA() throws Exception {
    Polynucleotide product = simulator.pcr(Polynucleotide.oligo(FORWARD), Polynucleotide.oligo(REVERSE),
        Polynucleotide.plasmid(TEMPLATE));
    assertEquals(PRODUCT, product.getSequence());
    assertTrue(product.isDoubleStranded());
    assertFalse(product.isCircular());
    assertEquals("", product.getExt5());
    assertEquals(Modification.HYDROXYL, product.getModExt5());
  }

  @Test(expected = NoAnnealException.class)
  public void testForwardPrimerMustAnneal() throws Exception {
    simulator.pcr("AAAAAAAAAAAAAAAAAAAAAA", REVERSE, TEMPLATE);
  }

  @Test(expected = NoAnnealException.class)
  public void testReversePrimerMustAnneal() throws Exception {
    simulator.pcr(FORWARD, "TTTTTTTTTTTTTTTTTTTTTTTTT", TEMPLATE);
  }

  @Test(expected = InvalidSequenceException.class)
  public void testUnreadablePrimer() throws Exception {
    simulator.pcr("P6libF", REVERSE, TEMPLATE);
  }
}
