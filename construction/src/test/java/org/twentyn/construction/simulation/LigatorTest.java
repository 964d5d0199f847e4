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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class LigatorTest {

  private static final String PLASMID = "AAAAAGAATTCTTTTTTTTTTTTTTTTTTTTTTTTTTTTGGATCCGGGGG";

  private RestrictionEnzymeRegistry registry;
  private Digester digester;
  private Ligator ligator;

  @Before
  public void setUp() throws Exception {
    registry = RestrictionEnzymeRegistry.loadDefault();
    digester = new Digester(registry);
    ligator = new Ligator();
  }

  private List<Polynucleotide> digest(Polynucleotide dna, String... enzymes) throws Exception {
    return digester.digestToCompletion(dna, registry.getEnzymes(Arrays.asList(enzymes)));
  }

  @Test
  public void testDigestThenLigateRestoresThePlasmid() throws Exception {
    List<Polynucleotide> fragments = digest(Polynucleotide.plasmid(PLASMID), "EcoRI", "BamHI");
    Polynucleotide religated = ligator.ligate(Arrays.asList(fragments.get(1), fragments.get(0)));
    assertTrue(religated.isCircular());
    assertEquals(Polynucleotide.plasmid(PLASMID), religated);
    assertEquals(Polynucleotide.plasmid(PLASMID), ligator.ligate(fragments));
  }

  @Test
  public void testFragmentIsFlippedToFit() throws Exception {
    List<Polynucleotide> fragments = digest(Polynucleotide.plasmid(PLASMID), "EcoRI", "BamHI");
    Polynucleotide religated = ligator.ligate(Arrays.asList(fragments.get(1), fragments.get(0).reverseComplement()));
    assertEquals(Polynucleotide.plasmid(PLASMID), religated);
  }

  @Test
  public void testSingleCutPlasmidRecloses() throws Exception {
    List<Polynucleotide> opened = digest(Polynucleotide.plasmid(PLASMID), "BamHI");
    assertEquals(1, opened.size());
    assertEquals(Polynucleotide.plasmid(PLASMID), ligator.ligate(opened));
  }

  @Test
  public void testLinearPiecesRejoin() throws Exception {
    String seq = "ACAACCCCAAGGACCGGATCCGAGACCCTGCAGTGATCGTGG";
    List<Polynucleotide> pieces = digest(Polynucleotide.dsDNA(seq), "BamHI");
    Polynucleotide rejoined = ligator.ligate(pieces);
    assertFalse("Unphosphorylated outer ends stay open", rejoined.isCircular());
    assertEquals(seq, rejoined.getSequence());
    assertEquals(Polynucleotide.dsDNA(seq), rejoined);
  }

  @Test
  public void testCompatibleEndsNeedAPhosphate() {
    assertTrue(Ligator.compatible("GATC", Modification.PHOSPHATE, "GATC", Modification.HYDROXYL));
    assertFalse(Ligator.compatible("GATC", Modification.HYDROXYL, "GATC", Modification.HYDROXYL));
    assertFalse(Ligator.compatible("GATC", Modification.PHOSPHATE, "AATT", Modification.PHOSPHATE));
  }

  @Test(expected = NonClosingAssemblyException.class)
  public void testPcrProductsDoNotLigate() throws Exception {
    ligator.ligate(Arrays.asList(Polynucleotide.dsDNA("ACGTACGTAA"), Polynucleotide.dsDNA("GGCCGGCCTT")));
  }

  @Test(expected = AmbiguousAssemblyException.class)
  public void testSymmetricEndsAreAmbiguous() throws Exception {
    List<Polynucleotide> fragments =
        digest(Polynucleotide.plasmid("AAAAAGGATCCTTTTTTTTTTTTTGGATCCGGGGG"), "BamHI");
    assertEquals(2, fragments.size());
    ligator.ligate(fragments);
  }

  @Test(expected = InvalidPartException.class)
  public void testCirclesCannotBeLigated() throws Exception {
    ligator.ligate(Collections.singletonList(Polynucleotide.plasmid(PLASMID)));
  }
}
