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

package org.twentyn.construction.sequence;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class SequenceUtilsTest {

  @Test
  public void testReverseComplement() {
    assertEquals("ATGC reverse complements to GCAT", "GCAT", SequenceUtils.reverseComplement("ATGC"));
    assertEquals("Case is preserved", "gcAT", SequenceUtils.reverseComplement("ATgc"));
    assertEquals("Ambiguity codes complement", "NYRVB", SequenceUtils.reverseComplement("VBYRN"));
  }

  @Test
  public void testReverseComplementIsAnInvolution() {
    String seq = "GACTTGAATTCGCGGCCGCTTCTAGAGKMRYSWBDHVN";
    assertEquals(seq, SequenceUtils.reverseComplement(SequenceUtils.reverseComplement(seq)));
  }

  @Test(expected = InvalidCharacterException.class)
  public void testComplementRejectsNonNucleotides() {
    SequenceUtils.complement("ACGTX");
  }

  @Test
  public void testIsPalindromic() {
    assertTrue("AATT is its own reverse complement", SequenceUtils.isPalindromic("AATT"));
    assertTrue("EcoRI site is palindromic", SequenceUtils.isPalindromic("GAATTC"));
    assertFalse("CGAT is not palindromic", SequenceUtils.isPalindromic("CGAT"));
    assertFalse("BsaI site is not palindromic", SequenceUtils.isPalindromic("GGTCTC"));
  }

  @Test
  public void testCalcGC() {
    assertEquals(0.5, SequenceUtils.calcGC("ATGC"), 1e-9);
    assertEquals(1.0, SequenceUtils.calcGC("gcgc"), 1e-9);
    assertEquals(0.0, SequenceUtils.calcGC("ATAT"), 1e-9);
  }

  @Test
  public void testLeastRotation() {
    assertEquals("ACGT", SequenceUtils.leastRotation("GTAC"));
    assertEquals("AAAB", SequenceUtils.leastRotation("ABAA"));
    assertEquals("AAAA", SequenceUtils.leastRotation("AAAA"));
    assertEquals("A", SequenceUtils.leastRotation("A"));
  }

  @Test
  public void testRotate() {
    assertEquals("CGTA", SequenceUtils.rotate("ACGT", 1));
    assertEquals("TACG", SequenceUtils.rotate("ACGT", -1));
    assertEquals("ACGT", SequenceUtils.rotate("ACGT", 4));
  }
}
