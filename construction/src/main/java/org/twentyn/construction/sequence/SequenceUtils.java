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

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

/**
 * Utility methods for common molecular biology operations on plain sequence strings.
 */
public class SequenceUtils {

  private static final Map<Character, Character> COMPLEMENTS = new HashMap<Character, Character>() {{
    put('A', 'T');
    put('T', 'A');
    put('U', 'A');
    put('C', 'G');
    put('G', 'C');
    //BDHKMNRSVWY
    //VHDMKNYSBWR
    put('B', 'V');
    put('D', 'H');
    put('H', 'D');
    put('K', 'M');
    put('M', 'K');
    put('N', 'N');
    put('R', 'Y');
    put('S', 'S');
    put('V', 'B');
    put('W', 'W');
    put('Y', 'R');
  }};

  private SequenceUtils() {}

  public static char complement(char base) {
    boolean lower = Character.isLowerCase(base);
    Character out = COMPLEMENTS.get(Character.toUpperCase(base));
    if (out == null) {
      throw new InvalidCharacterException(base);
    }
    return lower ? Character.toLowerCase(out) : out;
  }

  public static String complement(String seq) {
    StringBuilder sb = new StringBuilder(seq.length());
    for (int i = 0; i < seq.length(); i++) {
      sb.append(complement(seq.charAt(i)));
    }
    return sb.toString();
  }

  /**
   * Reverse complements a sequence, keeping the case of each base.  Ambiguity codes complement to their partner
   * code (R/Y, K/M, B/V, D/H); S, W and N complement to themselves.
   * @param seq The sequence to reverse complement.
   * @return The reverse complement.
   * @throws InvalidCharacterException If a symbol is not a nucleotide or ambiguity code.
   */
  public static String reverseComplement(String seq) {
    StringBuilder sb = new StringBuilder(seq.length());
    for (int i = seq.length() - 1; i >= 0; i--) {
      sb.append(complement(seq.charAt(i)));
    }
    return sb.toString();
  }

  public static boolean isPalindromic(String seq) {
    return seq.equals(reverseComplement(seq));
  }

  public static double calcGC(String inseq) {
    String seq = inseq.toUpperCase();
    int gcs = 0;
    for (int i = 0; i < seq.length(); i++) {
      char achar = seq.charAt(i);
      if (achar == 'C' || achar == 'G') {
        gcs++;
      }
    }
    return gcs / (1.0 * seq.length());
  }

  /**
   * Finds the lexicographically least rotation of a sequence using Booth's algorithm.
   * @param seq A non-empty sequence, read as circular.
   * @return The rotation of seq that sorts first.
   */
  public static String leastRotation(String seq) {
    String doubled = seq + seq;
    int[] failure = new int[doubled.length()];
    Arrays.fill(failure, -1);
    int k = 0;
    for (int j = 1; j < doubled.length(); j++) {
      char sj = doubled.charAt(j);
      int i = failure[j - k - 1];
      while (i != -1 && sj != doubled.charAt(k + i + 1)) {
        if (sj < doubled.charAt(k + i + 1)) {
          k = j - i - 1;
        }
        i = failure[i];
      }
      // Here i == -1 whenever the characters differ.
      if (sj != doubled.charAt(k + i + 1)) {
        if (sj < doubled.charAt(k)) {
          k = j;
        }
        failure[j - k] = -1;
      } else {
        failure[j - k] = i + 1;
      }
    }
    return doubled.substring(k, k + seq.length());
  }

  /**
   * Rotates a circular sequence so that it starts at the given offset.
   */
  public static String rotate(String seq, int offset) {
    int start = Math.floorMod(offset, seq.length());
    return seq.substring(start) + seq.substring(0, start);
  }
}
