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

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * Turns user supplied text into canonical sequences and molecules.  This is the only place where raw input is
 * validated; everything downstream works on canonical uppercase sequences.
 */
public class SequenceResolver {

  // IUPAC nucleotides and ambiguity codes.
  public static final Pattern NUCLEOTIDE_PATTERN = Pattern.compile("^[ACGTURYSWKMBDHVN]+$", Pattern.CASE_INSENSITIVE);
  private static final Pattern CLEANUP_PATTERN = Pattern.compile("[\\s\\d]");

  private SequenceResolver() {}

  public static boolean isSequence(String text) {
    return text != null && NUCLEOTIDE_PATTERN.matcher(text).matches();
  }

  /**
   * Validates a sequence against the IUPAC nucleotide alphabet and returns it in canonical uppercase form.
   * @param input The candidate sequence.
   * @return The uppercase sequence.
   * @throws InvalidSequenceException If input is empty or contains a symbol outside the alphabet.
   */
  public static String resolveToSequence(String input) {
    if (!isSequence(input)) {
      throw new InvalidSequenceException(String.format("Unrecognizable as sequence: %s", input));
    }
    return input.toUpperCase();
  }

  /**
   * Strips whitespace and position numbers from pasted sequence text, e.g. "1 ACGTACGTAC GTACG\n16 TTAG".
   */
  public static String cleanup(String messy) {
    return resolveToSequence(CLEANUP_PATTERN.matcher(StringUtils.defaultString(messy)).replaceAll(""));
  }

  public static Polynucleotide resolveToPolynucleotide(MoleculeInput input) {
    return input.toPolynucleotide();
  }

  /**
   * Resolves text that is either a raw sequence or a JSON Polynucleotide record.
   * @throws ResolutionException If the text is neither.
   */
  public static Polynucleotide resolveToPolynucleotide(String input) throws ResolutionException {
    return MoleculeInput.parse(input).toPolynucleotide();
  }
}
