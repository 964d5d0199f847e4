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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.apache.commons.lang3.StringUtils;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A modeled DNA or RNA molecule: the top strand sequence (5' to 3'), the single-stranded extensions at either end,
 * its topology and strandedness, and the chemistry of its termini.
 *
 * Extensions are written in top-strand coordinates.  A 5' overhang is the bare sequence of the protruding bases; a
 * 3' overhang carries a leading '-'.  Circular molecules have no ends and so never carry extensions.
 *
 * Polynucleotides are immutable.  Equality, hashing and ordering are defined on a canonical form: the least rotation
 * over both strands for circular molecules, and the least orientation for linear ones.  Two circular molecules are
 * therefore equal when one is a rotation of the other or of its reverse complement, and two linear molecules are
 * equal when they match directly or after reverse complementing, ends included.
 */
@JsonPropertyOrder({"sequence", "ext5", "ext3", "isDoubleStranded", "isRNA", "isCircular", "mod_ext5", "mod_ext3"})
public class Polynucleotide implements Comparable<Polynucleotide> {
  public static final String THREE_PRIME_OVERHANG_MARKER = "-";

  private static final Pattern OVERHANG_PATTERN =
      Pattern.compile("^-?[ACGTURYSWKMBDHVN]*$", Pattern.CASE_INSENSITIVE);

  private static final Comparator<Polynucleotide> FIELD_ORDER = Comparator
      .comparing(Polynucleotide::isCircular)
      .thenComparing(Polynucleotide::isDoubleStranded)
      .thenComparing(Polynucleotide::isRNA)
      .thenComparing(Polynucleotide::getSequence)
      .thenComparing(Polynucleotide::getExt5)
      .thenComparing(Polynucleotide::getExt3)
      .thenComparing(Polynucleotide::getModExt5)
      .thenComparing(Polynucleotide::getModExt3);

  private final String sequence;
  private final String ext5;
  private final String ext3;
  private final boolean doubleStranded;
  private final boolean rna;
  private final boolean circular;
  private final Modification modExt5;
  private final Modification modExt3;

  private Polynucleotide canonical;

  public Polynucleotide(String sequence, String ext5, String ext3, boolean isDoubleStranded, boolean isRNA,
                        boolean isCircular, Modification modExt5, Modification modExt3) {
    this.sequence = SequenceResolver.resolveToSequence(sequence);
    this.ext5 = normalizeOverhang(ext5);
    this.ext3 = normalizeOverhang(ext3);
    if (isCircular && !(this.ext5.isEmpty() && this.ext3.isEmpty())) {
      throw new IllegalArgumentException(String.format(
          "Circular molecule %s cannot carry overhangs (ext5 '%s', ext3 '%s')", this.sequence, this.ext5, this.ext3));
    }
    this.doubleStranded = isDoubleStranded;
    this.rna = isRNA;
    this.circular = isCircular;
    this.modExt5 = modExt5 == null ? Modification.NONE : modExt5;
    this.modExt3 = modExt3 == null ? Modification.NONE : modExt3;
  }

  // Missing flags in a record default to a linear double stranded DNA.
  @JsonCreator
  private static Polynucleotide fromRecord(@JsonProperty("sequence") String sequence,
                                           @JsonProperty("ext5") String ext5,
                                           @JsonProperty("ext3") String ext3,
                                           @JsonProperty("isDoubleStranded") Boolean isDoubleStranded,
                                           @JsonProperty("isRNA") Boolean isRNA,
                                           @JsonProperty("isCircular") Boolean isCircular,
                                           @JsonProperty("mod_ext5") Modification modExt5,
                                           @JsonProperty("mod_ext3") Modification modExt3) {
    return new Polynucleotide(sequence, ext5, ext3,
        isDoubleStranded == null ? true : isDoubleStranded,
        isRNA == null ? false : isRNA,
        isCircular == null ? false : isCircular,
        modExt5, modExt3);
  }

  /**
   * A blunt, linear, double stranded DNA with hydroxyl ends, such as a PCR product.
   */
  public static Polynucleotide dsDNA(String sequence) {
    return new Polynucleotide(sequence, "", "", true, false, false, Modification.HYDROXYL, Modification.HYDROXYL);
  }

  /**
   * A single stranded synthetic oligonucleotide.
   */
  public static Polynucleotide oligo(String sequence) {
    return new Polynucleotide(sequence, "", "", false, false, false, Modification.HYDROXYL, Modification.NONE);
  }

  /**
   * A circular double stranded DNA.
   */
  public static Polynucleotide plasmid(String sequence) {
    return new Polynucleotide(sequence, "", "", true, false, true, Modification.NONE, Modification.NONE);
  }

  private static String normalizeOverhang(String overhang) {
    String out = StringUtils.defaultString(overhang).trim().toUpperCase();
    if (!OVERHANG_PATTERN.matcher(out).matches()) {
      throw new InvalidSequenceException(String.format("Unrecognizable as overhang: %s", overhang));
    }
    // A bare marker means there is nothing protruding.
    return THREE_PRIME_OVERHANG_MARKER.equals(out) ? "" : out;
  }

  public static boolean isThreePrimeOverhang(String overhang) {
    return overhang.startsWith(THREE_PRIME_OVERHANG_MARKER);
  }

  /**
   * The bases of an overhang without its 3' marker.
   */
  public static String overhangBases(String overhang) {
    return isThreePrimeOverhang(overhang) ? overhang.substring(1) : overhang;
  }

  static String reverseComplementOverhang(String overhang) {
    if (isThreePrimeOverhang(overhang)) {
      return THREE_PRIME_OVERHANG_MARKER + SequenceUtils.reverseComplement(overhang.substring(1));
    }
    return SequenceUtils.reverseComplement(overhang);
  }

  @JsonProperty("sequence")
  public String getSequence() {
    return sequence;
  }

  @JsonProperty("ext5")
  public String getExt5() {
    return ext5;
  }

  @JsonProperty("ext3")
  public String getExt3() {
    return ext3;
  }

  @JsonProperty("isDoubleStranded")
  public boolean isDoubleStranded() {
    return doubleStranded;
  }

  @JsonProperty("isRNA")
  public boolean isRNA() {
    return rna;
  }

  @JsonProperty("isCircular")
  public boolean isCircular() {
    return circular;
  }

  @JsonProperty("mod_ext5")
  public Modification getModExt5() {
    return modExt5;
  }

  @JsonProperty("mod_ext3")
  public Modification getModExt3() {
    return modExt3;
  }

  public int length() {
    return sequence.length();
  }

  /**
   * Flips the molecule: the sequence is reverse complemented, and the ends swap places and are reverse complemented
   * in turn (a 3' overhang stays a 3' overhang).
   */
  public Polynucleotide reverseComplement() {
    return new Polynucleotide(SequenceUtils.reverseComplement(sequence),
        reverseComplementOverhang(ext3), reverseComplementOverhang(ext5),
        doubleStranded, rna, circular, modExt3, modExt5);
  }

  /**
   * Re-reads a circular molecule starting at the given position.
   */
  public Polynucleotide rotate(int offset) {
    if (!circular) {
      throw new IllegalStateException("Only circular molecules can be rotated");
    }
    return new Polynucleotide(SequenceUtils.rotate(sequence, offset), "", "",
        doubleStranded, rna, true, modExt5, modExt3);
  }

  public Polynucleotide canonical() {
    if (canonical == null) {
      canonical = computeCanonical();
    }
    return canonical;
  }

  private Polynucleotide computeCanonical() {
    if (circular) {
      String forward = SequenceUtils.leastRotation(sequence);
      String reverse = SequenceUtils.leastRotation(SequenceUtils.reverseComplement(sequence));
      String least = forward.compareTo(reverse) <= 0 ? forward : reverse;
      // Termini chemistry has no meaning once the ends are joined.
      return new Polynucleotide(least, "", "", doubleStranded, rna, true, Modification.NONE, Modification.NONE);
    }
    Polynucleotide flipped = reverseComplement();
    return FIELD_ORDER.compare(this, flipped) <= 0 ? this : flipped;
  }

  @Override
  public int compareTo(Polynucleotide other) {
    return FIELD_ORDER.compare(this.canonical(), other.canonical());
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Polynucleotide)) {
      return false;
    }
    Polynucleotide that = (Polynucleotide) o;
    if (circular != that.circular || doubleStranded != that.doubleStranded || rna != that.rna ||
        sequence.length() != that.sequence.length()) {
      return false;
    }
    return FIELD_ORDER.compare(this.canonical(), that.canonical()) == 0;
  }

  @Override
  public int hashCode() {
    Polynucleotide c = canonical();
    return Objects.hash(c.sequence, c.ext5, c.ext3, c.doubleStranded, c.rna, c.circular, c.modExt5, c.modExt3);
  }

  @Override
  public String toString() {
    return String.format("Polynucleotide{%s%s%s, %s, %s}",
        ext5.isEmpty() ? "" : "(" + ext5 + ")", sequence, ext3.isEmpty() ? "" : "(" + ext3 + ")",
        circular ? "circular" : "linear", doubleStranded ? "ds" : "ss");
  }
}
