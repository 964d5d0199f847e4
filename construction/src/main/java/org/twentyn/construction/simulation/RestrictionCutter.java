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

import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.twentyn.construction.enzymes.RestrictionEnzyme;
import org.twentyn.construction.enzymes.RestrictionEnzymeRegistry;
import org.twentyn.construction.enzymes.UnknownEnzymeException;
import org.twentyn.construction.sequence.Modification;
import org.twentyn.construction.sequence.Polynucleotide;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Cuts a molecule once, at the first usable recognition site of a restriction enzyme.
 *
 * The top strand is searched for the recognition sequence first, then for its reverse complement (a site on the
 * bottom strand).  A circular molecule opens into one linear molecule that starts just after the new overhang and
 * carries that overhang at both ends.  A linear molecule splits in two: the left piece keeps the original 5' end and
 * the right piece keeps the original 3' end.  New ends are 5' phosphorylated.
 */
public class RestrictionCutter {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RestrictionCutter.class);

  private final RestrictionEnzymeRegistry registry;

  public RestrictionCutter(RestrictionEnzymeRegistry registry) {
    this.registry = registry;
  }

  public Optional<List<Polynucleotide>> cutOnce(Polynucleotide poly, String enzymeName)
      throws UnknownEnzymeException {
    return cutOnce(poly, registry.getEnzyme(enzymeName));
  }

  /**
   * Cuts poly at one site of enzyme.
   * @param poly The molecule to cut.
   * @param enzyme The enzyme to cut with.
   * @return The products, left to right, or empty if the enzyme has no usable site in poly.
   */
  public Optional<List<Polynucleotide>> cutOnce(Polynucleotide poly, RestrictionEnzyme enzyme) {
    return cut(poly, enzyme).map(Cut::getProducts);
  }

  /**
   * Like cutOnce, but also reports where each product starts in poly.
   */
  Optional<Cut> cut(Polynucleotide poly, RestrictionEnzyme enzyme) {
    String seq = poly.getSequence();
    int length = seq.length();
    String site = enzyme.getRecognitionSequence();

    // Sites that straddle the origin of a circle are still sites.
    String searchable = poly.isCircular() ? seq + seq.substring(0, Math.min(length, site.length() - 1)) : seq;

    for (boolean topStrand : Arrays.asList(true, false)) {
      String pattern = topStrand ? site : enzyme.getRecognitionSequenceRC();
      int index = searchable.indexOf(pattern);
      while (index != -1 && index < length) {
        Pair<Integer, Integer> region = overhangRegion(enzyme, index, topStrand);
        Optional<Cut> products = poly.isCircular()
            ? cutCircular(poly, enzyme, region.getLeft(), region.getRight())
            : cutLinear(poly, enzyme, region.getLeft(), region.getRight());
        if (products.isPresent()) {
          return products;
        }
        LOGGER.debug("%s site at %d of %s is too close to an end to cut", enzyme.getName(), index, seq);
        index = searchable.indexOf(pattern, index + 1);
      }
    }
    return Optional.empty();
  }

  /**
   * Computes the single stranded span left between the two nicks, as [start, end) in top-strand coordinates.
   */
  static Pair<Integer, Integer> overhangRegion(RestrictionEnzyme enzyme, int siteIndex, boolean topStrand) {
    int cut5 = enzyme.getCut5();
    int cut3 = enzyme.getCut3();
    if (topStrand) {
      int siteEnd = siteIndex + enzyme.getRecognitionSequence().length();
      return enzyme.isFivePrime()
          ? Pair.of(siteEnd + cut5, siteEnd + cut3)
          : Pair.of(siteEnd + cut3, siteEnd + cut5);
    }
    // On the bottom strand the site reads right to left, so offsets count leftward from its top-strand start.
    return enzyme.isFivePrime()
        ? Pair.of(siteIndex - cut3, siteIndex - cut5)
        : Pair.of(siteIndex - cut5, siteIndex - cut3);
  }

  private static String stickyEnd(RestrictionEnzyme enzyme, String bases) {
    if (bases.isEmpty() || enzyme.isFivePrime()) {
      return bases;
    }
    return Polynucleotide.THREE_PRIME_OVERHANG_MARKER + bases;
  }

  private Optional<Cut> cutCircular(Polynucleotide poly, RestrictionEnzyme enzyme, int start, int end) {
    String seq = poly.getSequence();
    int length = seq.length();
    int overhangLength = end - start;
    if (overhangLength >= length) {
      return Optional.empty();
    }
    int wrappedStart = Math.floorMod(start, length);
    String doubled = seq + seq;
    String stickyEnd = stickyEnd(enzyme, doubled.substring(wrappedStart, wrappedStart + overhangLength));
    String linearSeq = doubled.substring(wrappedStart + overhangLength, wrappedStart + length);

    Polynucleotide linear = new Polynucleotide(linearSeq, stickyEnd, stickyEnd,
        poly.isDoubleStranded(), poly.isRNA(), false, Modification.PHOSPHATE, Modification.PHOSPHATE);
    return Optional.of(new Cut(Collections.singletonList(linear),
        Collections.singletonList((wrappedStart + overhangLength) % length)));
  }

  private Optional<Cut> cutLinear(Polynucleotide poly, RestrictionEnzyme enzyme, int start, int end) {
    String seq = poly.getSequence();
    // Both pieces must keep at least one paired base.
    if (start < 1 || end > seq.length() - 1) {
      return Optional.empty();
    }
    String stickyEnd = stickyEnd(enzyme, seq.substring(start, end));

    Polynucleotide left = new Polynucleotide(seq.substring(0, start), poly.getExt5(), stickyEnd,
        poly.isDoubleStranded(), poly.isRNA(), false, poly.getModExt5(), Modification.PHOSPHATE);
    Polynucleotide right = new Polynucleotide(seq.substring(end), stickyEnd, poly.getExt3(),
        poly.isDoubleStranded(), poly.isRNA(), false, Modification.PHOSPHATE, poly.getModExt3());
    return Optional.of(new Cut(Arrays.asList(left, right), Arrays.asList(0, end)));
  }

  /**
   * The products of one cut, each with the position in the parent's sequence where its own sequence begins.
   */
  static class Cut {
    private final List<Polynucleotide> products;
    private final List<Integer> offsets;

    Cut(List<Polynucleotide> products, List<Integer> offsets) {
      this.products = products;
      this.offsets = offsets;
    }

    public List<Polynucleotide> getProducts() {
      return products;
    }

    public List<Integer> getOffsets() {
      return offsets;
    }
  }
}
