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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.twentyn.construction.enzymes.RestrictionEnzyme;
import org.twentyn.construction.enzymes.RestrictionEnzymeRegistry;
import org.twentyn.construction.enzymes.UnknownEnzymeException;
import org.twentyn.construction.sequence.Polynucleotide;
import org.twentyn.construction.sequence.ResolutionException;
import org.twentyn.construction.sequence.SequenceResolver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Digests a molecule to completion with one or more restriction enzymes and picks out one fragment.
 *
 * Fragments are numbered from zero, left to right by where they sat in the input.  For a circular input the fragment
 * that spans the origin is fragment zero.
 */
public class Digester {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Digester.class);

  private final RestrictionEnzymeRegistry registry;
  private final RestrictionCutter cutter;

  public Digester(RestrictionEnzymeRegistry registry) {
    this.registry = registry;
    this.cutter = new RestrictionCutter(registry);
  }

  /**
   * Splits an enzyme list such as "EcoRI,BamHI" or "EcoRI/BamHI" into names.
   */
  public static List<String> splitEnzymeList(String enzymes) {
    return Arrays.stream(enzymes.split("[^A-Za-z0-9]+"))
        .filter(name -> !name.trim().isEmpty())
        .collect(Collectors.toList());
  }

  /**
   * Digests text that is either a raw sequence (read as a linear blunt dsDNA) or a Polynucleotide record.
   */
  public Polynucleotide digest(String seqOrRecord, String enzymes, int fragSelect)
      throws ResolutionException, UnknownEnzymeException, InvalidFragmentIndexException {
    return digest(SequenceResolver.resolveToPolynucleotide(seqOrRecord), splitEnzymeList(enzymes), fragSelect);
  }

  public Polynucleotide digest(Polynucleotide poly, List<String> enzymeNames, int fragSelect)
      throws UnknownEnzymeException, InvalidFragmentIndexException {
    // Check every name before cutting anything.
    List<RestrictionEnzyme> enzymes = registry.getEnzymes(enzymeNames);
    List<Polynucleotide> fragments = digestToCompletion(poly, enzymes);

    if (fragSelect < 0 || fragSelect >= fragments.size()) {
      throw new InvalidFragmentIndexException(String.format(
          "Invalid fragment %d selected; digest of %s with %s gave %d fragments",
          fragSelect, poly.getSequence(), enzymeNames, fragments.size()));
    }
    return fragments.get(fragSelect);
  }

  /**
   * Cuts until no enzyme has a usable site left in any fragment.  Each pass takes the first fragment any enzyme
   * can cut, replaces it in place with its pieces, and starts over.
   * @return The fragments, numbered as described for this class.
   */
  public List<Polynucleotide> digestToCompletion(Polynucleotide poly, List<RestrictionEnzyme> enzymes) {
    List<Polynucleotide> fragments = new ArrayList<>();
    // Where each fragment's sequence begins in poly; may run past the end of a circle.
    List<Integer> starts = new ArrayList<>();
    fragments.add(poly);
    starts.add(0);

    boolean foundCut = true;
    while (foundCut) {
      foundCut = false;
      for (int i = 0; i < fragments.size() && !foundCut; i++) {
        for (RestrictionEnzyme enzyme : enzymes) {
          Optional<RestrictionCutter.Cut> cut = cutter.cut(fragments.get(i), enzyme);
          if (cut.isPresent()) {
            int parentStart = starts.remove(i);
            fragments.remove(i);
            fragments.addAll(i, cut.get().getProducts());
            starts.addAll(i, cut.get().getOffsets().stream()
                .map(offset -> parentStart + offset)
                .collect(Collectors.toList()));
            foundCut = true;
            break;
          }
        }
      }
    }
    LOGGER.debug("Digest of %d bp with %s gave %d fragments", poly.length(), enzymes, fragments.size());

    if (poly.isCircular() && fragments.size() > 1) {
      return orderCircularFragments(poly.length(), fragments, starts);
    }
    return fragments;
  }

  private static List<Polynucleotide> orderCircularFragments(int circumference, List<Polynucleotide> fragments,
                                                             List<Integer> starts) {
    List<Integer> order = new ArrayList<>(fragments.size());
    for (int i = 0; i < fragments.size(); i++) {
      order.add(i);
    }
    order.sort(Comparator.comparingInt(i -> sortPosition(circumference, starts.get(i), fragments.get(i).length())));

    List<Polynucleotide> ordered = new ArrayList<>(fragments.size());
    for (int i : order) {
      ordered.add(fragments.get(i));
    }
    return ordered;
  }

  // A fragment that runs past the origin sorts ahead of everything that starts after it.
  private static int sortPosition(int circumference, int start, int length) {
    int position = start % circumference;
    return position + length > circumference ? position - circumference : position;
  }
}
