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
import org.twentyn.construction.sequence.Modification;
import org.twentyn.construction.sequence.Polynucleotide;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

/**
 * Ligates linear fragments end to end through matching sticky (or blunt) ends.
 *
 * Two ends join when their overhangs are identical and at least one of them carries a 5' phosphate, so unkinased PCR
 * products never ligate to each other.  Joining starts from the first fragment and extends its 3' end one fragment
 * at a time; every remaining fragment is tried both as given and flipped.  If the finished chain's 3' end can join
 * its own 5' end, the product closes into a circle.
 */
public class Ligator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Ligator.class);

  public Polynucleotide ligate(List<Polynucleotide> fragments)
      throws InvalidPartException, AmbiguousAssemblyException, NonClosingAssemblyException {
    if (fragments.isEmpty()) {
      throw new NonClosingAssemblyException("Nothing to ligate");
    }
    for (Polynucleotide fragment : fragments) {
      if (fragment.isCircular()) {
        throw new InvalidPartException(String.format("Cannot ligate circular molecule %s", fragment.getSequence()));
      }
    }

    Polynucleotide first = fragments.get(0);
    LinkedList<Polynucleotide> unused = new LinkedList<>(fragments.subList(1, fragments.size()));
    StringBuilder sequence = new StringBuilder(first.getSequence());
    String ext3 = first.getExt3();
    Modification modExt3 = first.getModExt3();

    while (!unused.isEmpty()) {
      List<Polynucleotide> candidates = new ArrayList<>();
      Polynucleotide source = null;
      for (Polynucleotide fragment : unused) {
        for (Polynucleotide oriented : new Polynucleotide[] {fragment, fragment.reverseComplement()}) {
          if (compatible(ext3, modExt3, oriented.getExt5(), oriented.getModExt5())) {
            candidates.add(oriented);
            source = fragment;
          }
        }
      }
      if (candidates.isEmpty()) {
        throw new NonClosingAssemblyException(String.format(
            "No fragment ligates to end '%s'; %d fragments left over", ext3, unused.size()));
      }
      if (candidates.size() > 1) {
        throw new AmbiguousAssemblyException(String.format(
            "%d fragments could ligate to end '%s'", candidates.size(), ext3));
      }

      Polynucleotide next = candidates.get(0);
      sequence.append(Polynucleotide.overhangBases(ext3)).append(next.getSequence());
      ext3 = next.getExt3();
      modExt3 = next.getModExt3();
      unused.remove(source);
    }

    if (compatible(ext3, modExt3, first.getExt5(), first.getModExt5())) {
      sequence.append(Polynucleotide.overhangBases(ext3));
      LOGGER.debug("Ligated %d fragments into a %d bp circle", fragments.size(), sequence.length());
      return Polynucleotide.plasmid(sequence.toString());
    }
    LOGGER.debug("Ligated %d fragments into a %d bp linear product", fragments.size(), sequence.length());
    return new Polynucleotide(sequence.toString(), first.getExt5(), ext3, true, false, false,
        first.getModExt5(), modExt3);
  }

  static boolean compatible(String ext3, Modification modExt3, String ext5, Modification modExt5) {
    return ext3.equals(ext5) && (modExt3 == Modification.PHOSPHATE || modExt5 == Modification.PHOSPHATE);
  }
}
