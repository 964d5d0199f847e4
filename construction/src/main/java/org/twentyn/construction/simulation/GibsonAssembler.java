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

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.twentyn.construction.sequence.Polynucleotide;
import org.twentyn.construction.sequence.SequenceResolver;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Predicts the product of a Gibson (or SOEing, or yeast recombination) assembly from overlapping fragments.
 *
 * Fragments join where the last 20 bases of one occur in another.  Joining proceeds in rounds: in each round every
 * ordered pair that overlaps is merged.  A round that yields as many products as it started with has wrapped all
 * the way around, which marks the product circular; the last product is then redundant and is dropped.  A round
 * that yields more products than it started with means some junction is ambiguous.
 */
public class GibsonAssembler {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GibsonAssembler.class);

  public static final int HOMOLOGY_LENGTH = 20;

  /**
   * @param fragments The fragments to join.  Only their sequences, with 5' overhangs filled in, are used.
   * @param requireCircular Reject a product that does not close into a circle.
   * @return A plasmid if the product closed, otherwise a linear dsDNA.
   */
  public Polynucleotide assemble(List<Polynucleotide> fragments, boolean requireCircular)
      throws AmbiguousAssemblyException, NonClosingAssemblyException {
    List<String> sequences = fragments.stream().map(EndRepairer::duplexSequence).collect(Collectors.toList());
    AssemblyResult result = assembleSequences(sequences, requireCircular);
    return result.isCircular() ? Polynucleotide.plasmid(result.getSequence()) : Polynucleotide.dsDNA(result.getSequence());
  }

  public String assemble(List<String> sequences)
      throws AmbiguousAssemblyException, NonClosingAssemblyException {
    List<String> resolved = sequences.stream().map(SequenceResolver::resolveToSequence).collect(Collectors.toList());
    return assembleSequences(resolved, true).getSequence();
  }

  AssemblyResult assembleSequences(List<String> sequences, boolean requireCircular)
      throws AmbiguousAssemblyException, NonClosingAssemblyException {
    if (sequences.isEmpty()) {
      throw new NonClosingAssemblyException("Nothing to assemble: expected at least one sequence");
    }

    List<String> current = new ArrayList<>(sequences);
    boolean circular = false;
    int round = 0;
    while (current.size() > 1) {
      List<String> joined = joinRound(current);
      round++;
      LOGGER.debug("Gibson round %d: %d fragments gave %d products", round, current.size(), joined.size());
      if (joined.size() == current.size()) {
        current = joined.subList(0, joined.size() - 1);
        circular = true;
      } else if (joined.size() < current.size()) {
        current = joined;
      } else {
        throw new AmbiguousAssemblyException(
            "Products do not assemble correctly, multiple assembly junctions present");
      }
    }

    if (current.size() != 1) {
      throw new NonClosingAssemblyException("Gibson assembly did not resolve to a single product");
    }

    String product = current.get(0);
    if (sequences.size() == 1) {
      circular = true;
    }

    if (circular) {
      String threePrime = StringUtils.right(product, HOMOLOGY_LENGTH);
      product = product.substring(product.indexOf(threePrime) + threePrime.length());
      if (product.isEmpty()) {
        throw new NonClosingAssemblyException("Gibson product has no homology between its ends and cannot close");
      }
    } else if (requireCircular) {
      throw new NonClosingAssemblyException(
          "Products do not assemble into a circular product; linear products must be explicitly allowed");
    }
    return new AssemblyResult(product, circular);
  }

  private List<String> joinRound(List<String> fragments) {
    List<String> joined = new ArrayList<>();
    for (int i = 0; i < fragments.size(); i++) {
      String threePrime = StringUtils.right(fragments.get(i), HOMOLOGY_LENGTH);
      for (int j = 0; j < fragments.size(); j++) {
        if (i == j) {
          continue;
        }
        String other = fragments.get(j);
        int startIndex = other.indexOf(threePrime);
        if (startIndex == -1) {
          continue;
        }
        joined.add(fragments.get(i) + other.substring(startIndex + threePrime.length()));
      }
    }
    return joined;
  }

  static class AssemblyResult {
    private final String sequence;
    private final boolean circular;

    AssemblyResult(String sequence, boolean circular) {
      this.sequence = sequence;
      this.circular = circular;
    }

    public String getSequence() {
      return sequence;
    }

    public boolean isCircular() {
      return circular;
    }
  }
}
