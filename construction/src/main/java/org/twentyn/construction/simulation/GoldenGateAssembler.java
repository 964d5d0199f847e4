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
import org.twentyn.construction.enzymes.RestrictionEnzyme;
import org.twentyn.construction.sequence.Polynucleotide;
import org.twentyn.construction.sequence.SequenceUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Simulates a one-pot Golden Gate assembly: every part is cut with the same type IIS enzyme and the freed inserts
 * ligate through their sticky ends into a single circle.
 *
 * Each part must carry exactly one forward site followed by one reverse site.  The insert between them has a 5'
 * sticky end, a body, and a 3' sticky end.  Inserts are chained by matching each 3' end to the next 5' end, starting
 * with the insert whose 5' end sorts first.  That starting point is only a stable way of choosing where to open the
 * circle for output; it carries no biological meaning.
 */
public class GoldenGateAssembler {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GoldenGateAssembler.class);

  /**
   * An insert released from a part by the enzyme.
   */
  public static class Insert {
    private final String stickyEnd5;
    private final String body;
    private final String stickyEnd3;

    public Insert(String stickyEnd5, String body, String stickyEnd3) {
      this.stickyEnd5 = stickyEnd5;
      this.body = body;
      this.stickyEnd3 = stickyEnd3;
    }

    public String getStickyEnd5() {
      return stickyEnd5;
    }

    public String getBody() {
      return body;
    }

    public String getStickyEnd3() {
      return stickyEnd3;
    }
  }

  public Polynucleotide assemble(List<Polynucleotide> parts, RestrictionEnzyme enzyme)
      throws InvalidPartException, PalindromicEndException, AmbiguousAssemblyException, NonClosingAssemblyException {
    List<Insert> inserts = new ArrayList<>(parts.size());
    for (Polynucleotide part : parts) {
      inserts.add(excise(part, enzyme));
    }
    return Polynucleotide.plasmid(join(inserts));
  }

  /**
   * Cuts the insert out of one part.  A circular part (a plasmid carrying the insert) is first rotated to start at
   * its forward site.
   */
  public Insert excise(Polynucleotide part, RestrictionEnzyme enzyme) throws InvalidPartException {
    String site = enzyme.getRecognitionSequence();
    String siteRC = enzyme.getRecognitionSequenceRC();
    String sequence = EndRepairer.duplexSequence(part);
    if (part.isCircular()) {
      int forwardSite = (sequence + sequence).indexOf(site);
      if (forwardSite != -1 && forwardSite < sequence.length()) {
        sequence = SequenceUtils.rotate(sequence, forwardSite);
      }
    }

    int forwardSites = StringUtils.countMatches(sequence, site);
    int reverseSites = StringUtils.countMatches(sequence, siteRC);
    if (forwardSites == 0) {
      throw new InvalidPartException(String.format("Enzyme site %s not found in sequence %s", site, sequence));
    }
    if (reverseSites == 0) {
      throw new InvalidPartException(String.format("Reverse enzyme site %s not found in sequence %s", siteRC, sequence));
    }
    if (forwardSites > 1) {
      throw new InvalidPartException(String.format(
          "More than one forward enzyme site %s found in sequence %s", site, sequence));
    }
    if (reverseSites > 1) {
      throw new InvalidPartException(String.format(
          "More than one reverse enzyme site %s found in sequence %s", siteRC, sequence));
    }

    int forwardIndex = sequence.indexOf(site);
    int reverseIndex = sequence.indexOf(siteRC);
    if (reverseIndex < forwardIndex) {
      throw new InvalidPartException(String.format(
          "Reverse enzyme site found before forward enzyme site in sequence %s", sequence));
    }

    int near = Math.min(enzyme.getCut5(), enzyme.getCut3());
    int far = Math.max(enzyme.getCut5(), enzyme.getCut3());
    int siteEnd = forwardIndex + site.length();
    int end5Start = siteEnd + near;
    int bodyStart = siteEnd + far;
    int bodyEnd = reverseIndex - far;
    int end3End = reverseIndex - near;
    if (end5Start < 0 || end3End > sequence.length() || bodyStart > bodyEnd) {
      throw new InvalidPartException(String.format(
          "Enzyme sites in sequence %s are too close together or too near an end to release an insert", sequence));
    }

    return new Insert(sequence.substring(end5Start, bodyStart),
        sequence.substring(bodyStart, bodyEnd),
        sequence.substring(bodyEnd, end3End));
  }

  /**
   * Orders inserts into a closed chain and reads the circle out as each insert's 5' end followed by its body.
   */
  public String join(List<Insert> inserts)
      throws PalindromicEndException, AmbiguousAssemblyException, NonClosingAssemblyException {
    if (inserts.isEmpty()) {
      throw new NonClosingAssemblyException("Nothing to assemble");
    }

    for (Insert insert : inserts) {
      if (SequenceUtils.isPalindromic(insert.stickyEnd5) || SequenceUtils.isPalindromic(insert.stickyEnd3)) {
        throw new PalindromicEndException(String.format("Palindromic sticky ends found in fragment %s", insert.body));
      }
    }

    Map<String, Insert> byEnd5 = new HashMap<>();
    if (inserts.size() > 1) {
      Map<String, Integer> end3Counts = new HashMap<>();
      for (Insert insert : inserts) {
        if (byEnd5.put(insert.stickyEnd5, insert) != null ||
            end3Counts.merge(insert.stickyEnd3, 1, Integer::sum) > 1) {
          throw new AmbiguousAssemblyException(
              "Some fragments have the same sticky ends, which can lead to incorrect assemblies");
        }
      }
    } else {
      byEnd5.put(inserts.get(0).stickyEnd5, inserts.get(0));
    }

    Insert first = inserts.stream().min(Comparator.comparing(Insert::getStickyEnd5)).get();
    List<Insert> chain = new ArrayList<>(inserts.size());
    chain.add(first);
    while (chain.size() < inserts.size()) {
      Insert last = chain.get(chain.size() - 1);
      Insert next = byEnd5.get(last.stickyEnd3);
      if (next == null || chain.contains(next)) {
        throw new NonClosingAssemblyException(String.format(
            "Sticky ends do not match: nothing continues from fragment %s (%s)", last.body, last.stickyEnd3));
      }
      chain.add(next);
    }

    Insert last = chain.get(chain.size() - 1);
    if (!first.stickyEnd5.equals(last.stickyEnd3)) {
      throw new NonClosingAssemblyException(String.format(
          "Sticky ends do not match between first and last fragments %s and %s", first.body, last.body));
    }

    StringBuilder product = new StringBuilder();
    for (Insert insert : chain) {
      product.append(insert.stickyEnd5).append(insert.body);
    }
    LOGGER.debug("Golden Gate joined %d inserts into %d bp", chain.size(), product.length());
    return product.toString();
  }
}
