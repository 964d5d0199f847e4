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
import org.twentyn.construction.sequence.InvalidSequenceException;
import org.twentyn.construction.sequence.Polynucleotide;
import org.twentyn.construction.sequence.SequenceResolver;
import org.twentyn.construction.sequence.SequenceUtils;

/**
 * Predicts the product of a PCR from its two primers and a template.
 *
 * The last 18 bases on the 3' end of each primer must match the template exactly; the 5' ends may carry tails that
 * do not.  The template is read as circular: it is rotated to begin where the forward primer anneals, and the
 * reverse primer's anneal site is then looked up downstream.  The product is the whole forward primer, the template
 * between the two anneal sites, and the reverse complement of the whole reverse primer.
 */
public class PCRSimulator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(PCRSimulator.class);

  public static final int ANNEAL_LENGTH = 18;

  public Polynucleotide pcr(Polynucleotide forward, Polynucleotide reverse, Polynucleotide template)
      throws NoAnnealException {
    return Polynucleotide.dsDNA(pcr(forward.getSequence(), reverse.getSequence(),
        EndRepairer.duplexSequence(template)));
  }

  /**
   * @param forwardSeq The forward primer.
   * @param reverseSeq The reverse primer.
   * @param templateSeq The template, in either orientation.
   * @return The predicted amplicon.
   * @throws NoAnnealException If either primer's 3' end is absent from the template.
   */
  public String pcr(String forwardSeq, String reverseSeq, String templateSeq) throws NoAnnealException {
    String forward = resolve("forward primer", forwardSeq);
    String reverse = resolve("reverse primer", reverseSeq);
    String template = resolve("template sequence", templateSeq);

    String forwardAnneal = StringUtils.right(forward, ANNEAL_LENGTH);
    int forwardMatchIndex = template.indexOf(forwardAnneal);
    if (forwardMatchIndex == -1) {
      // The template may have been given as the other strand.
      template = SequenceUtils.reverseComplement(template);
      forwardMatchIndex = template.indexOf(forwardAnneal);
      if (forwardMatchIndex == -1) {
        throw new NoAnnealException(String.format(
            "Forward oligo %s does not exactly anneal to the template", forward));
      }
    }

    String rotatedTemplate = SequenceUtils.rotate(template, forwardMatchIndex);

    String reverseComp = SequenceUtils.reverseComplement(reverse);
    String reverseAnneal = StringUtils.left(reverseComp, ANNEAL_LENGTH);
    int reverseMatchIndex = rotatedTemplate.indexOf(reverseAnneal);
    if (reverseMatchIndex == -1) {
      throw new NoAnnealException(String.format(
          "Reverse oligo %s does not exactly anneal to the template", reverse));
    }

    // Anneal sites that overlap leave nothing of the template between the primers.
    String between = reverseMatchIndex > forwardAnneal.length()
        ? rotatedTemplate.substring(forwardAnneal.length(), reverseMatchIndex)
        : "";
    String product = forward + between + reverseComp;
    LOGGER.debug("PCR product is %d bp", product.length());
    return product;
  }

  private static String resolve(String role, String seq) {
    try {
      return SequenceResolver.resolveToSequence(seq);
    } catch (InvalidSequenceException e) {
      throw new InvalidSequenceException(String.format("PCR unable to parse %s %s", role, seq), e);
    }
  }
}
