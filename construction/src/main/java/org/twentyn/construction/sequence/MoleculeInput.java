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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;

/**
 * Text supplied for a molecule is either a raw sequence or a structured Polynucleotide record.  Which one it is gets
 * decided once, here, so simulators never have to sniff their inputs.
 */
public abstract class MoleculeInput {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public abstract Polynucleotide toPolynucleotide();

  /**
   * Classifies text as a JSON Polynucleotide record (anything starting with '{') or a raw sequence.
   * @param text The text to classify.
   * @return The classified input.
   * @throws ResolutionException If the text is neither a readable record nor a valid sequence.
   */
  public static MoleculeInput parse(String text) throws ResolutionException {
    String trimmed = StringUtils.trimToEmpty(text);
    if (trimmed.startsWith("{")) {
      try {
        return new StructuredMolecule(OBJECT_MAPPER.readValue(trimmed, Polynucleotide.class));
      } catch (IOException e) {
        throw new ResolutionException(String.format("Cannot resolve molecule record %s", trimmed), e);
      }
    }
    if (!SequenceResolver.isSequence(trimmed)) {
      throw new ResolutionException(String.format("Cannot resolve %s", text));
    }
    return new RawSequence(trimmed);
  }

  public static MoleculeInput of(Polynucleotide molecule) {
    return new StructuredMolecule(molecule);
  }

  public static MoleculeInput ofSequence(String sequence) {
    return new RawSequence(sequence);
  }

  /**
   * A bare sequence, read as a blunt linear double stranded DNA with hydroxyl ends.
   */
  public static class RawSequence extends MoleculeInput {
    private final String sequence;

    private RawSequence(String sequence) {
      this.sequence = SequenceResolver.resolveToSequence(sequence);
    }

    public String getSequence() {
      return sequence;
    }

    @Override
    public Polynucleotide toPolynucleotide() {
      return Polynucleotide.dsDNA(sequence);
    }
  }

  public static class StructuredMolecule extends MoleculeInput {
    private final Polynucleotide molecule;

    private StructuredMolecule(Polynucleotide molecule) {
      if (molecule == null) {
        throw new IllegalArgumentException("Molecule record cannot be null");
      }
      this.molecule = molecule;
    }

    @Override
    public Polynucleotide toPolynucleotide() {
      return molecule;
    }
  }
}
