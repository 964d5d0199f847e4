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

package org.twentyn.construction.enzymes;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.twentyn.construction.sequence.SequenceResolver;
import org.twentyn.construction.sequence.SequenceUtils;

/**
 * A restriction enzyme's recognition sequence and cut geometry.
 *
 * Cut positions are offsets from the 3' end of the recognition site on the strand where the site was found: cut5 is
 * where the top strand is nicked and cut3 where the bottom strand is nicked.  BsaI (GGTCTC, 1, 5) leaves a four base
 * 5' overhang starting one base past the site; EcoRI (GAATTC, -5, -1) cuts G^AATTC.  When cut5 &lt; cut3 the enzyme
 * leaves a 5' overhang.
 */
public class RestrictionEnzyme {

  @JsonProperty("name")
  private final String name;

  @JsonProperty("recognitionSequence")
  private final String recognitionSequence;

  @JsonProperty("cut5")
  private final int cut5;

  @JsonProperty("cut3")
  private final int cut3;

  // Derived once when the enzyme is built.
  private final String recognitionSequenceRC;
  private final boolean fivePrime;

  @JsonCreator
  public RestrictionEnzyme(@JsonProperty("name") String name,
                           @JsonProperty("recognitionSequence") String recognitionSequence,
                           @JsonProperty("cut5") int cut5,
                           @JsonProperty("cut3") int cut3) {
    if (name == null || name.trim().isEmpty()) {
      throw new IllegalArgumentException("Restriction enzymes must be named");
    }
    this.name = name.trim();
    this.recognitionSequence = SequenceResolver.resolveToSequence(recognitionSequence);
    this.cut5 = cut5;
    this.cut3 = cut3;
    this.recognitionSequenceRC = SequenceUtils.reverseComplement(this.recognitionSequence);
    this.fivePrime = cut5 < cut3;
  }

  public String getName() {
    return name;
  }

  public String getRecognitionSequence() {
    return recognitionSequence;
  }

  @JsonIgnore
  public String getRecognitionSequenceRC() {
    return recognitionSequenceRC;
  }

  public int getCut5() {
    return cut5;
  }

  public int getCut3() {
    return cut3;
  }

  @JsonIgnore
  public boolean isFivePrime() {
    return fivePrime;
  }

  @JsonIgnore
  public int getOverhangLength() {
    return Math.abs(cut3 - cut5);
  }

  @Override
  public String toString() {
    return name;
  }
}
