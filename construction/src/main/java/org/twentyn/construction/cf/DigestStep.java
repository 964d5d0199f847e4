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

package org.twentyn.construction.cf;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class DigestStep extends ConstructionStep {

  @JsonProperty("dna")
  private String dna;

  @JsonProperty("enzymes")
  private List<String> enzymes;

  @JsonProperty("fragSelect")
  private int fragSelect;

  /**
   * For JSON.
   */
  private DigestStep() {
  }

  public DigestStep(String dna, List<String> enzymes, int fragSelect, String output) {
    super(output);
    this.dna = dna;
    this.enzymes = new ArrayList<>(enzymes);
    this.fragSelect = fragSelect;
  }

  public String getDna() {
    return dna;
  }

  public List<String> getEnzymes() {
    return Collections.unmodifiableList(enzymes);
  }

  public int getFragSelect() {
    return fragSelect;
  }

  @Override
  public Operation getOperation() {
    return Operation.DIGEST;
  }

  @Override
  public List<String> getInputNames() {
    return Collections.singletonList(dna);
  }
}
