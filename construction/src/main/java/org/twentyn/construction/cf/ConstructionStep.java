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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * One line of a Construction File: an operation that reads named molecules and names its product.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.EXISTING_PROPERTY,
    property = "operation")
@JsonSubTypes({
    @JsonSubTypes.Type(value = PcrStep.class, name = "PCR"),
    @JsonSubTypes.Type(value = AssembleStep.class, name = "Assemble"),
    @JsonSubTypes.Type(value = DigestStep.class, name = "Digest"),
    @JsonSubTypes.Type(value = LigateStep.class, name = "Ligate"),
    @JsonSubTypes.Type(value = TransformStep.class, name = "Transform"),
    @JsonSubTypes.Type(value = BluntStep.class, name = "Blunt"),
})
public abstract class ConstructionStep {

  @JsonProperty("output")
  private String output;

  protected ConstructionStep() {
  }

  protected ConstructionStep(String output) {
    this.output = output;
  }

  public String getOutput() {
    return output;
  }

  @JsonProperty("operation")
  public abstract Operation getOperation();

  /**
   * @return The names of the molecules this step reads, in the order it reads them.
   */
  @JsonIgnore
  public abstract List<String> getInputNames();

  @Override
  public String toString() {
    return String.format("%s %s -> %s", getOperation().getLabel(), getInputNames(), output);
  }
}
