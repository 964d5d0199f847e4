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

import java.util.Collections;
import java.util.List;

/**
 * Introduces a DNA into a host strain.  The product is the DNA itself; strain, selection and temperature are
 * recorded for the bench and do not change the simulation.
 */
public class TransformStep extends ConstructionStep {

  @JsonProperty("dna")
  private String dna;

  @JsonProperty("strain")
  private String strain;

  @JsonProperty("antibiotics")
  private String antibiotics;

  @JsonProperty("temperature")
  private Double temperature;

  /**
   * For JSON.
   */
  private TransformStep() {
  }

  public TransformStep(String dna, String strain, String antibiotics, String output, Double temperature) {
    super(output);
    this.dna = dna;
    this.strain = strain;
    this.antibiotics = antibiotics;
    this.temperature = temperature;
  }

  public String getDna() {
    return dna;
  }

  public String getStrain() {
    return strain;
  }

  public String getAntibiotics() {
    return antibiotics;
  }

  public Double getTemperature() {
    return temperature;
  }

  @Override
  public Operation getOperation() {
    return Operation.TRANSFORM;
  }

  @Override
  public List<String> getInputNames() {
    return Collections.singletonList(dna);
  }
}
