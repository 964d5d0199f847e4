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

import java.util.Arrays;
import java.util.List;

public class PcrStep extends ConstructionStep {

  @JsonProperty("forward_oligo")
  private String forwardOligo;

  @JsonProperty("reverse_oligo")
  private String reverseOligo;

  @JsonProperty("template")
  private String template;

  // Expected length in bp, when the author wrote one down.
  @JsonProperty("product_size")
  private Integer productSize;

  /**
   * For JSON.
   */
  private PcrStep() {
  }

  public PcrStep(String forwardOligo, String reverseOligo, String template, String output, Integer productSize) {
    super(output);
    this.forwardOligo = forwardOligo;
    this.reverseOligo = reverseOligo;
    this.template = template;
    this.productSize = productSize;
  }

  public String getForwardOligo() {
    return forwardOligo;
  }

  public String getReverseOligo() {
    return reverseOligo;
  }

  public String getTemplate() {
    return template;
  }

  public Integer getProductSize() {
    return productSize;
  }

  @Override
  public Operation getOperation() {
    return Operation.PCR;
  }

  @Override
  public List<String> getInputNames() {
    return Arrays.asList(forwardOligo, reverseOligo, template);
  }
}
