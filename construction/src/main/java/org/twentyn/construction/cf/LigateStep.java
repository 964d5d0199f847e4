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

public class LigateStep extends ConstructionStep {

  @JsonProperty("dnas")
  private List<String> dnas;

  /**
   * For JSON.
   */
  private LigateStep() {
  }

  public LigateStep(List<String> dnas, String output) {
    super(output);
    this.dnas = new ArrayList<>(dnas);
  }

  public List<String> getDnas() {
    return Collections.unmodifiableList(dnas);
  }

  @Override
  public Operation getOperation() {
    return Operation.LIGATE;
  }

  @Override
  public List<String> getInputNames() {
    return getDnas();
  }
}
