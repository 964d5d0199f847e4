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
import org.twentyn.construction.sequence.Polynucleotide;

/**
 * The named result of one step.
 */
public class Product {
  @JsonProperty("name")
  private final String name;

  @JsonProperty("molecule")
  private final Polynucleotide molecule;

  public Product(String name, Polynucleotide molecule) {
    this.name = name;
    this.molecule = molecule;
  }

  public String getName() {
    return name;
  }

  public Polynucleotide getMolecule() {
    return molecule;
  }

  @JsonIgnore
  public String getSequence() {
    return molecule.getSequence();
  }

  @Override
  public String toString() {
    return String.format("%s\t%s", name, molecule.getSequence());
  }
}
