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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.twentyn.construction.sequence.Polynucleotide;

/**
 * The kind of molecule a declared sequence stands for.  Undeclared sequences are read as linear dsDNA.
 */
public enum MoleculeType {
  OLIGO("oligo") {
    @Override
    public Polynucleotide toPolynucleotide(String sequence) {
      return Polynucleotide.oligo(sequence);
    }
  },
  PLASMID("plasmid") {
    @Override
    public Polynucleotide toPolynucleotide(String sequence) {
      return Polynucleotide.plasmid(sequence);
    }
  },
  DSDNA("dsdna") {
    @Override
    public Polynucleotide toPolynucleotide(String sequence) {
      return Polynucleotide.dsDNA(sequence);
    }
  },
  ;

  private final String keyword;

  MoleculeType(String keyword) {
    this.keyword = keyword;
  }

  public abstract Polynucleotide toPolynucleotide(String sequence);

  @JsonValue
  public String getKeyword() {
    return keyword;
  }

  /**
   * @return The type named by the keyword (in any case), or null if the word names no type.
   */
  @JsonCreator
  public static MoleculeType fromKeyword(String keyword) {
    for (MoleculeType type : values()) {
      if (type.keyword.equalsIgnoreCase(keyword)) {
        return type;
      }
    }
    return null;
  }
}
