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

import org.twentyn.construction.sequence.Polynucleotide;

/**
 * Blunts the ends of a linear duplex the way a polymerase end-repair does: 5' overhangs are filled in and 3'
 * overhangs are chewed back.  End modifications are left as they were.
 */
public class EndRepairer {

  public Polynucleotide blunt(Polynucleotide molecule) {
    if (molecule.isCircular()) {
      return molecule;
    }
    return new Polynucleotide(duplexSequence(molecule), "", "", molecule.isDoubleStranded(), molecule.isRNA(), false,
        molecule.getModExt5(), molecule.getModExt3());
  }

  /**
   * The sequence a polymerase sees once 5' overhangs are filled in and 3' overhangs are removed.  Simulations that
   * read a molecule as a template use this instead of the bare paired sequence so sticky end bases are not lost.
   */
  public static String duplexSequence(Polynucleotide molecule) {
    StringBuilder sequence = new StringBuilder();
    if (!Polynucleotide.isThreePrimeOverhang(molecule.getExt5())) {
      sequence.append(molecule.getExt5());
    }
    sequence.append(molecule.getSequence());
    if (!Polynucleotide.isThreePrimeOverhang(molecule.getExt3())) {
      sequence.append(molecule.getExt3());
    }
    return sequence.toString();
  }
}
