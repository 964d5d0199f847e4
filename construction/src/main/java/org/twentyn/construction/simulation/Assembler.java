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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.twentyn.construction.SimulationException;
import org.twentyn.construction.enzymes.RestrictionEnzymeRegistry;
import org.twentyn.construction.sequence.Polynucleotide;

import java.util.List;

/**
 * Routes an assembly to Golden Gate when it names a known restriction enzyme, and to Gibson otherwise.
 */
public class Assembler {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Assembler.class);

  public static final String GIBSON = "gibson";

  private final RestrictionEnzymeRegistry registry;
  private final GoldenGateAssembler goldenGate = new GoldenGateAssembler();
  private final GibsonAssembler gibson = new GibsonAssembler();

  public Assembler(RestrictionEnzymeRegistry registry) {
    this.registry = registry;
  }

  public Polynucleotide assemble(List<Polynucleotide> parts, String enzymeName) throws SimulationException {
    if (enzymeName != null && registry.hasEnzyme(enzymeName)) {
      LOGGER.debug("Assembling %d parts by Golden Gate with %s", parts.size(), enzymeName);
      return goldenGate.assemble(parts, registry.getEnzyme(enzymeName));
    }
    if (enzymeName != null && !GIBSON.equalsIgnoreCase(enzymeName)) {
      LOGGER.info("'%s' is not a known restriction enzyme, assembling by Gibson instead", enzymeName);
    } else {
      LOGGER.debug("Assembling %d parts by Gibson", parts.size());
    }
    return gibson.assemble(parts, true);
  }
}
