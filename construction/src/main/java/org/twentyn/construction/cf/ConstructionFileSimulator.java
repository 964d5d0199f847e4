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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.twentyn.construction.SimulationException;
import org.twentyn.construction.enzymes.RestrictionEnzymeRegistry;
import org.twentyn.construction.sequence.Polynucleotide;
import org.twentyn.construction.simulation.Assembler;
import org.twentyn.construction.simulation.Digester;
import org.twentyn.construction.simulation.EndRepairer;
import org.twentyn.construction.simulation.Ligator;
import org.twentyn.construction.simulation.PCRSimulator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs a Construction File step by step and reports the product of every step.
 *
 * Names resolve against a working table seeded with the declared sequences.  Each product is added to the table
 * under its output name as soon as its step finishes, so a later step sees the most recent molecule of that name.
 * The first failing step aborts the whole run.
 */
public class ConstructionFileSimulator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ConstructionFileSimulator.class);

  private final PCRSimulator pcrSimulator = new PCRSimulator();
  private final Assembler assembler;
  private final Digester digester;
  private final Ligator ligator = new Ligator();
  private final EndRepairer endRepairer = new EndRepairer();

  public ConstructionFileSimulator(RestrictionEnzymeRegistry registry) {
    this.assembler = new Assembler(registry);
    this.digester = new Digester(registry);
  }

  public List<Product> simulate(ConstructionFile cf) throws SimulationException {
    if (cf.getSequences().isEmpty()) {
      throw new MissingSequenceException("(no sequences declared)");
    }

    Map<String, Polynucleotide> workingTable = new HashMap<>();
    for (Map.Entry<String, String> entry : cf.getSequences().entrySet()) {
      workingTable.put(entry.getKey(), cf.getTypeOf(entry.getKey()).toPolynucleotide(entry.getValue()));
    }

    List<Product> products = new ArrayList<>(cf.getSteps().size());
    for (ConstructionStep step : cf.getSteps()) {
      LOGGER.debug("Running step %s", step);
      Polynucleotide result = runStep(step, workingTable);
      workingTable.put(step.getOutput(), result);
      products.add(new Product(step.getOutput(), result));
    }
    LOGGER.info("Simulated %d steps", products.size());
    return products;
  }

  private Polynucleotide runStep(ConstructionStep step, Map<String, Polynucleotide> workingTable)
      throws SimulationException {
    switch (step.getOperation()) {
      case PCR: {
        PcrStep pcr = (PcrStep) step;
        Polynucleotide product = pcrSimulator.pcr(lookup(workingTable, pcr.getForwardOligo()),
            lookup(workingTable, pcr.getReverseOligo()), lookup(workingTable, pcr.getTemplate()));
        if (pcr.getProductSize() != null && pcr.getProductSize() != product.length()) {
          LOGGER.warn("PCR product %s is %d bp but the file expects %d bp",
              pcr.getOutput(), product.length(), pcr.getProductSize());
        }
        return product;
      }
      case ASSEMBLE: {
        AssembleStep assemble = (AssembleStep) step;
        return assembler.assemble(lookupAll(workingTable, assemble.getDnas()), assemble.getEnzyme());
      }
      case DIGEST: {
        DigestStep digest = (DigestStep) step;
        return digester.digest(lookup(workingTable, digest.getDna()), digest.getEnzymes(), digest.getFragSelect());
      }
      case LIGATE:
        return ligator.ligate(lookupAll(workingTable, step.getInputNames()));
      case BLUNT:
        return endRepairer.blunt(lookup(workingTable, ((BluntStep) step).getDna()));
      case TRANSFORM:
        // Transformation does not change the DNA.
        return lookup(workingTable, ((TransformStep) step).getDna());
      default:
        throw new IllegalStateException(String.format("Unhandled operation %s", step.getOperation()));
    }
  }

  private static Polynucleotide lookup(Map<String, Polynucleotide> workingTable, String name)
      throws MissingSequenceException {
    Polynucleotide molecule = workingTable.get(name);
    if (molecule == null) {
      throw new MissingSequenceException(name);
    }
    return molecule;
  }

  private static List<Polynucleotide> lookupAll(Map<String, Polynucleotide> workingTable, List<String> names)
      throws MissingSequenceException {
    List<Polynucleotide> molecules = new ArrayList<>(names.size());
    for (String name : names) {
      molecules.add(lookup(workingTable, name));
    }
    return molecules;
  }
}
