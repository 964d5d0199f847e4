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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed Construction File: the steps in the order they are performed, plus the sequences the file declares.
 *
 * Declared sequences are kept in declaration order, upper case.  A later declaration of the same name replaces the
 * earlier one.
 */
public class ConstructionFile {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  static {
    OBJECT_MAPPER.enable(SerializationFeature.INDENT_OUTPUT);
  }

  @JsonProperty("steps")
  private List<ConstructionStep> steps = new ArrayList<>();

  @JsonProperty("sequences")
  private LinkedHashMap<String, String> sequences = new LinkedHashMap<>();

  @JsonProperty("types")
  private LinkedHashMap<String, MoleculeType> types = new LinkedHashMap<>();

  public ConstructionFile() {
  }

  public void addStep(ConstructionStep step) {
    steps.add(step);
  }

  public void addSequence(String name, String sequence, MoleculeType type) {
    sequences.put(name, sequence.toUpperCase());
    if (type == null) {
      types.remove(name);
    } else {
      types.put(name, type);
    }
  }

  public List<ConstructionStep> getSteps() {
    return Collections.unmodifiableList(steps);
  }

  public Map<String, String> getSequences() {
    return Collections.unmodifiableMap(sequences);
  }

  public Map<String, MoleculeType> getTypes() {
    return Collections.unmodifiableMap(types);
  }

  /**
   * @return The declared type of a sequence, or dsDNA if none was declared.
   */
  public MoleculeType getTypeOf(String name) {
    MoleculeType type = types.get(name);
    return type == null ? MoleculeType.DSDNA : type;
  }

  public String toJson() throws IOException {
    return OBJECT_MAPPER.writeValueAsString(this);
  }

  public static ConstructionFile fromJson(String json) throws IOException {
    return OBJECT_MAPPER.readValue(json, ConstructionFile.class);
  }

  public static ConstructionFile fromJsonFile(File file) throws IOException {
    return OBJECT_MAPPER.readValue(file, ConstructionFile.class);
  }
}
