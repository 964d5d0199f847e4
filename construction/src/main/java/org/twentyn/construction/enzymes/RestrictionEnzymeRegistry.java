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

package org.twentyn.construction.enzymes;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * An immutable snapshot of the restriction enzymes a simulation knows about.  Build one with {@link #loadDefault()}
 * (or from an explicit collection) and hand it to the simulators that need it; there is no global table.
 * Lookups ignore case, so "bsai" finds BsaI.
 */
public class RestrictionEnzymeRegistry {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RestrictionEnzymeRegistry.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final String DEFAULT_ENZYMES_FILE = "restriction_enzymes.json";

  private final Map<String, RestrictionEnzyme> enzymes;

  public RestrictionEnzymeRegistry(Collection<RestrictionEnzyme> enzymeList) {
    Map<String, RestrictionEnzyme> byName = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    for (RestrictionEnzyme enzyme : enzymeList) {
      if (byName.containsKey(enzyme.getName())) {
        throw new IllegalArgumentException(String.format("Enzyme %s is defined twice", enzyme.getName()));
      }
      byName.put(enzyme.getName(), enzyme);
    }
    this.enzymes = Collections.unmodifiableMap(byName);
  }

  /**
   * Reads the bundled enzyme table.
   * @return A registry holding every bundled enzyme.
   * @throws IOException If the bundled table is missing or malformed.
   */
  public static RestrictionEnzymeRegistry loadDefault() throws IOException {
    try (InputStream is = RestrictionEnzymeRegistry.class.getResourceAsStream(DEFAULT_ENZYMES_FILE)) {
      if (is == null) {
        throw new IOException(String.format("Unable to find enzyme table %s on the classpath", DEFAULT_ENZYMES_FILE));
      }
      return load(is);
    }
  }

  public static RestrictionEnzymeRegistry load(InputStream is) throws IOException {
    EnzymeTable table = OBJECT_MAPPER.readValue(is, EnzymeTable.class);
    RestrictionEnzymeRegistry registry = new RestrictionEnzymeRegistry(table.enzymes);
    LOGGER.debug("Loaded %d restriction enzymes", registry.enzymes.size());
    return registry;
  }

  public boolean hasEnzyme(String name) {
    return name != null && enzymes.containsKey(name.trim());
  }

  public RestrictionEnzyme getEnzyme(String name) throws UnknownEnzymeException {
    RestrictionEnzyme enzyme = name == null ? null : enzymes.get(name.trim());
    if (enzyme == null) {
      throw new UnknownEnzymeException(name);
    }
    return enzyme;
  }

  public List<RestrictionEnzyme> getEnzymes(List<String> names) throws UnknownEnzymeException {
    List<RestrictionEnzyme> out = new ArrayList<>(names.size());
    for (String name : names) {
      out.add(getEnzyme(name));
    }
    return out;
  }

  public Collection<RestrictionEnzyme> getAllEnzymes() {
    return enzymes.values();
  }

  private static class EnzymeTable {
    private final List<RestrictionEnzyme> enzymes;

    @JsonCreator
    EnzymeTable(@JsonProperty("enzymes") List<RestrictionEnzyme> enzymes) {
      this.enzymes = enzymes == null ? Collections.emptyList() : enzymes;
    }
  }
}
