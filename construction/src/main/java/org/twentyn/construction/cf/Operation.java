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

import java.util.HashMap;
import java.util.Map;

public enum Operation {
  PCR("PCR"),
  ASSEMBLE("Assemble"),
  DIGEST("Digest"),
  LIGATE("Ligate"),
  TRANSFORM("Transform"),
  BLUNT("Blunt"),
  ;

  // Words that may open a step row in a Construction File, lower-cased.
  private static final Map<String, Operation> KEYWORDS = new HashMap<>();
  private static final Map<String, Operation> LABELS = new HashMap<>();
  static {
    for (Operation operation : values()) {
      LABELS.put(operation.label, operation);
      KEYWORDS.put(operation.label.toLowerCase(), operation);
    }
    KEYWORDS.put("gibson", ASSEMBLE);
    KEYWORDS.put("goldengate", ASSEMBLE);
  }

  private final String label;

  Operation(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  /**
   * @param keyword The first token of a row, in any case.
   * @return The operation it names, or null if it names none.
   */
  public static Operation fromKeyword(String keyword) {
    return keyword == null ? null : KEYWORDS.get(keyword.toLowerCase());
  }

  @JsonCreator
  public static Operation fromLabel(String label) {
    Operation operation = LABELS.get(label);
    if (operation == null) {
      operation = fromKeyword(label);
    }
    if (operation == null) {
      throw new IllegalArgumentException(String.format("Unknown operation: %s", label));
    }
    return operation;
  }
}
