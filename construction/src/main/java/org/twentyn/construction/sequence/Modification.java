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

package org.twentyn.construction.sequence;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.apache.commons.lang3.StringUtils;

/**
 * Chemistry of a molecule terminus.  A 5' phosphate is what restriction enzymes leave behind and what ligase needs.
 */
public enum Modification {
  HYDROXYL("hydroxyl"),
  PHOSPHATE("phos5"),
  NONE("");

  private final String tag;

  Modification(String tag) {
    this.tag = tag;
  }

  @JsonValue
  public String getTag() {
    return tag;
  }

  @JsonCreator
  public static Modification fromTag(String tag) {
    if (StringUtils.isBlank(tag)) {
      return NONE;
    }
    for (Modification m : values()) {
      if (m.tag.equalsIgnoreCase(tag.trim())) {
        return m;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown terminal modification: %s", tag));
  }
}
