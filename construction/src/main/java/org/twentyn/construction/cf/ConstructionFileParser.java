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

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.twentyn.construction.sequence.SequenceResolver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Reads Construction Files written the way people write them at the bench:
 * <pre>
 *   PCR P6libF P6libR on pTP1, P6
 *   Assemble P6 BsaI, pP6
 *   oligo P6libF ccaaaggtctcaGCTTAAAGGGTT...
 * </pre>
 * A row whose first word names an operation becomes a step; any other row declares a named sequence, optionally
 * preceded by its molecule type.  Rows that are neither (notes, headers, rows too short for their operation) are
 * skipped.
 */
public class ConstructionFileParser {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ConstructionFileParser.class);

  private static final Pattern TOKEN_SEPARATORS = Pattern.compile("[\\s,/()]+");
  private static final Set<String> FILLER_WORDS = new HashSet<>(Arrays.asList("on", "with"));
  private static final Pattern PRODUCT_SIZE_PATTERN = Pattern.compile("^(\\d+)(bp)?$", Pattern.CASE_INSENSITIVE);

  private static final String GIBSON = "gibson";
  private static final String GOLDEN_GATE = "goldengate";

  /**
   * @param blocks Pieces of Construction File text; each may hold one or many lines.
   */
  public ConstructionFile parse(String... blocks) {
    List<List<String>> lines = new ArrayList<>();
    for (String block : blocks) {
      if (block == null) {
        continue;
      }
      for (String line : block.split("\\r?\\n")) {
        lines.add(tokenize(line));
      }
    }
    return parseTokenized(lines);
  }

  /**
   * @param rows Table rows, such as those read from a spreadsheet; each row's cells are read as one line.
   */
  public ConstructionFile parseRows(List<List<String>> rows) {
    List<List<String>> lines = new ArrayList<>(rows.size());
    for (List<String> row : rows) {
      lines.add(tokenize(StringUtils.join(row, '\t')));
    }
    return parseTokenized(lines);
  }

  public static List<String> tokenize(String line) {
    return Arrays.stream(TOKEN_SEPARATORS.split(line))
        .filter(token -> !token.isEmpty() && !FILLER_WORDS.contains(token.toLowerCase()))
        .collect(Collectors.toList());
  }

  private ConstructionFile parseTokenized(List<List<String>> lines) {
    ConstructionFile cf = new ConstructionFile();
    for (List<String> tokens : lines) {
      if (tokens.isEmpty()) {
        continue;
      }
      String keyword = tokens.get(0).toLowerCase();
      Operation operation = Operation.fromKeyword(keyword);
      if (operation != null) {
        ConstructionStep step = parseStep(operation, keyword, tokens);
        if (step == null) {
          LOGGER.debug("Dropping %s row with too few fields: %s", operation.getLabel(), tokens);
        } else {
          cf.addStep(step);
        }
      } else {
        parseSequence(cf, tokens);
      }
    }
    LOGGER.debug("Parsed %d steps and %d sequences", cf.getSteps().size(), cf.getSequences().size());
    return cf;
  }

  private ConstructionStep parseStep(Operation operation, String keyword, List<String> tokens) {
    int n = tokens.size();
    switch (operation) {
      case PCR:
        if (n < 5) {
          return null;
        }
        return new PcrStep(tokens.get(1), tokens.get(2), tokens.get(3), tokens.get(4),
            n > 5 ? parseProductSize(tokens.get(5)) : null);
      case ASSEMBLE:
        if (GIBSON.equals(keyword)) {
          if (n < 3) {
            return null;
          }
          return new AssembleStep(tokens.subList(1, n - 1), GIBSON, tokens.get(n - 1));
        }
        // "Assemble" and "GoldenGate" rows both end with the enzyme and the product.
        if (n < 4) {
          return null;
        }
        return new AssembleStep(tokens.subList(1, n - 2), tokens.get(n - 2), tokens.get(n - 1));
      case LIGATE:
        if (n < 3) {
          return null;
        }
        return new LigateStep(tokens.subList(1, n - 1), tokens.get(n - 1));
      case DIGEST:
        if (n < 5) {
          return null;
        }
        Integer fragSelect = parseInteger(tokens.get(n - 2));
        if (fragSelect == null) {
          return null;
        }
        return new DigestStep(tokens.get(1), tokens.subList(2, n - 2), fragSelect, tokens.get(n - 1));
      case TRANSFORM:
        if (n < 5) {
          return null;
        }
        return new TransformStep(tokens.get(1), tokens.get(2), tokens.get(3), tokens.get(4),
            n > 5 ? parseTemperature(tokens.get(5)) : null);
      case BLUNT:
        if (n < 3) {
          return null;
        }
        return new BluntStep(tokens.get(1), tokens.get(2));
      default:
        throw new IllegalStateException(String.format("Unhandled operation %s", operation));
    }
  }

  private void parseSequence(ConstructionFile cf, List<String> tokens) {
    MoleculeType type = MoleculeType.fromKeyword(tokens.get(0));
    int nameIndex = type == null ? 0 : 1;
    if (tokens.size() <= nameIndex + 1) {
      LOGGER.debug("Skipping row with no sequence: %s", tokens);
      return;
    }
    String name = tokens.get(nameIndex);
    String payload = StringUtils.join(tokens.subList(nameIndex + 1, tokens.size()), "");
    if (!SequenceResolver.isSequence(payload)) {
      LOGGER.debug("Skipping row that is neither a step nor a sequence: %s", tokens);
      return;
    }
    cf.addSequence(name, payload, type);
  }

  private static Integer parseProductSize(String token) {
    Matcher matcher = PRODUCT_SIZE_PATTERN.matcher(token);
    if (!matcher.matches()) {
      LOGGER.debug("Ignoring unreadable PCR product size '%s'", token);
      return null;
    }
    return Integer.parseInt(matcher.group(1));
  }

  private static Integer parseInteger(String token) {
    try {
      return Integer.parseInt(token);
    } catch (NumberFormatException e) {
      LOGGER.debug("Expected a fragment number but found '%s'", token);
      return null;
    }
  }

  private static Double parseTemperature(String token) {
    try {
      return Double.parseDouble(StringUtils.removeEndIgnoreCase(token, "C"));
    } catch (NumberFormatException e) {
      LOGGER.debug("Ignoring unreadable temperature '%s'", token);
      return null;
    }
  }
}
