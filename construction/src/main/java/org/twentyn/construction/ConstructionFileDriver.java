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

package org.twentyn.construction;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.twentyn.construction.cf.ConstructionFile;
import org.twentyn.construction.cf.ConstructionFileParser;
import org.twentyn.construction.cf.ConstructionFileSimulator;
import org.twentyn.construction.cf.Product;
import org.twentyn.construction.enzymes.RestrictionEnzymeRegistry;
import org.twentyn.construction.sequence.SequenceUtils;
import org.twentyn.construction.utils.CLIUtil;
import org.twentyn.construction.utils.TSVParser;
import org.twentyn.construction.utils.TSVWriter;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class ConstructionFileDriver {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ConstructionFileDriver.class);

  private static final String OPTION_INPUT = "i";
  private static final String OPTION_OUTPUT = "o";
  private static final String OPTION_FORMAT = "f";
  private static final String OPTION_JSON_CF = "j";

  public static final String FORMAT_TSV = "tsv";
  public static final String FORMAT_JSON = "json";

  public static final String HEADER_NAME = "name";
  public static final String HEADER_LENGTH = "length";
  public static final String HEADER_GC = "gc";
  public static final String HEADER_SEQUENCE = "sequence";
  public static final List<String> OUTPUT_HEADER =
      Arrays.asList(HEADER_NAME, HEADER_LENGTH, HEADER_GC, HEADER_SEQUENCE);

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("input-file")
        .desc("A Construction File: free text, or tab separated rows if the name ends in .tsv")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("output-file")
        .desc("Where to write the products (default: standard out)")
        .hasArg()
        .longOpt("output")
    );
    add(Option.builder(OPTION_FORMAT)
        .argName("format")
        .desc(String.format("Output format, %s or %s (default: %s)", FORMAT_TSV, FORMAT_JSON, FORMAT_TSV))
        .hasArg()
        .longOpt("format")
    );
    add(Option.builder(OPTION_JSON_CF)
        .desc("Read the input as a JSON Construction File")
        .longOpt("json-cf")
    );
  }};

  public static final String HELP_MESSAGE =
      "This class simulates a Construction File: it runs each step in order and reports the DNA each step produces.";

  private static final CLIUtil CLI_UTIL = new CLIUtil(ConstructionFileDriver.class, HELP_MESSAGE, OPTION_BUILDERS);

  public static void main(String[] args) throws Exception {
    CommandLine cl = CLI_UTIL.parseCommandLine(args);

    String format = cl.getOptionValue(OPTION_FORMAT, FORMAT_TSV).toLowerCase();
    if (!FORMAT_TSV.equals(format) && !FORMAT_JSON.equals(format)) {
      CLI_UTIL.failWithMessage("Unknown output format: %s", format);
    }

    File inputFile = new File(cl.getOptionValue(OPTION_INPUT));
    if (!inputFile.exists()) {
      CLI_UTIL.failWithMessage("Input file at %s does not exist", inputFile.getAbsolutePath());
    }

    List<Product> products;
    try {
      ConstructionFile cf = readConstructionFile(inputFile, cl.hasOption(OPTION_JSON_CF));
      ConstructionFileSimulator simulator = new ConstructionFileSimulator(RestrictionEnzymeRegistry.loadDefault());
      products = simulator.simulate(cf);
    } catch (SimulationException e) {
      LOGGER.error("Simulation of %s failed: %s", inputFile.getName(), e.getMessage());
      System.exit(1);
      return;
    }

    File outputFile = cl.hasOption(OPTION_OUTPUT) ? new File(cl.getOptionValue(OPTION_OUTPUT)) : null;
    try (Writer writer = outputFile == null ?
        new OutputStreamWriter(System.out, StandardCharsets.UTF_8) :
        Files.newBufferedWriter(outputFile.toPath(), StandardCharsets.UTF_8)) {
      if (FORMAT_JSON.equals(format)) {
        writeJson(products, writer);
      } else {
        writeTsv(products, writer);
      }
    }
    LOGGER.info("Wrote %d products", products.size());
  }

  public static ConstructionFile readConstructionFile(File inputFile, boolean isJson) throws IOException {
    if (isJson) {
      return ConstructionFile.fromJsonFile(inputFile);
    }
    ConstructionFileParser parser = new ConstructionFileParser();
    if (inputFile.getName().toLowerCase().endsWith(".tsv")) {
      TSVParser tsvParser = new TSVParser();
      tsvParser.parse(inputFile);
      return parser.parseRows(tsvParser.getRows());
    }
    return parser.parse(new String(Files.readAllBytes(inputFile.toPath()), StandardCharsets.UTF_8));
  }

  public static void writeTsv(List<Product> products, Writer writer) throws IOException {
    TSVWriter<String, String> tsvWriter = new TSVWriter<>(OUTPUT_HEADER);
    tsvWriter.open(writer);
    for (Product product : products) {
      Map<String, String> row = new HashMap<>();
      row.put(HEADER_NAME, product.getName());
      row.put(HEADER_LENGTH, String.valueOf(product.getMolecule().length()));
      row.put(HEADER_GC, String.format(Locale.US, "%.3f", SequenceUtils.calcGC(product.getSequence())));
      row.put(HEADER_SEQUENCE, product.getSequence());
      tsvWriter.append(row);
    }
    tsvWriter.flush();
  }

  public static void writeJson(List<Product> products, Writer writer) throws IOException {
    ObjectMapper mapper = new ObjectMapper();
    mapper.enable(SerializationFeature.INDENT_OUTPUT);
    mapper.writeValue(writer, products);
  }
}
