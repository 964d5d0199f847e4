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

package org.twentyn.construction.utils;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.ParseException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class CLIUtilTest {

  private static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder("i")
        .argName("input")
        .desc("An input file")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder("j")
        .desc("A flag")
        .longOpt("json-cf")
    );
  }};

  @Test
  public void testHelpOptionIsAlwaysPresent() {
    CLIUtil cliUtil = new CLIUtil(CLIUtilTest.class, "Testing", OPTION_BUILDERS);
    assertTrue(cliUtil.getOptions().hasOption("h"));
    assertTrue(cliUtil.getOptions().hasOption("help"));
    assertEquals(3, cliUtil.getOptions().getOptions().size());
  }

  @Test
  public void testParse() throws Exception {
    CLIUtil cliUtil = new CLIUtil(CLIUtilTest.class, "Testing", OPTION_BUILDERS);
    CommandLine cl = cliUtil.parse(new String[] {"--input", "cf.txt"});
    assertEquals("cf.txt", cl.getOptionValue("i"));
    assertFalse(cl.hasOption("j"));
    assertEquals(cl, cliUtil.getCommandLine());
  }

  @Test(expected = ParseException.class)
  public void testMissingRequiredOption() throws Exception {
    new CLIUtil(CLIUtilTest.class, "Testing", OPTION_BUILDERS).parse(new String[] {"-j"});
  }
}
