/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */

package exm.sdfg.ui;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.log4j.Logger;

import exm.sdfg.common.Logging;
import exm.sdfg.common.Settings;
import exm.sdfg.common.exceptions.InvalidGraphException;
import exm.sdfg.common.exceptions.InvalidOptionException;
import exm.sdfg.common.exceptions.SDFGRuntimeError;
import exm.sdfg.common.exceptions.SerializationException;
import exm.sdfg.common.lang.Data;
import exm.sdfg.ir.serialize.SDFGSerializer;
import exm.sdfg.ir.tree.ControlFlowBlock.BlockType;
import exm.sdfg.ir.tree.ControlFlowRegion;
import exm.sdfg.ir.tree.SDFG;
import exm.sdfg.ir.tree.SDFGState;

/**
 * Command line tool to inspect a graph document.  Logging and validation
 * options are passed indirectly through Java properties.  See
 * Settings.java for handling of these options.
 */
public class Main {
  private static final String STATES_FLAG = "states";
  private static final String SYMBOLS_FLAG = "symbols";
  private static final String ARGLIST_FLAG = "arglist";
  private static final String INLINE_FLAG = "inline";
  private static final String OUTPUT_FLAG = "o";

  public static void main(String[] args) {
    Options opts = initOptions();
    CommandLine cmd = processArgs(opts, args);

    try {
      Settings.initProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    File input = new File(cmd.getArgs()[0]);
    if (!input.isFile() || !input.canRead()) {
      System.err.println("Input file \"" + input + "\" is not readable");
      System.exit(ExitCode.ERROR_IO.code());
    }

    SDFGSerializer serializer = new SDFGSerializer();
    try {
      SDFG sdfg = serializer.load(input);
      System.exit(run(cmd, sdfg, serializer, logger, System.out).code());
    } catch (IOException ex) {
      System.err.println("Error reading " + input + ": " + ex.getMessage());
      System.exit(ExitCode.ERROR_IO.code());
    } catch (SerializationException ex) {
      System.err.println("Could not load " + input + ": " + ex.getMessage());
      System.exit(ExitCode.ERROR_DOCUMENT.code());
    } catch (InvalidGraphException ex) {
      System.err.println("Invalid graph: " + ex.getMessage());
      System.exit(ExitCode.ERROR_DOCUMENT.code());
    } catch (SDFGRuntimeError ex) {
      reportInternalError(logger, ex);
      System.exit(ExitCode.ERROR_INTERNAL.code());
    }
  }

  /**
   * Run the requested reports on a loaded graph
   * @return exit code
   */
  static ExitCode run(CommandLine cmd, SDFG sdfg, SDFGSerializer serializer,
                   Logger logger, PrintStream out)
                   throws IOException, SerializationException {
    if (cmd.hasOption(INLINE_FLAG)) {
      int count = inlineAll(sdfg);
      logger.debug("Inlined " + count + " regions of " + sdfg.getLabel());
      out.println("Inlined " + count + " regions");
    }
    if (cmd.hasOption(STATES_FLAG)) {
      printStates(sdfg, out);
    }
    if (cmd.hasOption(SYMBOLS_FLAG)) {
      printSymbols(sdfg, out);
    }
    if (cmd.hasOption(ARGLIST_FLAG)) {
      String label = cmd.getOptionValue(ARGLIST_FLAG);
      SDFGState state = findState(sdfg, label);
      if (state == null) {
        System.err.println("No state labeled \"" + label + "\" in " +
                           sdfg.getLabel());
        return ExitCode.ERROR_COMMAND;
      }
      printArgList(state, out);
    }
    if (cmd.hasOption(OUTPUT_FLAG)) {
      File output = new File(cmd.getOptionValue(OUTPUT_FLAG));
      serializer.save(sdfg, output);
      logger.debug("Saved result to " + output);
    }
    return ExitCode.SUCCESS;
  }

  static Options initOptions() {
    Options opts = new Options();
    opts.addOption(new Option(STATES_FLAG, false,
                              "List states with node and edge counts"));
    opts.addOption(new Option(SYMBOLS_FLAG, false,
                              "Print free and declared symbols"));
    Option arglist = new Option(ARGLIST_FLAG, true,
                                "Print the inferred arguments of a state");
    arglist.setArgName("state");
    opts.addOption(arglist);
    opts.addOption(new Option(INLINE_FLAG, false,
                              "Inline all nested control flow regions"));
    Option output = new Option(OUTPUT_FLAG, "output", true,
                               "Write the resulting document to file");
    output.setArgName("file");
    opts.addOption(output);
    return opts;
  }

  static CommandLine processArgs(Options opts, String[] args) {
    CommandLine cmd = null;
    try {
      CommandLineParser parser = new GnuParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length != 1) {
      System.err.println("Expected one input document, but got "
              + remainingArgs.length + " arguments");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }
    return cmd;
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("sdfg-inspect [options] <input.json>", opts);
  }

  /**
   * Inline nested regions until none can be inlined further.
   * @return number of regions inlined
   */
  static int inlineAll(SDFG sdfg) {
    int count = 0;
    boolean changed;
    do {
      changed = false;
      for (ControlFlowRegion region: sdfg.allControlFlowRegions(true)) {
        if (region.getType() == BlockType.SDFG ||
            region.parentGraph() == null) {
          continue;
        }
        if (region.inline()) {
          count++;
          changed = true;
          // Region list is stale after a rewrite
          break;
        }
      }
    } while (changed);
    return count;
  }

  static SDFGState findState(SDFG sdfg, String label) {
    for (SDFGState state: sdfg.allStates()) {
      if (state.getLabel().equals(label)) {
        return state;
      }
    }
    return null;
  }

  static void printStates(SDFG sdfg, PrintStream out) {
    for (SDFGState state: sdfg.allStates()) {
      ControlFlowRegion parent = state.parentGraph();
      out.println(state.getLabel() + " (in " +
          (parent == null ? "-" : parent.getLabel()) + "): " +
          state.numberOfNodes() + " nodes, " +
          state.edges().size() + " edges");
    }
  }

  static void printSymbols(SDFG sdfg, PrintStream out) {
    List<String> declared = new ArrayList<String>(sdfg.symbols().keySet());
    List<String> free = new ArrayList<String>(sdfg.freeSymbols());
    out.println("declared: " + StringUtils.join(declared, ", "));
    out.println("free: " + StringUtils.join(free, ", "));
  }

  static void printArgList(SDFGState state, PrintStream out) {
    for (Map.Entry<String, Data> e: state.argList().entrySet()) {
      out.println(e.getKey() + ": " + e.getValue());
    }
    out.println("signature: " +
        StringUtils.join(state.signatureArgList(true, false), ", "));
  }

  private static void reportInternalError(Logger logger, Throwable t) {
    logger.error("Internal error: " + t.getMessage(), t);
    System.err.println("This is a bug in the graph library; please " +
                       "report it with the input document");
  }
}
