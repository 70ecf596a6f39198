/*
 * Copyright 2026 The Closure Compiler Authors.
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
 * limitations under the License.
 */

package com.google.flowchart;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.Files;
import com.google.flowchart.parsing.JsonAstParser;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.jspecify.annotations.Nullable;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/**
 * Command line entry point: reads a syntax tree dumped as JSON and writes the Mermaid flowchart.
 *
 * <pre>
 * java -jar flowchart.jar --ast_json program.json --output program.mmd
 * </pre>
 */
public class CommandLineRunner {

  // Held so the configured level is not lost when the logger is collected.
  private static final Logger packageLogger = Logger.getLogger("com.google.flowchart");

  private static class Flags {
    @Option(
        name = "--ast_json",
        required = true,
        usage = "The program to draw, as the JSON dump of a Python syntax tree",
        metaVar = "FILE")
    private String astJson = null;

    @Option(
        name = "--output",
        usage = "Where to write the Mermaid flowchart. Defaults to standard output",
        metaVar = "FILE")
    private @Nullable String output = null;

    @Option(
        name = "--io_function",
        usage =
            "A function whose calls are drawn as input/output steps, in addition to input and"
                + " print. You may specify multiple",
        metaVar = "NAME")
    private List<String> ioFunctions = new ArrayList<>();

    @Option(
        name = "--max_inline_depth",
        usage = "How deeply calls to user-defined functions are inlined",
        metaVar = "N")
    private int maxInlineDepth = FlowchartOptions.DEFAULT_MAX_INLINE_DEPTH;

    @Option(
        name = "--orphan_jump_level",
        usage = "How to report break and continue outside of a loop: OFF, WARNING or ERROR")
    private CheckLevel orphanJumpLevel = CheckLevel.WARNING;

    @Option(
        name = "--logging_level",
        usage =
            "The logging level (standard java.util.logging.Level values) for progress messages."
                + " Does not control errors or warnings about the program being drawn")
    private String loggingLevel = Level.WARNING.getName();

    @Option(name = "--help", help = true, usage = "Displays this message")
    private boolean displayHelp = false;
  }

  private final PrintStream out;
  private final PrintStream err;

  @VisibleForTesting
  CommandLineRunner(PrintStream out, PrintStream err) {
    this.out = out;
    this.err = err;
  }

  /**
   * Runs the tool.
   *
   * @return 0 when a flowchart was drawn, 1 when the arguments were bad or the error diagram was
   *     produced instead
   */
  @VisibleForTesting
  int run(String[] args) {
    Flags flags = new Flags();
    CmdLineParser parser = new CmdLineParser(flags);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      if (flags.displayHelp) {
        printUsage(parser, out);
        return 0;
      }
      err.println(e.getMessage());
      printUsage(parser, err);
      return 1;
    }
    if (flags.displayHelp) {
      printUsage(parser, out);
      return 0;
    }

    FlowchartOptions options;
    try {
      options = createOptions(flags);
    } catch (IllegalArgumentException e) {
      err.println("ERROR - " + e.getMessage());
      return 1;
    }

    String input;
    File inputFile = new File(flags.astJson);
    try {
      input = Files.asCharSource(inputFile, UTF_8).read();
    } catch (IOException e) {
      err.println("ERROR - " + flags.astJson + " read error.");
      return 1;
    }

    ErrorManager errorManager = new LoggerErrorManager(packageLogger);
    String diagram =
        new FlowchartGenerator(options, errorManager)
            .generate(inputFile.getName(), input, new JsonAstParser());
    errorManager.generateReport();

    try {
      if (flags.output == null) {
        out.print(diagram);
        out.flush();
      } else {
        Files.asCharSink(new File(flags.output), UTF_8).write(diagram);
      }
    } catch (IOException e) {
      err.println("ERROR - " + flags.output + " write error.");
      return 1;
    }
    return errorManager.getErrorCount() > 0 ? 1 : 0;
  }

  private static FlowchartOptions createOptions(Flags flags) {
    packageLogger.setLevel(Level.parse(flags.loggingLevel));
    FlowchartOptions options = new FlowchartOptions();
    for (String name : flags.ioFunctions) {
      options.addIoFunctionName(name);
    }
    options.setMaxInlineDepth(flags.maxInlineDepth);
    options.setOrphanJumpLevel(flags.orphanJumpLevel);
    return options;
  }

  private static void printUsage(CmdLineParser parser, PrintStream ps) {
    ps.println("Usage: flowchart --ast_json FILE [options]");
    parser.printUsage(ps);
    ps.flush();
  }

  public static void main(String[] args) {
    int result = new CommandLineRunner(System.out, System.err).run(args);
    System.exit(result);
  }
}
