/*
 * Copyright 2026 The Scope Hoist Authors.
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
package org.scopehoist;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableSet;
import com.google.javascript.jscomp.Compiler;
import com.google.javascript.jscomp.CompilerOptions;
import com.google.javascript.jscomp.CompilerOptions.LanguageMode;
import com.google.javascript.jscomp.JSError;
import com.google.javascript.jscomp.SourceFile;
import com.google.javascript.rhino.Node;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.OptionDef;
import org.kohsuke.args4j.spi.OptionHandler;
import org.kohsuke.args4j.spi.Parameters;
import org.kohsuke.args4j.spi.Setter;

/**
 * Hoists a single JavaScript file from the command line.
 *
 * <pre>
 * java -jar scope-hoist.jar --js a.js --module_id a --result_output a.json
 * </pre>
 *
 * <p>Prints the rewritten code to stdout and diagnostics to stderr. The {@link HoistResult} is
 * written as JSON to {@code --result_output} when given.
 */
public final class ScopeHoistRunner {

  private static final Logger logger = Logger.getLogger(ScopeHoistRunner.class.getName());

  /** Command line flags. */
  static final class Flags {
    @Option(
        name = "--help",
        handler = BooleanOptionHandler.class,
        usage = "Displays this message on stdout and exits")
    boolean displayHelp = false;

    @Option(name = "--js", usage = "The JavaScript file to hoist")
    List<String> js = new ArrayList<>();

    @Option(
        name = "--module_id",
        usage =
            "Prefix of every synthesized name. Letters, digits, _ and $ only. Defaults to a hash"
                + " of the input path")
    String moduleId = "";

    @Option(
        name = "--trace_bailouts",
        handler = BooleanOptionHandler.class,
        usage = "Reports every skipped optimization as a warning")
    boolean traceBailouts = false;

    @Option(
        name = "--pretty_print",
        handler = BooleanOptionHandler.class,
        usage = "Prints the rewritten code with indentation and line breaks")
    boolean prettyPrint = false;

    @Option(
        name = "--result_output",
        usage = "File that the hoisting result is written to, as JSON")
    String resultOutput = "";

    @Option(
        name = "--logging_level",
        usage = "The logging level (standard java.util.logging.Level values) for progress messages")
    String loggingLevel = Level.WARNING.getName();

    @Argument List<String> arguments = new ArrayList<>();

    private final CmdLineParser parser;

    Flags() {
      parser = new CmdLineParser(this);
    }

    void parse(String[] args) throws CmdLineException {
      parser.parseArgument(args);
      if (displayHelp) {
        return;
      }
      if (inputs().size() != 1) {
        throw new CmdLineException(parser, "Exactly one input is required, got " + inputs());
      }
      if (!moduleId.isEmpty() && !SymbolNames.isValidModuleId(moduleId)) {
        throw new CmdLineException(parser, "Bad value for --module_id: " + moduleId);
      }
      try {
        Level.parse(loggingLevel);
      } catch (IllegalArgumentException e) {
        throw new CmdLineException(parser, "Bad value for --logging_level: " + loggingLevel, e);
      }
    }

    List<String> inputs() {
      List<String> inputs = new ArrayList<>(js);
      inputs.addAll(arguments);
      return inputs;
    }

    String moduleIdFor(String input) {
      return moduleId.isEmpty() ? ModuleIdGenerator.hashed().moduleIdFor(input) : moduleId;
    }

    void printUsage(PrintStream ps) {
      ps.println("Usage: scope-hoist [flags] --js <file>");
      parser.printUsage(new OutputStreamWriter(ps, UTF_8), null);
      ps.flush();
    }
  }

  private final String[] args;
  private final PrintStream out;
  private final PrintStream err;
  private final Flags flags = new Flags();

  public ScopeHoistRunner(String[] args, PrintStream out, PrintStream err) {
    this.args = args;
    this.out = out;
    this.err = err;
  }

  /** Runs the tool and returns the process exit code. */
  public int run() {
    try {
      flags.parse(args);
    } catch (CmdLineException e) {
      err.println(e.getMessage());
      flags.printUsage(err);
      return 1;
    }
    if (flags.displayHelp) {
      flags.printUsage(out);
      return 0;
    }

    Logger.getLogger("org.scopehoist").setLevel(Level.parse(flags.loggingLevel));
    try {
      return hoist(flags.inputs().get(0));
    } catch (IOException e) {
      err.println("ERROR - " + e.getMessage());
      return 1;
    }
  }

  private int hoist(String input) throws IOException {
    CompilerOptions options = new CompilerOptions();
    options.setLanguageIn(LanguageMode.ECMASCRIPT_NEXT);
    options.setStrictModeInput(false);
    options.setPrettyPrint(flags.prettyPrint);
    Compiler compiler = new Compiler(err);
    compiler.initOptions(options);

    Node script = compiler.parse(SourceFile.fromFile(input, UTF_8));
    if (compiler.hasErrors()) {
      for (JSError error : compiler.getErrors()) {
        err.println(error);
      }
      return 1;
    }

    String moduleId = flags.moduleIdFor(input);
    logger.fine("Module id of " + input + " is " + moduleId);
    HoistOutput output =
        ScopeHoist.builder()
            .setModuleId(moduleId)
            .setTraceBailouts(flags.traceBailouts)
            .build()
            .hoist(script);

    for (HoistDiagnostic diagnostic : output.diagnostics()) {
      err.print(format(diagnostic));
    }
    if (!output.isSuccessful()) {
      return 1;
    }

    out.println(compiler.toSource(output.root()));
    if (!flags.resultOutput.isEmpty()) {
      List<Bailout> bailouts = flags.traceBailouts ? output.bailouts() : null;
      try (Writer writer = Files.newBufferedWriter(Paths.get(flags.resultOutput), UTF_8)) {
        HoistResultJson.write(output.result(), bailouts, writer, flags.prettyPrint);
      }
    }
    return 0;
  }

  /** One line per highlight, the first one carrying the level and message. */
  static String format(HoistDiagnostic diagnostic) {
    StringBuilder sb = new StringBuilder();
    List<HoistDiagnostic.CodeHighlight> highlights = diagnostic.highlights();
    for (int i = 0; i < highlights.size(); i++) {
      HoistDiagnostic.CodeHighlight highlight = highlights.get(i);
      sb.append(highlight.loc()).append(": ");
      if (i == 0) {
        sb.append(diagnostic.isError() ? "ERROR" : "WARNING")
            .append(" - [")
            .append(diagnostic.type().key)
            .append("] ")
            .append(diagnostic.message());
        if (highlight.message() != null) {
          sb.append(" (").append(highlight.message()).append(')');
        }
      } else if (highlight.message() != null) {
        sb.append("  ").append(highlight.message());
      }
      sb.append('\n');
    }
    return sb.toString();
  }

  public static void main(String[] args) {
    System.exit(new ScopeHoistRunner(args, System.out, System.err).run());
  }

  /** Boolean flags that can be given with or without a value. */
  public static class BooleanOptionHandler extends OptionHandler<Boolean> {
    private static final Set<String> TRUES = ImmutableSet.of("true", "on", "yes", "1");
    private static final Set<String> FALSES = ImmutableSet.of("false", "off", "no", "0");

    public BooleanOptionHandler(
        CmdLineParser parser, OptionDef option, Setter<? super Boolean> setter) {
      super(parser, option, setter);
    }

    @Override
    public int parseArguments(Parameters params) throws CmdLineException {
      String param = params.size() == 0 ? null : params.getParameter(0);
      if (param == null) {
        setter.addValue(true);
        return 0;
      }
      String lowerParam = param.toLowerCase();
      if (TRUES.contains(lowerParam)) {
        setter.addValue(true);
      } else if (FALSES.contains(lowerParam)) {
        setter.addValue(false);
      } else {
        // The next argument isn't a value for this flag.
        setter.addValue(true);
        return 0;
      }
      return 1;
    }

    @Override
    public String getDefaultMetaVariable() {
      return null;
    }
  }
}
