// Copyright 2014 The Bazel Authors. All rights reserved.
// Copyright 2021 Jonathan Bluett-Duncan. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.jbduncan.tsort;

import static com.google.common.base.Preconditions.checkNotNull;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

/**
 * The {@code tsort} command: writes a totally ordered list consistent with the partial ordering in
 * FILE, or in standard input.
 *
 * <p>Exit status is {@link #EXIT_OK} for a partial order, {@link #EXIT_LOOP} when the input
 * contained a cycle (all keys are still written), and {@link #EXIT_FATAL} when the input could not
 * be read or held an odd number of tokens, in which case nothing is written to standard output.
 * Usage errors exit with picocli's usage status, which is also 2.
 */
@Command(
    name = TsortCommand.NAME,
    mixinStandardHelpOptions = true,
    version = "tsort 1.0",
    description = {
      "Write totally ordered list consistent with the partial ordering in FILE.",
      "With no FILE, or when FILE is -, read standard input."
    })
public final class TsortCommand implements Callable<Integer> {

  static final String NAME = "tsort";

  static final int EXIT_OK = 0;
  static final int EXIT_LOOP = 1;
  static final int EXIT_FATAL = 2;

  private static final String STDIN = "-";

  private static final Logger log = LoggerFactory.getLogger(TsortCommand.class);

  @Parameters(
      arity = "0..1",
      paramLabel = "FILE",
      description = "File of whitespace-separated pairs of keys (default: standard input).")
  private String file = STDIN;

  private final InputStream stdin;
  private final OutputStream stdout;
  private final OutputStream stderr;

  TsortCommand(InputStream stdin, OutputStream stdout, OutputStream stderr) {
    this.stdin = checkNotNull(stdin, "stdin");
    this.stdout = checkNotNull(stdout, "stdout");
    this.stderr = checkNotNull(stderr, "stderr");
  }

  public static void main(String[] args) {
    System.exit(createCommandLine().execute(args));
  }

  /** Creates a command line bound to the process's standard streams. */
  public static CommandLine createCommandLine() {
    return createCommandLine(System.in, System.out, System.err);
  }

  /**
   * Creates a command line bound to the given streams. Help, version and usage messages go through
   * the same streams as the sorted keys and the loop diagnostics.
   */
  static CommandLine createCommandLine(
      InputStream stdin, OutputStream stdout, OutputStream stderr) {
    CommandLine commandLine = new CommandLine(new TsortCommand(stdin, stdout, stderr));
    commandLine.setOut(
        new PrintWriter(new OutputStreamWriter(stdout, Charset.defaultCharset()), true));
    commandLine.setErr(
        new PrintWriter(new OutputStreamWriter(stderr, Charset.defaultCharset()), true));
    return commandLine;
  }

  @Override
  public Integer call() {
    Writer out = new BufferedWriter(new OutputStreamWriter(stdout, TokenReader.CHARSET));
    Writer diagnostics = new OutputStreamWriter(stderr, TokenReader.CHARSET);
    PrintingVisitor<String> visitor = new PrintingVisitor<>(out, diagnostics, NAME);

    try {
      SortResult result;
      if (STDIN.equals(file)) {
        result = TopologicalSorter.sortTokens(stdin, visitor);
      } else {
        try (InputStream in = Files.newInputStream(Paths.get(file))) {
          result = TopologicalSorter.sortTokens(in, visitor);
        }
      }
      log.debug("{}: {}", file, result);
      return result.isAcyclic() ? EXIT_OK : EXIT_LOOP;
    } catch (MalformedInputException e) {
      return fatal(diagnostics, e.getMessage(), e);
    } catch (NoSuchFileException e) {
      return fatal(diagnostics, "No such file or directory", e);
    } catch (AccessDeniedException e) {
      return fatal(diagnostics, "Permission denied", e);
    } catch (IOException e) {
      return fatal(diagnostics, e.getMessage(), e);
    } catch (UncheckedIOException e) {
      return fatal(diagnostics, e.getCause().getMessage(), e);
    }
  }

  private int fatal(Writer diagnostics, String message, Exception cause) {
    log.debug("Failed to sort {}", file, cause);
    try {
      diagnostics.write(NAME + ": " + file + ": " + message + '\n');
      diagnostics.flush();
    } catch (IOException e) {
      cause.addSuppressed(e);
      log.error("Could not report failure to sort {}", file, cause);
    }
    return EXIT_FATAL;
  }
}
