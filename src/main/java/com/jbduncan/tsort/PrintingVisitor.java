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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;

/**
 * A {@link SortVisitor} that writes one key per line to an output writer, and reports each broken
 * cycle on a diagnostic writer in the format of the {@code tsort} utility:
 *
 * <pre>
 * tsort: input contains a loop:
 * tsort: a
 * tsort: b
 * </pre>
 *
 * <p>Lines are terminated by {@code '\n'} regardless of platform. Both writers are flushed by
 * {@link #endVisit}, and the diagnostic writer after each cycle; neither is closed.
 */
public final class PrintingVisitor<K> implements SortVisitor<K> {

  private final Writer out;
  private final Writer diagnostics;
  private final String programName;

  public PrintingVisitor(Writer out, Writer diagnostics, String programName) {
    this.out = checkNotNull(out, "out");
    this.diagnostics = checkNotNull(diagnostics, "diagnostics");
    this.programName = checkNotNull(programName, "programName");
  }

  @Override
  public void beginVisit() {}

  @Override
  public void endVisit() {
    try {
      out.flush();
      diagnostics.flush();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void visitNode(K key) {
    try {
      out.write(String.valueOf(key));
      out.write('\n');
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void visitCycle(List<? extends K> members) {
    try {
      diagnostics.write(programName + ": input contains a loop:\n");
      for (K member : members) {
        diagnostics.write(programName + ": " + member + '\n');
      }
      diagnostics.flush();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
