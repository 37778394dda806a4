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
import static java.nio.charset.StandardCharsets.ISO_8859_1;

import com.google.common.collect.AbstractIterator;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;

/**
 * A lazy iterator over the whitespace-separated tokens of a byte stream.
 *
 * <p>A token is a maximal run of bytes other than ASCII space, tab, line feed, carriage return,
 * vertical tab and form feed. Tokens are decoded as ISO-8859-1, so every char of a token stands
 * for exactly one input byte: {@link String#compareTo} then orders tokens byte-wise, and encoding a
 * token back with ISO-8859-1 reproduces the input bytes whatever their original encoding was.
 *
 * <p>The stream is read on demand and is not closed by this class. I/O failures surface as {@link
 * UncheckedIOException}.
 */
public final class TokenReader extends AbstractIterator<String> {

  /** The charset in which tokens are decoded, and in which they must be written back. */
  public static final Charset CHARSET = ISO_8859_1;

  private final InputStream in;
  private final ByteArrayOutputStream token = new ByteArrayOutputStream();

  public TokenReader(InputStream in) {
    checkNotNull(in, "in");
    this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
  }

  /** Returns a reader over the bytes of {@code text}, encoded as ISO-8859-1. */
  public static TokenReader of(String text) {
    return new TokenReader(new ByteArrayInputStream(text.getBytes(CHARSET)));
  }

  @Override
  protected String computeNext() {
    try {
      int b;
      do {
        b = in.read();
      } while (b != -1 && isWhitespace(b));

      if (b == -1) {
        return endOfData();
      }

      token.reset();
      do {
        token.write(b);
        b = in.read();
      } while (b != -1 && !isWhitespace(b));
      return token.toString(CHARSET);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  static boolean isWhitespace(int b) {
    switch (b) {
      case ' ':
      case '\t':
      case '\n':
      case '\r':
      case 0x0B:
      case '\f':
        return true;
      default:
        return false;
    }
  }
}
