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

/**
 * Thrown when the token stream cannot be read as a list of (predecessor, successor) pairs, i.e.
 * when it holds an odd number of tokens. Raised before any key is emitted.
 */
public final class MalformedInputException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  public MalformedInputException(String message) {
    super(message);
  }
}
