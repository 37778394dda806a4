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

import java.util.List;

/** A {@link SortVisitor} whose methods do nothing. */
public class AbstractSortVisitor<K> implements SortVisitor<K> {

  @Override
  public void beginVisit() {}

  @Override
  public void endVisit() {}

  @Override
  public void visitNode(K key) {}

  @Override
  public void visitCycle(List<? extends K> members) {}
}
