/*
 * Copyright 2025 The Ward Authors
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

package org.wardlang.resolve;

import com.google.common.collect.ImmutableList;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.wardlang.compiler.CompileError;
import org.wardlang.compiler.Compiler;

/**
 * Computes the order in which packages must be verified: every package after all the packages it
 * uses, with the base package always first. Base is read through the {@link UseReader} like any
 * other package; a reader for a built-in base returns no uses.
 *
 * <p>The walk is a depth-first traversal driven by an explicit stack rather than recursion.
 * Packages are numbered as they are discovered; the numbers index the {@code visited} and {@code
 * onStack} sets. Reaching a package that is still on the stack means the {@code use} declarations
 * form a cycle, which is reported as an error naming the cycle.
 */
public class DependencyResolver {

  /** Returns the paths named by a package's {@code use} declarations. */
  public interface UseReader {
    ImmutableList<String> uses(String path) throws IOException;
  }

  private final UseReader reader;

  public DependencyResolver(UseReader reader) {
    this.reader = reader;
  }

  /** One entry of the traversal stack: a package and the uses not yet followed. */
  private static class Frame {
    final int index;
    final Iterator<String> remaining;

    Frame(int index, Iterator<String> remaining) {
      this.index = index;
      this.remaining = remaining;
    }
  }

  /** Returns the packages needed by {@code path}, including itself, in dependency order. */
  public ImmutableList<String> resolve(String path) throws IOException {
    return resolve(List.of(path));
  }

  /**
   * Returns the packages needed by each of {@code paths}, in dependency order. Each package
   * appears exactly once, and the first is always the base package.
   */
  public ImmutableList<String> resolve(List<String> paths) throws IOException {
    List<String> arena = new ArrayList<>();
    Map<String, Integer> indices = new HashMap<>();
    BitSet visited = new BitSet();
    BitSet onStack = new BitSet();
    ImmutableList.Builder<String> order = ImmutableList.builder();
    List<String> roots = new ArrayList<>();
    roots.add(Compiler.BASE);
    roots.addAll(paths);
    for (String root : roots) {
      PackagePaths.validate(root);
      int rootIndex = indices.computeIfAbsent(root, p -> add(arena, p));
      if (visited.get(rootIndex)) {
        continue;
      }
      Deque<Frame> stack = new ArrayDeque<>();
      visited.set(rootIndex);
      onStack.set(rootIndex);
      stack.push(new Frame(rootIndex, reader.uses(root).iterator()));
      while (!stack.isEmpty()) {
        Frame top = stack.peek();
        if (!top.remaining.hasNext()) {
          stack.pop();
          onStack.clear(top.index);
          order.add(arena.get(top.index));
          continue;
        }
        String used = top.remaining.next();
        PackagePaths.validate(used);
        int usedIndex = indices.computeIfAbsent(used, p -> add(arena, p));
        if (onStack.get(usedIndex)) {
          throw cycleError(stack, arena, usedIndex);
        } else if (!visited.get(usedIndex)) {
          visited.set(usedIndex);
          onStack.set(usedIndex);
          stack.push(new Frame(usedIndex, reader.uses(used).iterator()));
        }
      }
    }
    return order.build();
  }

  private static int add(List<String> arena, String path) {
    arena.add(path);
    return arena.size() - 1;
  }

  /** Describes the cycle from {@code repeated} to the top of the stack and back. */
  private static CompileError cycleError(Deque<Frame> stack, List<String> arena, int repeated) {
    List<String> cycle = new ArrayList<>();
    // The stack iterates from top to bottom.
    for (Frame frame : stack) {
      cycle.add(0, arena.get(frame.index));
      if (frame.index == repeated) {
        break;
      }
    }
    cycle.add(arena.get(repeated));
    return new CompileError(
        CompileError.Phase.RESOLVE,
        "use cycle: " + cycle.stream().collect(Collectors.joining(" -> ")),
        null,
        0);
  }
}
