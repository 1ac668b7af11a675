/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.pyunparse.ast;

import static java.util.Objects.requireNonNull;

/** Abstract syntax tree node. */
public abstract class AstNode {
  public final Pos pos;
  public final Op op;

  public AstNode(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into source text, using default settings.
   *
   * <p>The purpose of this string is debugging. If you want to control the
   * indentation or quoting, use {@link #unparse(AstWriter)} or
   * {@link net.hydromatic.pyunparse.Unparser}.
   *
   * <p>Throws {@link UnsupportedConstructException} if this node, or a node
   * beneath it, cannot be converted.
   */
  @Override
  public final String toString() {
    // Marked final because you should override write, not toString
    return unparse(new AstWriter());
  }

  /** Converts this node into source text, with a given writer. */
  public final String unparse(AstWriter w) {
    return w.append(this).toString();
  }

  /** Writes this node to a writer. Called only via
   * {@link AstWriter#append(AstNode)}, which tracks nesting depth. */
  abstract AstWriter write(AstWriter w);
}

// End AstNode.java
