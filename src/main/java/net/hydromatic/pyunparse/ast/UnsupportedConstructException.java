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

/**
 * Thrown when the writer meets a node that it cannot yet convert to source
 * text, such as a class definition.
 *
 * <p>The writer throws rather than emitting approximate text, so callers can
 * detect that a tree uses a construct that is not covered.
 */
public class UnsupportedConstructException extends UnparseException {
  public final Op op;

  public UnsupportedConstructException(Op op, String message, Pos pos) {
    super("unsupported construct " + op.lowerName() + ": " + message, pos);
    this.op = requireNonNull(op);
  }

  UnsupportedConstructException(AstNode node, String message) {
    this(node.op, message, node.pos);
  }
}

// End UnsupportedConstructException.java
