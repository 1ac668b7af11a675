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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;
import java.util.List;
import net.hydromatic.pyunparse.util.Escapes;

/**
 * Context for writing an AST out as source text.
 *
 * <p>The writer holds the output buffer, the current indentation level and
 * the current nesting depth. Nodes write themselves by calling its methods;
 * every child node must be written via {@link #append(AstNode)} (or a method
 * that calls it) so that the depth limit is enforced.
 *
 * <p>An operand of a prefix or infix operator is enclosed in parentheses
 * unless it is an atom (see {@link Ast.Exp#isAtom()}); the writer never
 * consults operator precedence.
 */
public class AstWriter {
  /** Default number of spaces per indentation level. */
  public static final int DEFAULT_INDENT_WIDTH = 4;

  /** Default maximum nesting depth of nodes. */
  public static final int DEFAULT_MAX_DEPTH = 1000;

  private final StringBuilder b = new StringBuilder();
  private final int indentWidth;
  private final int maxDepth;
  private final char quote;
  private int level;
  private int depth;

  /** Creates a writer with default settings. */
  public AstWriter() {
    this(DEFAULT_INDENT_WIDTH, DEFAULT_MAX_DEPTH, '"');
  }

  /** Creates a writer. */
  public AstWriter(int indentWidth, int maxDepth, char quote) {
    checkArgument(indentWidth > 0, "indent width must be positive");
    checkArgument(maxDepth > 0, "max depth must be positive");
    checkArgument(quote == '"' || quote == '\'', "invalid quote %s", quote);
    this.indentWidth = indentWidth;
    this.maxDepth = maxDepth;
    this.quote = quote;
  }

  @Override
  public String toString() {
    return b.toString();
  }

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends a node to the output. */
  public AstWriter append(AstNode node) {
    if (++depth > maxDepth) {
      --depth;
      throw new UnparseException("nesting depth exceeds " + maxDepth,
          node.pos);
    }
    try {
      return node.write(this);
    } finally {
      --depth;
    }
  }

  /** Appends an identifier. */
  public AstWriter id(String name) {
    return append(name);
  }

  /** Appends a dotted name, e.g. "os.path". */
  public AstWriter dotted(List<String> names) {
    return append(String.join(".", names));
  }

  /** Appends a comma-separated list of identifiers. */
  public AstWriter ids(List<String> names) {
    return append(String.join(", ", names));
  }

  /** Appends a string literal, quoted and escaped. */
  public AstWriter appendString(String s) {
    return append(Escapes.quote(s, quote));
  }

  /** Appends a bytes literal, quoted and escaped. */
  public AstWriter appendBytes(byte[] bytes) {
    return append(Escapes.quoteBytes(bytes, quote));
  }

  /** Appends a list of nodes, separated by {@code sep}. Appends nothing if
   * the list is empty. */
  public AstWriter appendAll(Iterable<? extends AstNode> nodes, String sep) {
    return appendAll(nodes, "", sep, "");
  }

  /** Appends a list of nodes, separated by {@code sep}, preceded by
   * {@code start} and followed by {@code end}. */
  public AstWriter appendAll(Iterable<? extends AstNode> nodes, String start,
      String sep, String end) {
    append(start);
    int i = 0;
    for (AstNode node : nodes) {
      if (i++ > 0) {
        append(sep);
      }
      append(node);
    }
    return append(end);
  }

  /** Appends a list of nodes separated by commas, e.g. "a, b, c". */
  public AstWriter commaList(Iterable<? extends AstNode> nodes) {
    return appendAll(nodes, ", ");
  }

  /** Appends an expression that is an operand of an operator, enclosing it
   * in parentheses unless it is an atom. */
  public AstWriter operand(Ast.Exp e) {
    if (e.isAtom()) {
      return append(e);
    }
    return append("(").append(e).append(")");
  }

  /** Appends the base of a call, subscript or attribute access. A base that
   * is itself a call, subscript or attribute access needs no parentheses. */
  public AstWriter trailerBase(Ast.Exp e) {
    switch (e.op) {
      case CALL:
      case SUBSCRIPT:
      case ATTRIBUTE:
        return append(e);
      default:
        return operand(e);
    }
  }

  /** Appends an expression in a position where a conditional expression,
   * lambda, yield or star expression would be ambiguous, such as the
   * iterable of a comprehension. */
  public AstWriter orTest(Ast.Exp e) {
    switch (e.op) {
      case TERNARY:
      case LAMBDA:
      case YIELD:
      case YIELD_FROM:
      case STAR:
        return append("(").append(e).append(")");
      default:
        return append(e);
    }
  }

  /** Appends an expression in a position that takes any expression except
   * an unparenthesized yield, such as a call argument or a list item. */
  public AstWriter exp(Ast.Exp e) {
    switch (e.op) {
      case YIELD:
      case YIELD_FROM:
        return append("(").append(e).append(")");
      default:
        return append(e);
    }
  }

  /** Appends a comma-separated list of expressions, each as if by
   * {@link #exp(Ast.Exp)}. */
  public AstWriter expList(List<? extends Ast.Exp> exps) {
    for (int i = 0; i < exps.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      exp(exps.get(i));
    }
    return this;
  }

  /** Appends the values of an expression statement or of one side of an
   * assignment. A yield is bare only if it is the sole value. */
  public AstWriter stmtList(List<? extends Ast.Exp> exps) {
    return exps.size() == 1 ? append(exps.get(0)) : expList(exps);
  }

  /** Appends the target of a "for" loop or "with" item. Names, trailers and
   * star expressions need no parentheses. */
  public AstWriter target(Ast.Exp e) {
    return e.op == Op.STAR ? append(e) : trailerBase(e);
  }

  /** Appends a comma-separated list of targets. */
  public AstWriter targets(List<? extends Ast.Exp> exps) {
    for (int i = 0; i < exps.size(); i++) {
      if (i > 0) {
        append(", ");
      }
      target(exps.get(i));
    }
    return this;
  }

  /** Appends spaces for the current indentation level. */
  public AstWriter indent() {
    return append(Strings.repeat(" ", level * indentWidth));
  }

  /** Appends a line break. */
  public AstWriter newline() {
    return append("\n");
  }

  /** Appends a sequence of statements, one indentation level deeper than
   * the current one. */
  public AstWriter block(List<? extends Ast.Stmt> stmts) {
    ++level;
    try {
      for (Ast.Stmt stmt : stmts) {
        append(stmt);
      }
      return this;
    } finally {
      --level;
    }
  }

  /** Appends a clause of a compound statement whose header has no
   * expression, e.g. "else:", followed by its block. */
  public AstWriter clause(String keyword, List<? extends Ast.Stmt> stmts) {
    return indent().append(keyword).append(":").newline().block(stmts);
  }

  /** Appends a clause of a compound statement whose header has an
   * expression, e.g. "while x:", followed by its block. */
  public AstWriter clause(String keyword, Ast.Exp e,
      List<? extends Ast.Stmt> stmts) {
    return indent().append(keyword).append(" ").exp(e).append(":")
        .newline().block(stmts);
  }
}

// End AstWriter.java
