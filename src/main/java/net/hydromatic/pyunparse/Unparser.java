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
package net.hydromatic.pyunparse;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.Map;
import net.hydromatic.pyunparse.ast.Ast;
import net.hydromatic.pyunparse.ast.AstNode;
import net.hydromatic.pyunparse.ast.AstWriter;
import net.hydromatic.pyunparse.ast.UnparseException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts parse trees back into source text.
 *
 * <p>An unparser is immutable. Its settings are {@link Prop properties};
 * {@link #withProp} and {@link #withTracer} return modified copies, so an
 * instance may be shared between threads.
 *
 * <pre>{@code
 * String text = Unparser.create()
 *     .withProp(Prop.INDENT_WIDTH, 2)
 *     .unparse(statements);
 * }</pre>
 */
public class Unparser {
  private final ImmutableMap<Prop, Object> propMap;
  private final Tracer tracer;

  private Unparser(ImmutableMap<Prop, Object> propMap, Tracer tracer) {
    this.propMap = requireNonNull(propMap);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates an unparser with default properties and no tracing. */
  public static Unparser create() {
    return new Unparser(ImmutableMap.of(), Tracers.empty());
  }

  /** Returns a copy of this unparser with a property set. The value may be
   * a string for an enum or integer property, for example
   * {@code withProp(Prop.QUOTE, "single")}. A null value reverts the
   * property to its default. */
  public Unparser withProp(Prop prop, @Nullable Object value) {
    final Map<Prop, Object> map = new EnumMap<>(Prop.class);
    map.putAll(propMap);
    if (value == null) {
      prop.remove(map);
    } else {
      prop.setLenient(map, value);
    }
    return new Unparser(ImmutableMap.copyOf(map), tracer);
  }

  /** Returns a copy of this unparser with a given tracer. */
  public Unparser withTracer(Tracer tracer) {
    return new Unparser(propMap, tracer);
  }

  /** Returns the value of a property. */
  public Object get(Prop prop) {
    return prop.get(propMap);
  }

  /** Creates a writer for one conversion. */
  private AstWriter writer() {
    return new AstWriter(Prop.INDENT_WIDTH.intValue(propMap),
        Prop.MAX_DEPTH.intValue(propMap),
        Prop.QUOTE.enumValue(propMap, Prop.Quote.class).c);
  }

  /** Converts a sequence of top-level statements to source text. Each
   * statement is written at the outermost indentation level and ends with a
   * line break.
   *
   * @throws UnparseException if a statement cannot be converted
   */
  public String unparse(Iterable<? extends Ast.Stmt> stmts) {
    final StringBuilder b = new StringBuilder();
    try {
      for (Ast.Stmt stmt : stmts) {
        final String text = stmt.unparse(writer());
        tracer.onStatement(stmt, text);
        b.append(text);
      }
    } catch (UnparseException e) {
      tracer.onException(e);
      throw e;
    }
    final String text = b.toString();
    tracer.onResult(text);
    return text;
  }

  /** Converts a single node (statement, expression or part) to source
   * text.
   *
   * @throws UnparseException if the node cannot be converted
   */
  public String unparse(AstNode node) {
    try {
      return node.unparse(writer());
    } catch (UnparseException e) {
      tracer.onException(e);
      throw e;
    }
  }
}

// End Unparser.java
