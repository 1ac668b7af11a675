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

import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.pyunparse.ast.Ast;
import net.hydromatic.pyunparse.ast.UnparseException;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on each top-level
   * statement and its text, then calls the underlying tracer. */
  public static Tracer withOnStatement(Tracer tracer,
      BiConsumer<Ast.Stmt, String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onStatement(Ast.Stmt stmt, String text) {
        consumer.accept(stmt, text);
        super.onStatement(stmt, text);
      }
    };
  }

  /** Returns a tracer that performs the given action on the complete text,
   * then calls the underlying tracer. */
  public static Tracer withOnResult(Tracer tracer,
      Consumer<String> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onResult(String text) {
        consumer.accept(text);
        super.onResult(text);
      }
    };
  }

  /** Returns a tracer that performs the given action on each error, then
   * calls the underlying tracer. */
  public static Tracer withOnException(Tracer tracer,
      Consumer<UnparseException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onException(UnparseException e) {
        consumer.accept(e);
        super.onException(e);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onStatement(Ast.Stmt stmt, String text) {
    }

    @Override public void onResult(String text) {
    }

    @Override public void onException(UnparseException e) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onStatement(Ast.Stmt stmt, String text) {
      tracer.onStatement(stmt, text);
    }

    @Override public void onResult(String text) {
      tracer.onResult(text);
    }

    @Override public void onException(UnparseException e) {
      tracer.onException(e);
    }
  }
}

// End Tracers.java
