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

/**
 * Ways in which an argument list can be malformed.
 *
 * <p>The writer never produces these; {@link Ast.Arglist} assumes that its
 * arguments have already been checked against them. The parser that builds
 * argument lists reports a violation by its {@link #code}, a small integer
 * that is stable across releases, so that callers on the other side of a
 * language boundary can use it.
 */
public enum ArgumentError {
  /** A keyword argument whose name is an expression, e.g. {@code f(a.b=1)}. */
  KEYWORD_EXPRESSION(1, "Keyword cannot be an expression."),
  /** A positional argument after a keyword argument or {@code **kwargs},
   * e.g. {@code f(a=1, 2)}. */
  POSITIONAL_AFTER_KEYWORD(2,
      "Positional argument after keyword argument or **kwargs."),
  /** A {@code *args} argument after a keyword argument or {@code **kwargs},
   * e.g. {@code f(**k, *a)}. */
  STARARGS_AFTER_KEYWORD(3, "*args after keyword argument or **kwargs.");

  public final int code;
  public final String message;

  ArgumentError(int code, String message) {
    this.code = code;
    this.message = message;
  }

  /** Returns the error with a given code. Throws if the code is not valid;
   * never returns null. */
  public static ArgumentError of(int code) {
    switch (code) {
      case 1:
        return KEYWORD_EXPRESSION;
      case 2:
        return POSITIONAL_AFTER_KEYWORD;
      case 3:
        return STARARGS_AFTER_KEYWORD;
      default:
        throw new AssertionError("invalid error code " + code);
    }
  }
}

// End ArgumentError.java
