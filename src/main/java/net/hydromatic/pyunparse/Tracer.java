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

import net.hydromatic.pyunparse.ast.Ast;
import net.hydromatic.pyunparse.ast.UnparseException;

/** Called on various events while writing source text. */
public interface Tracer {
  /** Called when a top-level statement has been written. */
  void onStatement(Ast.Stmt stmt, String text);

  /** Called with the complete text, after all statements have been
   * written. */
  void onResult(String text);

  /** Called with the exception thrown while writing. The exception is
   * rethrown after this method returns. */
  void onException(UnparseException e);
}

// End Tracer.java
