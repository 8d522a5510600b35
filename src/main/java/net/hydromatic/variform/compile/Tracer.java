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
package net.hydromatic.variform.compile;

import net.hydromatic.variform.ast.Expr;
import net.hydromatic.variform.rewrite.RewriteException;

/** Called on various events during a rewrite. */
public interface Tracer {
  /** Called with a non-fatal warning, such as a quantity that could not be
   * lowered on a non-affine domain. */
  void onWarning(RewriteException warning);

  /** Called when a pass has rewritten an expression (the integrand of an
   * integral, or a bare expression). {@code after} is the same object as
   * {@code before} if the pass made no change. */
  void onRewrite(String pass, Expr before, Expr after);
}

// End Tracer.java
