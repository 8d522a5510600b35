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

import java.io.PrintStream;
import java.util.function.Consumer;
import net.hydromatic.variform.ast.Expr;
import net.hydromatic.variform.rewrite.RewriteException;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that prints each warning to a stream. */
  public static Tracer printWarnings(PrintStream out) {
    return withOnWarning(empty(),
        w -> out.println("Warning: " + w.getMessage()));
  }

  /** Returns a tracer that performs the given action on a warning,
   * then calls the underlying tracer. */
  public static Tracer withOnWarning(Tracer tracer,
      Consumer<RewriteException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onWarning(RewriteException warning) {
        consumer.accept(warning);
        super.onWarning(warning);
      }
    };
  }

  /** Returns a tracer that performs the given action on the result of a
   * given pass, then calls the underlying tracer. */
  public static Tracer withOnRewrite(Tracer tracer, String pass,
      Consumer<Expr> consumer) {
    final String expectedPass = pass;
    return new DelegatingTracer(tracer) {
      @Override public void onRewrite(String pass, Expr before, Expr after) {
        if (pass.equals(expectedPass)) {
          consumer.accept(after);
        }
        super.onRewrite(pass, before, after);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onWarning(RewriteException warning) {
    }

    @Override public void onRewrite(String pass, Expr before, Expr after) {
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onWarning(RewriteException warning) {
      tracer.onWarning(warning);
    }

    @Override public void onRewrite(String pass, Expr before, Expr after) {
      tracer.onRewrite(pass, before, after);
    }
  }
}

// End Tracers.java
