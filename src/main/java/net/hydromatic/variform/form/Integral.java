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
package net.hydromatic.variform.form;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.variform.ast.Expr;
import net.hydromatic.variform.domain.Domain;

/** Integral of an expression over the entities of a given type in a
 * domain. */
public final class Integral {
  /** Subdomain id of an integral over the whole domain. */
  public static final String EVERYWHERE = "everywhere";

  public final Expr integrand;
  public final IntegralType type;
  public final Domain domain;
  public final String subdomainId;
  public final ImmutableMap<String, Object> metadata;

  private Integral(Expr integrand, IntegralType type, Domain domain,
      String subdomainId, ImmutableMap<String, Object> metadata) {
    this.integrand = requireNonNull(integrand);
    this.type = requireNonNull(type);
    this.domain = requireNonNull(domain);
    this.subdomainId = requireNonNull(subdomainId);
    this.metadata = requireNonNull(metadata);
  }

  /** Creates an integral. */
  public static Integral of(Expr integrand, IntegralType type, Domain domain,
      String subdomainId, Map<String, ?> metadata) {
    return new Integral(integrand, type, domain, subdomainId,
        ImmutableMap.copyOf(metadata));
  }

  /** Creates an integral over the whole domain, with no metadata. */
  public static Integral of(Expr integrand, IntegralType type,
      Domain domain) {
    return new Integral(integrand, type, domain, EVERYWHERE,
        ImmutableMap.of());
  }

  /** Returns an integral with a different integrand and the same type,
   * domain, subdomain and metadata; or this integral, if the integrand is the
   * same object. */
  public Integral reconstruct(Expr integrand) {
    if (integrand == this.integrand) {
      return this;
    }
    return new Integral(integrand, type, domain, subdomainId, metadata);
  }

  @Override public int hashCode() {
    return Objects.hash(integrand, type, domain, subdomainId, metadata);
  }

  @Override public boolean equals(Object o) {
    return o == this
        || o instanceof Integral
        && integrand.equals(((Integral) o).integrand)
        && type == ((Integral) o).type
        && domain.equals(((Integral) o).domain)
        && subdomainId.equals(((Integral) o).subdomainId)
        && metadata.equals(((Integral) o).metadata);
  }

  @Override public String toString() {
    return "{ integral of type " + type + " over " + domain + ", subdomain "
        + subdomainId + ": " + integrand + " }";
  }
}

// End Integral.java
