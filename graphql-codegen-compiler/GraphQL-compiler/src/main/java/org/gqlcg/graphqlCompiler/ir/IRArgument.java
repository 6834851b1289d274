package org.gqlcg.graphqlCompiler.ir;

import javax.annotation.Nullable;

/** A field argument.  The value is a plain Java value: String, BigInteger,
 * BigDecimal, Boolean, null, List, Map, or {@link IRVariableReference}. */
public record IRArgument(String name, @Nullable Object value) {}
