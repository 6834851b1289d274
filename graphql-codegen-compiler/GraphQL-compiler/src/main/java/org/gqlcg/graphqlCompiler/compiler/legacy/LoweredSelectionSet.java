package org.gqlcg.graphqlCompiler.compiler.legacy;

import com.google.common.collect.ImmutableList;

/** The flattened form of a selection set. */
public record LoweredSelectionSet(
        ImmutableList<LegacyField> fields,
        ImmutableList<String> fragmentSpreads,
        ImmutableList<CompiledInlineFragment> inlineFragments) {}
