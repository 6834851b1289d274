package org.gqlcg.graphqlCompiler.compiler.legacy;

import com.google.common.collect.ImmutableList;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLSchema;
import org.gqlcg.graphqlCompiler.compiler.CompilerOptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Result of lowering a document: what the code generators consume. */
public final class LegacyCompilationContext {
    public final GraphQLSchema schema;
    /** Keyed by operation name, in document order. */
    public final Map<String, CompiledOperation> operations;
    /** Keyed by fragment name, in document order. */
    public final Map<String, CompiledFragment> fragments;
    public final ImmutableList<GraphQLNamedType> typesUsed;
    public final CompilerOptions options;

    public LegacyCompilationContext(GraphQLSchema schema, Map<String, CompiledOperation> operations,
                                    Map<String, CompiledFragment> fragments,
                                    ImmutableList<GraphQLNamedType> typesUsed, CompilerOptions options) {
        this.schema = schema;
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
        this.fragments = Collections.unmodifiableMap(new LinkedHashMap<>(fragments));
        this.typesUsed = typesUsed;
        this.options = options;
    }
}
