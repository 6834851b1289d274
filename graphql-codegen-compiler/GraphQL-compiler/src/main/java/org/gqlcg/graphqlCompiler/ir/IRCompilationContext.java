package org.gqlcg.graphqlCompiler.ir;

import com.google.common.collect.ImmutableList;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLSchema;
import org.gqlcg.graphqlCompiler.compiler.CompilerOptions;

import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The typed IR of a whole document: every operation and fragment, in
 * document order, together with the schema they were resolved against. */
public final class IRCompilationContext {
    public final GraphQLSchema schema;
    public final Map<String, IROperation> operations;
    public final Map<String, IRFragment> fragments;
    /** Enums, input objects and custom scalars the document needs, in discovery order. */
    public final ImmutableList<GraphQLNamedType> typesUsed;
    public final CompilerOptions options;

    public IRCompilationContext(GraphQLSchema schema, Map<String, IROperation> operations,
                                Map<String, IRFragment> fragments, List<GraphQLNamedType> typesUsed,
                                CompilerOptions options) {
        this.schema = schema;
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
        this.fragments = Collections.unmodifiableMap(new LinkedHashMap<>(fragments));
        this.typesUsed = ImmutableList.copyOf(typesUsed);
        this.options = options;
    }

    @Nullable
    public IRFragment fragmentNamed(String name) {
        return this.fragments.get(name);
    }
}
