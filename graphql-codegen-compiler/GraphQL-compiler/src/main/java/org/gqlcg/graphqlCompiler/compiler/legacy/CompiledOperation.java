package org.gqlcg.graphqlCompiler.compiler.legacy;

import com.google.common.collect.ImmutableList;
import graphql.schema.GraphQLObjectType;
import org.gqlcg.graphqlCompiler.ir.IRVariable;

import javax.annotation.Nullable;

public final class CompiledOperation {
    public final String operationName;
    /** One of "query", "mutation", "subscription". */
    public final String operationType;
    public final GraphQLObjectType rootType;
    public final ImmutableList<IRVariable> variables;
    public final String source;
    /** The operation source followed by the sources of {@link #fragmentsReferenced}, one per line. */
    public final String sourceWithFragments;
    /** SHA-256 of {@link #sourceWithFragments}; null when identifiers are not generated. */
    @Nullable
    public final String operationId;
    public final ImmutableList<LegacyField> fields;
    public final ImmutableList<String> fragmentSpreads;
    public final ImmutableList<CompiledInlineFragment> inlineFragments;
    /** Every fragment reachable from the operation, in discovery order. */
    public final ImmutableList<String> fragmentsReferenced;

    public CompiledOperation(String operationName, String operationType, GraphQLObjectType rootType,
                             ImmutableList<IRVariable> variables, String source,
                             String sourceWithFragments, @Nullable String operationId,
                             LoweredSelectionSet body, ImmutableList<String> fragmentsReferenced) {
        this.operationName = operationName;
        this.operationType = operationType;
        this.rootType = rootType;
        this.variables = variables;
        this.source = source;
        this.sourceWithFragments = sourceWithFragments;
        this.operationId = operationId;
        this.fields = body.fields();
        this.fragmentSpreads = body.fragmentSpreads();
        this.inlineFragments = body.inlineFragments();
        this.fragmentsReferenced = fragmentsReferenced;
    }

    @Override
    public String toString() {
        return this.operationType + " " + this.operationName;
    }
}
