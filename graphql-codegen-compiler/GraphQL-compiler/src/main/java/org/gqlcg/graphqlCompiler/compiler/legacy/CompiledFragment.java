package org.gqlcg.graphqlCompiler.compiler.legacy;

import com.google.common.collect.ImmutableList;
import graphql.schema.GraphQLCompositeType;
import graphql.schema.GraphQLObjectType;

public final class CompiledFragment {
    public final String fragmentName;
    public final String source;
    public final GraphQLCompositeType typeCondition;
    /** Concrete types the type condition can resolve to. */
    public final ImmutableList<GraphQLObjectType> possibleTypes;
    public final ImmutableList<LegacyField> fields;
    public final ImmutableList<String> fragmentSpreads;
    public final ImmutableList<CompiledInlineFragment> inlineFragments;

    public CompiledFragment(String fragmentName, String source, GraphQLCompositeType typeCondition,
                            ImmutableList<GraphQLObjectType> possibleTypes, LoweredSelectionSet body) {
        this.fragmentName = fragmentName;
        this.source = source;
        this.typeCondition = typeCondition;
        this.possibleTypes = possibleTypes;
        this.fields = body.fields();
        this.fragmentSpreads = body.fragmentSpreads();
        this.inlineFragments = body.inlineFragments();
    }

    @Override
    public String toString() {
        return "fragment " + this.fragmentName;
    }
}
