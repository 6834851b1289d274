package org.gqlcg.graphqlCompiler.compiler.legacy;

import com.google.common.collect.ImmutableList;
import graphql.schema.GraphQLObjectType;

/** Fields which apply only when the runtime type is {@code typeCondition}.
 * {@code possibleTypes} always holds exactly that one type. */
public record CompiledInlineFragment(
        GraphQLObjectType typeCondition,
        ImmutableList<GraphQLObjectType> possibleTypes,
        ImmutableList<LegacyField> fields,
        ImmutableList<String> fragmentSpreads) {
    public CompiledInlineFragment(GraphQLObjectType typeCondition,
                                  ImmutableList<LegacyField> fields,
                                  ImmutableList<String> fragmentSpreads) {
        this(typeCondition, ImmutableList.of(typeCondition), fields, fragmentSpreads);
    }

    @Override
    public String toString() {
        return "... on " + this.typeCondition.getName() + " " + this.fields + " " + this.fragmentSpreads;
    }
}
