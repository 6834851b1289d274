package org.gqlcg.graphqlCompiler.ir;

import graphql.schema.GraphQLCompositeType;
import org.gqlcg.graphqlCompiler.compiler.errors.SourcePosition;

public final class IRFragment extends IRNode {
    public final String fragmentName;
    /** Printed source of the fragment definition. */
    public final String source;
    public final GraphQLCompositeType typeCondition;
    public final IRSelectionSet selectionSet;

    public IRFragment(SourcePosition position, String fragmentName, String source,
                      GraphQLCompositeType typeCondition, IRSelectionSet selectionSet) {
        super(position);
        this.fragmentName = fragmentName;
        this.source = source;
        this.typeCondition = typeCondition;
        this.selectionSet = selectionSet;
    }

    @Override
    public String toString() {
        return "fragment " + this.fragmentName;
    }
}
