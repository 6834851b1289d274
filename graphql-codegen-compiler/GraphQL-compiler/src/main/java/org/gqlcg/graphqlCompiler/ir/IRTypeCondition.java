package org.gqlcg.graphqlCompiler.ir;

import graphql.schema.GraphQLCompositeType;
import graphql.schema.GraphQLNamedType;
import org.gqlcg.graphqlCompiler.compiler.errors.SourcePosition;

/** An inline fragment with a type condition, {@code ... on T { ... }}.
 * The possible types of the nested set are already narrowed to the
 * types matching both the condition and the enclosing selection set. */
public final class IRTypeCondition extends IRSelection {
    public final GraphQLCompositeType type;
    public final IRSelectionSet selectionSet;

    public IRTypeCondition(SourcePosition position, GraphQLCompositeType type, IRSelectionSet selectionSet) {
        super(position);
        this.type = type;
        this.selectionSet = selectionSet;
    }

    @Override
    public <T> T accept(IRSelectionVisitor<T> visitor) {
        return visitor.visitTypeCondition(this);
    }

    @Override
    public String toString() {
        return "... on " + ((GraphQLNamedType) this.type).getName() + " " + this.selectionSet;
    }
}
