package org.gqlcg.graphqlCompiler.ir;

import com.google.common.collect.ImmutableList;
import graphql.schema.GraphQLObjectType;
import org.gqlcg.graphqlCompiler.compiler.errors.SourcePosition;

import java.util.List;

public final class IROperation extends IRNode {
    public final String operationName;
    /** One of "query", "mutation", "subscription". */
    public final String operationType;
    public final GraphQLObjectType rootType;
    public final ImmutableList<IRVariable> variables;
    /** Printed source of the operation definition. */
    public final String source;
    public final IRSelectionSet selectionSet;

    public IROperation(SourcePosition position, String operationName, String operationType,
                       GraphQLObjectType rootType, List<IRVariable> variables,
                       String source, IRSelectionSet selectionSet) {
        super(position);
        this.operationName = operationName;
        this.operationType = operationType;
        this.rootType = rootType;
        this.variables = ImmutableList.copyOf(variables);
        this.source = source;
        this.selectionSet = selectionSet;
    }

    @Override
    public String toString() {
        return this.operationType + " " + this.operationName;
    }
}
