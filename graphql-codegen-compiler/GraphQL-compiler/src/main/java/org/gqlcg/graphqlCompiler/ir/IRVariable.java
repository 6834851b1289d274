package org.gqlcg.graphqlCompiler.ir;

import graphql.schema.GraphQLInputType;

/** A variable declared by an operation. */
public record IRVariable(String name, GraphQLInputType type) {}
