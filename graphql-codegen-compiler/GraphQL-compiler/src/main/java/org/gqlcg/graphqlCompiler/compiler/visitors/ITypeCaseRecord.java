package org.gqlcg.graphqlCompiler.compiler.visitors;

import graphql.schema.GraphQLObjectType;
import org.gqlcg.graphqlCompiler.ir.IRField;

import java.util.List;

/** One slice of a {@link ITypeCase}: fields which apply when the runtime
 * type of the object is one of the possible types of the record. */
public interface ITypeCaseRecord {
    List<GraphQLObjectType> getPossibleTypes();

    /** Fields, in the order they were first selected. */
    List<IRField> getFields();

    default int fieldCount() {
        return this.getFields().size();
    }
}
