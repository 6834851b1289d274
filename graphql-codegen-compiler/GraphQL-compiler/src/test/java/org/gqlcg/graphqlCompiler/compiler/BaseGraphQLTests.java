package org.gqlcg.graphqlCompiler.compiler;

import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLSchema;
import org.gqlcg.graphqlCompiler.compiler.legacy.LegacyCompilationContext;
import org.gqlcg.graphqlCompiler.ir.IRCompilationContext;
import org.gqlcg.graphqlCompiler.ir.IRField;
import org.gqlcg.graphqlCompiler.ir.IRSelection;
import org.gqlcg.graphqlCompiler.ir.IRSelectionSet;
import org.gqlcg.util.Linq;
import org.gqlcg.util.Logger;
import org.junit.After;
import org.junit.Assert;

import java.util.List;

/** Shared schema and helpers for compiler tests. */
public abstract class BaseGraphQLTests {
    public static final String SCHEMA = """
            type Query {
              pet(id: ID!): Pet
              pets(filter: PetFilter, first: Int): [Pet!]!
              search(text: String!): [SearchResult!]!
              owner(id: ID!): Owner
            }

            type Mutation {
              adopt(petId: ID!, when: DateTime): Pet
            }

            interface Pet {
              name: String!
              owner: Owner
            }

            type Dog implements Pet {
              name: String!
              owner: Owner
              barkVolume: Int
              breed: Breed
            }

            type Cat implements Pet {
              name: String!
              owner: Owner
              lives: Int
              meowVolume: Int @deprecated(reason: "Cats prefer silence")
            }

            type Owner {
              "Full name of the owner"
              name: String!
              pets: [Pet!]!
            }

            union SearchResult = Dog | Cat | Owner

            enum Breed { HUSKY POODLE }

            enum Species { DOG CAT }

            input PetFilter {
              bornAfter: DateTime
              owner: OwnerFilter
              species: Species
            }

            input OwnerFilter {
              name: String
            }

            scalar DateTime
            """;

    static GraphQLSchema schema;

    public static GraphQLSchema getSchema() {
        if (schema == null)
            schema = GraphQLCompiler.parseSchema(SCHEMA);
        return schema;
    }

    public GraphQLObjectType objectType(String name) {
        return getSchema().getObjectType(name);
    }

    public CompilerOptions testOptions() {
        return new CompilerOptions();
    }

    public GraphQLCompiler testCompiler(CompilerOptions options) {
        return new GraphQLCompiler(getSchema(), options);
    }

    public GraphQLCompiler testCompiler() {
        return this.testCompiler(this.testOptions());
    }

    public IRCompilationContext compileToIR(String document) {
        return this.testCompiler().compileToIR(document);
    }

    public LegacyCompilationContext compile(String document) {
        return this.testCompiler().compileToLegacyIR(document);
    }

    /** The selection set of the only field at the root of operation {@code operation}. */
    public static IRSelectionSet rootFieldSelectionSet(IRCompilationContext context, String operation) {
        IRSelectionSet root = context.operations.get(operation).selectionSet;
        Assert.assertEquals(1, root.selections.size());
        IRField field = selection(root, 0, IRField.class);
        Assert.assertNotNull(field.selectionSet);
        return field.selectionSet;
    }

    public static List<String> typeNames(List<GraphQLObjectType> types) {
        return Linq.map(types, GraphQLObjectType::getName);
    }

    public static <T extends IRSelection> T selection(IRSelectionSet set, int index, Class<T> clazz) {
        IRSelection selection = set.selections.get(index);
        Assert.assertTrue(selection + " is not an instance of " + clazz.getSimpleName(), clazz.isInstance(selection));
        return clazz.cast(selection);
    }

    @After
    public void resetLogging() {
        Logger.INSTANCE.reset();
    }
}
