package org.gqlcg.graphqlCompiler.compiler.legacy;

import graphql.Scalars;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLObjectType;
import org.gqlcg.graphqlCompiler.compiler.BaseGraphQLTests;
import org.gqlcg.graphqlCompiler.compiler.errors.SourcePosition;
import org.gqlcg.graphqlCompiler.compiler.visitors.ITypeCase;
import org.gqlcg.graphqlCompiler.compiler.visitors.ITypeCasePartitioner;
import org.gqlcg.graphqlCompiler.compiler.visitors.ITypeCaseRecord;
import org.gqlcg.graphqlCompiler.ir.IRCompilationContext;
import org.gqlcg.graphqlCompiler.ir.IRField;
import org.gqlcg.graphqlCompiler.ir.IRSelectionSet;
import org.junit.Assert;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

/** Lowering with hand-made partitions. */
public class SelectionSetLowererTests extends BaseGraphQLTests {
    record FixedRecord(List<GraphQLObjectType> possibleTypes, List<IRField> fields) implements ITypeCaseRecord {
        @Override
        public List<GraphQLObjectType> getPossibleTypes() {
            return this.possibleTypes;
        }

        @Override
        public List<IRField> getFields() {
            return this.fields;
        }
    }

    static class FixedTypeCase implements ITypeCase {
        final ITypeCaseRecord defaultRecord;
        final List<ITypeCaseRecord> records;

        FixedTypeCase(ITypeCaseRecord defaultRecord, ITypeCaseRecord... extra) {
            this.defaultRecord = defaultRecord;
            this.records = new ArrayList<>();
            this.records.add(defaultRecord);
            this.records.addAll(List.of(extra));
        }

        @Override
        public ITypeCaseRecord getDefault() {
            return this.defaultRecord;
        }

        @Override
        public List<ITypeCaseRecord> getRecords() {
            return this.records;
        }
    }

    static IRField scalarField(String name) {
        return new IRField(SourcePosition.INVALID, name, null, GraphQLNonNull.nonNull(Scalars.GraphQLString),
                List.of(), false, null, false, null, null);
    }

    static final String QUERY = """
            query Q {
              search(text: "rex") {
                ... on Pet { name }
                ... on Dog { ...DogOnly }
                ...Everything
              }
            }
            fragment DogOnly on Dog { barkVolume }
            fragment Everything on SearchResult { __typename }
            """;

    @Test
    public void recordCoveringEveryTypeIsDropped() {
        IRCompilationContext context = this.compileToIR(QUERY);
        IRSelectionSet set = rootFieldSelectionSet(context, "Q");
        FixedRecord defaultRecord = new FixedRecord(set.possibleTypes, List.of(scalarField("name")));
        FixedRecord full = new FixedRecord(set.possibleTypes, List.of(scalarField("name")));
        SelectionSetLowerer lowerer = new SelectionSetLowerer(context, ITypeCasePartitioner.standard());
        LoweredSelectionSet result = lowerer.lower(set, new FixedTypeCase(defaultRecord, full), "Q", 0);
        Assert.assertEquals(1, result.fields().size());
        Assert.assertTrue(result.inlineFragments().isEmpty());
    }

    @Test
    public void recordWithoutFieldsIsDropped() {
        IRCompilationContext context = this.compileToIR(QUERY);
        IRSelectionSet set = rootFieldSelectionSet(context, "Q");
        FixedRecord defaultRecord = new FixedRecord(set.possibleTypes, List.of());
        FixedRecord empty = new FixedRecord(List.of(this.objectType("Dog")), List.of());
        SelectionSetLowerer lowerer = new SelectionSetLowerer(context, ITypeCasePartitioner.standard());
        LoweredSelectionSet result = lowerer.lower(set, new FixedTypeCase(defaultRecord, empty), "Q", 0);
        Assert.assertTrue(result.fields().isEmpty());
        Assert.assertTrue(result.inlineFragments().isEmpty());
    }

    @Test
    public void recordFansOutToOneInlineFragmentPerType() {
        IRCompilationContext context = this.compileToIR(QUERY);
        IRSelectionSet set = rootFieldSelectionSet(context, "Q");
        GraphQLObjectType dog = this.objectType("Dog");
        GraphQLObjectType cat = this.objectType("Cat");
        FixedRecord defaultRecord = new FixedRecord(set.possibleTypes, List.of());
        FixedRecord pets = new FixedRecord(List.of(dog, cat), List.of(scalarField("name")));
        SelectionSetLowerer lowerer = new SelectionSetLowerer(context, ITypeCasePartitioner.standard());
        LoweredSelectionSet result = lowerer.lower(set, new FixedTypeCase(defaultRecord, pets), "Q", 0);

        Assert.assertEquals(2, result.inlineFragments().size());
        CompiledInlineFragment onDog = result.inlineFragments().get(0);
        CompiledInlineFragment onCat = result.inlineFragments().get(1);
        Assert.assertSame(dog, onDog.typeCondition());
        Assert.assertEquals(List.of(dog), onDog.possibleTypes());
        Assert.assertSame(cat, onCat.typeCondition());
        Assert.assertEquals(List.of(cat), onCat.possibleTypes());
        Assert.assertEquals("[name]", onDog.fields().toString());
        Assert.assertSame(onDog.fields(), onCat.fields());
        // Spreads are classified against the record's types, not per inline fragment
        Assert.assertEquals(List.of("Everything"), onDog.fragmentSpreads());
        Assert.assertEquals(List.of("Everything"), onCat.fragmentSpreads());
        Assert.assertEquals(List.of("Everything"), result.fragmentSpreads());
    }

    @Test
    public void narrowedSpreadOnlyAppearsInItsInlineFragment() {
        IRCompilationContext context = this.compileToIR(QUERY);
        IRSelectionSet set = rootFieldSelectionSet(context, "Q");
        GraphQLObjectType dog = this.objectType("Dog");
        GraphQLObjectType cat = this.objectType("Cat");
        FixedRecord defaultRecord = new FixedRecord(set.possibleTypes, List.of());
        FixedRecord onDogRecord = new FixedRecord(List.of(dog), List.of(scalarField("name")));
        FixedRecord onCatRecord = new FixedRecord(List.of(cat), List.of(scalarField("name")));
        SelectionSetLowerer lowerer = new SelectionSetLowerer(context, ITypeCasePartitioner.standard());
        LoweredSelectionSet result = lowerer.lower(
                set, new FixedTypeCase(defaultRecord, onDogRecord, onCatRecord), "Q", 0);

        Assert.assertEquals(List.of("Everything"), result.fragmentSpreads());
        Assert.assertEquals(2, result.inlineFragments().size());
        Assert.assertEquals(List.of("DogOnly", "Everything"), result.inlineFragments().get(0).fragmentSpreads());
        Assert.assertEquals(List.of("Everything"), result.inlineFragments().get(1).fragmentSpreads());
    }

    @Test
    public void defaultPartitionerSkipsTypeConditionOnTheParentType() {
        LegacyCompilationContext context = this.compile("""
                query Q { pet(id: "1") { name ... on Pet { owner { name } } } }
                """);
        LegacyField pet = context.operations.get("Q").fields.get(0);
        Assert.assertNotNull(pet.fields);
        Assert.assertEquals("[name, owner [name]]", pet.fields.toString());
        Assert.assertNotNull(pet.inlineFragments);
        Assert.assertTrue(pet.inlineFragments.isEmpty());
    }
}
