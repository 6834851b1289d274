package org.gqlcg.graphqlCompiler.compiler.visitors;

import org.gqlcg.graphqlCompiler.compiler.BaseGraphQLTests;
import org.gqlcg.graphqlCompiler.ir.IRCompilationContext;
import org.gqlcg.graphqlCompiler.ir.IRField;
import org.gqlcg.graphqlCompiler.ir.IRSelectionSet;
import org.gqlcg.util.Linq;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class TypeCaseTests extends BaseGraphQLTests {
    ITypeCase partition(String body, String fragments) {
        IRCompilationContext context = this.compileToIR(
                "query Q($a: Boolean!, $b: Boolean!) { search(text: \"x\") " + body + " }\n" + fragments);
        return new TypeCase(context, rootFieldSelectionSet(context, "Q"));
    }

    ITypeCase partition(String body) {
        return this.partition(body, "");
    }

    static List<String> fieldNames(ITypeCaseRecord record) {
        return Linq.map(record.getFields(), IRField::getResponseKey);
    }

    @Test
    public void fieldsForEveryTypeGoToTheDefault() {
        ITypeCase typeCase = this.partition("{ __typename ... on SearchResult { kind: __typename } }");
        Assert.assertEquals(List.of("__typename", "kind"), fieldNames(typeCase.getDefault()));
        Assert.assertEquals(1, typeCase.getRecords().size());
        Assert.assertSame(typeCase.getDefault(), typeCase.getRecords().get(0));
    }

    @Test
    public void recordsAreSplit() {
        ITypeCase typeCase = this.partition("{ ... on Pet { name } ... on Dog { barkVolume } }");
        Assert.assertTrue(typeCase.getDefault().getFields().isEmpty());
        List<ITypeCaseRecord> records = typeCase.getRecords();
        Assert.assertEquals(3, records.size());
        Assert.assertEquals(List.of("Cat"), typeNames(records.get(1).getPossibleTypes()));
        Assert.assertEquals(List.of("name"), fieldNames(records.get(1)));
        Assert.assertEquals(List.of("Dog"), typeNames(records.get(2).getPossibleTypes()));
        Assert.assertEquals(List.of("name", "barkVolume"), fieldNames(records.get(2)));
    }

    @Test
    public void nestedTypeConditionsNarrowFurther() {
        ITypeCase typeCase = this.partition("{ ... on Pet { ... on Cat { lives } ... on Owner { name } } }");
        List<ITypeCaseRecord> records = typeCase.getRecords();
        Assert.assertEquals(2, records.size());
        Assert.assertEquals(List.of("Cat"), typeNames(records.get(1).getPossibleTypes()));
        Assert.assertEquals(List.of("lives"), fieldNames(records.get(1)));
    }

    @Test
    public void spreadsContributeTheFieldsOfTheirFragment() {
        ITypeCase typeCase = this.partition("{ ...PetFields ... on Dog { ...DogFields } }", """
                fragment PetFields on Pet { name }
                fragment DogFields on Dog { breed }
                """);
        Assert.assertEquals(0, typeCase.getDefault().fieldCount());
        List<ITypeCaseRecord> records = typeCase.getRecords();
        Assert.assertEquals(3, records.size());
        Assert.assertEquals(List.of("Cat"), typeNames(records.get(1).getPossibleTypes()));
        Assert.assertEquals(List.of("name"), fieldNames(records.get(1)));
        Assert.assertEquals(List.of("Dog"), typeNames(records.get(2).getPossibleTypes()));
        Assert.assertEquals(List.of("name", "breed"), fieldNames(records.get(2)));
    }

    @Test
    public void spreadUnderBooleanConditionIsConditional() {
        ITypeCase typeCase = this.partition("{ ...Everything @include(if: $a) }",
                "fragment Everything on SearchResult { __typename }");
        Assert.assertEquals(1, typeCase.getDefault().fieldCount());
        Assert.assertTrue(typeCase.getDefault().getFields().get(0).isConditional);
    }

    @Test
    public void fieldsUnderConditionsAreConditional() {
        ITypeCase typeCase = this.partition("{ ... @include(if: $a) { __typename } }");
        IRField field = typeCase.getDefault().getFields().get(0);
        Assert.assertTrue(field.isConditional);
    }

    @Test
    public void repeatedFieldIsConditionalOnlyIfEveryOccurrenceIs() {
        ITypeCase typeCase = this.partition("{ __typename @include(if: $a) __typename }");
        Assert.assertEquals(1, typeCase.getDefault().fieldCount());
        Assert.assertFalse(typeCase.getDefault().getFields().get(0).isConditional);

        typeCase = this.partition("{ __typename @include(if: $a) __typename @skip(if: $b) }");
        Assert.assertEquals(1, typeCase.getDefault().fieldCount());
        Assert.assertTrue(typeCase.getDefault().getFields().get(0).isConditional);
    }

    @Test
    public void repeatedFieldSelectionsAreConcatenated() {
        IRCompilationContext context = this.compileToIR(
                "query Q { pet(id: \"1\") { owner { name } owner { pets { name } } } }");
        ITypeCase typeCase = new TypeCase(context, rootFieldSelectionSet(context, "Q"));
        Assert.assertEquals(1, typeCase.getDefault().fieldCount());
        IRSelectionSet owner = typeCase.getDefault().getFields().get(0).selectionSet;
        Assert.assertNotNull(owner);
        Assert.assertEquals(2, owner.selections.size());
    }

    @Test
    public void recordsIncludeDefaultSelectionsOfSharedFields() {
        IRCompilationContext context = this.compileToIR(
                "query Q { pet(id: \"1\") { ... on Dog { owner { pets { name } } } owner { name } } }");
        ITypeCase typeCase = new TypeCase(context, rootFieldSelectionSet(context, "Q"));
        List<ITypeCaseRecord> records = typeCase.getRecords();
        Assert.assertEquals(2, records.size());
        IRSelectionSet ownerOfDog = records.get(1).getFields().get(0).selectionSet;
        Assert.assertNotNull(ownerOfDog);
        // Default selections come first, whatever the source order
        Assert.assertEquals("name", selection(ownerOfDog, 0, IRField.class).name);
        Assert.assertEquals("pets", selection(ownerOfDog, 1, IRField.class).name);
    }
}
