package org.gqlcg.graphqlCompiler.compiler.legacy;

import org.apache.commons.codec.digest.DigestUtils;
import org.gqlcg.graphqlCompiler.compiler.BaseGraphQLTests;
import org.gqlcg.graphqlCompiler.compiler.CompilerOptions;
import org.gqlcg.graphqlCompiler.compiler.errors.CompilationError;
import org.gqlcg.graphqlCompiler.compiler.errors.UnknownFragmentException;
import org.junit.Assert;
import org.junit.Test;

import java.util.List;

public class LegacyIRCompilerTests extends BaseGraphQLTests {
    static final String PETS = """
            query Q {
              pet(id: "1") {
                name
                ... on Dog { barkVolume }
                ... on Cat { ...CatFields }
              }
            }

            fragment CatFields on Cat { lives }
            """;

    CompilerOptions options(boolean merge) {
        CompilerOptions options = this.testOptions();
        options.languageOptions.mergeInFieldsFromFragmentSpreads = merge;
        return options;
    }

    @Test
    public void typeConditionsWithMergedFragments() {
        LegacyCompilationContext context = this.testCompiler(this.options(true)).compileToLegacyIR(PETS);
        CompiledOperation operation = context.operations.get("Q");
        Assert.assertEquals("query", operation.operationType);
        Assert.assertEquals("Query", operation.rootType.getName());
        Assert.assertEquals(List.of("CatFields"), operation.fragmentsReferenced);
        Assert.assertEquals(1, operation.fields.size());

        LegacyField pet = operation.fields.get(0);
        Assert.assertEquals("pet", pet.responseName);
        Assert.assertEquals("[name]", String.valueOf(pet.fields));
        Assert.assertEquals(List.of(), pet.fragmentSpreads);
        Assert.assertNotNull(pet.inlineFragments);
        Assert.assertEquals(2, pet.inlineFragments.size());

        CompiledInlineFragment onDog = pet.inlineFragments.get(0);
        Assert.assertEquals("Dog", onDog.typeCondition().getName());
        Assert.assertEquals("[barkVolume]", onDog.fields().toString());
        Assert.assertTrue(onDog.fragmentSpreads().isEmpty());

        CompiledInlineFragment onCat = pet.inlineFragments.get(1);
        Assert.assertEquals("Cat", onCat.typeCondition().getName());
        Assert.assertEquals("[lives]", onCat.fields().toString());
        Assert.assertEquals(List.of("CatFields"), onCat.fragmentSpreads());
    }

    @Test
    public void typeConditionsWithReferencedFragments() {
        LegacyCompilationContext context = this.testCompiler(this.options(false)).compileToLegacyIR(PETS);
        LegacyField pet = context.operations.get("Q").fields.get(0);
        Assert.assertEquals("[name]", String.valueOf(pet.fields));
        Assert.assertEquals(List.of(), pet.fragmentSpreads);
        Assert.assertNotNull(pet.inlineFragments);
        Assert.assertEquals(2, pet.inlineFragments.size());

        CompiledInlineFragment onDog = pet.inlineFragments.get(0);
        Assert.assertEquals("Dog", onDog.typeCondition().getName());
        Assert.assertEquals("[barkVolume]", onDog.fields().toString());
        Assert.assertEquals(List.of(), onDog.fragmentSpreads());

        CompiledInlineFragment onCat = pet.inlineFragments.get(1);
        Assert.assertEquals("Cat", onCat.typeCondition().getName());
        Assert.assertEquals(List.of("Cat"), typeNames(onCat.possibleTypes()));
        Assert.assertEquals("[lives]", onCat.fields().toString());
        Assert.assertEquals(List.of("CatFields"), onCat.fragmentSpreads());
    }

    @Test
    public void mergingDoesNotChangeTypeConditions() {
        LegacyField merged = this.testCompiler(this.options(true))
                .compileToLegacyIR(PETS).operations.get("Q").fields.get(0);
        LegacyField referenced = this.testCompiler(this.options(false))
                .compileToLegacyIR(PETS).operations.get("Q").fields.get(0);
        Assert.assertEquals(String.valueOf(merged.inlineFragments), String.valueOf(referenced.inlineFragments));
    }

    @Test
    public void inlineFragmentKeepsDefaultSelectionsOfSharedField() {
        for (boolean merge: new boolean[] { true, false }) {
            LegacyCompilationContext context = this.testCompiler(this.options(merge)).compileToLegacyIR(
                    "query Q { pet(id: \"1\") { owner { name } ... on Dog { owner { pets { name } } } } }");
            LegacyField pet = context.operations.get("Q").fields.get(0);
            Assert.assertEquals("[owner [name]]", String.valueOf(pet.fields));
            Assert.assertNotNull(pet.inlineFragments);
            Assert.assertEquals(1, pet.inlineFragments.size());
            CompiledInlineFragment onDog = pet.inlineFragments.get(0);
            Assert.assertEquals("Dog", onDog.typeCondition().getName());
            Assert.assertEquals("[owner [name, pets [name]]]", onDog.fields().toString());
        }
    }

    @Test
    public void fragmentsAreCompiled() {
        LegacyCompilationContext context = this.compile(PETS);
        CompiledFragment fragment = context.fragments.get("CatFields");
        Assert.assertEquals("Cat", fragment.typeCondition.getName());
        Assert.assertEquals(List.of("Cat"), typeNames(fragment.possibleTypes));
        Assert.assertEquals("[lives]", fragment.fields.toString());
        Assert.assertTrue(fragment.fragmentSpreads.isEmpty());
        Assert.assertTrue(fragment.inlineFragments.isEmpty());
        Assert.assertTrue(fragment.source.startsWith("fragment CatFields on Cat"));
    }

    @Test
    public void spreadAtTheDefaultLevel() {
        LegacyCompilationContext context = this.compile("""
                query Q { pet(id: "1") { ...PetFields ... on Dog { ...DogFields } } }
                fragment PetFields on Pet { name owner { name } }
                fragment DogFields on Dog { breed }
                """);
        LegacyField pet = context.operations.get("Q").fields.get(0);
        Assert.assertEquals(List.of("PetFields"), pet.fragmentSpreads);
        Assert.assertEquals("[name, owner [name]]", String.valueOf(pet.fields));
        Assert.assertNotNull(pet.inlineFragments);
        Assert.assertEquals(1, pet.inlineFragments.size());
        CompiledInlineFragment onDog = pet.inlineFragments.get(0);
        Assert.assertEquals(List.of("PetFields", "DogFields"), onDog.fragmentSpreads());
        // Inline fragments only hold what the type condition adds
        Assert.assertEquals("[breed]", onDog.fields().toString());
    }

    @Test
    public void conditionalFields() {
        LegacyCompilationContext context = this.compile("""
                query Q($withOwner: Boolean!) {
                  pet(id: "1") { name owner @include(if: $withOwner) { name } }
                }
                """);
        LegacyField pet = context.operations.get("Q").fields.get(0);
        Assert.assertNotNull(pet.fields);
        Assert.assertFalse(pet.fields.get(0).isConditional);
        Assert.assertTrue(pet.fields.get(1).isConditional);
        Assert.assertTrue(pet.fields.get(1).hasSelectionSet());
    }

    @Test
    public void deprecationIsCarried() {
        LegacyCompilationContext context = this.compile("""
                query Q { pet(id: "1") { ... on Cat { meowVolume } } }
                """);
        LegacyField pet = context.operations.get("Q").fields.get(0);
        Assert.assertNotNull(pet.inlineFragments);
        LegacyField meow = pet.inlineFragments.get(0).fields().get(0);
        Assert.assertTrue(meow.isDeprecated);
        Assert.assertEquals("Cats prefer silence", meow.deprecationReason);
        Assert.assertFalse(meow.hasSelectionSet());
        Assert.assertNull(meow.inlineFragments);
    }

    @Test
    public void operationIdHashesSourceWithFragments() {
        CompiledOperation operation = this.compile(PETS).operations.get("Q");
        CompiledFragment fragment = this.compile(PETS).fragments.get("CatFields");
        Assert.assertEquals(operation.source + "\n" + fragment.source, operation.sourceWithFragments);
        Assert.assertEquals(DigestUtils.sha256Hex(operation.sourceWithFragments), operation.operationId);
        Assert.assertNotNull(operation.operationId);
        Assert.assertEquals(64, operation.operationId.length());
    }

    @Test
    public void operationIdIsDeterministic() {
        String first = this.compile(PETS).operations.get("Q").operationId;
        String second = this.compile(PETS).operations.get("Q").operationId;
        Assert.assertEquals(first, second);
    }

    @Test
    public void operationIdIgnoresFormatting() {
        String reformatted = """
                query Q { pet(id: "1") { name, ... on Dog { barkVolume } ... on Cat { ...CatFields } } }
                fragment CatFields on Cat {
                    lives
                }
                """;
        Assert.assertEquals(this.compile(PETS).operations.get("Q").operationId,
                this.compile(reformatted).operations.get("Q").operationId);
    }

    @Test
    public void operationIdDependsOnFragments() {
        String changed = PETS.replace("{ lives }", "{ lives name }");
        Assert.assertNotEquals(this.compile(PETS).operations.get("Q").operationId,
                this.compile(changed).operations.get("Q").operationId);
    }

    @Test
    public void operationIdsCanBeDisabled() {
        CompilerOptions options = this.testOptions();
        options.languageOptions.generateOperationIds = false;
        CompiledOperation operation = this.testCompiler(options).compileToLegacyIR(PETS).operations.get("Q");
        Assert.assertNull(operation.operationId);
        Assert.assertTrue(operation.sourceWithFragments.contains("fragment CatFields"));
    }

    @Test
    public void fragmentClosureIsOrdered() {
        CompiledOperation operation = this.compile("""
                query Q { pet(id: "1") { ...A owner { ...B } ...A } }
                fragment A on Pet { ...C }
                fragment B on Owner { name }
                fragment C on Pet { name }
                """).operations.get("Q");
        Assert.assertEquals(List.of("A", "C", "B"), operation.fragmentsReferenced);
        String source = operation.sourceWithFragments;
        Assert.assertTrue(source.indexOf("fragment A ") < source.indexOf("fragment C "));
        Assert.assertTrue(source.indexOf("fragment C ") < source.indexOf("fragment B "));
    }

    @Test
    public void missingFragmentInOperation() {
        try {
            this.compile("query Q { pet(id: \"1\") { ...Missing } }");
            Assert.fail("Expected an exception");
        } catch (UnknownFragmentException ex) {
            Assert.assertEquals("Missing", ex.fragmentName);
            Assert.assertEquals("Q", ex.referencedFrom);
            Assert.assertEquals("Cannot find fragment Missing referenced from Q", ex.getMessage());
        }
    }

    @Test
    public void missingFragmentInFragment() {
        try {
            this.compile("""
                    query Q { pet(id: "1") { name } }
                    fragment F on Pet { ...Missing }
                    """);
            Assert.fail("Expected an exception");
        } catch (UnknownFragmentException ex) {
            Assert.assertEquals("Missing", ex.fragmentName);
            Assert.assertEquals("F", ex.referencedFrom);
        }
    }

    @Test
    public void missingFragmentWithoutMerging() {
        try {
            this.testCompiler(this.options(false)).compileToLegacyIR("query Q { pet(id: \"1\") { ...Missing } }");
            Assert.fail("Expected an exception");
        } catch (UnknownFragmentException ex) {
            Assert.assertEquals("Missing", ex.fragmentName);
        }
    }

    @Test
    public void fragmentCycle() {
        try {
            this.compile("""
                    query Q { pet(id: "1") { ...A } }
                    fragment A on Pet { ...B }
                    fragment B on Pet { ...A }
                    """);
            Assert.fail("Expected an exception");
        } catch (CompilationError ex) {
            Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("A -> B -> A"));
        }
    }

    @Test
    public void nestingDepthIsLimited() {
        CompilerOptions options = this.testOptions();
        options.languageOptions.maxSelectionDepth = 2;
        LegacyCompilationContext shallow = this.testCompiler(options).compileToLegacyIR(
                "query Q { owner(id: \"1\") { pets { name } } }");
        Assert.assertEquals(1, shallow.operations.size());
        try {
            this.testCompiler(options).compileToLegacyIR(
                    "query Q { owner(id: \"1\") { pets { owner { name } } } }");
            Assert.fail("Expected an exception");
        } catch (CompilationError ex) {
            Assert.assertTrue(ex.getMessage(), ex.getMessage().contains("nested more than 2 levels"));
            Assert.assertTrue(ex.position.isValid());
        }
    }

    @Test
    public void compilationIsDeterministic() {
        String first = this.compile(PETS).operations.get("Q").inlineFragments.toString() +
                this.compile(PETS).operations.get("Q").fields;
        String second = this.compile(PETS).operations.get("Q").inlineFragments.toString() +
                this.compile(PETS).operations.get("Q").fields;
        Assert.assertEquals(first, second);
    }
}
