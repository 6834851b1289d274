package org.gqlcg.graphqlCompiler.compiler.frontend;

import graphql.introspection.Introspection;
import graphql.language.Definition;
import graphql.language.Document;
import graphql.language.Field;
import graphql.language.FragmentDefinition;
import graphql.language.InlineFragment;
import graphql.language.OperationDefinition;
import graphql.language.Selection;
import graphql.language.SelectionSet;

import java.util.ArrayList;
import java.util.List;

/** Rewrites a document so that every selection set except the roots of
 * operations selects {@code __typename} first.  Selection sets which already
 * select an unaliased {@code __typename} are left as they are. */
@SuppressWarnings("rawtypes")
final class TypenameInserter {
    private TypenameInserter() {}

    static Document addTypename(Document document) {
        List<Definition> definitions = new ArrayList<>();
        for (Definition definition: document.getDefinitions()) {
            if (definition instanceof OperationDefinition) {
                OperationDefinition operation = (OperationDefinition) definition;
                SelectionSet selectionSet = rewriteNested(operation.getSelectionSet());
                definitions.add(operation.transform(builder -> builder.selectionSet(selectionSet)));
            } else if (definition instanceof FragmentDefinition) {
                FragmentDefinition fragment = (FragmentDefinition) definition;
                SelectionSet selectionSet = withTypename(fragment.getSelectionSet());
                definitions.add(fragment.transform(builder -> builder.selectionSet(selectionSet)));
            } else {
                definitions.add(definition);
            }
        }
        return document.transform(builder -> builder.definitions(definitions));
    }

    static SelectionSet withTypename(SelectionSet selectionSet) {
        SelectionSet rewritten = rewriteNested(selectionSet);
        for (Selection selection: rewritten.getSelections()) {
            if (selection instanceof Field) {
                Field field = (Field) selection;
                if (field.getAlias() == null && field.getName().equals(Introspection.TypeNameMetaFieldDef.getName()))
                    return rewritten;
            }
        }
        List<Selection> selections = new ArrayList<>();
        selections.add(Field.newField(Introspection.TypeNameMetaFieldDef.getName()).build());
        selections.addAll(rewritten.getSelections());
        return rewritten.transform(builder -> builder.selections(selections));
    }

    /** Add the field to the selection sets of fields nested in {@code selectionSet}. */
    static SelectionSet rewriteNested(SelectionSet selectionSet) {
        List<Selection> selections = new ArrayList<>();
        for (Selection selection: selectionSet.getSelections()) {
            if (selection instanceof Field && ((Field) selection).getSelectionSet() != null) {
                Field field = (Field) selection;
                SelectionSet nested = withTypename(field.getSelectionSet());
                selections.add(field.transform(builder -> builder.selectionSet(nested)));
            } else if (selection instanceof InlineFragment) {
                InlineFragment inline = (InlineFragment) selection;
                SelectionSet nested = rewriteNested(inline.getSelectionSet());
                selections.add(inline.transform(builder -> builder.selectionSet(nested)));
            } else {
                selections.add(selection);
            }
        }
        return selectionSet.transform(builder -> builder.selections(selections));
    }
}
