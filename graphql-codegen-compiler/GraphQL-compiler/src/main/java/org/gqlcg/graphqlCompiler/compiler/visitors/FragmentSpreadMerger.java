package org.gqlcg.graphqlCompiler.compiler.visitors;

import graphql.schema.GraphQLObjectType;
import org.gqlcg.graphqlCompiler.compiler.errors.UnknownFragmentException;
import org.gqlcg.graphqlCompiler.ir.IRBooleanCondition;
import org.gqlcg.graphqlCompiler.ir.IRCompilationContext;
import org.gqlcg.graphqlCompiler.ir.IRField;
import org.gqlcg.graphqlCompiler.ir.IRFragment;
import org.gqlcg.graphqlCompiler.ir.IRFragmentSpread;
import org.gqlcg.graphqlCompiler.ir.IRSelection;
import org.gqlcg.graphqlCompiler.ir.IRSelectionSet;
import org.gqlcg.graphqlCompiler.ir.IRSelectionVisitor;
import org.gqlcg.graphqlCompiler.ir.IRTypeCondition;

import java.util.ArrayList;
import java.util.List;

/** Replaces the fragment spreads of one selection set level by type
 * conditions holding the body of the spread fragment, so that a
 * partitioner which does not follow spreads still sees the fields the
 * fragments contribute.
 * Spreads nested in type and boolean conditions are replaced too, but the
 * selection sets of fields are left alone: they are merged when they are
 * lowered themselves.  The fragment graph must be acyclic. */
public class FragmentSpreadMerger {
    final IRCompilationContext context;

    public FragmentSpreadMerger(IRCompilationContext context) {
        this.context = context;
    }

    /** @param selectionSet  Selection set to rewrite.
     *  @param owner         Operation or fragment which contains the selection set, for diagnostics. */
    public IRSelectionSet merge(IRSelectionSet selectionSet, String owner) {
        Rewriter rewriter = new Rewriter(selectionSet, owner);
        List<IRSelection> selections = new ArrayList<>(selectionSet.selections.size());
        for (IRSelection selection: selectionSet.selections)
            selections.add(selection.accept(rewriter));
        return selectionSet.withSelections(selections);
    }

    class Rewriter implements IRSelectionVisitor<IRSelection> {
        final IRSelectionSet enclosing;
        final String owner;

        Rewriter(IRSelectionSet enclosing, String owner) {
            this.enclosing = enclosing;
            this.owner = owner;
        }

        @Override
        public IRSelection visitField(IRField field) {
            return field;
        }

        @Override
        public IRSelection visitFragmentSpread(IRFragmentSpread spread) {
            IRFragment fragment = FragmentSpreadMerger.this.context.fragmentNamed(spread.fragmentName);
            if (fragment == null)
                throw new UnknownFragmentException(spread.fragmentName, this.owner);
            List<GraphQLObjectType> possibleTypes = this.enclosing.intersect(fragment.selectionSet.possibleTypes);
            IRSelectionSet body = new IRSelectionSet(possibleTypes, fragment.selectionSet.selections);
            return new IRTypeCondition(spread.position, fragment.typeCondition,
                    FragmentSpreadMerger.this.merge(body, this.owner));
        }

        @Override
        public IRSelection visitTypeCondition(IRTypeCondition condition) {
            return new IRTypeCondition(condition.position, condition.type,
                    FragmentSpreadMerger.this.merge(condition.selectionSet, this.owner));
        }

        @Override
        public IRSelection visitBooleanCondition(IRBooleanCondition condition) {
            return new IRBooleanCondition(condition.position, condition.variableName, condition.inverted,
                    FragmentSpreadMerger.this.merge(condition.selectionSet, this.owner));
        }
    }
}
