package org.gqlcg.graphqlCompiler.compiler.legacy;

import com.google.common.collect.ImmutableList;
import graphql.schema.GraphQLObjectType;
import org.gqlcg.graphqlCompiler.ir.IRBooleanCondition;
import org.gqlcg.graphqlCompiler.ir.IRField;
import org.gqlcg.graphqlCompiler.ir.IRFragmentSpread;
import org.gqlcg.graphqlCompiler.ir.IRSelection;
import org.gqlcg.graphqlCompiler.ir.IRSelectionSet;
import org.gqlcg.graphqlCompiler.ir.IRSelectionVisitor;
import org.gqlcg.graphqlCompiler.ir.IRTypeCondition;

import java.util.List;

/** Decides which fragment spreads of one selection set level are visible
 * for a given set of runtime types.
 *
 * <p>The walk covers the direct selections of the set, left to right,
 * and never enters the selection sets of fields.  Spreads are always
 * visible.  Boolean conditions are always entered.  A type condition is
 * entered only if it matches every one of the target types; otherwise its
 * spreads belong to the narrower inline fragment instead.  Repeated spreads
 * are reported once per occurrence. */
public final class FragmentSpreadClassifier {
    public List<String> visibleSpreads(IRSelectionSet selectionSet) {
        return this.visibleSpreads(selectionSet, selectionSet.possibleTypes);
    }

    public List<String> visibleSpreads(IRSelectionSet selectionSet, List<GraphQLObjectType> possibleTypes) {
        Collector collector = new Collector(possibleTypes);
        collector.walk(selectionSet);
        return collector.result.build();
    }

    static final class Collector implements IRSelectionVisitor<Void> {
        final List<GraphQLObjectType> possibleTypes;
        final ImmutableList.Builder<String> result;

        Collector(List<GraphQLObjectType> possibleTypes) {
            this.possibleTypes = possibleTypes;
            this.result = ImmutableList.builder();
        }

        void walk(IRSelectionSet selectionSet) {
            for (IRSelection selection: selectionSet.selections)
                selection.accept(this);
        }

        @Override
        public Void visitField(IRField field) {
            return null;
        }

        @Override
        public Void visitFragmentSpread(IRFragmentSpread spread) {
            this.result.add(spread.fragmentName);
            return null;
        }

        @Override
        public Void visitTypeCondition(IRTypeCondition condition) {
            if (condition.selectionSet.covers(this.possibleTypes))
                this.walk(condition.selectionSet);
            return null;
        }

        @Override
        public Void visitBooleanCondition(IRBooleanCondition condition) {
            this.walk(condition.selectionSet);
            return null;
        }
    }
}
