package org.gqlcg.graphqlCompiler.compiler.visitors;

import com.google.common.collect.ImmutableList;
import org.gqlcg.graphqlCompiler.compiler.errors.CompilationError;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** Computes the names of all fragments reachable from a selection set
 * through fragment spreads, at any depth.
 *
 * <p>Names appear once, in the order in which they are first reached by a
 * pre-order, left-to-right walk; a fragment is recorded before the fragments
 * it spreads.  Names with no definition are recorded but cannot be followed;
 * reporting them is left to the caller.  Fragment cycles are rejected. */
public class FragmentsReferencedCollector {
    final IRCompilationContext context;

    public FragmentsReferencedCollector(IRCompilationContext context) {
        this.context = context;
    }

    public ImmutableList<String> collect(IRSelectionSet selectionSet) {
        Walker walker = new Walker(new ArrayList<>());
        walker.walk(selectionSet);
        return ImmutableList.copyOf(walker.result);
    }

    /** Fragments reachable from the body of {@code fragment}, excluding the fragment itself. */
    public ImmutableList<String> collect(IRFragment fragment) {
        List<String> path = new ArrayList<>();
        path.add(fragment.fragmentName);
        Walker walker = new Walker(path);
        walker.walk(fragment.selectionSet);
        return ImmutableList.copyOf(walker.result);
    }

    class Walker implements IRSelectionVisitor<Void> {
        final Set<String> result;
        /** Fragments currently being expanded, outermost first. */
        final List<String> path;

        Walker(List<String> path) {
            this.result = new LinkedHashSet<>();
            this.path = path;
        }

        void walk(IRSelectionSet selectionSet) {
            for (IRSelection selection: selectionSet.selections)
                selection.accept(this);
        }

        @Override
        public Void visitField(IRField field) {
            if (field.selectionSet != null)
                this.walk(field.selectionSet);
            return null;
        }

        @Override
        public Void visitFragmentSpread(IRFragmentSpread spread) {
            String name = spread.fragmentName;
            int index = this.path.indexOf(name);
            if (index >= 0) {
                List<String> cycle = new ArrayList<>(this.path.subList(index, this.path.size()));
                cycle.add(name);
                throw new CompilationError("Cannot spread fragment " + name +
                        " within itself: " + String.join(" -> ", cycle), spread.position);
            }
            if (!this.result.add(name))
                return null;
            IRFragment fragment = FragmentsReferencedCollector.this.context.fragmentNamed(name);
            if (fragment == null)
                return null;
            this.path.add(name);
            this.walk(fragment.selectionSet);
            this.path.remove(this.path.size() - 1);
            return null;
        }

        @Override
        public Void visitTypeCondition(IRTypeCondition condition) {
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
