package org.gqlcg.graphqlCompiler.ir;

import org.gqlcg.graphqlCompiler.compiler.errors.SourcePosition;

/** One element of a selection set.  The set of kinds is closed:
 * every consumer dispatches through {@link IRSelectionVisitor}, so adding
 * a kind forces every consumer to decide how to handle it. */
public abstract class IRSelection extends IRNode {
    protected IRSelection(SourcePosition position) {
        super(position);
    }

    public abstract <T> T accept(IRSelectionVisitor<T> visitor);
}
