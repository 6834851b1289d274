package org.gqlcg.graphqlCompiler.ir;

import org.gqlcg.graphqlCompiler.compiler.errors.SourcePosition;

/** A named fragment spread, {@code ...Name}.  The fragment itself is
 * looked up by name in the {@link IRCompilationContext}. */
public final class IRFragmentSpread extends IRSelection {
    public final String fragmentName;

    public IRFragmentSpread(SourcePosition position, String fragmentName) {
        super(position);
        this.fragmentName = fragmentName;
    }

    @Override
    public <T> T accept(IRSelectionVisitor<T> visitor) {
        return visitor.visitFragmentSpread(this);
    }

    @Override
    public String toString() {
        return "..." + this.fragmentName;
    }
}
