package org.gqlcg.graphqlCompiler.ir;

import org.gqlcg.graphqlCompiler.compiler.errors.SourcePosition;

/** Selections guarded by {@code @include(if: $v)} or, when inverted, {@code @skip(if: $v)}. */
public final class IRBooleanCondition extends IRSelection {
    public final String variableName;
    public final boolean inverted;
    public final IRSelectionSet selectionSet;

    public IRBooleanCondition(SourcePosition position, String variableName, boolean inverted,
                              IRSelectionSet selectionSet) {
        super(position);
        this.variableName = variableName;
        this.inverted = inverted;
        this.selectionSet = selectionSet;
    }

    @Override
    public <T> T accept(IRSelectionVisitor<T> visitor) {
        return visitor.visitBooleanCondition(this);
    }

    @Override
    public String toString() {
        return (this.inverted ? "@skip" : "@include") + "($" + this.variableName + ") " + this.selectionSet;
    }
}
