package org.gqlcg.graphqlCompiler.ir;

/** Exhaustive dispatch over the kinds of {@link IRSelection}. */
public interface IRSelectionVisitor<T> {
    T visitField(IRField field);

    T visitFragmentSpread(IRFragmentSpread spread);

    T visitTypeCondition(IRTypeCondition condition);

    T visitBooleanCondition(IRBooleanCondition condition);
}
