package org.gqlcg.graphqlCompiler.compiler.visitors;

import org.gqlcg.graphqlCompiler.ir.IRCompilationContext;
import org.gqlcg.graphqlCompiler.ir.IRSelectionSet;

/** Builds the {@link ITypeCase} of a selection set.  The context resolves
 * the fragments the selection set spreads. */
@FunctionalInterface
public interface ITypeCasePartitioner {
    ITypeCase partition(IRCompilationContext context, IRSelectionSet selectionSet);

    static ITypeCasePartitioner standard() {
        return TypeCase::new;
    }
}
