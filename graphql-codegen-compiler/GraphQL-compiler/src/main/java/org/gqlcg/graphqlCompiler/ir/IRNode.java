package org.gqlcg.graphqlCompiler.ir;

import org.gqlcg.graphqlCompiler.compiler.errors.SourcePosition;

/** Base class for all nodes of the typed IR. */
public abstract class IRNode {
    /** Position of the source construct that produced this node. */
    public final SourcePosition position;

    protected IRNode(SourcePosition position) {
        this.position = position;
    }
}
