package org.gqlcg.graphqlCompiler.compiler.visitors;

import java.util.List;

/** Partition of a selection set by possible type. */
public interface ITypeCase {
    /** Fields which apply to every possible type of the selection set. */
    ITypeCaseRecord getDefault();

    /** All records in a stable order.  May include records covering every
     * possible type, the default one among them; consumers filter those out. */
    List<ITypeCaseRecord> getRecords();
}
