package org.gqlcg.graphqlCompiler.compiler.legacy;

import org.gqlcg.graphqlCompiler.compiler.errors.CompilationError;
import org.gqlcg.graphqlCompiler.ir.IRField;

import javax.annotation.Nullable;

/** Converts a typed-IR field into a {@link LegacyField}.  The nested
 * selection set, if any, is flattened by the {@link SelectionSetLowerer}. */
public final class FieldLowerer {
    final SelectionSetLowerer selectionSetLowerer;
    final int maxDepth;

    FieldLowerer(SelectionSetLowerer selectionSetLowerer, int maxDepth) {
        this.selectionSetLowerer = selectionSetLowerer;
        this.maxDepth = maxDepth;
    }

    /** @param field  Field to lower.
     *  @param owner  Operation or fragment containing the field.
     *  @param depth  Nesting depth of the selection set containing the field. */
    public LegacyField lower(IRField field, String owner, int depth) {
        @Nullable LoweredSelectionSet nested = null;
        if (field.selectionSet != null) {
            if (depth >= this.maxDepth)
                throw new CompilationError("Selection sets in " + owner + " are nested more than " +
                        this.maxDepth + " levels deep at field " + field.getResponseKey(), field.position);
            nested = this.selectionSetLowerer.lower(field.selectionSet, owner, depth + 1);
        }
        return new LegacyField(field.getResponseKey(), field.name, field.type, field.args,
                field.isConditional, field.description, field.isDeprecated, field.deprecationReason,
                nested);
    }
}
