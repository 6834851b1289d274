package org.gqlcg.graphqlCompiler.compiler.legacy;

import com.google.common.collect.ImmutableList;
import graphql.schema.GraphQLOutputType;
import org.gqlcg.graphqlCompiler.ir.IRArgument;

import javax.annotation.Nullable;

/** A field of the legacy IR.  Fields of composite type carry their own
 * flattened selection set; the three nested lists are null otherwise. */
public final class LegacyField {
    /** Alias if present, else the field name. */
    public final String responseName;
    public final String fieldName;
    public final GraphQLOutputType type;
    public final ImmutableList<IRArgument> args;
    public final boolean isConditional;
    @Nullable
    public final String description;
    public final boolean isDeprecated;
    @Nullable
    public final String deprecationReason;
    @Nullable
    public final ImmutableList<LegacyField> fields;
    @Nullable
    public final ImmutableList<String> fragmentSpreads;
    @Nullable
    public final ImmutableList<CompiledInlineFragment> inlineFragments;

    public LegacyField(String responseName, String fieldName, GraphQLOutputType type,
                       ImmutableList<IRArgument> args, boolean isConditional,
                       @Nullable String description, boolean isDeprecated,
                       @Nullable String deprecationReason,
                       @Nullable LoweredSelectionSet selectionSet) {
        this.responseName = responseName;
        this.fieldName = fieldName;
        this.type = type;
        this.args = args;
        this.isConditional = isConditional;
        this.description = description;
        this.isDeprecated = isDeprecated;
        this.deprecationReason = deprecationReason;
        if (selectionSet != null) {
            this.fields = selectionSet.fields();
            this.fragmentSpreads = selectionSet.fragmentSpreads();
            this.inlineFragments = selectionSet.inlineFragments();
        } else {
            this.fields = null;
            this.fragmentSpreads = null;
            this.inlineFragments = null;
        }
    }

    public boolean hasSelectionSet() {
        return this.fields != null;
    }

    @Override
    public String toString() {
        return this.responseName + (this.fields != null ? " " + this.fields : "");
    }
}
