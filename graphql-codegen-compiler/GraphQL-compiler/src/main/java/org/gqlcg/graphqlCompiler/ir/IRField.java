package org.gqlcg.graphqlCompiler.ir;

import com.google.common.collect.ImmutableList;
import graphql.schema.GraphQLOutputType;
import org.gqlcg.graphqlCompiler.compiler.errors.SourcePosition;

import javax.annotation.Nullable;
import java.util.List;

public final class IRField extends IRSelection {
    public final String name;
    @Nullable
    public final String alias;
    public final GraphQLOutputType type;
    public final ImmutableList<IRArgument> args;
    /** True if the field is only included depending on a variable. */
    public final boolean isConditional;
    @Nullable
    public final String description;
    public final boolean isDeprecated;
    @Nullable
    public final String deprecationReason;
    /** Present for fields of composite type. */
    @Nullable
    public final IRSelectionSet selectionSet;

    public IRField(SourcePosition position, String name, @Nullable String alias, GraphQLOutputType type,
                   List<IRArgument> args, boolean isConditional, @Nullable String description,
                   boolean isDeprecated, @Nullable String deprecationReason,
                   @Nullable IRSelectionSet selectionSet) {
        super(position);
        this.name = name;
        this.alias = alias;
        this.type = type;
        this.args = ImmutableList.copyOf(args);
        this.isConditional = isConditional;
        this.description = description;
        this.isDeprecated = isDeprecated;
        this.deprecationReason = deprecationReason;
        this.selectionSet = selectionSet;
    }

    /** Name under which the field appears in the response. */
    public String getResponseKey() {
        return this.alias != null ? this.alias : this.name;
    }

    public IRField withConditional(boolean isConditional) {
        if (isConditional == this.isConditional)
            return this;
        return new IRField(this.position, this.name, this.alias, this.type, this.args, isConditional,
                this.description, this.isDeprecated, this.deprecationReason, this.selectionSet);
    }

    public IRField withSelectionSet(@Nullable IRSelectionSet selectionSet) {
        return new IRField(this.position, this.name, this.alias, this.type, this.args, this.isConditional,
                this.description, this.isDeprecated, this.deprecationReason, selectionSet);
    }

    @Override
    public <T> T accept(IRSelectionVisitor<T> visitor) {
        return visitor.visitField(this);
    }

    @Override
    public String toString() {
        return this.getResponseKey() + (this.selectionSet != null ? " " + this.selectionSet : "");
    }
}
