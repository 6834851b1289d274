package org.gqlcg.graphqlCompiler.ir;

import com.google.common.collect.ImmutableList;
import graphql.schema.GraphQLObjectType;
import org.gqlcg.util.Linq;

import java.util.Collection;
import java.util.List;

/** A selection set together with the concrete object types it may be applied to. */
public final class IRSelectionSet {
    /** Concrete types, in schema order. */
    public final ImmutableList<GraphQLObjectType> possibleTypes;
    /** Selections, in source order. */
    public final ImmutableList<IRSelection> selections;

    public IRSelectionSet(List<GraphQLObjectType> possibleTypes, List<? extends IRSelection> selections) {
        this.possibleTypes = ImmutableList.copyOf(possibleTypes);
        this.selections = ImmutableList.copyOf(selections);
    }

    public IRSelectionSet withSelections(List<? extends IRSelection> selections) {
        return new IRSelectionSet(this.possibleTypes, selections);
    }

    /** True if every type in {@code types} is also a possible type of this set. */
    public boolean covers(Collection<GraphQLObjectType> types) {
        return this.possibleTypes.containsAll(types);
    }

    /** The possible types of this set that also appear in {@code types}, in this set's order. */
    public List<GraphQLObjectType> intersect(Collection<GraphQLObjectType> types) {
        return Linq.where(this.possibleTypes, types::contains);
    }

    public boolean isEmpty() {
        return this.selections.isEmpty();
    }

    @Override
    public String toString() {
        return "{" + Linq.map(this.possibleTypes, GraphQLObjectType::getName) + " " + this.selections + "}";
    }
}
