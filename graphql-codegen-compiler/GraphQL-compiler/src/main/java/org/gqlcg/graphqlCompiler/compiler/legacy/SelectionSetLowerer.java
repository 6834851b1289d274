package org.gqlcg.graphqlCompiler.compiler.legacy;

import com.google.common.collect.ImmutableList;
import graphql.schema.GraphQLObjectType;
import org.gqlcg.graphqlCompiler.compiler.visitors.FragmentSpreadMerger;
import org.gqlcg.graphqlCompiler.compiler.visitors.ITypeCase;
import org.gqlcg.graphqlCompiler.compiler.visitors.ITypeCasePartitioner;
import org.gqlcg.graphqlCompiler.compiler.visitors.ITypeCaseRecord;
import org.gqlcg.graphqlCompiler.ir.IRCompilationContext;
import org.gqlcg.graphqlCompiler.ir.IRField;
import org.gqlcg.graphqlCompiler.ir.IRSelectionSet;
import org.gqlcg.util.IWritesLogs;
import org.gqlcg.util.Logger;

import javax.annotation.Nullable;
import java.util.List;

/** Flattens a selection set into fields, visible fragment spreads, and one
 * inline fragment per concrete type that selects more than the default.
 *
 * <p>Records of the partition are dropped when they cover every possible
 * type of the selection set, since the default record already holds their
 * fields, and when they select no field.  The remaining records are
 * expanded into one inline fragment per possible type, all sharing the
 * record's lowered fields and fragment spreads. */
public class SelectionSetLowerer implements IWritesLogs {
    final IRCompilationContext context;
    final ITypeCasePartitioner partitioner;
    final FragmentSpreadClassifier classifier;
    final FieldLowerer fieldLowerer;
    /** Null unless fields of spread fragments are merged before partitioning. */
    @Nullable
    final FragmentSpreadMerger merger;

    public SelectionSetLowerer(IRCompilationContext context, ITypeCasePartitioner partitioner) {
        this.context = context;
        this.partitioner = partitioner;
        this.classifier = new FragmentSpreadClassifier();
        this.fieldLowerer = new FieldLowerer(this, context.options.languageOptions.maxSelectionDepth);
        this.merger = context.options.languageOptions.mergeInFieldsFromFragmentSpreads
                ? new FragmentSpreadMerger(context) : null;
    }

    /** Lower a top-level selection set.
     * @param owner  Operation or fragment the selection set belongs to. */
    public LoweredSelectionSet lower(IRSelectionSet selectionSet, String owner) {
        return this.lower(selectionSet, owner, 0);
    }

    LoweredSelectionSet lower(IRSelectionSet selectionSet, String owner, int depth) {
        IRSelectionSet partitioned = this.merger != null ? this.merger.merge(selectionSet, owner) : selectionSet;
        ITypeCase typeCase = this.partitioner.partition(this.context, partitioned);
        return this.lower(selectionSet, typeCase, owner, depth);
    }

    /** Lower a selection set given its partition by possible type.
     * Spreads are classified on {@code selectionSet} itself, not on the set
     * the partition was computed from. */
    LoweredSelectionSet lower(IRSelectionSet selectionSet, ITypeCase typeCase, String owner, int depth) {
        ImmutableList<LegacyField> fields = this.lowerFields(typeCase.getDefault().getFields(), owner, depth);

        ImmutableList.Builder<CompiledInlineFragment> inlineFragments = ImmutableList.builder();
        for (ITypeCaseRecord record: typeCase.getRecords()) {
            List<GraphQLObjectType> recordTypes = record.getPossibleTypes();
            if (recordTypes.containsAll(selectionSet.possibleTypes))
                continue;
            if (record.fieldCount() == 0)
                continue;
            ImmutableList<LegacyField> recordFields = this.lowerFields(record.getFields(), owner, depth);
            ImmutableList<String> recordSpreads = ImmutableList.copyOf(
                    this.classifier.visibleSpreads(selectionSet, recordTypes));
            for (GraphQLObjectType type: recordTypes)
                inlineFragments.add(new CompiledInlineFragment(type, recordFields, recordSpreads));
        }

        ImmutableList<String> fragmentSpreads = ImmutableList.copyOf(this.classifier.visibleSpreads(selectionSet));
        LoweredSelectionSet result = new LoweredSelectionSet(fields, fragmentSpreads, inlineFragments.build());
        Logger.INSTANCE.belowLevel(this, 2)
                .append("Lowered selection set in ")
                .append(owner)
                .append(" at depth ")
                .append(depth)
                .append(": ")
                .appendSupplier(result::toString)
                .newline();
        return result;
    }

    ImmutableList<LegacyField> lowerFields(List<IRField> fields, String owner, int depth) {
        ImmutableList.Builder<LegacyField> result = ImmutableList.builder();
        for (IRField field: fields)
            result.add(this.fieldLowerer.lower(field, owner, depth));
        return result.build();
    }
}
