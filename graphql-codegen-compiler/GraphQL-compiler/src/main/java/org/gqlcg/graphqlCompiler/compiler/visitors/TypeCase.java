package org.gqlcg.graphqlCompiler.compiler.visitors;

import com.google.common.collect.ImmutableList;
import graphql.schema.GraphQLObjectType;
import org.gqlcg.graphqlCompiler.compiler.errors.InternalCompilerError;
import org.gqlcg.graphqlCompiler.ir.IRBooleanCondition;
import org.gqlcg.graphqlCompiler.ir.IRCompilationContext;
import org.gqlcg.graphqlCompiler.ir.IRField;
import org.gqlcg.graphqlCompiler.ir.IRFragment;
import org.gqlcg.graphqlCompiler.ir.IRFragmentSpread;
import org.gqlcg.graphqlCompiler.ir.IRSelection;
import org.gqlcg.graphqlCompiler.ir.IRSelectionSet;
import org.gqlcg.graphqlCompiler.ir.IRSelectionVisitor;
import org.gqlcg.graphqlCompiler.ir.IRTypeCondition;
import org.gqlcg.util.IWritesLogs;
import org.gqlcg.util.Linq;
import org.gqlcg.util.Logger;
import org.gqlcg.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Default partition of a selection set by possible type.
 *
 * <p>Fields selected for every possible type go to the default record.
 * Fields selected under a narrowing type condition go to extra records;
 * the extra records always cover disjoint sets of types, and a record is
 * split when a later condition only covers part of it.  A fragment spread
 * contributes the fields of the fragment, restricted to the types the
 * fragment applies to.  An extra record also holds the default selections
 * of every field it shares with the default record.
 *
 * <p>The fragments of the context must be defined and acyclic; the
 * compiler checks this before partitioning. */
public class TypeCase implements ITypeCase, IWritesLogs {
    static final class Record implements ITypeCaseRecord {
        final List<GraphQLObjectType> possibleTypes;
        final Map<String, IRField> fieldMap;
        /** Default record whose fields apply to this record too; null for the default itself. */
        @Nullable
        final Record base;

        Record(List<GraphQLObjectType> possibleTypes, @Nullable Record base) {
            this.possibleTypes = new ArrayList<>(possibleTypes);
            this.fieldMap = new LinkedHashMap<>();
            this.base = base;
        }

        Record split(List<GraphQLObjectType> types) {
            Record result = new Record(types, this.base);
            result.fieldMap.putAll(this.fieldMap);
            this.possibleTypes.removeAll(types);
            return result;
        }

        void addField(IRField field) {
            String key = field.getResponseKey();
            IRField existing = this.fieldMap.get(key);
            if (existing == null)
                this.fieldMap.put(key, field);
            else
                this.fieldMap.put(key, merge(existing, field));
        }

        @Override
        public List<GraphQLObjectType> getPossibleTypes() {
            return ImmutableList.copyOf(this.possibleTypes);
        }

        @Override
        public List<IRField> getFields() {
            if (this.base == null)
                return ImmutableList.copyOf(this.fieldMap.values());
            ImmutableList.Builder<IRField> result = ImmutableList.builder();
            for (IRField field: this.fieldMap.values()) {
                IRField shared = this.base.fieldMap.get(field.getResponseKey());
                result.add(shared == null ? field : merge(shared, field));
            }
            return result.build();
        }

        @Override
        public int fieldCount() {
            return this.fieldMap.size();
        }

        @Override
        public String toString() {
            return Linq.map(this.possibleTypes, GraphQLObjectType::getName) + " " + this.fieldMap.keySet();
        }
    }

    /** Two selections of the same response key: the nested selections are
     * concatenated and the field stays conditional only if both were. */
    static IRField merge(IRField existing, IRField added) {
        IRSelectionSet selectionSet = existing.selectionSet;
        if (selectionSet == null) {
            selectionSet = added.selectionSet;
        } else if (added.selectionSet != null) {
            List<IRSelection> selections = new ArrayList<>(selectionSet.selections);
            selections.addAll(added.selectionSet.selections);
            selectionSet = selectionSet.withSelections(selections);
        }
        return existing
                .withConditional(existing.isConditional && added.isConditional)
                .withSelectionSet(selectionSet);
    }

    final IRCompilationContext context;
    final IRSelectionSet selectionSet;
    final Record defaultRecord;
    final List<Record> extraRecords;
    final Map<GraphQLObjectType, Record> recordByType;

    public TypeCase(IRCompilationContext context, IRSelectionSet selectionSet) {
        this.context = context;
        this.selectionSet = selectionSet;
        this.defaultRecord = new Record(selectionSet.possibleTypes, null);
        this.extraRecords = new ArrayList<>();
        this.recordByType = new HashMap<>();
        this.visit(selectionSet, selectionSet.possibleTypes, false);
        Logger.INSTANCE.belowLevel(this, 2)
                .append("TypeCase ")
                .appendSupplier(this::toString)
                .newline();
    }

    class Visitor implements IRSelectionVisitor<Void> {
        final List<GraphQLObjectType> possibleTypes;
        final boolean conditional;

        Visitor(List<GraphQLObjectType> possibleTypes, boolean conditional) {
            this.possibleTypes = possibleTypes;
            this.conditional = conditional;
        }

        @Override
        public Void visitField(IRField field) {
            TypeCase.this.addField(field.withConditional(field.isConditional || this.conditional),
                    this.possibleTypes);
            return null;
        }

        @Override
        public Void visitFragmentSpread(IRFragmentSpread spread) {
            IRFragment fragment = TypeCase.this.context.fragmentNamed(spread.fragmentName);
            if (fragment == null)
                throw new InternalCompilerError("Fragment " + spread.fragmentName +
                        " is not defined", spread.position);
            List<GraphQLObjectType> narrowed = Linq.where(this.possibleTypes, fragment.selectionSet.possibleTypes::contains);
            if (!narrowed.isEmpty())
                TypeCase.this.visit(fragment.selectionSet, narrowed, this.conditional);
            return null;
        }

        @Override
        public Void visitTypeCondition(IRTypeCondition condition) {
            List<GraphQLObjectType> narrowed = Linq.where(this.possibleTypes, condition.selectionSet.possibleTypes::contains);
            if (!narrowed.isEmpty())
                TypeCase.this.visit(condition.selectionSet, narrowed, this.conditional);
            return null;
        }

        @Override
        public Void visitBooleanCondition(IRBooleanCondition condition) {
            TypeCase.this.visit(condition.selectionSet, this.possibleTypes, true);
            return null;
        }
    }

    void visit(IRSelectionSet set, List<GraphQLObjectType> possibleTypes, boolean conditional) {
        Visitor visitor = new Visitor(possibleTypes, conditional);
        for (IRSelection selection: set.selections)
            selection.accept(visitor);
    }

    void addField(IRField field, List<GraphQLObjectType> possibleTypes) {
        Utilities.enforce(this.selectionSet.covers(possibleTypes),
                "Field " + field + " selected for types outside of the selection set");
        if (possibleTypes.size() == this.selectionSet.possibleTypes.size()) {
            this.defaultRecord.addField(field);
            return;
        }
        for (Record record: this.recordsFor(possibleTypes))
            record.addField(field);
    }

    /** The extra records which together cover exactly {@code possibleTypes},
     * creating or splitting records as needed. */
    List<Record> recordsFor(List<GraphQLObjectType> possibleTypes) {
        List<GraphQLObjectType> unassigned = new ArrayList<>();
        Map<Record, List<GraphQLObjectType>> groups = new LinkedHashMap<>();
        for (GraphQLObjectType type: possibleTypes) {
            Record record = this.recordByType.get(type);
            if (record == null)
                unassigned.add(type);
            else
                groups.computeIfAbsent(record, r -> new ArrayList<>()).add(type);
        }

        List<Record> result = new ArrayList<>();
        for (Map.Entry<Record, List<GraphQLObjectType>> group: groups.entrySet()) {
            Record record = group.getKey();
            List<GraphQLObjectType> types = group.getValue();
            if (types.size() == record.possibleTypes.size()) {
                result.add(record);
                continue;
            }
            Record split = record.split(types);
            this.extraRecords.add(this.extraRecords.indexOf(record) + 1, split);
            for (GraphQLObjectType type: types)
                this.recordByType.put(type, split);
            result.add(split);
        }
        if (!unassigned.isEmpty()) {
            Record record = new Record(unassigned, this.defaultRecord);
            this.extraRecords.add(record);
            for (GraphQLObjectType type: unassigned)
                this.recordByType.put(type, record);
            result.add(record);
        }
        return result;
    }

    @Override
    public ITypeCaseRecord getDefault() {
        return this.defaultRecord;
    }

    @Override
    public List<ITypeCaseRecord> getRecords() {
        ImmutableList.Builder<ITypeCaseRecord> builder = ImmutableList.builder();
        builder.add(this.defaultRecord);
        builder.addAll(this.extraRecords);
        return builder.build();
    }

    @Override
    public String toString() {
        return "default=" + this.defaultRecord + " extra=" + this.extraRecords;
    }
}
