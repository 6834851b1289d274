package org.gqlcg.graphqlCompiler.compiler.legacy;

import com.google.common.collect.ImmutableList;
import org.gqlcg.graphqlCompiler.compiler.errors.UnknownFragmentException;
import org.gqlcg.graphqlCompiler.compiler.visitors.FragmentsReferencedCollector;
import org.gqlcg.graphqlCompiler.compiler.visitors.ITypeCasePartitioner;
import org.gqlcg.graphqlCompiler.ir.IRCompilationContext;
import org.gqlcg.graphqlCompiler.ir.IRFragment;
import org.gqlcg.graphqlCompiler.ir.IROperation;
import org.gqlcg.graphqlCompiler.ir.IRSelectionSet;
import org.gqlcg.util.HashString;
import org.gqlcg.util.IWritesLogs;
import org.gqlcg.util.Logger;
import org.gqlcg.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Lowers every operation and fragment of a typed-IR document to the legacy IR.
 *
 * <p>Each operation and fragment is compiled independently; the compiler
 * only reads the shared context.  A fragment spread without a matching
 * fragment definition aborts the whole compilation. */
public class LegacyIRCompiler implements IWritesLogs {
    final IRCompilationContext context;
    final SelectionSetLowerer lowerer;
    final FragmentsReferencedCollector collector;

    public LegacyIRCompiler(IRCompilationContext context) {
        this(context, ITypeCasePartitioner.standard());
    }

    public LegacyIRCompiler(IRCompilationContext context, ITypeCasePartitioner partitioner) {
        this.context = context;
        this.lowerer = new SelectionSetLowerer(context, partitioner);
        this.collector = new FragmentsReferencedCollector(context);
    }

    public LegacyCompilationContext compile() {
        Map<String, CompiledOperation> operations = new LinkedHashMap<>();
        for (IROperation operation: this.context.operations.values())
            Utilities.putNew(operations, operation.operationName, this.compileOperation(operation));

        Map<String, CompiledFragment> fragments = new LinkedHashMap<>();
        for (IRFragment fragment: this.context.fragments.values())
            Utilities.putNew(fragments, fragment.fragmentName, this.compileFragment(fragment));

        return new LegacyCompilationContext(this.context.schema, operations, fragments,
                this.context.typesUsed, this.context.options);
    }

    public CompiledOperation compileOperation(IROperation operation) {
        ImmutableList<String> fragmentsReferenced = this.collector.collect(operation.selectionSet);
        List<String> fragmentSources = new ArrayList<>(fragmentsReferenced.size());
        for (String name: fragmentsReferenced)
            fragmentSources.add(this.getFragment(name, operation.operationName).source);

        String sourceWithFragments = OperationIdentifier.sourceWithFragments(operation.source, fragmentSources);
        @Nullable HashString operationId = null;
        if (this.context.options.languageOptions.generateOperationIds)
            operationId = OperationIdentifier.compute(sourceWithFragments);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Compiling ")
                .append(operation.toString())
                .append(" id=")
                .append(operationId != null ? operationId.shortString() : "none")
                .append(" fragments=")
                .join(",", fragmentsReferenced)
                .increase();
        LoweredSelectionSet body = this.lower(operation.selectionSet, operation.operationName);
        return new CompiledOperation(operation.operationName, operation.operationType, operation.rootType,
                operation.variables, operation.source, sourceWithFragments,
                operationId != null ? operationId.value() : null, body, fragmentsReferenced);
    }

    public CompiledFragment compileFragment(IRFragment fragment) {
        for (String name: this.collector.collect(fragment))
            this.getFragment(name, fragment.fragmentName);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Compiling ")
                .append(fragment.toString())
                .increase();
        LoweredSelectionSet body = this.lower(fragment.selectionSet, fragment.fragmentName);
        return new CompiledFragment(fragment.fragmentName, fragment.source, fragment.typeCondition,
                fragment.selectionSet.possibleTypes, body);
    }

    /** Lower a top-level selection set; its log lines are nested under the owner's. */
    LoweredSelectionSet lower(IRSelectionSet selectionSet, String owner) {
        try {
            return this.lowerer.lower(selectionSet, owner);
        } finally {
            Logger.INSTANCE.belowLevel(this, 1).decrease();
        }
    }

    IRFragment getFragment(String name, String referencedFrom) {
        IRFragment fragment = this.context.fragmentNamed(name);
        if (fragment == null)
            throw new UnknownFragmentException(name, referencedFrom);
        return fragment;
    }
}
