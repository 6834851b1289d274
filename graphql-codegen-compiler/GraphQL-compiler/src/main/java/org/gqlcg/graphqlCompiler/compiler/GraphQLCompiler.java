package org.gqlcg.graphqlCompiler.compiler;

import com.fasterxml.jackson.databind.node.ObjectNode;
import graphql.language.Document;
import graphql.parser.InvalidSyntaxException;
import graphql.parser.Parser;
import graphql.schema.GraphQLSchema;
import graphql.schema.idl.SchemaParser;
import graphql.schema.idl.TypeDefinitionRegistry;
import graphql.schema.idl.UnExecutableSchemaGenerator;
import graphql.schema.idl.errors.SchemaProblem;
import org.gqlcg.graphqlCompiler.compiler.backend.LegacyIRJsonWriter;
import org.gqlcg.graphqlCompiler.compiler.errors.CompilationError;
import org.gqlcg.graphqlCompiler.compiler.errors.SourcePosition;
import org.gqlcg.graphqlCompiler.compiler.frontend.DocumentCompiler;
import org.gqlcg.graphqlCompiler.compiler.legacy.LegacyCompilationContext;
import org.gqlcg.graphqlCompiler.compiler.legacy.LegacyIRCompiler;
import org.gqlcg.graphqlCompiler.compiler.visitors.ITypeCasePartitioner;
import org.gqlcg.graphqlCompiler.ir.IRCompilationContext;
import org.gqlcg.util.IWritesLogs;
import org.gqlcg.util.Logger;

import java.util.Map;

/** Compiles GraphQL documents to the legacy IR.
 *
 * <p>A compiler instance is bound to one schema and one set of options.
 * Every call compiles a whole document; the first error aborts the
 * compilation with a {@link CompilationError}. */
public class GraphQLCompiler implements IWritesLogs {
    public final GraphQLSchema schema;
    public final CompilerOptions options;
    final ITypeCasePartitioner partitioner;

    public GraphQLCompiler(GraphQLSchema schema, CompilerOptions options, ITypeCasePartitioner partitioner) {
        options.validate();
        this.schema = schema;
        this.options = options;
        this.partitioner = partitioner;
        for (Map.Entry<String, String> entry: options.ioOptions.loggingLevel.entrySet())
            Logger.INSTANCE.setLoggingLevel(entry.getKey(), Integer.parseInt(entry.getValue()));
    }

    public GraphQLCompiler(GraphQLSchema schema, CompilerOptions options) {
        this(schema, options, ITypeCasePartitioner.standard());
    }

    /** Build a schema from SDL text.  Resolvers are not needed to compile documents. */
    public static GraphQLSchema parseSchema(String sdl) {
        try {
            TypeDefinitionRegistry registry = new SchemaParser().parse(sdl);
            return UnExecutableSchemaGenerator.makeUnExecutableSchema(registry);
        } catch (SchemaProblem ex) {
            throw new CompilationError("Invalid schema: " + ex.getMessage(), SourcePosition.INVALID, ex);
        }
    }

    public Document parse(String source) {
        try {
            return Parser.parse(source);
        } catch (InvalidSyntaxException ex) {
            throw new CompilationError(ex.getMessage(), SourcePosition.create(ex.getLocation()), ex);
        }
    }

    public IRCompilationContext compileToIR(Document document) {
        return new DocumentCompiler(this.schema, this.options).compile(document);
    }

    public IRCompilationContext compileToIR(String source) {
        return this.compileToIR(this.parse(source));
    }

    public LegacyCompilationContext compileToLegacyIR(IRCompilationContext context) {
        LegacyCompilationContext result = new LegacyIRCompiler(context, this.partitioner).compile();
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Lowered ")
                .append(result.operations.size())
                .append(" operations, ")
                .append(result.fragments.size())
                .append(" fragments, ")
                .append(result.typesUsed.size())
                .append(" types used")
                .newline();
        return result;
    }

    public LegacyCompilationContext compileToLegacyIR(String source) {
        return this.compileToLegacyIR(this.compileToIR(source));
    }

    public ObjectNode toJson(LegacyCompilationContext context) {
        return new LegacyIRJsonWriter().toJson(context);
    }
}
