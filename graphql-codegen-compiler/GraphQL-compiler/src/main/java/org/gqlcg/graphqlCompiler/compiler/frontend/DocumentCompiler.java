package org.gqlcg.graphqlCompiler.compiler.frontend;

import graphql.introspection.Introspection;
import graphql.language.Argument;
import graphql.language.ArrayValue;
import graphql.language.AstPrinter;
import graphql.language.BooleanValue;
import graphql.language.Definition;
import graphql.language.Directive;
import graphql.language.Document;
import graphql.language.EnumValue;
import graphql.language.Field;
import graphql.language.FloatValue;
import graphql.language.FragmentDefinition;
import graphql.language.FragmentSpread;
import graphql.language.InlineFragment;
import graphql.language.IntValue;
import graphql.language.ListType;
import graphql.language.Node;
import graphql.language.NonNullType;
import graphql.language.NullValue;
import graphql.language.ObjectField;
import graphql.language.ObjectValue;
import graphql.language.OperationDefinition;
import graphql.language.Selection;
import graphql.language.SelectionSet;
import graphql.language.StringValue;
import graphql.language.Type;
import graphql.language.TypeName;
import graphql.language.Value;
import graphql.language.VariableDefinition;
import graphql.language.VariableReference;
import graphql.schema.GraphQLCompositeType;
import graphql.schema.GraphQLEnumType;
import graphql.schema.GraphQLFieldDefinition;
import graphql.schema.GraphQLFieldsContainer;
import graphql.schema.GraphQLInputObjectField;
import graphql.schema.GraphQLInputObjectType;
import graphql.schema.GraphQLInputType;
import graphql.schema.GraphQLInterfaceType;
import graphql.schema.GraphQLList;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLNonNull;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLOutputType;
import graphql.schema.GraphQLScalarType;
import graphql.schema.GraphQLSchema;
import graphql.schema.GraphQLType;
import graphql.schema.GraphQLTypeUtil;
import graphql.schema.GraphQLUnionType;
import org.gqlcg.graphqlCompiler.compiler.CompilerOptions;
import org.gqlcg.graphqlCompiler.compiler.errors.CompilationError;
import org.gqlcg.graphqlCompiler.compiler.errors.InternalCompilerError;
import org.gqlcg.graphqlCompiler.compiler.errors.SourcePosition;
import org.gqlcg.graphqlCompiler.ir.IRArgument;
import org.gqlcg.graphqlCompiler.ir.IRBooleanCondition;
import org.gqlcg.graphqlCompiler.ir.IRCompilationContext;
import org.gqlcg.graphqlCompiler.ir.IRField;
import org.gqlcg.graphqlCompiler.ir.IRFragment;
import org.gqlcg.graphqlCompiler.ir.IRFragmentSpread;
import org.gqlcg.graphqlCompiler.ir.IROperation;
import org.gqlcg.graphqlCompiler.ir.IRSelection;
import org.gqlcg.graphqlCompiler.ir.IRSelectionSet;
import org.gqlcg.graphqlCompiler.ir.IRTypeCondition;
import org.gqlcg.graphqlCompiler.ir.IRVariable;
import org.gqlcg.graphqlCompiler.ir.IRVariableReference;
import org.gqlcg.util.IWritesLogs;
import org.gqlcg.util.Linq;
import org.gqlcg.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Builds the typed IR of a parsed document against a schema.
 * The document is expected to be valid; the checks performed here only
 * cover what is needed to resolve types. */
@SuppressWarnings("rawtypes")
public class DocumentCompiler implements IWritesLogs {
    static final Set<String> BUILTIN_SCALARS = Set.of("Int", "Float", "String", "Boolean", "ID");

    final GraphQLSchema schema;
    final CompilerOptions options;
    final Set<GraphQLNamedType> typesUsed;

    public DocumentCompiler(GraphQLSchema schema, CompilerOptions options) {
        this.schema = schema;
        this.options = options;
        this.typesUsed = new LinkedHashSet<>();
    }

    /** A variable condition from {@code @include} or {@code @skip}. */
    record Condition(String variableName, boolean inverted) {}

    public IRCompilationContext compile(Document document) {
        if (this.options.languageOptions.addTypename)
            document = TypenameInserter.addTypename(document);

        List<OperationDefinition> operationDefinitions = new ArrayList<>();
        List<FragmentDefinition> fragmentDefinitions = new ArrayList<>();
        for (Definition definition: document.getDefinitions()) {
            if (definition instanceof OperationDefinition)
                operationDefinitions.add((OperationDefinition) definition);
            else if (definition instanceof FragmentDefinition)
                fragmentDefinitions.add((FragmentDefinition) definition);
            else
                throw new CompilationError("Unexpected " + definition.getClass().getSimpleName() +
                        " in executable document", position(definition));
        }

        Map<String, IROperation> operations = new LinkedHashMap<>();
        for (OperationDefinition definition: operationDefinitions) {
            IROperation operation = this.compileOperation(definition);
            if (operations.put(operation.operationName, operation) != null)
                throw new CompilationError("There can be only one operation named " +
                        operation.operationName, operation.position);
        }
        Map<String, IRFragment> fragments = new LinkedHashMap<>();
        for (FragmentDefinition definition: fragmentDefinitions) {
            IRFragment fragment = this.compileFragment(definition);
            if (fragments.put(fragment.fragmentName, fragment) != null)
                throw new CompilationError("There can be only one fragment named " +
                        fragment.fragmentName, fragment.position);
        }
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Compiled ")
                .append(operations.size())
                .append(" operations and ")
                .append(fragments.size())
                .append(" fragments")
                .newline();
        return new IRCompilationContext(this.schema, operations, fragments,
                new ArrayList<>(this.typesUsed), this.options);
    }

    static SourcePosition position(Node node) {
        return SourcePosition.create(node.getSourceLocation());
    }

    IROperation compileOperation(OperationDefinition definition) {
        SourcePosition position = position(definition);
        String name = definition.getName();
        if (name == null)
            throw new CompilationError("Operations must be named", position);
        OperationDefinition.Operation kind = definition.getOperation();
        GraphQLObjectType rootType = switch (kind) {
            case QUERY -> this.schema.getQueryType();
            case MUTATION -> this.schema.getMutationType();
            case SUBSCRIPTION -> this.schema.getSubscriptionType();
        };
        if (rootType == null)
            throw new CompilationError("Schema does not support " + kind.name().toLowerCase(Locale.ROOT) +
                    " operations", position);

        List<IRVariable> variables = new ArrayList<>();
        for (VariableDefinition variable: definition.getVariableDefinitions()) {
            GraphQLType type = this.typeFromAst(variable.getType());
            if (!(type instanceof GraphQLInputType))
                throw new CompilationError("Variable $" + variable.getName() + " cannot have non-input type " +
                        GraphQLTypeUtil.simplePrint(type), position(variable));
            this.addTypeUsed(GraphQLTypeUtil.unwrapAll(type));
            variables.add(new IRVariable(variable.getName(), (GraphQLInputType) type));
        }

        IRSelectionSet selectionSet = this.compileSelectionSet(
                definition.getSelectionSet(), rootType, this.possibleTypes(rootType));
        return new IROperation(position, name, kind.name().toLowerCase(Locale.ROOT), rootType, variables,
                AstPrinter.printAst(definition), selectionSet);
    }

    IRFragment compileFragment(FragmentDefinition definition) {
        SourcePosition position = position(definition);
        GraphQLCompositeType type = this.compositeType(definition.getTypeCondition(), position);
        IRSelectionSet selectionSet = this.compileSelectionSet(
                definition.getSelectionSet(), type, this.possibleTypes(type));
        return new IRFragment(position, definition.getName(), AstPrinter.printAst(definition), type, selectionSet);
    }

    IRSelectionSet compileSelectionSet(SelectionSet selectionSet, GraphQLCompositeType parentType,
                                       List<GraphQLObjectType> possibleTypes) {
        List<IRSelection> selections = new ArrayList<>();
        for (Selection selection: selectionSet.getSelections()) {
            IRSelection compiled = this.compileSelection(selection, parentType, possibleTypes);
            if (compiled != null)
                selections.add(compiled);
        }
        return new IRSelectionSet(possibleTypes, selections);
    }

    /** @return null if the selection is excluded by a literal condition. */
    @Nullable
    IRSelection compileSelection(Selection selection, GraphQLCompositeType parentType,
                                 List<GraphQLObjectType> possibleTypes) {
        SourcePosition position = position(selection);
        IRSelection result;
        List<Condition> conditions;
        if (selection instanceof Field) {
            Field field = (Field) selection;
            conditions = this.conditions(field.getDirectives(), position);
            if (conditions == null)
                return null;
            result = this.compileField(field, parentType, !conditions.isEmpty());
        } else if (selection instanceof InlineFragment) {
            InlineFragment inline = (InlineFragment) selection;
            conditions = this.conditions(inline.getDirectives(), position);
            if (conditions == null)
                return null;
            TypeName typeCondition = inline.getTypeCondition();
            GraphQLCompositeType type = typeCondition == null ? parentType : this.compositeType(typeCondition, position);
            List<GraphQLObjectType> narrowed = Linq.where(possibleTypes, this.possibleTypes(type)::contains);
            result = new IRTypeCondition(position, type,
                    this.compileSelectionSet(inline.getSelectionSet(), type, narrowed));
        } else if (selection instanceof FragmentSpread) {
            FragmentSpread spread = (FragmentSpread) selection;
            conditions = this.conditions(spread.getDirectives(), position);
            if (conditions == null)
                return null;
            result = new IRFragmentSpread(position, spread.getName());
        } else {
            throw new InternalCompilerError("Unexpected selection " + selection, position);
        }

        for (int i = conditions.size() - 1; i >= 0; i--) {
            Condition condition = conditions.get(i);
            result = new IRBooleanCondition(position, condition.variableName(), condition.inverted(),
                    new IRSelectionSet(possibleTypes, List.of(result)));
        }
        return result;
    }

    /** Variable conditions from {@code @include} and {@code @skip}, outermost first.
     * @return null if a literal condition excludes the selection. */
    @Nullable
    List<Condition> conditions(List<Directive> directives, SourcePosition position) {
        List<Condition> result = new ArrayList<>();
        for (Directive directive: directives) {
            boolean skip = directive.getName().equals("skip");
            if (!skip && !directive.getName().equals("include"))
                continue;
            Argument argument = directive.getArgument("if");
            if (argument == null)
                throw new CompilationError("Directive @" + directive.getName() +
                        " requires an 'if' argument", position);
            Value value = argument.getValue();
            if (value instanceof BooleanValue) {
                if (((BooleanValue) value).isValue() == skip)
                    return null;
            } else if (value instanceof VariableReference) {
                result.add(new Condition(((VariableReference) value).getName(), skip));
            } else {
                throw new CompilationError("Argument 'if' of @" + directive.getName() +
                        " must be a Boolean or a variable", position);
            }
        }
        return result;
    }

    IRField compileField(Field field, GraphQLCompositeType parentType, boolean isConditional) {
        SourcePosition position = position(field);
        String name = field.getName();
        GraphQLFieldDefinition definition = this.fieldDefinition(parentType, name);
        if (definition == null)
            throw new CompilationError("Cannot query field " + name + " on type " +
                    GraphQLTypeUtil.simplePrint(parentType), position);
        GraphQLOutputType type = definition.getType();
        GraphQLNamedType namedType = GraphQLTypeUtil.unwrapAll(type);
        this.addTypeUsed(namedType);

        List<IRArgument> args = new ArrayList<>();
        for (Argument argument: field.getArguments())
            args.add(new IRArgument(argument.getName(), this.valueFromAst(argument.getValue(), position)));

        IRSelectionSet selectionSet = null;
        if (namedType instanceof GraphQLCompositeType) {
            GraphQLCompositeType composite = (GraphQLCompositeType) namedType;
            if (field.getSelectionSet() == null)
                throw new CompilationError("Field " + name + " of type " + GraphQLTypeUtil.simplePrint(type) +
                        " must have a selection of subfields", position);
            selectionSet = this.compileSelectionSet(field.getSelectionSet(), composite, this.possibleTypes(composite));
        }
        return new IRField(position, name, field.getAlias(), type, args, isConditional,
                definition.getDescription(), definition.isDeprecated(), definition.getDeprecationReason(),
                selectionSet);
    }

    @Nullable
    GraphQLFieldDefinition fieldDefinition(GraphQLCompositeType parentType, String name) {
        if (name.equals(Introspection.TypeNameMetaFieldDef.getName()))
            return Introspection.TypeNameMetaFieldDef;
        if (parentType == this.schema.getQueryType()) {
            if (name.equals(Introspection.SchemaMetaFieldDef.getName()))
                return Introspection.SchemaMetaFieldDef;
            if (name.equals(Introspection.TypeMetaFieldDef.getName()))
                return Introspection.TypeMetaFieldDef;
        }
        if (parentType instanceof GraphQLFieldsContainer)
            return ((GraphQLFieldsContainer) parentType).getFieldDefinition(name);
        return null;
    }

    /** The concrete object types a composite type can resolve to, in schema order. */
    public List<GraphQLObjectType> possibleTypes(GraphQLCompositeType type) {
        if (type instanceof GraphQLObjectType)
            return List.of((GraphQLObjectType) type);
        if (type instanceof GraphQLInterfaceType)
            return this.schema.getImplementations((GraphQLInterfaceType) type);
        if (type instanceof GraphQLUnionType)
            return Linq.map(((GraphQLUnionType) type).getTypes(), member -> (GraphQLObjectType) member);
        throw new InternalCompilerError("Unexpected composite type " + type);
    }

    GraphQLCompositeType compositeType(TypeName typeName, SourcePosition position) {
        GraphQLType type = this.schema.getType(typeName.getName());
        if (type == null)
            throw new CompilationError("Unknown type " + typeName.getName(), position);
        if (!(type instanceof GraphQLCompositeType))
            throw new CompilationError("Type condition on non-composite type " + typeName.getName(), position);
        return (GraphQLCompositeType) type;
    }

    GraphQLType typeFromAst(Type type) {
        if (type instanceof NonNullType)
            return GraphQLNonNull.nonNull(this.typeFromAst(((NonNullType) type).getType()));
        if (type instanceof ListType)
            return GraphQLList.list(this.typeFromAst(((ListType) type).getType()));
        TypeName typeName = (TypeName) type;
        GraphQLType result = this.schema.getType(typeName.getName());
        if (result == null)
            throw new CompilationError("Unknown type " + typeName.getName(), position(typeName));
        return result;
    }

    @Nullable
    Object valueFromAst(Value value, SourcePosition position) {
        if (value instanceof VariableReference)
            return new IRVariableReference(((VariableReference) value).getName());
        if (value instanceof StringValue)
            return ((StringValue) value).getValue();
        if (value instanceof IntValue)
            return ((IntValue) value).getValue();
        if (value instanceof FloatValue)
            return ((FloatValue) value).getValue();
        if (value instanceof BooleanValue)
            return ((BooleanValue) value).isValue();
        if (value instanceof NullValue)
            return null;
        if (value instanceof EnumValue)
            return ((EnumValue) value).getName();
        if (value instanceof ArrayValue) {
            List<Object> result = new ArrayList<>();
            for (Value element: ((ArrayValue) value).getValues())
                result.add(this.valueFromAst(element, position));
            return Collections.unmodifiableList(result);
        }
        if (value instanceof ObjectValue) {
            Map<String, Object> result = new LinkedHashMap<>();
            for (ObjectField field: ((ObjectValue) value).getObjectFields())
                result.put(field.getName(), this.valueFromAst(field.getValue(), position));
            return Collections.unmodifiableMap(result);
        }
        throw new InternalCompilerError("Unexpected value " + value, position);
    }

    /** Record the types code generators must declare: enums, input objects
     * and their field types, and scalars other than the built-in ones. */
    void addTypeUsed(GraphQLNamedType type) {
        boolean needed = type instanceof GraphQLEnumType ||
                type instanceof GraphQLInputObjectType ||
                (type instanceof GraphQLScalarType && !BUILTIN_SCALARS.contains(type.getName()));
        if (!needed || !this.typesUsed.add(type))
            return;
        if (type instanceof GraphQLInputObjectType) {
            for (GraphQLInputObjectField field: ((GraphQLInputObjectType) type).getFieldDefinitions())
                this.addTypeUsed(GraphQLTypeUtil.unwrapAll(field.getType()));
        }
    }
}
