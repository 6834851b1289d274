package org.gqlcg.graphqlCompiler.compiler.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import graphql.schema.GraphQLEnumType;
import graphql.schema.GraphQLEnumValueDefinition;
import graphql.schema.GraphQLInputObjectField;
import graphql.schema.GraphQLInputObjectType;
import graphql.schema.GraphQLNamedType;
import graphql.schema.GraphQLObjectType;
import graphql.schema.GraphQLScalarType;
import graphql.schema.GraphQLTypeUtil;
import org.gqlcg.graphqlCompiler.compiler.errors.InternalCompilerError;
import org.gqlcg.graphqlCompiler.compiler.legacy.CompiledFragment;
import org.gqlcg.graphqlCompiler.compiler.legacy.CompiledInlineFragment;
import org.gqlcg.graphqlCompiler.compiler.legacy.CompiledOperation;
import org.gqlcg.graphqlCompiler.compiler.legacy.LegacyCompilationContext;
import org.gqlcg.graphqlCompiler.compiler.legacy.LegacyField;
import org.gqlcg.graphqlCompiler.ir.IRArgument;
import org.gqlcg.graphqlCompiler.ir.IRVariable;
import org.gqlcg.graphqlCompiler.ir.IRVariableReference;
import org.gqlcg.util.Utilities;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/** Renders the legacy IR as JSON for the code generators.
 * Types are written in their printed GraphQL form, e.g. {@code [Pet!]!}. */
public class LegacyIRJsonWriter {
    final ObjectMapper mapper;

    public LegacyIRJsonWriter() {
        this.mapper = Utilities.deterministicObjectMapper();
    }

    public ObjectNode toJson(LegacyCompilationContext context) {
        ObjectNode result = this.mapper.createObjectNode();
        ArrayNode operations = result.putArray("operations");
        for (CompiledOperation operation: context.operations.values())
            operations.add(this.operation(operation));
        ArrayNode fragments = result.putArray("fragments");
        for (CompiledFragment fragment: context.fragments.values())
            fragments.add(this.fragment(fragment));
        ArrayNode types = result.putArray("typesUsed");
        for (GraphQLNamedType type: context.typesUsed)
            types.add(this.typeUsed(type));
        return result;
    }

    public String toJsonString(LegacyCompilationContext context) {
        try {
            return this.mapper.writerWithDefaultPrettyPrinter().writeValueAsString(this.toJson(context));
        } catch (JsonProcessingException ex) {
            throw new InternalCompilerError("Could not serialize legacy IR", ex);
        }
    }

    ObjectNode operation(CompiledOperation operation) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("operationName", operation.operationName);
        result.put("operationType", operation.operationType);
        result.put("rootType", operation.rootType.getName());
        ArrayNode variables = result.putArray("variables");
        for (IRVariable variable: operation.variables) {
            ObjectNode node = variables.addObject();
            node.put("name", variable.name());
            node.put("type", GraphQLTypeUtil.simplePrint(variable.type()));
        }
        result.put("source", operation.source);
        result.put("sourceWithFragments", operation.sourceWithFragments);
        if (operation.operationId != null)
            result.put("operationId", operation.operationId);
        this.body(result, operation.fields, operation.fragmentSpreads, operation.inlineFragments);
        this.strings(result.putArray("fragmentsReferenced"), operation.fragmentsReferenced);
        return result;
    }

    ObjectNode fragment(CompiledFragment fragment) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("fragmentName", fragment.fragmentName);
        result.put("source", fragment.source);
        result.put("typeCondition", GraphQLTypeUtil.simplePrint(fragment.typeCondition));
        this.typeNames(result.putArray("possibleTypes"), fragment.possibleTypes);
        this.body(result, fragment.fields, fragment.fragmentSpreads, fragment.inlineFragments);
        return result;
    }

    void body(ObjectNode node, List<LegacyField> fields, List<String> fragmentSpreads,
              List<CompiledInlineFragment> inlineFragments) {
        ArrayNode fieldArray = node.putArray("fields");
        for (LegacyField field: fields)
            fieldArray.add(this.field(field));
        this.strings(node.putArray("fragmentSpreads"), fragmentSpreads);
        ArrayNode inlineArray = node.putArray("inlineFragments");
        for (CompiledInlineFragment inline: inlineFragments) {
            ObjectNode inlineNode = inlineArray.addObject();
            inlineNode.put("typeCondition", inline.typeCondition().getName());
            this.typeNames(inlineNode.putArray("possibleTypes"), inline.possibleTypes());
            ArrayNode inlineFields = inlineNode.putArray("fields");
            for (LegacyField field: inline.fields())
                inlineFields.add(this.field(field));
            this.strings(inlineNode.putArray("fragmentSpreads"), inline.fragmentSpreads());
        }
    }

    ObjectNode field(LegacyField field) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("responseName", field.responseName);
        result.put("fieldName", field.fieldName);
        result.put("type", GraphQLTypeUtil.simplePrint(field.type));
        if (!field.args.isEmpty()) {
            ArrayNode args = result.putArray("args");
            for (IRArgument arg: field.args) {
                ObjectNode argNode = args.addObject();
                argNode.put("name", arg.name());
                argNode.set("value", this.value(arg.value()));
            }
        }
        result.put("isConditional", field.isConditional);
        if (field.description != null)
            result.put("description", field.description);
        result.put("isDeprecated", field.isDeprecated);
        if (field.deprecationReason != null)
            result.put("deprecationReason", field.deprecationReason);
        if (field.hasSelectionSet())
            this.body(result, field.fields, field.fragmentSpreads, field.inlineFragments);
        return result;
    }

    /** Argument values as produced by the front end. */
    JsonNode value(@Nullable Object value) {
        JsonNodeFactory factory = this.mapper.getNodeFactory();
        if (value == null)
            return factory.nullNode();
        if (value instanceof IRVariableReference) {
            ObjectNode result = factory.objectNode();
            result.put("kind", "Variable");
            result.put("variableName", ((IRVariableReference) value).variableName());
            return result;
        }
        if (value instanceof String)
            return factory.textNode((String) value);
        if (value instanceof Boolean)
            return factory.booleanNode((Boolean) value);
        if (value instanceof BigInteger)
            return factory.numberNode((BigInteger) value);
        if (value instanceof BigDecimal)
            return factory.numberNode((BigDecimal) value);
        if (value instanceof List) {
            ArrayNode result = factory.arrayNode();
            for (Object element: (List<?>) value)
                result.add(this.value(element));
            return result;
        }
        if (value instanceof Map) {
            ObjectNode result = factory.objectNode();
            for (Map.Entry<?, ?> entry: ((Map<?, ?>) value).entrySet())
                result.set(entry.getKey().toString(), this.value(entry.getValue()));
            return result;
        }
        throw new InternalCompilerError("Unexpected argument value " + value);
    }

    ObjectNode typeUsed(GraphQLNamedType type) {
        ObjectNode result = this.mapper.createObjectNode();
        result.put("name", type.getName());
        if (type.getDescription() != null)
            result.put("description", type.getDescription());
        if (type instanceof GraphQLEnumType) {
            result.put("kind", "EnumType");
            ArrayNode values = result.putArray("values");
            for (GraphQLEnumValueDefinition value: ((GraphQLEnumType) type).getValues()) {
                ObjectNode node = values.addObject();
                node.put("name", value.getName());
                if (value.getDescription() != null)
                    node.put("description", value.getDescription());
                node.put("isDeprecated", value.isDeprecated());
                if (value.getDeprecationReason() != null)
                    node.put("deprecationReason", value.getDeprecationReason());
            }
        } else if (type instanceof GraphQLInputObjectType) {
            result.put("kind", "InputObjectType");
            ArrayNode fields = result.putArray("fields");
            for (GraphQLInputObjectField field: ((GraphQLInputObjectType) type).getFieldDefinitions()) {
                ObjectNode node = fields.addObject();
                node.put("name", field.getName());
                node.put("type", GraphQLTypeUtil.simplePrint(field.getType()));
                if (field.getDescription() != null)
                    node.put("description", field.getDescription());
            }
        } else if (type instanceof GraphQLScalarType) {
            result.put("kind", "ScalarType");
        } else {
            throw new InternalCompilerError("Unexpected type used " + GraphQLTypeUtil.simplePrint(type));
        }
        return result;
    }

    void typeNames(ArrayNode array, List<GraphQLObjectType> types) {
        for (GraphQLObjectType type: types)
            array.add(type.getName());
    }

    void strings(ArrayNode array, List<String> values) {
        for (String value: values)
            array.add(value);
    }
}
