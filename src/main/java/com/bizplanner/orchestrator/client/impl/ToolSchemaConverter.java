package com.bizplanner.orchestrator.client.impl;

import com.bizplanner.orchestrator.client.ToolSchema;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Converts a skill's JSON-schema parameter map into a LangChain4j
 * {@link ToolSpecification}. Unknown or missing types fall back to string.
 */
public final class ToolSchemaConverter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ToolSchemaConverter() {
    }

    public static ToolSpecification toSpecification(ToolSchema schema) {
        JsonNode root = MAPPER.valueToTree(schema.getParameters());
        return ToolSpecification.builder()
                .name(schema.getName())
                .description(schema.getDescription())
                .parameters(parseObject(root))
                .build();
    }

    private static JsonSchemaElement parseElement(JsonNode node) {
        if (!node.has("type")) {
            if (node.has("properties")) {
                return parseObject(node);
            }
            return JsonStringSchema.builder().description(description(node)).build();
        }

        String type = node.get("type").asText();
        switch (type) {
            case "object":
                return parseObject(node);
            case "array":
                return parseArray(node);
            case "integer":
                return JsonIntegerSchema.builder().description(description(node)).build();
            case "number":
                return JsonNumberSchema.builder().description(description(node)).build();
            case "boolean":
                return JsonBooleanSchema.builder().description(description(node)).build();
            case "string":
            default:
                return parseString(node);
        }
    }

    private static JsonObjectSchema parseObject(JsonNode node) {
        JsonObjectSchema.Builder builder = JsonObjectSchema.builder();
        if (node.has("description")) {
            builder.description(node.get("description").asText());
        }

        if (node.has("properties")) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.get("properties").fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                builder.addProperty(field.getKey(), parseElement(field.getValue()));
            }
        }

        if (node.has("required") && node.get("required").isArray()) {
            List<String> required = new ArrayList<>();
            node.get("required").forEach(n -> required.add(n.asText()));
            builder.required(required);
        }
        return builder.build();
    }

    private static JsonArraySchema parseArray(JsonNode node) {
        JsonArraySchema.Builder builder = JsonArraySchema.builder().description(description(node));
        builder.items(node.has("items") ? parseElement(node.get("items")) : JsonStringSchema.builder().build());
        return builder.build();
    }

    private static JsonSchemaElement parseString(JsonNode node) {
        if (node.has("enum")) {
            List<String> values = new ArrayList<>();
            node.get("enum").forEach(n -> values.add(n.asText()));
            return JsonEnumSchema.builder()
                    .description(description(node))
                    .enumValues(values)
                    .build();
        }
        return JsonStringSchema.builder().description(description(node)).build();
    }

    private static String description(JsonNode node) {
        return node.has("description") ? node.get("description").asText() : null;
    }
}
