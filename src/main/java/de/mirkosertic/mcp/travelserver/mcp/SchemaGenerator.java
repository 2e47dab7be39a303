package de.mirkosertic.mcp.travelserver.mcp;

import io.modelcontextprotocol.spec.McpSchema;
import org.jspecify.annotations.Nullable;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives MCP tool input schemas from request records.
 * <p>
 * Every record component becomes a property. Components annotated with {@link Nullable} are
 * optional, all others are listed as required. {@link Description} texts are carried over.
 */
public final class SchemaGenerator {

    private SchemaGenerator() {
    }

    public static McpSchema.JsonSchema generateSchema(final Class<? extends Record> recordClass) {
        final Map<String, Object> properties = new LinkedHashMap<>();
        final List<String> required = new ArrayList<>();

        for (final RecordComponent component : recordClass.getRecordComponents()) {
            properties.put(component.getName(), propertySchema(component));
            if (!isNullable(component)) {
                required.add(component.getName());
            }
        }

        return new McpSchema.JsonSchema("object", properties, required, null, null, null);
    }

    /**
     * Schema for tools without arguments.
     */
    public static McpSchema.JsonSchema emptySchema() {
        return new McpSchema.JsonSchema("object", Map.of(), List.of(), null, null, null);
    }

    // JSpecify's @Nullable is a type-use annotation and sits on the component type
    private static boolean isNullable(final RecordComponent component) {
        return component.isAnnotationPresent(Nullable.class)
                || component.getAnnotatedType().isAnnotationPresent(Nullable.class);
    }

    private static Map<String, Object> propertySchema(final RecordComponent component) {
        final Map<String, Object> schema = new LinkedHashMap<>();

        final Description description = component.getAnnotation(Description.class);
        if (description != null) {
            schema.put("description", description.value());
        }

        final Type type = component.getGenericType();
        if (type instanceof ParameterizedType parameterized
                && parameterized.getRawType() instanceof Class<?> raw
                && Collection.class.isAssignableFrom(raw)) {
            schema.put("type", "array");
            final Type[] arguments = parameterized.getActualTypeArguments();
            final Class<?> itemClass = arguments.length > 0 && arguments[0] instanceof Class<?> c ? c : Object.class;
            schema.put("items", Map.of("type", jsonType(itemClass)));
        } else if (type instanceof Class<?> clazz) {
            schema.put("type", jsonType(clazz));
            if (clazz.isEnum()) {
                final List<String> values = new ArrayList<>();
                for (final Object constant : clazz.getEnumConstants()) {
                    values.add(((Enum<?>) constant).name());
                }
                schema.put("enum", values);
            }
        } else {
            schema.put("type", "object");
        }

        return schema;
    }

    static String jsonType(final Class<?> clazz) {
        if (clazz == String.class || clazz.isEnum()) {
            return "string";
        }
        if (clazz == Integer.class || clazz == int.class || clazz == Long.class || clazz == long.class) {
            return "integer";
        }
        if (clazz == Double.class || clazz == double.class || clazz == Float.class || clazz == float.class) {
            return "number";
        }
        if (clazz == Boolean.class || clazz == boolean.class) {
            return "boolean";
        }
        return "object";
    }
}
