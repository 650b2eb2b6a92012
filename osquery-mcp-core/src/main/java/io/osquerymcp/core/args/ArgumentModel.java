package io.osquerymcp.core.args;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.victools.jsonschema.generator.FieldScope;
import com.github.victools.jsonschema.generator.Option;
import com.github.victools.jsonschema.generator.OptionPreset;
import com.github.victools.jsonschema.generator.SchemaGenerator;
import com.github.victools.jsonschema.generator.SchemaGeneratorConfigBuilder;
import com.github.victools.jsonschema.generator.SchemaVersion;
import com.github.victools.jsonschema.module.jackson.JacksonModule;
import com.github.victools.jsonschema.module.jackson.JacksonOption;
import io.osquerymcp.core.OsQueryObjectMappers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Typed argument contract for one tool.
 *
 * <p>Wraps a parameter record and provides:
 * <ul>
 *   <li>the JSON Schema advertised to MCP clients (generated with victools from the
 *       record's Jackson annotations, merged with the shared {@link ClusterTarget} fields)</li>
 *   <li>{@link #bind(Map)}, a pure function from raw arguments to {@link ToolArguments}</li>
 * </ul>
 *
 * <p>Required fields are those marked {@code @JsonProperty(required = true)}. Defaults
 * come from {@code @JsonProperty(defaultValue = ...)}. Unknown fields are ignored.
 *
 * @param <P> Parameter record type
 */
public final class ArgumentModel<P> {

    private static final Logger log = LoggerFactory.getLogger(ArgumentModel.class);

    private static final ObjectMapper MAPPER = OsQueryObjectMappers.create()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private static final SchemaGenerator SCHEMA_GENERATOR;

    static {
        JacksonModule jacksonModule = new JacksonModule(JacksonOption.RESPECT_JSONPROPERTY_REQUIRED);
        SchemaGeneratorConfigBuilder configBuilder = new SchemaGeneratorConfigBuilder(
                SchemaVersion.DRAFT_2020_12, OptionPreset.PLAIN_JSON)
            .with(jacksonModule)
            .without(Option.SCHEMA_VERSION_INDICATOR);

        configBuilder.forFields().withDefaultResolver(ArgumentModel::resolveDefault);

        SCHEMA_GENERATOR = new SchemaGenerator(configBuilder.build());
    }

    private final Class<P> paramsType;
    private final Map<String, Object> inputSchema;
    private final List<String> requiredFields;

    private ArgumentModel(Class<P> paramsType) {
        this.paramsType = paramsType;

        Map<String, Object> clusterSchema = generateSchema(ClusterTarget.class);
        Map<String, Object> paramsSchema = generateSchema(paramsType);

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.putAll(propertiesOf(clusterSchema));
        properties.putAll(propertiesOf(paramsSchema));

        this.requiredFields = requiredOf(paramsSchema);

        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put("type", "object");
        schema.put("properties", Collections.unmodifiableMap(properties));
        if (!requiredFields.isEmpty()) {
            schema.put("required", requiredFields);
        }
        this.inputSchema = Collections.unmodifiableMap(schema);
    }

    /**
     * Create the argument model for a parameter record.
     *
     * @param paramsType Record class annotated with Jackson property annotations
     * @param <P>        Parameter type
     * @return The model
     */
    public static <P> ArgumentModel<P> of(Class<P> paramsType) {
        return new ArgumentModel<>(paramsType);
    }

    public Class<P> paramsType() {
        return paramsType;
    }

    /**
     * @return JSON Schema ({@code type}, {@code properties}, optional {@code required})
     */
    public Map<String, Object> inputSchema() {
        return inputSchema;
    }

    public List<String> requiredFields() {
        return requiredFields;
    }

    /**
     * Validate and convert raw arguments.
     *
     * @param rawArguments Arguments as received (may be null)
     * @return Typed arguments
     * @throws ArgumentValidationException listing every problem found
     */
    public ToolArguments<P> bind(Map<String, Object> rawArguments) {
        Map<String, Object> source = rawArguments != null ? rawArguments : Map.of();
        List<ValidationError> errors = new ArrayList<>();

        Object clusterValue = source.get(ClusterTarget.FIELD);
        if (clusterValue != null && !(clusterValue instanceof String)) {
            errors.add(new ValidationError(ClusterTarget.FIELD, "must be a string"));
        }
        for (String field : requiredFields) {
            if (source.get(field) == null) {
                errors.add(new ValidationError(field, "field required"));
            }
        }
        if (!errors.isEmpty()) {
            throw new ArgumentValidationException(errors);
        }

        Map<String, Object> paramValues = new LinkedHashMap<>(source);
        paramValues.remove(ClusterTarget.FIELD);

        P params;
        try {
            params = MAPPER.convertValue(paramValues, paramsType);
        } catch (IllegalArgumentException e) {
            throw new ArgumentValidationException(List.of(describe(e)));
        }

        if (params instanceof ValidatedParams) {
            List<ValidationError> violations = ((ValidatedParams) params).validate();
            if (!violations.isEmpty()) {
                throw new ArgumentValidationException(violations);
            }
        }

        log.debug("Bound {} arguments: {}", paramsType.getSimpleName(), params);
        return new ToolArguments<>(new ClusterTarget((String) clusterValue), params);
    }

    private static ValidationError describe(IllegalArgumentException e) {
        if (e.getCause() instanceof JsonMappingException) {
            JsonMappingException mapping = (JsonMappingException) e.getCause();
            String field = mapping.getPath().stream()
                .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : "[" + ref.getIndex() + "]")
                .collect(Collectors.joining("."));
            return new ValidationError(field, mapping.getOriginalMessage());
        }
        return new ValidationError("", e.getMessage());
    }

    private static Map<String, Object> generateSchema(Class<?> type) {
        ObjectNode node = SCHEMA_GENERATOR.generateSchema(type);
        return MAPPER.convertValue(node, new TypeReference<Map<String, Object>>() {});
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> propertiesOf(Map<String, Object> schema) {
        Object properties = schema.get("properties");
        return properties instanceof Map ? (Map<String, Object>) properties : Map.of();
    }

    @SuppressWarnings("unchecked")
    private static List<String> requiredOf(Map<String, Object> schema) {
        Object required = schema.get("required");
        return required instanceof List ? List.copyOf((List<String>) required) : List.of();
    }

    private static Object resolveDefault(FieldScope field) {
        JsonProperty property = field.getAnnotationConsideringFieldAndGetter(JsonProperty.class);
        if (property == null || property.defaultValue().isEmpty()) {
            return null;
        }
        String value = property.defaultValue();
        Class<?> type = field.getType().getErasedType();
        if (type == boolean.class || type == Boolean.class) {
            return Boolean.valueOf(value);
        }
        if (type == int.class || type == Integer.class) {
            return Integer.valueOf(value);
        }
        return value;
    }
}
