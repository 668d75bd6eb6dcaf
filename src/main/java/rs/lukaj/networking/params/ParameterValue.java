package rs.lukaj.networking.params;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import rs.lukaj.networking.EncodingException;
import rs.lukaj.networking.Utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.*;

/**
 * Request parameters, as one of: scalar (string, number, boolean, null), sequence, mapping with string
 * keys, or a binary {@link FormDataPart}. Loosely-typed parameters (maps, lists, arrays, boxed
 * primitives, Jackson trees) are converted using {@link #of(Object)}; anything else is rejected.
 */
public abstract class ParameterValue {

    public enum Kind {
        SCALAR, SEQUENCE, MAPPING, PART
    }

    private ParameterValue() {
    }

    public abstract Kind getKind();

    /**
     * Converts a loosely-typed parameter object.
     * @param raw parameters as passed by the caller
     * @return tagged representation of the parameters
     * @throws EncodingException if raw, or anything it contains, isn't a supported parameter
     */
    public static ParameterValue of(Object raw) throws EncodingException {
        if(raw instanceof ParameterValue) return (ParameterValue) raw;
        if(raw == null || raw instanceof CharSequence || raw instanceof Number || raw instanceof Boolean
                || raw instanceof Character || raw instanceof Enum) {
            return new Scalar(raw);
        }
        if(raw instanceof FormDataPart) return new Part((FormDataPart) raw);
        if(raw instanceof JsonNode) {
            return of(Utils.jsonMapper().convertValue(raw, Object.class));
        }
        if(raw instanceof Map) {
            Map<String, ParameterValue> entries = new LinkedHashMap<>();
            for(Map.Entry<?, ?> entry : ((Map<?, ?>) raw).entrySet()) {
                if(!(entry.getKey() instanceof String))
                    throw new EncodingException("Parameter names must be strings, got " + entry.getKey());
                entries.put((String) entry.getKey(), of(entry.getValue()));
            }
            return new Mapping(entries);
        }
        if(raw instanceof Collection) {
            List<ParameterValue> elements = new ArrayList<>();
            for(Object element : (Collection<?>) raw) elements.add(of(element));
            return new Sequence(elements);
        }
        if(raw instanceof Object[]) {
            return of(Arrays.asList((Object[]) raw));
        }
        throw new EncodingException("Unsupported parameter type: " + raw.getClass().getName());
    }

    public Object getScalar() {
        throw new IllegalStateException(getKind() + " is not a scalar");
    }

    public List<ParameterValue> getElements() {
        throw new IllegalStateException(getKind() + " is not a sequence");
    }

    public Map<String, ParameterValue> getEntries() {
        throw new IllegalStateException(getKind() + " is not a mapping");
    }

    public FormDataPart getPart() {
        throw new IllegalStateException(getKind() + " is not a part");
    }

    /**
     * @return scalar as it's written in forms; null is an empty string
     */
    public String asText() {
        Object scalar = getScalar();
        if(scalar == null) return "";
        if(scalar instanceof Enum) return ((Enum<?>) scalar).name();
        return scalar.toString();
    }

    /**
     * @return JSON tree representing these parameters
     * @throws EncodingException if parameters contain a part or a non-finite number
     */
    public abstract JsonNode toJson() throws EncodingException;


    private static final class Scalar extends ParameterValue {
        private final Object value;

        private Scalar(Object value) {
            this.value = value;
        }

        @Override
        public Kind getKind() {
            return Kind.SCALAR;
        }

        @Override
        public Object getScalar() {
            return value;
        }

        @Override
        public JsonNode toJson() throws EncodingException {
            JsonNodeFactory nodes = JsonNodeFactory.instance;
            if(value == null) return nodes.nullNode();
            if(value instanceof Boolean) return nodes.booleanNode((Boolean) value);
            if(value instanceof BigDecimal) return nodes.numberNode((BigDecimal) value);
            if(value instanceof BigInteger) return nodes.numberNode((BigInteger) value);
            if(value instanceof Double || value instanceof Float) {
                double d = ((Number) value).doubleValue();
                if(Double.isNaN(d) || Double.isInfinite(d))
                    throw new EncodingException("Cannot represent " + d + " in JSON");
                return nodes.numberNode(d);
            }
            if(value instanceof Number) return nodes.numberNode(((Number) value).longValue());
            return nodes.textNode(asText());
        }
    }

    private static final class Sequence extends ParameterValue {
        private final List<ParameterValue> elements;

        private Sequence(List<ParameterValue> elements) {
            this.elements = Collections.unmodifiableList(elements);
        }

        @Override
        public Kind getKind() {
            return Kind.SEQUENCE;
        }

        @Override
        public List<ParameterValue> getElements() {
            return elements;
        }

        @Override
        public JsonNode toJson() throws EncodingException {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            for(ParameterValue element : elements) array.add(element.toJson());
            return array;
        }
    }

    private static final class Mapping extends ParameterValue {
        private final Map<String, ParameterValue> entries;

        private Mapping(Map<String, ParameterValue> entries) {
            this.entries = Collections.unmodifiableMap(entries);
        }

        @Override
        public Kind getKind() {
            return Kind.MAPPING;
        }

        @Override
        public Map<String, ParameterValue> getEntries() {
            return entries;
        }

        @Override
        public JsonNode toJson() throws EncodingException {
            ObjectNode object = JsonNodeFactory.instance.objectNode();
            for(Map.Entry<String, ParameterValue> entry : entries.entrySet())
                object.set(entry.getKey(), entry.getValue().toJson());
            return object;
        }
    }

    private static final class Part extends ParameterValue {
        private final FormDataPart part;

        private Part(FormDataPart part) {
            this.part = part;
        }

        @Override
        public Kind getKind() {
            return Kind.PART;
        }

        @Override
        public FormDataPart getPart() {
            return part;
        }

        @Override
        public JsonNode toJson() throws EncodingException {
            throw new EncodingException("Form data part " + part.getFieldName() + " can't be sent as JSON");
        }
    }
}
