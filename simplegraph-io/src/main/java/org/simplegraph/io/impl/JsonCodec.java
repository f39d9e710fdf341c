package org.simplegraph.io.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.StreamReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.simplegraph.common.Codec;
import org.simplegraph.common.DecodeException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link Codec} on top of the Jackson tree model.
 * <p>
 * Reading is strict: content after the first JSON value and duplicate keys in an object are errors.
 * Non-finite doubles are written as the strings <code>"NaN"</code>, <code>"Infinity"</code> and
 * <code>"-Infinity"</code>, which {@link #decodeDouble(EncodedValue)} reads back.
 */
public class JsonCodec implements Codec {
    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private final ObjectMapper objectMapper;

    public record D(JsonNode node) implements EncodedValue {
        @Override
        public String toString() {
            return node.toString();
        }
    }

    public JsonCodec() {
        this(false);
    }

    public JsonCodec(boolean prettyPrint) {
        objectMapper = JsonMapper.builder()
                .enable(StreamReadFeature.STRICT_DUPLICATE_DETECTION)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                .configure(SerializationFeature.INDENT_OUTPUT, prettyPrint)
                .build();
    }

    public String write(EncodedValue encodedValue) {
        try {
            return objectMapper.writeValueAsString(node(encodedValue));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot write JSON tree", e);
        }
    }

    public EncodedValue read(String json) {
        if (json == null) throw new DecodeException("Empty JSON input");
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node.isMissingNode()) {
                throw new DecodeException("Empty JSON input");
            }
            return new D(node);
        } catch (JsonProcessingException e) {
            throw new DecodeException("Cannot parse JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode node(EncodedValue encodedValue) {
        if (encodedValue instanceof D d) return d.node;
        throw new UnsupportedOperationException("Not a JSON value: " + encodedValue);
    }

    @Override
    public EncodedValue encodeInt(int i) {
        return new D(FACTORY.numberNode(i));
    }

    @Override
    public EncodedValue encodeLong(long l) {
        return new D(FACTORY.numberNode(l));
    }

    @Override
    public EncodedValue encodeDouble(double d) {
        return new D(FACTORY.numberNode(d));
    }

    @Override
    public EncodedValue encodeString(String s) {
        return new D(FACTORY.textNode(s));
    }

    @Override
    public EncodedValue encodeList(List<EncodedValue> list) {
        ArrayNode arrayNode = FACTORY.arrayNode(list.size());
        for (EncodedValue ev : list) {
            arrayNode.add(node(ev));
        }
        return new D(arrayNode);
    }

    @Override
    public EncodedValue encodeMap(Map<String, EncodedValue> map) {
        ObjectNode objectNode = FACTORY.objectNode();
        map.forEach((key, value) -> objectNode.set(key, node(value)));
        return new D(objectNode);
    }

    @Override
    public int decodeInt(EncodedValue encodedValue) {
        JsonNode node = node(encodedValue);
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new DecodeException("Expected an int, got " + node);
        }
        return node.intValue();
    }

    @Override
    public long decodeLong(EncodedValue encodedValue) {
        JsonNode node = node(encodedValue);
        if (!node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new DecodeException("Expected a long, got " + node);
        }
        return node.longValue();
    }

    @Override
    public double decodeDouble(EncodedValue encodedValue) {
        JsonNode node = node(encodedValue);
        if (node.isNumber()) return node.doubleValue();
        if (node.isTextual()) {
            return switch (node.textValue()) {
                case "NaN" -> Double.NaN;
                case "Infinity" -> Double.POSITIVE_INFINITY;
                case "-Infinity" -> Double.NEGATIVE_INFINITY;
                default -> throw new DecodeException("Expected a number, got " + node);
            };
        }
        throw new DecodeException("Expected a number, got " + node);
    }

    @Override
    public String decodeString(EncodedValue encodedValue) {
        JsonNode node = node(encodedValue);
        if (!node.isTextual()) {
            throw new DecodeException("Expected a string, got " + node);
        }
        return node.textValue();
    }

    @Override
    public List<EncodedValue> decodeList(EncodedValue encodedValue) {
        JsonNode node = node(encodedValue);
        if (!node.isArray()) {
            throw new DecodeException("Expected an array, got " + node);
        }
        List<EncodedValue> list = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            list.add(new D(element));
        }
        return list;
    }

    @Override
    public Map<String, EncodedValue> decodeMap(EncodedValue encodedValue) {
        JsonNode node = node(encodedValue);
        if (!node.isObject()) {
            throw new DecodeException("Expected an object, got " + node);
        }
        Map<String, EncodedValue> map = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            map.put(field.getKey(), new D(field.getValue()));
        }
        return map;
    }
}
