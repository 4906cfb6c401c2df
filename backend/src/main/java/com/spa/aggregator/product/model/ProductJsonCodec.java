package com.spa.aggregator.product.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts {@link NormalizedProduct} to and from the persisted {@code normalized_json} document.
 * Keys are snake_case; each field is {@code {"value","confidence","source","raw_excerpt"}}.
 * Unknown keys are ignored and values of the wrong kind are read as absent.
 */
@Component
public class ProductJsonCodec {
    private static final Logger log = LoggerFactory.getLogger(ProductJsonCodec.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public ProductJsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(NormalizedProduct product) {
        try {
            return objectMapper.writeValueAsString(toTree(product));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize product " + product.id(), e);
        }
    }

    public ObjectNode toTree(NormalizedProduct product) {
        ObjectNode root = objectMapper.createObjectNode();
        if (product.id() != null) {
            root.put("id", product.id());
        }
        for (ProductAttribute attribute : ProductAttribute.values()) {
            Field<?> field = product.get(attribute);
            if (field.isPresent()) {
                root.set(attribute.key(), writeField(field));
            }
        }
        ArrayNode underlyings = root.putArray(ProductListAttribute.UNDERLYINGS.key());
        for (Underlying underlying : product.underlyings()) {
            ObjectNode node = underlyings.addObject();
            underlying.fields().forEach((attribute, field) -> node.set(attribute.key(), writeField(field)));
        }
        ArrayNode schedule = root.putArray(ProductListAttribute.COUPON_SCHEDULE.key());
        for (CouponScheduleItem item : product.couponSchedule()) {
            ObjectNode node = schedule.addObject();
            node.set("date", writeField(item.date()));
            node.set("amount", writeField(item.amount()));
            node.set("currency", writeField(item.currency()));
        }
        writeFieldList(root, ProductListAttribute.CALL_OBSERVATION_DATES, product.callObservationDates());
        writeFieldList(root, ProductListAttribute.CALL_SETTLEMENT_DATES, product.callSettlementDates());
        writeFieldList(root, ProductListAttribute.SELLING_RESTRICTIONS, product.sellingRestrictions());
        ArrayNode audit = root.putArray("audit_trail");
        for (AuditEntry entry : product.auditTrail()) {
            ObjectNode node = audit.addObject();
            node.put("field", entry.field());
            node.put("from", entry.from());
            node.put("to", entry.to());
            node.put("reason", entry.reason());
        }
        return root;
    }

    /**
     * @throws IllegalArgumentException when the document is not valid JSON
     */
    public NormalizedProduct fromJson(String json) {
        if (json == null || json.isBlank()) {
            return NormalizedProduct.empty();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("normalized_json is not valid JSON", e);
        }
        return fromTree(root);
    }

    public NormalizedProduct fromTree(JsonNode root) {
        NormalizedProduct.Builder builder = NormalizedProduct.builder();
        if (root == null || !root.isObject()) {
            return builder.build();
        }
        if (root.hasNonNull("id")) {
            builder.id(root.get("id").asText());
        }
        for (ProductAttribute attribute : ProductAttribute.values()) {
            builder.field(attribute, readField(root.get(attribute.key()), attribute.kind()));
        }

        List<Underlying> underlyings = new ArrayList<>();
        for (JsonNode node : arrayOf(root, ProductListAttribute.UNDERLYINGS.key())) {
            Underlying underlying = Underlying.empty();
            for (UnderlyingAttribute attribute : UnderlyingAttribute.values()) {
                underlying = underlying.with(attribute, readField(node.get(attribute.key()), attribute.kind()));
            }
            underlyings.add(underlying);
        }
        builder.underlyings(underlyings);

        List<CouponScheduleItem> schedule = new ArrayList<>();
        for (JsonNode node : arrayOf(root, ProductListAttribute.COUPON_SCHEDULE.key())) {
            schedule.add(new CouponScheduleItem(
                text(readField(node.get("date"), ValueKind.TEXT)),
                number(readField(node.get("amount"), ValueKind.NUMBER)),
                text(readField(node.get("currency"), ValueKind.TEXT))
            ));
        }
        builder.couponSchedule(schedule);
        builder.callObservationDates(readFieldList(root, ProductListAttribute.CALL_OBSERVATION_DATES));
        builder.callSettlementDates(readFieldList(root, ProductListAttribute.CALL_SETTLEMENT_DATES));
        builder.sellingRestrictions(readFieldList(root, ProductListAttribute.SELLING_RESTRICTIONS));

        List<AuditEntry> audit = new ArrayList<>();
        for (JsonNode node : arrayOf(root, "audit_trail")) {
            audit.add(new AuditEntry(
                node.path("field").asText(null),
                node.path("from").asText(null),
                node.path("to").asText(null),
                node.path("reason").asText(null)
            ));
        }
        builder.auditTrail(audit);
        return builder.build();
    }

    private ObjectNode writeField(Field<?> field) {
        ObjectNode node = objectMapper.createObjectNode();
        node.set("value", objectMapper.valueToTree(field.value()));
        node.put("confidence", field.confidence());
        node.put("source", field.source());
        if (field.evidence() == null) {
            node.putNull("raw_excerpt");
        } else {
            node.put("raw_excerpt", field.evidence());
        }
        return node;
    }

    private void writeFieldList(ObjectNode root, ProductListAttribute attribute, List<Field<String>> fields) {
        ArrayNode array = root.putArray(attribute.key());
        fields.forEach(field -> array.add(writeField(field)));
    }

    private List<Field<String>> readFieldList(JsonNode root, ProductListAttribute attribute) {
        List<Field<String>> fields = new ArrayList<>();
        for (JsonNode node : arrayOf(root, attribute.key())) {
            Field<String> field = text(readField(node, ValueKind.TEXT));
            if (field.isPresent()) {
                fields.add(field);
            }
        }
        return fields;
    }

    private Field<?> readField(JsonNode node, ValueKind kind) {
        if (node == null || !node.isObject()) {
            return Field.empty();
        }
        double confidence = node.path("confidence").asDouble(0.0);
        String source = node.path("source").asText(null);
        String evidence = node.hasNonNull("raw_excerpt") ? node.get("raw_excerpt").asText() : null;
        return new Field<>(readValue(node.get("value"), kind), confidence, source, evidence);
    }

    private Object readValue(JsonNode value, ValueKind kind) {
        if (value == null || value.isNull()) {
            return null;
        }
        return switch (kind) {
            case TEXT -> value.isValueNode() ? value.asText() : null;
            case NUMBER -> value.isNumber() ? value.doubleValue() : parseDouble(value);
            case FLAG -> value.isBoolean() ? value.booleanValue() : null;
            case MAP -> value.isObject() ? objectMapper.convertValue(value, MAP_TYPE) : null;
        };
    }

    private Double parseDouble(JsonNode value) {
        if (!value.isTextual()) {
            return null;
        }
        try {
            return Double.parseDouble(value.asText().trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric value {}", value.asText());
            return null;
        }
    }

    private Iterable<JsonNode> arrayOf(JsonNode root, String key) {
        JsonNode node = root.get(key);
        if (node == null || !node.isArray()) {
            return List.of();
        }
        return node;
    }

    @SuppressWarnings("unchecked")
    private static Field<String> text(Field<?> field) {
        return (Field<String>) field;
    }

    @SuppressWarnings("unchecked")
    private static Field<Double> number(Field<?> field) {
        return (Field<Double>) field;
    }
}
