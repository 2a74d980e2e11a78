package com.example.purgejobs.models;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.Objects;
import java.util.function.Function;

/**
 * Identifies a delivery service either by its numeric id or by its external short name (xmlId).
 * Callers branch with {@link #map}, which every variant implements, so no lookup path is left
 * without a case.
 */
@JsonDeserialize(using = DeliveryServiceRefDeserializer.class)
public sealed interface DeliveryServiceRef permits DeliveryServiceRef.ById, DeliveryServiceRef.ByXmlId {

    <T> T map(Function<Long, T> byId, Function<String, T> byXmlId);

    /**
     * Whether this reference names {@code deliveryService}, compared on the identifier this
     * reference carries.
     */
    default boolean refersTo(DeliveryService deliveryService) {
        return map(id -> id.equals(deliveryService.getId()),
                xmlId -> xmlId.equals(deliveryService.getXmlId()));
    }

    static DeliveryServiceRef byId(long id) {
        return new ById(id);
    }

    static DeliveryServiceRef byXmlId(String xmlId) {
        return new ByXmlId(xmlId);
    }

    record ById(long id) implements DeliveryServiceRef {
        @Override
        public <T> T map(Function<Long, T> byId, Function<String, T> byXmlId) {
            return byId.apply(id);
        }

        @Override
        public String toString() {
            return "#" + id;
        }
    }

    record ByXmlId(String xmlId) implements DeliveryServiceRef {
        public ByXmlId {
            Objects.requireNonNull(xmlId, "xmlId");
            if (xmlId.isBlank()) {
                throw new IllegalArgumentException("xmlId must be non-blank");
            }
        }

        @Override
        public <T> T map(Function<Long, T> byId, Function<String, T> byXmlId) {
            return byXmlId.apply(xmlId);
        }

        @Override
        public String toString() {
            return xmlId;
        }
    }
}
