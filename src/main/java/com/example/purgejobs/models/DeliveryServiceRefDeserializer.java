package com.example.purgejobs.models;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;

/**
 * Accepts a JSON number as a delivery service id and a JSON string as its xmlId.
 */
public class DeliveryServiceRefDeserializer extends StdDeserializer<DeliveryServiceRef> {

    public DeliveryServiceRefDeserializer() {
        super(DeliveryServiceRef.class);
    }

    @Override
    public DeliveryServiceRef deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonNode node = parser.readValueAsTree();
        if (node.isIntegralNumber() && node.canConvertToLong() && node.asLong() > 0) {
            return DeliveryServiceRef.byId(node.asLong());
        }
        if (node.isTextual() && !node.asText().isBlank()) {
            return DeliveryServiceRef.byXmlId(node.asText());
        }
        throw JsonMappingException.from(parser,
                "deliveryService must be a positive integer id or a non-blank xmlId");
    }
}
