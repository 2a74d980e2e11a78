package com.example.purgejobs.requests;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.purgejobs.models.DeliveryServiceRef;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.Objects;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ReplaceJobHttpRequestTest {

    private static final ObjectMapper MAPPER = new ObjectMapper().findAndRegisterModules();
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            validator = factory.getValidator();
        }
    }

    @Test
    @DisplayName("fixture payload binds every field")
    void bindsFixture() throws IOException {
        ReplaceJobHttpRequest request;
        try (InputStream stream = getClass().getClassLoader().getResourceAsStream("fixtures/replace_job_request.json")) {
            request = MAPPER.readValue(Objects.requireNonNull(stream, "replace_job_request fixture not found"),
                    ReplaceJobHttpRequest.class);
        }

        assertEquals(42L, request.id());
        assertEquals(DeliveryServiceRef.byId(5L), request.deliveryService());
        assertEquals("alice", request.createdBy());
        assertEquals(Instant.parse("2025-01-01T06:00:00Z"), request.startTime());
        assertEquals(12, request.ttlHours());
        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    @DisplayName("value ranges are left to the service")
    void rangesNotCheckedHere() {
        ReplaceJobHttpRequest request = new ReplaceJobHttpRequest(42L, DeliveryServiceRef.byId(5L), "alice",
                "/x", Instant.EPOCH, -5);

        assertTrue(validator.validate(request).isEmpty());
    }

    @Test
    @DisplayName("service request rejects a blank creator")
    void serviceRequestRejectsBlankCreator() {
        assertThrows(IllegalArgumentException.class, () -> new ReplaceJobServiceRequest(42L, 42L,
                DeliveryServiceRef.byId(5L), " ", "/x", Instant.EPOCH, 1));
        assertThrows(NullPointerException.class, () -> new CreateJobServiceRequest(
                DeliveryServiceRef.byId(5L), null, Instant.EPOCH, 1));
    }
}
