package io.enforcerlink.monitor;

import com.fasterxml.jackson.databind.JsonNode;
import io.enforcerlink.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

final class EventInfoTest {

    @Test
    void encodesWithWireFieldNamesAndNumericUnitType() throws Exception {
        EventInfo event = new EventInfo("create", UnitType.LINUX_PROCESS, "u1", "PU", Map.of("app", "web"), "42",
                Map.of("bridge", "10.0.0.4"));

        JsonNode node = Jsons.compact().readTree(event.encode());

        Assertions.assertEquals("create", node.path("EventType").asText());
        Assertions.assertEquals(1, node.path("PUType").asInt());
        Assertions.assertEquals("u1", node.path("PUID").asText());
        Assertions.assertEquals("PU", node.path("Name").asText());
        Assertions.assertEquals("web", node.path("Tags").path("app").asText());
        Assertions.assertEquals("42", node.path("PID").asText());
        Assertions.assertEquals("10.0.0.4", node.path("IPs").path("bridge").asText());
    }

    @Test
    void decodesUnitTypeByNameOrCodeAndIgnoresUnknownFields() throws Exception {
        String json = "{\"EventType\":\"start\",\"PUType\":\"LINUX_PROCESS\",\"PUID\":\"u1\",\"Extra\":true}";
        EventInfo byName = EventInfo.decode(json.getBytes(StandardCharsets.UTF_8));
        EventInfo byCode = EventInfo.decode("{\"PUType\":0}".getBytes(StandardCharsets.UTF_8));

        Assertions.assertEquals(UnitType.LINUX_PROCESS, byName.unitType());
        Assertions.assertEquals("u1", byName.unitId());
        Assertions.assertTrue(byName.tags().isEmpty());
        Assertions.assertEquals(UnitType.CONTAINER, byCode.unitType());
        Assertions.assertNull(byCode.eventType());
    }

    @Test
    void rejectsEmptyOrMalformedRecords() {
        Assertions.assertThrows(IOException.class, () -> EventInfo.decode(new byte[0]));
        Assertions.assertThrows(IOException.class, () -> EventInfo.decode(null));
        Assertions.assertThrows(IOException.class,
                () -> EventInfo.decode("not-json".getBytes(StandardCharsets.UTF_8)));
        Assertions.assertThrows(IOException.class,
                () -> EventInfo.decode("{\"PUType\":7}".getBytes(StandardCharsets.UTF_8)));
    }
}
