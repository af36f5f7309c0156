package com.mk.fx.qa.stress.cfg;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mk.fx.qa.stress.TestSnapshots;
import com.mk.fx.qa.stress.metrics.WorkerSnapshot;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ObjectMapperConfigTest {

  private final ObjectMapper mapper = new ObjectMapperConfig().objectMapper();

  @Test
  void emptyCollectionsAndNullsAreOmittedButZeroCountersKept() throws Exception {
    WorkerSnapshot idle = TestSnapshots.snapshot("w-1", 1, false, Map.of());

    JsonNode json = mapper.readTree(mapper.writeValueAsString(idle));

    assertFalse(json.has("operations"));
    assertFalse(json.has("resources"));
    assertEquals(0, json.get("droppedSnapshots").asLong());
    assertEquals("2024-01-01T00:00:00Z", json.get("startedAt").asText());
  }

  @Test
  void snapshotWithOmittedFields_readsBackEqual() throws Exception {
    WorkerSnapshot idle = TestSnapshots.snapshot("w-1", 3, true, Map.of());

    WorkerSnapshot read = mapper.readValue(mapper.writeValueAsString(idle), WorkerSnapshot.class);

    assertEquals(idle, read);
    assertTrue(read.operations().isEmpty());
  }
}
