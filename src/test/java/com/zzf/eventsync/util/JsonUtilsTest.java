package com.zzf.eventsync.util;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.zzf.eventsync.support.TestEvents.json;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {

    @Test
    void textOrNullShouldTakeFirstStringKey() {
        JsonNode node = json("{\"parentId\":\"p-1\",\"count\":3}");

        assertEquals("p-1", JsonUtils.textOrNull(node, "parentID", "parentId"));
        assertNull(JsonUtils.textOrNull(node, "count"));
        assertNull(JsonUtils.textOrNull(json("[1]"), "parentID"));
        assertNull(JsonUtils.textOrNull(null, "parentID"));
    }

    @Test
    void numericAccessorsShouldRequireNumbers() {
        JsonNode node = json("{\"attempt\":2,\"next\":1700000000000,\"label\":\"3\"}");

        assertEquals(2, JsonUtils.intOrNull(node, "attempt"));
        assertEquals(1_700_000_000_000L, JsonUtils.longOrNull(node, "next"));
        assertNull(JsonUtils.intOrNull(node, "label"));
        assertNull(JsonUtils.longOrNull(node, "missing"));
    }

    @Test
    void textArrayShouldSkipNonStrings() {
        JsonNode node = json("{\"patterns\":[\"a\",1,\"b\",null],\"single\":\"x\"}");

        assertEquals(List.of("a", "b"), JsonUtils.textArray(node, "patterns"));
        assertTrue(JsonUtils.textArray(node, "single").isEmpty());
    }

    @Test
    void objectAccessorsShouldFallBackToEmpty() {
        JsonNode node = json("{\"metadata\":{\"k\":\"v\"},\"tool\":\"bash\"}");

        assertEquals("v", JsonUtils.objectOrNull(node, "metadata").get("k").asText());
        assertNull(JsonUtils.objectOrNull(node, "tool"));
        assertEquals(0, JsonUtils.objectOrEmpty(node, "tool").size());
        assertTrue(JsonUtils.asObject(json("\"text\"")).isEmpty());
    }
}
