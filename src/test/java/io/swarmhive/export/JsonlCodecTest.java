package io.swarmhive.export;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class JsonlCodecTest {

    @Test
    void hashIgnoresKeyOrder() throws Exception {
        CellExport a = JsonlCodec.parseLine("{\"id\":\"x-1\",\"title\":\"T\",\"status\":\"open\",\"priority\":2,\"issue_type\":\"task\"}");
        CellExport b = JsonlCodec.parseLine("{\"issue_type\":\"task\",\"priority\":2,\"status\":\"open\",\"title\":\"T\",\"id\":\"x-1\"}");
        CellExport c = JsonlCodec.parseLine("{\"id\":\"x-1\",\"title\":\"T2\",\"status\":\"open\",\"priority\":2,\"issue_type\":\"task\"}");
        Assertions.assertEquals(JsonlCodec.contentHash(a), JsonlCodec.contentHash(b));
        Assertions.assertNotEquals(JsonlCodec.contentHash(a), JsonlCodec.contentHash(c));
        Assertions.assertEquals(64, JsonlCodec.contentHash(a).length());
    }

    @Test
    void timestampsUseMillisecondUtcFormat() {
        Assertions.assertEquals("2023-11-14T22:13:20.000Z", JsonlCodec.formatTimestamp(1_700_000_000_000L));
        Assertions.assertEquals(1_700_000_000_123L, JsonlCodec.parseTimestamp("2023-11-14T22:13:20.123Z", 0L));
        Assertions.assertEquals(42L, JsonlCodec.parseTimestamp(" ", 42L));
    }

    @Test
    void idOfToleratesGarbage() {
        Assertions.assertEquals("x-9", JsonlCodec.idOf("{\"id\":\"x-9\",\"extra\":{\"nested\":true}}"));
        Assertions.assertNull(JsonlCodec.idOf("not json at all"));
        Assertions.assertNull(JsonlCodec.idOf("{\"id\":17}"));
        Assertions.assertNull(JsonlCodec.idOf("[1,2]"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> JsonlCodec.parseLine("{\"title\":\"x\"}"));
    }
}
