package io.ledgerpoller.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJsonCodecTest {

    private final JsonCodec codec = JsonCodec.getDefault();

    @Test
    void toJsonWithEmptyMapReturnsEmptyObject() {
        assertEquals("{}", codec.toJson(Map.of()));
        assertEquals("{}", codec.toJson(null));
    }

    @Test
    void toJsonKeepsIterationOrder() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("b", "2");
        map.put("a", "1");

        assertEquals("{\"b\":\"2\",\"a\":\"1\"}", codec.toJson(map));
    }

    @Test
    void toJsonWithSortedMapIsCanonical() {
        Map<String, String> first = new TreeMap<>();
        first.put("Sender", "0xabc");
        first.put("MoveModule", "pool");
        Map<String, String> second = new TreeMap<>();
        second.put("MoveModule", "pool");
        second.put("Sender", "0xabc");

        assertEquals(codec.toJson(first), codec.toJson(second));
        assertEquals("{\"MoveModule\":\"pool\",\"Sender\":\"0xabc\"}", codec.toJson(first));
    }

    @Test
    void toJsonEscapesSpecialCharacters() {
        String json = codec.toJson(Map.of("msg", "say \"hi\"\n\\\t\u0001"));

        assertEquals("{\"msg\":\"say \\\"hi\\\"\\n\\\\\\t\\u0001\"}", json);
    }

    @Test
    void toJsonRejectsNullKey() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(null, "v");

        assertThrows(IllegalArgumentException.class, () -> codec.toJson(map));
    }

    @Test
    void parseObjectReadsFlatObject() {
        Map<String, String> parsed = codec.parseObject(
                " { \"MoveEventType\" : \"0x2::coin::CoinEvent\", \"Sender\":\"0xabc\" } ");

        assertEquals(2, parsed.size());
        assertEquals("0x2::coin::CoinEvent", parsed.get("MoveEventType"));
        assertEquals("0xabc", parsed.get("Sender"));
    }

    @Test
    void parseObjectHandlesEscapes() {
        Map<String, String> parsed = codec.parseObject("{\"k\":\"a\\\"b\\\\c\\/d\\u0041\\n\"}");

        assertEquals("a\"b\\c/dA\n", parsed.get("k"));
    }

    @Test
    void parseObjectSkipsNullMembers() {
        Map<String, String> parsed = codec.parseObject("{\"a\":null,\"b\":\"x\"}");

        assertEquals(Map.of("b", "x"), parsed);
    }

    @Test
    void parseObjectWithBlankInputReturnsEmptyMap() {
        assertTrue(codec.parseObject(null).isEmpty());
        assertTrue(codec.parseObject("   ").isEmpty());
        assertTrue(codec.parseObject("{}").isEmpty());
    }

    @Test
    void parseObjectRejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("[]"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":1}"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"b\""));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"b\"} extra"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"\\q\"}"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"\\u00zz\"}"));
    }

    @Test
    void parseObjectRejectsUnicodeEscapeWithNonHexDigits() {
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"\\u+04a\"}"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"\\u-04a\"}"));
        assertThrows(IllegalArgumentException.class, () -> codec.parseObject("{\"a\":\"\\u\uFF10041\"}"));
        assertEquals("J", codec.parseObject("{\"a\":\"\\u004A\"}").get("a"));
        assertEquals("J", codec.parseObject("{\"a\":\"\\u004a\"}").get("a"));
    }

    @Test
    void parseObjectReadsWhatToJsonWrites() {
        Map<String, String> original = new LinkedHashMap<>();
        original.put("quote", "\"");
        original.put("control", "\u0002\r");

        assertEquals(original, codec.parseObject(codec.toJson(original)));
    }
}
