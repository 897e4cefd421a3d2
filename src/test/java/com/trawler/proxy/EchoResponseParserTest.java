package com.trawler.proxy;

import com.fasterxml.jackson.databind.json.JsonMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class EchoResponseParserTest {

    private final EchoResponseParser parser = new EchoResponseParser(JsonMapper.builder().build());

    @Test
    void readsHttpbinOrigin() {
        assertEquals("81.2.69.160", parser.extractOrigin("{\"origin\": \"81.2.69.160\"}"));
    }

    @Test
    void takesFirstAddressOfAChain() {
        assertEquals("81.2.69.160", parser.extractOrigin("{\"origin\": \"81.2.69.160, 34.82.11.5\"}"));
    }

    @Test
    void readsIpField() {
        assertEquals("34.82.11.5", parser.extractOrigin("{\"ip\":\"34.82.11.5\",\"country\":\"United States\",\"cc\":\"US\"}"));
    }

    @Test
    void readsPlainTextBody() {
        assertEquals("34.82.11.5", parser.extractOrigin("34.82.11.5\n"));
    }

    @Test
    void unusableBodiesAreUnknown() {
        assertEquals(EchoResponseParser.UNKNOWN, parser.extractOrigin(""));
        assertEquals(EchoResponseParser.UNKNOWN, parser.extractOrigin(null));
        assertEquals(EchoResponseParser.UNKNOWN, parser.extractOrigin("{\"status\": \"ok\"}"));
        assertEquals(EchoResponseParser.UNKNOWN, parser.extractOrigin("{broken"));
    }
}
