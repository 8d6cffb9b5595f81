package com.questrail.chatwire.protocol.codec.impl;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.questrail.chatwire.protocol.codec.MalformedMessageException;
import com.questrail.chatwire.protocol.codec.MessageDecodeException;
import com.questrail.chatwire.protocol.codec.UnknownMessageKindException;
import com.questrail.chatwire.protocol.model.ChatMessage;
import com.questrail.chatwire.protocol.model.MessageKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class JsonWireCodecTest
{
    private final JsonWireCodec codec = new JsonWireCodec();

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    // ---------------------------------------------------------------------
    // Encoding
    // ---------------------------------------------------------------------

    @Test
    void encodesAllFiveFieldsWithWireNames()
    {
        ChatMessage msg = new ChatMessage(MessageKind.CHAT, "hello", "alice", 1000.5, "1.0");

        JsonObject json = JsonParser.parseString(
                new String(codec.encode(msg), StandardCharsets.UTF_8)).getAsJsonObject();

        assertEquals("message", json.get("type").getAsString());
        assertEquals("hello", json.get("content").getAsString());
        assertEquals("alice", json.get("username").getAsString());
        assertEquals(1000.5, json.get("timestamp").getAsDouble());
        assertEquals("1.0", json.get("version").getAsString());
    }

    /**
     * A message without a sender still carries the username key, as null.
     */
    @Test
    void encodesMissingSenderAsNull()
    {
        ChatMessage msg = new ChatMessage(MessageKind.STATUS, "up", null, 1.0, "1.0");

        JsonObject json = JsonParser.parseString(
                new String(codec.encode(msg), StandardCharsets.UTF_8)).getAsJsonObject();

        assertTrue(json.has("username"));
        assertTrue(json.get("username").isJsonNull());
    }

    @Test
    void doesNotEscapeMarkupCharacters()
    {
        ChatMessage msg = ChatMessage.of(MessageKind.CHAT, "<b>&</b>", "bob", Instant.EPOCH);

        String text = new String(codec.encode(msg), StandardCharsets.UTF_8);

        assertTrue(text.contains("<b>&</b>"), text);
    }

    @Test
    void preservesNonAsciiContent()
    {
        ChatMessage msg = ChatMessage.of(MessageKind.CHAT, "grüße 👋", "zoë", Instant.ofEpochSecond(5));

        ChatMessage decoded = codec.decode(codec.encode(msg));

        assertEquals("grüße 👋", decoded.content());
        assertEquals("zoë", decoded.sender());
    }

    // ---------------------------------------------------------------------
    // Decoding
    // ---------------------------------------------------------------------

    @Test
    void decodesConnectFromWire()
    {
        ChatMessage msg = codec.decode(utf8(
                "{\"type\":\"connect\",\"content\":\"alice\",\"username\":\"alice\",\"timestamp\":1000.0,\"version\":\"1.0\"}"));

        assertEquals(MessageKind.CONNECT, msg.kind());
        assertEquals("alice", msg.content());
        assertEquals("alice", msg.sender());
        assertEquals(1000.0, msg.timestamp());
    }

    @Test
    void acceptsIntegralTimestamp()
    {
        ChatMessage msg = codec.decode(utf8(
                "{\"type\":\"status\",\"content\":\"x\",\"username\":null,\"timestamp\":1000,\"version\":\"1.0\"}"));

        assertEquals(1000.0, msg.timestamp());
        assertNull(msg.sender());
    }

    @Test
    void missingVersionDefaultsToCurrentProtocolVersion()
    {
        ChatMessage msg = codec.decode(utf8(
                "{\"type\":\"message\",\"content\":\"hi\",\"timestamp\":3}"));

        assertEquals(ChatMessage.PROTOCOL_VERSION, msg.version());
        assertNull(msg.sender());
    }

    /**
     * Bytes before the first '{' are discarded before parsing.
     */
    @Test
    void skipsLeadingNoiseBeforeObject()
    {
        ChatMessage msg = codec.decode(utf8(
                "\u0000\u0000 junk {\"type\":\"message\",\"content\":\"hi\",\"username\":\"a\",\"timestamp\":1,\"version\":\"1.0\"}"));

        assertEquals("hi", msg.content());
    }

    // ---------------------------------------------------------------------
    // Rejection
    // ---------------------------------------------------------------------

    @Test
    void rejectsUnknownType()
    {
        UnknownMessageKindException e = assertThrows(UnknownMessageKindException.class,
                () -> codec.decode(utf8(
                        "{\"type\":\"bogus\",\"content\":\"\",\"username\":\"a\",\"timestamp\":1,\"version\":\"1.0\"}")));

        assertEquals("bogus", e.wireType());
        assertEquals("Unknown message type: bogus", e.getMessage());
    }

    @Test
    void rejectsEmptyPayload()
    {
        assertThrows(MalformedMessageException.class, () -> codec.decode(new byte[0]));
    }

    @Test
    void rejectsPayloadWithoutObject()
    {
        assertThrows(MalformedMessageException.class, () -> codec.decode(utf8("not json at all")));
    }

    @Test
    void rejectsTruncatedJson()
    {
        assertThrows(MalformedMessageException.class,
                () -> codec.decode(utf8("{\"type\":\"message\",\"content\":")));
    }

    @Test
    void rejectsMissingRequiredFields()
    {
        assertThrows(MalformedMessageException.class,
                () -> codec.decode(utf8("{\"content\":\"x\",\"timestamp\":1}")));
        assertThrows(MalformedMessageException.class,
                () -> codec.decode(utf8("{\"type\":\"message\",\"timestamp\":1}")));
        assertThrows(MalformedMessageException.class,
                () -> codec.decode(utf8("{\"type\":\"message\",\"content\":\"x\"}")));
    }

    @Test
    void rejectsWrongFieldTypes()
    {
        assertThrows(MalformedMessageException.class,
                () -> codec.decode(utf8("{\"type\":\"message\",\"content\":5,\"timestamp\":1}")));
        assertThrows(MalformedMessageException.class,
                () -> codec.decode(utf8("{\"type\":\"message\",\"content\":\"x\",\"timestamp\":\"soon\"}")));
        assertThrows(MalformedMessageException.class,
                () -> codec.decode(utf8("{\"type\":\"message\",\"content\":\"x\",\"timestamp\":1,\"username\":[1]}")));
    }

    /** An overflowing timestamp would otherwise be echoed back as the invalid token Infinity. */
    @Test
    void rejectsTimestampOutsideDoubleRange()
    {
        MalformedMessageException e = assertThrows(MalformedMessageException.class,
                () -> codec.decode(utf8("{\"type\":\"test\",\"content\":\"\",\"timestamp\":1e400}")));
        assertTrue(e.getMessage().contains("timestamp"), e.getMessage());
        assertThrows(MalformedMessageException.class,
                () -> codec.decode(utf8("{\"type\":\"test\",\"content\":\"\",\"timestamp\":-1e400}")));

        assertEquals(1.0e300, codec.decode(
                utf8("{\"type\":\"test\",\"content\":\"\",\"timestamp\":1e300}")).timestamp());
    }

    @Test
    void allDecodeFailuresShareOneSupertype()
    {
        assertThrows(MessageDecodeException.class, () -> codec.decode(utf8("[]")));
        assertThrows(MessageDecodeException.class, () -> codec.decode(utf8(
                "{\"type\":\"nope\",\"content\":\"\",\"timestamp\":1}")));
    }
}
