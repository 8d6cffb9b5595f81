package com.questrail.chatwire.protocol.codec.impl;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.questrail.chatwire.protocol.codec.MalformedMessageException;
import com.questrail.chatwire.protocol.codec.UnknownMessageKindException;
import com.questrail.chatwire.protocol.codec.WireCodec;
import com.questrail.chatwire.protocol.model.ChatMessage;
import com.questrail.chatwire.protocol.model.MessageKind;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * JsonWireCodec
 * -----------------------------------------------------------------------------
 * Gson-backed {@link WireCodec}.
 *
 * <p>Decoding proceeds in order:</p>
 * <ol>
 *   <li>UTF-8 decode</li>
 *   <li>Skip to the first {@code '{'} (leading noise is tolerated)</li>
 *   <li>Parse a single JSON object</li>
 *   <li>Require {@code type}, {@code content}, {@code timestamp}</li>
 *   <li>Resolve {@code type} against {@link MessageKind}; unknown values are rejected</li>
 * </ol>
 *
 * <p>{@code username} may be absent or {@code null}. A missing {@code version}
 * is read as {@link ChatMessage#PROTOCOL_VERSION}.</p>
 */
public final class JsonWireCodec implements WireCodec
{
    static final String TYPE = "type";
    static final String CONTENT = "content";
    static final String USERNAME = "username";
    static final String TIMESTAMP = "timestamp";
    static final String VERSION = "version";

    private final Gson gson = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    @Override
    public byte[] encode(ChatMessage message)
    {
        Objects.requireNonNull(message, "message");

        JsonObject root = new JsonObject();
        root.addProperty(TYPE, message.kind().wireName());
        root.addProperty(CONTENT, message.content());
        root.addProperty(USERNAME, message.sender());
        root.addProperty(TIMESTAMP, message.timestamp());
        root.addProperty(VERSION, message.version());

        return gson.toJson(root).getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public ChatMessage decode(byte[] payload)
    {
        if (payload == null || payload.length == 0) {
            throw new MalformedMessageException("Empty payload");
        }

        final String text = new String(payload, StandardCharsets.UTF_8);
        final int start = text.indexOf('{');
        if (start < 0) {
            throw new MalformedMessageException("No JSON object in payload");
        }

        final JsonObject root;
        try {
            JsonElement element = JsonParser.parseString(text.substring(start));
            if (!element.isJsonObject()) {
                throw new MalformedMessageException("Payload is not a JSON object");
            }
            root = element.getAsJsonObject();
        }
        catch (JsonParseException e) {
            throw new MalformedMessageException("Invalid JSON: " + e.getMessage(), e);
        }

        final String type = requireString(root, TYPE);
        final String content = requireString(root, CONTENT);
        final double timestamp = requireNumber(root, TIMESTAMP);
        final String sender = optionalString(root, USERNAME);
        final String version = optionalString(root, VERSION);

        MessageKind kind = MessageKind.fromWireName(type)
                .orElseThrow(() -> new UnknownMessageKindException(type));

        return new ChatMessage(
                kind,
                content,
                sender,
                timestamp,
                version != null ? version : ChatMessage.PROTOCOL_VERSION
        );
    }

    private static String requireString(JsonObject root, String field)
    {
        JsonPrimitive primitive = primitive(root, field);
        if (primitive == null || !primitive.isString()) {
            throw new MalformedMessageException("Missing or non-string field: " + field);
        }
        return primitive.getAsString();
    }

    private static double requireNumber(JsonObject root, String field)
    {
        JsonPrimitive primitive = primitive(root, field);
        if (primitive == null || !primitive.isNumber()) {
            throw new MalformedMessageException("Missing or non-numeric field: " + field);
        }
        double value = primitive.getAsDouble();
        // 1e400 parses to Infinity, which could never be written back as JSON.
        if (!Double.isFinite(value)) {
            throw new MalformedMessageException("Non-finite number in field: " + field);
        }
        return value;
    }

    private static String optionalString(JsonObject root, String field)
    {
        JsonElement element = root.get(field);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new MalformedMessageException("Non-string field: " + field);
        }
        return element.getAsString();
    }

    private static JsonPrimitive primitive(JsonObject root, String field)
    {
        JsonElement element = root.get(field);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsJsonPrimitive();
    }
}
