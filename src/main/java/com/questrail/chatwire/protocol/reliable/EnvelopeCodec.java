package com.questrail.chatwire.protocol.reliable;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import com.questrail.chatwire.protocol.codec.MalformedMessageException;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * EnvelopeCodec
 * -----------------------------------------------------------------------------
 * Gson-backed encoding of the reliable-datagram envelope and acknowledgement
 * payloads. Both travel as JSON text inside a {@code ChatMessage}'s content.
 *
 * <p>Envelope decoding is a classification, not a validation: content that is
 * not an envelope is a plain chat message and yields {@link Optional#empty()}.
 * Acknowledgement decoding is strict, since an {@code ack} without a valid
 * payload is a malformed message.</p>
 */
public final class EnvelopeCodec
{
    static final String SEQUENCE = "sequence";
    static final String DATA = "data";
    static final String TEST_ID = "test_id";

    private final Gson gson = new GsonBuilder()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    public String encodeEnvelope(ReliableEnvelope envelope)
    {
        Objects.requireNonNull(envelope, "envelope");

        JsonObject root = new JsonObject();
        root.addProperty(SEQUENCE, envelope.sequence());
        root.addProperty(DATA, envelope.data());
        root.addProperty(TEST_ID, envelope.testId());
        return gson.toJson(root);
    }

    public String encodeAck(AckPayload ack)
    {
        Objects.requireNonNull(ack, "ack");

        JsonObject root = new JsonObject();
        root.addProperty(SEQUENCE, ack.sequence());
        root.addProperty(TEST_ID, ack.testId());
        return gson.toJson(root);
    }

    /**
     * Reads {@code content} as an envelope if it is one.
     *
     * @return the envelope, or empty when {@code content} is not a JSON object
     *         with a non-negative integral {@code sequence} and a string {@code data}
     */
    public Optional<ReliableEnvelope> tryDecodeEnvelope(String content)
    {
        Optional<JsonObject> root = parseObject(content);
        if (root.isEmpty()) {
            return Optional.empty();
        }

        JsonObject obj = root.get();
        Optional<Long> sequence = sequenceOf(obj);
        JsonPrimitive data = primitive(obj, DATA);
        if (sequence.isEmpty() || data == null || !data.isString()) {
            return Optional.empty();
        }

        String testId = optionalString(obj);
        return Optional.of(new ReliableEnvelope(sequence.get(), data.getAsString(), testId));
    }

    /**
     * @throws MalformedMessageException if {@code content} is not a valid acknowledgement
     */
    public AckPayload decodeAck(String content)
    {
        JsonObject obj = parseObject(content)
                .orElseThrow(() -> new MalformedMessageException("Ack content is not a JSON object"));

        long sequence = sequenceOf(obj)
                .orElseThrow(() -> new MalformedMessageException("Ack without a valid sequence"));

        return new AckPayload(sequence, optionalString(obj));
    }

    // -------------------------------------------------------------------------

    private static Optional<JsonObject> parseObject(String content)
    {
        if (content == null || content.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonElement element = JsonParser.parseString(content);
            return element.isJsonObject() ? Optional.of(element.getAsJsonObject()) : Optional.empty();
        }
        catch (JsonParseException e) {
            return Optional.empty();
        }
    }

    private static Optional<Long> sequenceOf(JsonObject obj)
    {
        JsonPrimitive seq = primitive(obj, SEQUENCE);
        if (seq == null || !seq.isNumber()) {
            return Optional.empty();
        }
        BigDecimal value = seq.getAsBigDecimal();
        if (value.signum() < 0) {
            return Optional.empty();
        }
        try {
            return Optional.of(value.longValueExact());
        }
        catch (ArithmeticException e) {
            // Fractional or out of range.
            return Optional.empty();
        }
    }

    private static String optionalString(JsonObject obj)
    {
        JsonElement element = obj.get(TEST_ID);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (element.isJsonPrimitive()) {
            return element.getAsString();
        }
        return element.toString();
    }

    private static JsonPrimitive primitive(JsonObject obj, String field)
    {
        JsonElement element = obj.get(field);
        if (element == null || !element.isJsonPrimitive()) {
            return null;
        }
        return element.getAsJsonPrimitive();
    }
}
