package com.phonepe.honeypotai.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.phonepe.honeypotai.core.utils.JsonUtils;
import com.phonepe.honeypotai.core.utils.LenientInstantDeserializer;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Wire format of requests and replies
 */
class HoneypotModelJsonTest {
    private final ObjectMapper mapper = JsonUtils.createMapper();

    @Test
    @SneakyThrows
    void testReadRequest() {
        final var request = mapper.readValue("""
                {
                  "sessionId": "wertyu-dfghj-ertyui",
                  "message": {
                    "sender": "scammer",
                    "text": "Your bank account will be blocked today.",
                    "timestamp": 1770005528731
                  },
                  "conversationHistory": [
                    { "sender": "scammer", "text": "Hello", "timestamp": "2026-01-21T10:15:30Z" },
                    { "sender": "user", "text": "Who is this?", "timestamp": "2026-01-21T10:16:30" }
                  ],
                  "metadata": { "channel": "SMS", "language": "English", "locale": "IN" }
                }
                """, HoneypotRequest.class);
        assertEquals("wertyu-dfghj-ertyui", request.getSessionId());
        assertEquals(Sender.COUNTERPART, request.getMessage().getSender());
        assertEquals(Instant.ofEpochMilli(1770005528731L), request.getMessage().getTimestamp());
        assertEquals(2, request.getConversationHistory().size());
        assertEquals(Sender.AGENT, request.getConversationHistory().get(1).getSender());
        assertEquals(Instant.parse("2026-01-21T10:15:30Z"), request.getConversationHistory().get(0).getTimestamp());
        assertEquals(Instant.parse("2026-01-21T10:16:30Z"), request.getConversationHistory().get(1).getTimestamp());
        assertEquals("SMS", request.getMetadata().getChannel());
    }

    @Test
    @SneakyThrows
    void testMissingOptionalFields() {
        final var before = Instant.now();
        final var request = mapper.readValue("""
                { "sessionId": "s1", "message": { "sender": "Agent", "text": "hi" } }
                """, HoneypotRequest.class);
        assertEquals(List.of(), request.getConversationHistory());
        assertEquals(Sender.AGENT, request.getMessage().getSender());
        assertFalse(request.getMessage().getTimestamp().isBefore(before));
    }

    @Test
    void testUnknownSenderRejected() {
        assertThrows(JsonProcessingException.class, () -> mapper.readValue("""
                { "sessionId": "s1", "message": { "sender": "robot", "text": "hi" } }
                """, HoneypotRequest.class));
    }

    @Test
    void testLenientTimestamps() {
        assertEquals(Instant.ofEpochMilli(1770005528731L), LenientInstantDeserializer.parse("1770005528731"));
        assertEquals(Instant.parse("2026-01-21T04:45:30Z"),
                     LenientInstantDeserializer.parse("2026-01-21T10:15:30+05:30"));
        final var before = Instant.now();
        assertFalse(LenientInstantDeserializer.parse("yesterday").isBefore(before));
        assertFalse(LenientInstantDeserializer.parse(null).isBefore(before));
        assertFalse(LenientInstantDeserializer.parse("123456789012345678901234567890").isBefore(before));
    }

    @Test
    @SneakyThrows
    void testOutOfRangeTimestampIsNotFatal() {
        final var before = Instant.now();
        final var message = mapper.readValue("""
                {"sender":"scammer","text":"hello there","timestamp":123456789012345678901234567890}
                """, Message.class);
        assertEquals("hello there", message.getText());
        assertFalse(message.getTimestamp().isBefore(before));

        final var fractional = mapper.readValue("""
                {"sender":"scammer","text":"hello there","timestamp":1.0E30}
                """, Message.class);
        assertFalse(fractional.getTimestamp().isBefore(before));
    }

    @Test
    @SneakyThrows
    void testReplyJson() {
        final var silent = mapper.readTree(mapper.writeValueAsString(HoneypotReply.silent()));
        assertEquals("success", silent.get("status").asText());
        assertTrue(silent.has("reply"));
        assertTrue(silent.get("reply").isNull());
        assertFalse(silent.has("error"));

        final var spoken = mapper.readTree(mapper.writeValueAsString(HoneypotReply.success("Who is this?")));
        assertEquals("Who is this?", spoken.get("reply").asText());

        final var error = mapper.readTree(mapper.writeValueAsString(HoneypotReply.error("Invalid request")));
        assertEquals("error", error.get("status").asText());
        assertEquals("Invalid request", error.get("error").asText());
    }

    @Test
    @SneakyThrows
    void testIntelligenceJson() {
        final var intelligence = ExtractedIntelligence.builder()
                .upiIds(List.of("b@ybl", "a@ybl"))
                .build();
        final var node = mapper.readTree(mapper.writeValueAsString(intelligence));
        assertEquals("a@ybl", node.get("upiIds").get(0).asText());
        assertTrue(node.get("bankAccounts").isEmpty());
        assertFalse(node.has("empty"));
        assertEquals(intelligence, mapper.readValue(mapper.writeValueAsString(intelligence),
                                                    ExtractedIntelligence.class));
    }
}
