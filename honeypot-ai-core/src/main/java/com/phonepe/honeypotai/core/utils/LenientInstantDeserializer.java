package com.phonepe.honeypotai.core.utils;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;

/**
 * Reads message timestamps sent either as epoch milliseconds (number or numeric string) or as ISO-8601 text.
 * Anything unreadable becomes the current time.
 */
@Slf4j
public class LenientInstantDeserializer extends StdDeserializer<Instant> {

    public LenientInstantDeserializer() {
        super(Instant.class);
    }

    @Override
    public Instant deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        final var token = parser.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT) {
            if (parser.getNumberType() == JsonParser.NumberType.BIG_INTEGER) {
                log.debug("Timestamp {} out of range, using current time", parser.getText());
                return Instant.now();
            }
            return Instant.ofEpochMilli(parser.getLongValue());
        }
        if (token == JsonToken.VALUE_NUMBER_FLOAT) {
            final var value = parser.getDoubleValue();
            if (!Double.isFinite(value) || Math.abs(value) >= Long.MAX_VALUE) {
                log.debug("Timestamp {} out of range, using current time", parser.getText());
                return Instant.now();
            }
            return Instant.ofEpochMilli((long) value);
        }
        if (token == JsonToken.VALUE_STRING) {
            return parse(parser.getText());
        }
        parser.skipChildren();
        log.debug("Unsupported timestamp token {}, using current time", token);
        return Instant.now();
    }

    public static Instant parse(final String value) {
        if (null == value || value.isBlank()) {
            return Instant.now();
        }
        final var text = value.trim();
        if (text.chars().allMatch(Character::isDigit)) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(text));
            }
            catch (NumberFormatException e) {
                log.debug("Timestamp {} out of range, using current time", text);
                return Instant.now();
            }
        }
        try {
            return Instant.parse(text);
        }
        catch (DateTimeParseException e) {
            log.trace("{} is not an instant", text);
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        }
        catch (DateTimeParseException e) {
            log.trace("{} is not an offset date time", text);
        }
        try {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        }
        catch (DateTimeParseException e) {
            log.debug("Unreadable timestamp {}, using current time", text);
        }
        return Instant.now();
    }
}
