package org.netpreserve.domainprober.util;

import com.fasterxml.jackson.core.JacksonException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

/**
 * Reads durations written as milliseconds ({@code 5000}), shorthand ({@code 5s}, {@code 1m30s}) or
 * ISO-8601 ({@code PT5S}).
 */
public class DurationDeserializer extends JsonDeserializer<Duration> {
    @Override
    public Duration deserialize(JsonParser jsonParser, DeserializationContext deserializationContext) throws IOException, JacksonException {
        if (jsonParser.currentToken().isNumeric()) return Duration.ofMillis(jsonParser.getLongValue());
        String text = jsonParser.getText().trim().toUpperCase(Locale.ROOT);
        try {
            if (text.startsWith("P")) return Duration.parse(text);
            if (text.endsWith("MS")) return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2).trim()));
            return Duration.parse("PT" + text);
        } catch (RuntimeException e) {
            throw deserializationContext.weirdStringException(jsonParser.getText(), Duration.class,
                    "expected a duration like 5s, 500ms or PT1M");
        }
    }
}
