package org.netpreserve.domainprober.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ProbeConfigTest {
    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory()).findAndRegisterModules();

    @Test
    public void test() throws IOException {
        var config = mapper.readValue(getClass().getResource("example.yaml"), ProbeConfig.class);
        assertEquals("/srv/words/english.txt", config.candidates().wordList());
        assertEquals(List.of("com", "net", "org"), config.candidates().suffixes());
        assertEquals("https", config.candidates().scheme());
        assertEquals(3, config.candidates().comboLength());
        assertEquals(4, config.candidates().maxComboLength());
        assertEquals(25, config.probe().workers());
        assertEquals(Duration.ofMillis(1500), config.probe().timeout());
        assertEquals(Duration.ofSeconds(90), config.probe().progressInterval());
        assertEquals(List.of("domainprober-test/1.0"), config.probe().userAgents());
        assertEquals(250, config.classifier().minContentLength());
        assertEquals("live.json", config.storage().discoveries());
        assertFalse(config.resume());
    }

    @Test
    public void durations() throws IOException {
        assertEquals(Duration.ofSeconds(5), timeout("5s"));
        assertEquals(Duration.ofMillis(250), timeout("250"));
        assertEquals(Duration.ofMillis(250), timeout("250ms"));
        assertEquals(Duration.ofMinutes(2), timeout("PT2M"));
        assertEquals(Duration.ofSeconds(90), timeout("1m30s"));
        assertThrows(InvalidFormatException.class, () -> timeout("soon"));
    }

    private Duration timeout(String value) throws IOException {
        return mapper.readValue("{workers: 1, timeout: " + value + "}", ProbeSettings.class).timeout();
    }
}
