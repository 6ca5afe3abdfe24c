package org.patternlab.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Main driver Tests")
class MainTest {

    @Test
    @DisplayName("Driver prints the result of every demonstration")
    void testRunOutputsExpectedLines() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Main.run(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("Road Route from Home to Office : Drive I-95, takes 30 mins"));
        assertTrue(output.contains("Walking from Home to Office: Walk through the park, takes 2 hours"));
        assertTrue(output.contains("Broadcast temperature 50"));
        assertTrue(output.contains("Phone display updated to 50 temperature"));
        assertTrue(output.contains("Window display updated to 50 temperature"));
        assertTrue(output.contains("Played let_it_be.mp3 with VLC at 1.0x"));
        assertTrue(output.contains("<HTML>HELLO WORLD</HTML>"));
        assertTrue(output.contains("XML representation: <data>My business data</data>"));
        assertTrue(output.contains("[UNKNOWN_SERIALIZER_FORMAT] Unknown format: yaml"));
        assertTrue(output.contains("Is both reference pointing to same memory location - true"));
    }

    @Test
    @DisplayName("Road directions are printed before walk directions")
    void testStrategyOrder() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        Main.runStrategy(new PrintStream(buffer, true, StandardCharsets.UTF_8));

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.indexOf("Road Route") < output.indexOf("Walking from"));
    }
}
