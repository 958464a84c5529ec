package com.bag;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private final PrintStream originalOut = System.out;
    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void tearDown() {
        System.setOut(originalOut);
        System.setErr(originalErr);
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String errors() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Inserts and removals from arguments are applied in order")
    void appliesArguments() {
        Main.main(new String[]{"a", "b", "c", "-2", "-2", "d"});

        assertEquals("[a, c, d]", output().trim());
    }

    @Test
    @DisplayName("No arguments runs the demo and prints usage")
    void runsDemo() {
        Main.main(new String[0]);

        String printed = output();
        assertTrue(printed.contains("=== Token Bag Demo ==="));
        assertTrue(printed.contains("Contents: [a, c, d]"));
        assertTrue(printed.contains("Usage:"));
    }

    @Test
    @DisplayName("Removal of an insertion that never happened fails with status 1")
    void removalOutOfRangeFails() {
        int status = Main.run(new String[]{"a", "-2"});

        assertEquals(1, status);
        assertTrue(errors().contains("No insertion #2 (have 1)"));
        assertEquals("", output());
    }

    @Test
    @DisplayName("Non-numeric removal fails with status 1 and prints usage")
    void nonNumericRemovalFails() {
        int status = Main.run(new String[]{"a", "-x"});

        assertEquals(1, status);
        assertTrue(errors().contains("Invalid removal '-x'"));
        assertTrue(output().contains("Usage:"));
    }

    @Test
    @DisplayName("Valid arguments return status 0")
    void validArgumentsSucceed() {
        assertEquals(0, Main.run(new String[]{"a", "-1"}));
        assertEquals("[]", output().trim());
    }
}
