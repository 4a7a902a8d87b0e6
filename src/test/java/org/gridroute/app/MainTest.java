package org.gridroute.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Main CLI Tests")
class MainTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private int run(String... args) {
        PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        return Main.run(args, out);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Default scenario without random obstacles takes the diagonal")
    void testDefaultScenario() {
        int exit = run("--random=0", "--seed=1");

        assertEquals(Main.EXIT_FOUND, exit);
        String text = output();
        assertTrue(text.contains("Obstacles were placed at:"));
        assertTrue(text.contains("[(9,7),(8,7),(6,7),(6,8)]"));
        assertTrue(text.contains("traversing 0 obstacle(s)"));
        assertTrue(text.contains("This is 9 steps"));
        assertFalse(text.contains("without crossing obstacles"));
    }

    @Test
    @DisplayName("Relaxed mode reports a forced crossing")
    void testForcedCrossing() {
        int exit = run("--size=3", "--obstacles=1,2;2,1;1,1", "--random=0");

        assertEquals(Main.EXIT_FOUND, exit);
        String text = output();
        assertTrue(text.contains("Unable to reach delivery point without crossing obstacles"));
        assertTrue(text.contains("traversing 1 obstacle(s)"));
        assertTrue(text.contains("This is 2 steps"));
    }

    @Test
    @DisplayName("Strict mode with an enclosed goal exits as not found")
    void testStrictNotFound() {
        int exit = run("--size=3", "--obstacles=1,2;2,1;1,1", "--random=0", "--mode=strict");

        assertEquals(Main.EXIT_NOT_FOUND, exit);
        assertTrue(output().contains("Unable to reach delivery point: no route from (0,0) to (2,2)"));
    }

    @Test
    @DisplayName("Seeded runs are reproducible")
    void testSeededRunsRepeat() {
        run("--seed=12345");
        String first = output();
        buffer.reset();
        run("--seed=12345");

        assertEquals(first, output());
    }

    @Test
    @DisplayName("Bad input exits with the usage code")
    void testUsageErrors() {
        assertEquals(Main.EXIT_USAGE, run("--bogus=1"));
        assertTrue(output().contains("Usage:"));
        assertEquals(Main.EXIT_USAGE, run("positional"));
        assertEquals(Main.EXIT_USAGE, run("--size=3", "--obstacles=5,5"));
        assertEquals(Main.EXIT_USAGE, run("--size=3", "--start=9,9", "--random=0"));
        assertTrue(output().contains("GR_START_OUT_OF_BOUNDS"));
    }

    @Test
    @DisplayName("Fixed obstacles may not cover the start or the goal")
    void testObstacleOnEndpoint() {
        assertEquals(Main.EXIT_USAGE, run("--size=3", "--random=0", "--obstacles=0,0", "--mode=relaxed"));
        assertTrue(output().contains("obstacle (0,0) would block the start or the delivery point"));
        assertFalse(output().contains("This is a path"));

        buffer.reset();
        assertEquals(Main.EXIT_USAGE, run("--size=3", "--random=0", "--obstacles=1,0;2,2"));
        assertTrue(output().contains("obstacle (2,2) would block"));
    }

    @Test
    @DisplayName("Oversized grid is a usage error, not a crash")
    void testOversizedGrid() {
        assertEquals(Main.EXIT_USAGE, run("--size=50000"));
        assertTrue(output().contains("Usage:"));
    }

    @Test
    @DisplayName("Help prints usage and succeeds")
    void testHelp() {
        assertEquals(Main.EXIT_FOUND, run("--help"));
        assertTrue(output().contains("Usage:"));
    }
}
