package com.deliveryhealth.app;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DeliveryHealthApplicationTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final DeliveryHealthApplication app =
            new DeliveryHealthApplication(new PrintStream(buffer, true, StandardCharsets.UTF_8));

    @Test
    void run_shouldPrintDefaults() {
        int exit = app.run(new String[]{"--print-defaults"});

        assertEquals(0, exit);
        JSONObject doc = new JSONObject(printed());
        assertEquals(140.0, doc.getJSONObject("defaults").getDouble("slip_days_max"), 1e-12);
    }

    @Test
    void run_shouldReturnUsageErrorWithoutInput() {
        assertEquals(2, app.run(new String[]{}));
        assertEquals(2, app.run(new String[]{"--no-such-flag"}));
    }

    @Test
    void run_shouldKeepUsageOffStdoutForArgumentErrors() {
        app.run(new String[]{});
        app.run(new String[]{"--no-such-flag"});

        assertEquals("", printed());
    }

    @Test
    void run_shouldPrintHelpToStdout() {
        assertEquals(0, app.run(new String[]{"--help"}));

        assertTrue(printed().startsWith("usage: delivery-health"));
        assertTrue(printed().contains("--input <csv>"));
    }

    @Test
    void run_shouldScoreCsvIntoOutputFile(@TempDir Path dir) throws Exception {
        Path input = writeSample(dir);
        Path output = dir.resolve("out/scores.json");

        int exit = app.run(new String[]{
                "--input", input.toString(),
                "--output", output.toString(),
                "--threads", "2",
                "--threshold", "slip_days_max=70",
                "--threshold", "broken"
        });

        assertEquals(0, exit);
        JSONObject doc = new JSONObject(Files.readString(output, StandardCharsets.UTF_8));
        assertEquals(2, doc.getJSONArray("summaries").length());
        assertEquals("P-100", doc.getJSONArray("summaries").getJSONObject(0).getString("project_id"));
        assertEquals("kanban", doc.getJSONArray("summaries").getJSONObject(1).getString("delivery_framework"));
        assertEquals(3, doc.getJSONArray("series").getJSONObject(1).getJSONArray("weeks").length());
        assertTrue(doc.getJSONObject("failures").isEmpty());
    }

    @Test
    void run_shouldWriteToStdoutWithoutOutputOption(@TempDir Path dir) throws Exception {
        int exit = app.run(new String[]{"--input", writeSample(dir).toString()});

        assertEquals(0, exit);
        assertEquals(2, new JSONObject(printed()).getJSONArray("summaries").length());
    }

    @Test
    void run_shouldFailForMissingFile(@TempDir Path dir) {
        assertEquals(1, app.run(new String[]{"--input", dir.resolve("missing.csv").toString()}));
    }

    @Test
    void run_shouldRejectCsvWithoutRequiredColumns(@TempDir Path dir) throws Exception {
        Path input = dir.resolve("bad.csv");
        Files.writeString(input, "project_id,week_ending\nA,2024-03-01\n", StandardCharsets.UTF_8);

        assertEquals(2, app.run(new String[]{"--input", input.toString()}));
    }

    @Test
    void parseOverrides_shouldSkipMalformedPairs() {
        Map<String, String> overrides = DeliveryHealthApplication.parseOverrides(
                new String[]{"cycle_time_max = 12", "=3", "no_equals"});

        assertEquals(Map.of("cycle_time_max", "12"), overrides);
    }

    private String printed() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static Path writeSample(Path dir) throws Exception {
        Path target = dir.resolve("sample.csv");
        try (InputStream in = DeliveryHealthApplicationTest.class.getResourceAsStream("/snapshots/sample.csv")) {
            Files.copy(in, target);
        }
        return target;
    }
}
