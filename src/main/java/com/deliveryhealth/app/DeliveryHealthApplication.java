package com.deliveryhealth.app;

import com.deliveryhealth.config.ThresholdConfig;
import com.deliveryhealth.data.SnapshotCsvReader;
import com.deliveryhealth.model.ScoringResult;
import com.deliveryhealth.model.WeeklySnapshot;
import com.deliveryhealth.output.ScoreJsonWriter;
import com.deliveryhealth.runner.PortfolioRunner;
import com.deliveryhealth.scoring.HealthScoringEngine;
import com.deliveryhealth.utils.StepTimer;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class DeliveryHealthApplication {
    private static final Logger LOG = LogManager.getLogger(DeliveryHealthApplication.class);
    private static final int JSON_INDENT = 2;

    private final PrintStream out;

    public DeliveryHealthApplication() {
        this(System.out);
    }

    DeliveryHealthApplication(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exit = new DeliveryHealthApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            printUsage(options, System.err);
            LOG.error("invalid arguments: {}", e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            printUsage(options, out);
            return 0;
        }

        ScoreJsonWriter writer = new ScoreJsonWriter();
        if (cmd.hasOption("print-defaults")) {
            out.println(writer.buildDefaults(ThresholdConfig.defaults()).toString(JSON_INDENT));
            return 0;
        }

        String input = cmd.getOptionValue("input");
        if (input == null || input.trim().isEmpty()) {
            printUsage(options, System.err);
            LOG.error("--input is required");
            return 2;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            ThresholdConfig thresholds = ThresholdConfig.load(workingDir)
                    .withOverrides(parseOverrides(cmd.getOptionValues("threshold")));
            for (String key : thresholds.asMap().keySet()) {
                if (!"default".equals(thresholds.sourceOf(key))) {
                    LOG.info("threshold key={} value={} source={}", key, thresholds.get(key), thresholds.sourceOf(key));
                }
            }
            int threads = parseInt(cmd.getOptionValue("threads"), 1);
            StepTimer timer = new StepTimer();
            timer.start(StepTimer.TOTAL);

            timer.start(StepTimer.READ);
            List<WeeklySnapshot> snapshots = new SnapshotCsvReader().read(workingDir.resolve(input.trim()).normalize());
            timer.end(StepTimer.READ);

            timer.start(StepTimer.SCORE);
            ScoringResult result = new PortfolioRunner(new HealthScoringEngine(), threads).run(snapshots, thresholds);
            timer.end(StepTimer.SCORE);

            timer.start(StepTimer.WRITE);
            String json = writer.buildDocument(result).toString(JSON_INDENT);
            String output = cmd.getOptionValue("output");
            if (output == null || output.trim().isEmpty()) {
                out.println(json);
            } else {
                Path target = workingDir.resolve(output.trim()).normalize();
                if (target.getParent() != null) {
                    Files.createDirectories(target.getParent());
                }
                Files.writeString(target, json, StandardCharsets.UTF_8);
                LOG.info("scores written path={}", target);
            }
            timer.end(StepTimer.WRITE);
            timer.end(StepTimer.TOTAL);

            LOG.info("run finished rows={} projects={} failed={} {}",
                    snapshots.size(), result.series.size(), result.failures.size(), timer.summaryText());
            return 0;
        } catch (IllegalArgumentException e) {
            LOG.error("invalid input: {}", e.getMessage());
            return 2;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("scoring interrupted");
            return 1;
        } catch (Exception e) {
            LOG.error("FATAL: {}", e.getMessage(), e);
            return 1;
        }
    }

    static Map<String, String> parseOverrides(String[] values) {
        Map<String, String> overrides = new LinkedHashMap<>();
        if (values == null) {
            return overrides;
        }
        for (String value : values) {
            int eq = value == null ? -1 : value.indexOf('=');
            if (eq <= 0) {
                LOG.warn("threshold override ignored, expected name=value: {}", value);
                continue;
            }
            overrides.put(value.substring(0, eq).trim(), value.substring(eq + 1).trim());
        }
        return overrides;
    }

    // stdout is reserved for JSON, so only --help prints usage there
    private static void printUsage(Options options, PrintStream target) {
        PrintWriter writer = new PrintWriter(new OutputStreamWriter(target, StandardCharsets.UTF_8));
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(writer, formatter.getWidth(), "delivery-health", null, options,
                formatter.getLeftPadding(), formatter.getDescPadding(), null);
        writer.flush();
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("input").hasArg().argName("csv").desc("weekly snapshot CSV file").build());
        options.addOption(Option.builder().longOpt("output").hasArg().argName("json").desc("write the score document here instead of stdout").build());
        options.addOption(Option.builder().longOpt("threshold").hasArg().argName("name=value").desc("override one threshold, repeatable").build());
        options.addOption(Option.builder().longOpt("threads").hasArg().argName("n").desc("score projects on n worker threads (default 1)").build());
        options.addOption(Option.builder().longOpt("print-defaults").desc("print the default thresholds and exit").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    private static int parseInt(String value, int fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            LOG.warn("invalid --threads value={}, using {}", value, fallback);
            return fallback;
        }
    }
}
