package com.tradingassistant.app;

import com.tradingassistant.config.Config;
import com.tradingassistant.config.PipelineSettings;
import com.tradingassistant.core.RunTelemetry;
import com.tradingassistant.data.JsonSnapshotSource;
import com.tradingassistant.data.MarketDataSource;
import com.tradingassistant.model.MarketSnapshot;
import com.tradingassistant.model.Signal;
import com.tradingassistant.output.ExcelWorkbookWriter;
import com.tradingassistant.runner.PipelineResult;
import com.tradingassistant.runner.SignalPipeline;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.io.IoBuilder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class TradingAssistantApplication {
    private static final int EXIT_OK = 0;
    private static final int EXIT_FAILURE = 1;
    private static final int EXIT_USAGE = 2;
    private static final int TOP_PRINT_COUNT = 5;

    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final boolean routeStdStreams;

    public TradingAssistantApplication() {
        this(true);
    }

    /**
     * @param routeStdStreams when false, System.out and System.err are left untouched
     */
    TradingAssistantApplication(boolean routeStdStreams) {
        this.routeStdStreams = routeStdStreams;
    }

    public static void main(String[] args) {
        int exit = new TradingAssistantApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("trading-assistant", options);
            System.err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("trading-assistant", options);
            return EXIT_OK;
        }

        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        Config config;
        PipelineSettings settings;
        try {
            String configFile = cmd.getOptionValue("config");
            config = Config.load(workingDir, configFile == null ? null : Path.of(configFile));
            if (routeStdStreams) {
                installLogRoutingIfNeeded(config);
            }
            settings = PipelineSettings.from(config);
            if (cmd.hasOption("threads")) {
                settings = settings.toBuilder().threads(parseThreads(cmd.getOptionValue("threads"))).build();
            }
        } catch (IllegalArgumentException | IOException e) {
            System.err.println("ERROR: invalid configuration: " + e.getMessage());
            return EXIT_USAGE;
        }

        Logger log = LogManager.getLogger(TradingAssistantApplication.class);
        logConfiguration(log, config);
        try {
            Path input = resolve(workingDir, cmd.getOptionValue("input"), config.getPath("input.snapshot"));
            Path output = resolve(workingDir, cmd.getOptionValue("output"), config.getPath("output.excelFile"));
            return runOnce(log, settings, new JsonSnapshotSource(input), output, !cmd.hasOption("no-export"));
        } catch (IllegalArgumentException e) {
            log.error("Run aborted: {}", e.getMessage());
            return EXIT_USAGE;
        } catch (Exception e) {
            log.error("Error during analysis: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        }
    }

    int runOnce(
            Logger log,
            PipelineSettings settings,
            MarketDataSource source,
            Path output,
            boolean export
    ) throws IOException {
        RunTelemetry telemetry = new RunTelemetry("manual", Instant.now());

        log.info("Fetching market data from {}", source.describe());
        telemetry.startStep(RunTelemetry.STEP_LOAD);
        MarketSnapshot snapshot = source.fetch();
        telemetry.endStep(RunTelemetry.STEP_LOAD, 0, snapshot.prices.size(), 0);

        SignalPipeline pipeline = new SignalPipeline(settings);
        PipelineResult result = pipeline.run(snapshot, telemetry);

        if (export) {
            telemetry.startStep(RunTelemetry.STEP_EXPORT);
            new ExcelWorkbookWriter().write(output, result, snapshot, settings, Instant.now());
            telemetry.endStep(RunTelemetry.STEP_EXPORT, result.rankedSignals.size(), 1, 0, output.toString());
            log.info("Output written to: {}", output);
        }
        telemetry.finish();

        printTopSignals(result.rankedSignals);
        log.info("Run summary\n{}", telemetry.getSummary());
        return EXIT_OK;
    }

    private static void logConfiguration(Logger log, Config config) {
        Map<String, String> effective = config.snapshot();
        List<String> overridden = overriddenKeys(config);
        log.info("Configuration loaded keys={} overrides={}", effective.size(), overridden.size());
        for (String key : overridden) {
            log.info("  config override {}={}", key, effective.get(key));
        }
    }

    /**
     * Keys whose value comes from a working-directory or explicit config file, in sorted order.
     */
    static List<String> overriddenKeys(Config config) {
        List<String> out = new ArrayList<>();
        for (String key : config.snapshot().keySet()) {
            if ("override".equals(config.sourceOf(key))) {
                out.add(key);
            }
        }
        return out;
    }

    private void printTopSignals(List<Signal> ranked) {
        if (ranked.isEmpty()) {
            System.out.println("No signals passed the ranking thresholds.");
            return;
        }
        System.out.println("Top signals generated:");
        int limit = Math.min(TOP_PRINT_COUNT, ranked.size());
        for (int i = 0; i < limit; i++) {
            Signal s = ranked.get(i);
            System.out.println(String.format(
                    Locale.US,
                    "  %d. %s: Score %.2f/100 (risk %.2f)",
                    i + 1,
                    s.ticker,
                    s.compositeScore,
                    s.riskScore
            ));
        }
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (TradingAssistantApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("tradingassistant.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(TradingAssistantApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (IOException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private static int parseThreads(String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--threads must be an integer: " + raw, e);
        }
    }

    private static Path resolve(Path workingDir, String cliValue, Path configured) {
        if (cliValue == null || cliValue.trim().isEmpty()) {
            return configured;
        }
        return workingDir.resolve(cliValue.trim()).normalize();
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder("c").longOpt("config").hasArg().argName("file")
                .desc("Properties file layered over the built-in configuration").build());
        options.addOption(Option.builder("i").longOpt("input").hasArg().argName("file")
                .desc("Market snapshot JSON (default: input.snapshot)").build());
        options.addOption(Option.builder("o").longOpt("output").hasArg().argName("file")
                .desc("Excel workbook to write (default: output.excelFile)").build());
        options.addOption(Option.builder("t").longOpt("threads").hasArg().argName("n")
                .desc("Worker threads for per-ticker scoring").build());
        options.addOption(Option.builder().longOpt("no-export")
                .desc("Skip writing the Excel workbook").build());
        options.addOption(Option.builder("h").longOpt("help").desc("Show help").build());
        return options;
    }
}
