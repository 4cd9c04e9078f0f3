package com.tickerlink.app;

import com.tickerlink.config.Config;
import com.tickerlink.core.RunTelemetry;
import com.tickerlink.history.ChannelHistorySource;
import com.tickerlink.history.ReconcileResult;
import com.tickerlink.index.FreshnessSweeper;
import com.tickerlink.model.AnalysisRecord;
import com.tickerlink.model.Candidate;
import com.tickerlink.model.ChannelMessage;
import com.tickerlink.pipeline.IngestOutcome;
import com.tickerlink.scoring.GateDecision;
import com.tickerlink.source.DiscordRestHistorySource;
import com.tickerlink.source.JsonHistorySource;
import com.tickerlink.source.http.HttpClientEx;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

public class TickerLinkApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

    public static void main(String[] args) {
        int exit = new TickerLinkApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            new HelpFormatter().printHelp("tickerlink", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("tickerlink", options);
            return 0;
        }

        Clock clock;
        try {
            clock = resolveClock(cmd.getOptionValue("as-of"));
        } catch (DateTimeParseException e) {
            System.err.println("ERROR: --as-of must be an ISO-8601 instant, got " + cmd.getOptionValue("as-of"));
            return 2;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            if (cmd.hasOption("days")) {
                Map<String, String> overrides = new HashMap<>();
                overrides.put("reconcile.days", cmd.getOptionValue("days"));
                config = config.withOverrides(overrides);
            }
            installLogRoutingIfNeeded(config);

            if (cmd.hasOption("scan")) {
                TickerLinkComponents components = TickerLinkComponents.build(config, clock, null);
                printScan(components, cmd.getOptionValue("scan"));
                return 0;
            }

            ChannelHistorySource source;
            List<String> channels;
            if (cmd.hasOption("history")) {
                JsonHistorySource json = JsonHistorySource.load(workingDir.resolve(cmd.getOptionValue("history")).normalize());
                source = json;
                channels = config.getList("channels.analysis").isEmpty() ? json.channelIds() : config.getList("channels.analysis");
                System.out.println("Loaded history export: messages=" + json.size() + ", channels=" + json.channelIds().size());
            } else if (cmd.hasOption("rest")) {
                if (cmd.hasOption("live")) {
                    System.err.println("ERROR: --live replays a --history export and cannot be combined with --rest.");
                    return 2;
                }
                channels = config.getList("channels.analysis");
                if (channels.isEmpty()) {
                    System.err.println("ERROR: channels.analysis is required with --rest.");
                    return 2;
                }
                try {
                    source = DiscordRestHistorySource.fromConfig(config, new HttpClientEx());
                } catch (IllegalArgumentException e) {
                    System.err.println("ERROR: " + e.getMessage() + " (set discord.token or " + DiscordRestHistorySource.TOKEN_ENV + ")");
                    return 2;
                }
            } else {
                new HelpFormatter().printHelp("tickerlink", options);
                System.err.println("ERROR: one of --history, --rest or --scan is required.");
                return 2;
            }

            TickerLinkComponents components = TickerLinkComponents.build(config, clock, source);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> shuttingDown.set(true), "tickerlink-shutdown"));

            if (cmd.hasOption("live")) {
                replayLive(components, (JsonHistorySource) source);
            } else {
                reconcile(components, source, channels);
            }

            String[] tickers = cmd.getOptionValues("ticker");
            printIndex(components, tickers == null ? List.of() : List.of(tickers));
            return 0;
        } catch (Exception e) {
            System.err.println("FATAL: " + e.getMessage());
            e.printStackTrace();
            return 1;
        }
    }

    private void reconcile(TickerLinkComponents components, ChannelHistorySource source, List<String> channels) {
        RunTelemetry telemetry = new RunTelemetry("RECONCILE", Instant.now());
        ReconcileResult result = components.reconciler(source).reconcile(channels, telemetry, shuttingDown::get);
        telemetry.startStep(RunTelemetry.STEP_INDEX_LOAD);
        components.index.loadFromBulk(result.records);
        telemetry.endStep(RunTelemetry.STEP_INDEX_LOAD, result.records.size(), components.index.stats().tickers(), 0);
        telemetry.finish();
        System.out.println(telemetry.getSummary());
        if (!result.failedChannels.isEmpty()) {
            System.err.println("WARN: channels skipped after fetch errors: " + result.failedChannels);
        }
    }

    private void replayLive(TickerLinkComponents components, JsonHistorySource source) {
        RunTelemetry telemetry = new RunTelemetry("LIVE_REPLAY", Instant.now());
        List<ChannelMessage> messages = source.chronological();
        List<ChannelMessage> notices = new ArrayList<>();
        List<String> noticeChannels = components.config.getList("channels.notices");
        int indexed = 0;
        try (FreshnessSweeper sweeper = components.sweeper()) {
            sweeper.start();
            telemetry.startStep(RunTelemetry.STEP_LIVE_REPLAY);
            for (ChannelMessage message : messages) {
                if (shuttingDown.get()) {
                    telemetry.markCancelled();
                    break;
                }
                if (noticeChannels.contains(message.getChannelId())) {
                    notices.add(message);
                    continue;
                }
                IngestOutcome outcome = components.pipeline.onMessage(message);
                if (outcome.indexed()) {
                    indexed++;
                }
            }
            telemetry.endStep(RunTelemetry.STEP_LIVE_REPLAY, messages.size(), indexed, 0);
            sweeper.sweepOnce();
        }
        telemetry.finish();
        System.out.println(telemetry.getSummary());

        for (ChannelMessage notice : notices) {
            List<Candidate> picks = components.picks.resolve(notice);
            if (!picks.isEmpty()) {
                System.out.println("top picks " + notice.getId() + " with fresh analysis: " + picks);
            }
        }
    }

    private void printScan(TickerLinkComponents components, String text) {
        List<Candidate> candidates = components.extractor.extract(text);
        List<Candidate> topPicks = components.extractor.extractTopPicks(text);
        double score = components.scorer.score(text, candidates.size());
        GateDecision decision = components.gate.evaluate(score, candidates.size(), components.scorer.isTickerList(text));
        System.out.println("candidates=" + candidates);
        if (!topPicks.isEmpty()) {
            System.out.println("top_picks=" + topPicks);
        }
        System.out.println(String.format(Locale.US, "relevance=%.2f indexed=%s reason=%s",
                score, decision.accepted(), decision.reason()));
    }

    private void printIndex(TickerLinkComponents components, List<String> tickers) {
        List<String> wanted = tickers.isEmpty() ? new ArrayList<>(components.index.allFreshTickers()) : tickers;
        System.out.println("index " + components.index.stats());
        for (String ticker : wanted) {
            Optional<AnalysisRecord> latest = components.index.latest(ticker);
            if (latest.isEmpty()) {
                System.out.println(ticker.toUpperCase(Locale.ROOT) + ": no analysis");
                continue;
            }
            AnalysisRecord rec = latest.get();
            System.out.println(String.format(Locale.US, "%s: latest=%s score=%.2f fresh=%s url=%s",
                    ticker.toUpperCase(Locale.ROOT), rec.timestamp, rec.relevanceScore,
                    components.index.isFresh(ticker), rec.canonicalUrl));
            for (AnalysisRecord r : components.index.recent(ticker, 3)) {
                System.out.println("  recent " + r.timestamp + " " + r.canonicalUrl);
            }
        }
    }

    private Clock resolveClock(String asOf) {
        if (asOf == null || asOf.isBlank()) {
            return Clock.systemUTC();
        }
        return Clock.fixed(Instant.parse(asOf.trim()), ZoneOffset.UTC);
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (TickerLinkApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("tickerlink.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(TickerLinkApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                System.out.println("Log4j routing enabled. dir=" + logDir.toAbsolutePath());
            } catch (Exception e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("history").hasArg().argName("file").desc("reconcile from a JSON channel export").build());
        options.addOption(Option.builder().longOpt("rest").desc("reconcile from the Discord REST API (channels.analysis, discord.token)").build());
        options.addOption(Option.builder().longOpt("live").desc("replay the --history export through the live path instead of reconciling").build());
        options.addOption(Option.builder().longOpt("days").hasArg().argName("n").desc("backlog lookback in days (reconcile.days)").build());
        options.addOption(Option.builder().longOpt("ticker").hasArg().argName("SYM").desc("print latest/recent analysis for a ticker; repeatable").build());
        options.addOption(Option.builder().longOpt("scan").hasArg().argName("text").desc("print extraction and relevance for one text, then exit").build());
        options.addOption(Option.builder().longOpt("as-of").hasArg().argName("instant").desc("evaluate freshness and cutoffs at this ISO-8601 instant").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
