package com.stocktracker.app;

import com.stocktracker.kr.config.Config;
import com.stocktracker.kr.db.CycleRunDao;
import com.stocktracker.kr.db.Database;
import com.stocktracker.kr.db.MigrationRunner;
import com.stocktracker.kr.db.PostgresPortfolioStore;
import com.stocktracker.kr.feed.ReplayJudgmentProducer;
import com.stocktracker.kr.feed.ScreeningFile;
import com.stocktracker.kr.feed.SnapshotPriceFeed;
import com.stocktracker.kr.model.Cycle;
import com.stocktracker.kr.model.HistoryStats;
import com.stocktracker.kr.model.MarketCondition;
import com.stocktracker.kr.model.Position;
import com.stocktracker.kr.model.ScreeningRequest;
import com.stocktracker.kr.notify.BufferedNotificationSink;
import com.stocktracker.kr.notify.LoggingNotificationSink;
import com.stocktracker.kr.notify.PortfolioEvent;
import com.stocktracker.kr.runner.CycleReport;
import com.stocktracker.kr.runner.CycleRunLog;
import com.stocktracker.kr.runner.CycleRunner;
import com.stocktracker.kr.runner.InMemoryCycleRunLog;
import com.stocktracker.kr.runner.PortfolioEngine;
import com.stocktracker.kr.store.InMemoryPortfolioStore;
import com.stocktracker.kr.store.PortfolioStore;
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
import java.sql.SQLException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

public final class TrackerApplication {
    private static final Logger LOG = LogManager.getLogger(TrackerApplication.class);
    private static final DateTimeFormatter DISPLAY_TS_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final ReentrantLock runLock = new ReentrantLock();

    public static void main(String[] args) {
        int exit = new TrackerApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("stock-tracker", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("stock-tracker", options);
            return 0;
        }

        MarketCondition market;
        try {
            market = parseMarket(cmd.getOptionValue("market"));
        } catch (IllegalArgumentException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        try {
            Path workingDir = Path.of(".").toAbsolutePath().normalize();
            Config config = Config.load(workingDir);
            installLogRoutingIfNeeded(config);
            if (market == null) {
                market = MarketCondition.fromText(config.getString("market.condition", "NEUTRAL"));
            }

            boolean noArgs = args == null || args.length == 0;
            boolean scheduleEnabled = noArgs && config.getBoolean("app.schedule.enabled", false);
            if (!scheduleEnabled && !cmd.hasOption("once") && !cmd.hasOption("stats")) {
                new HelpFormatter().printHelp("stock-tracker", options);
                System.err.println("ERROR: nothing to do; pass --once or --stats, or set app.schedule.enabled=true");
                return 2;
            }

            StoreWiring wiring = openStore(config);
            BufferedNotificationSink sink = new BufferedNotificationSink(new LoggingNotificationSink());
            PortfolioEngine engine = PortfolioEngine.create(config, wiring.store, sink);

            if (cmd.hasOption("stats")) {
                printStats(engine, config.getDouble("portfolio.total_capital", 100_000_000.0));
                if (!cmd.hasOption("once")) {
                    return 0;
                }
            }

            CycleRunner runner = new CycleRunner(
                    engine,
                    SnapshotPriceFeed.fromConfig(config),
                    ReplayJudgmentProducer.fromConfig(config),
                    wiring.runLog,
                    config.getInt("cycle.threads", 4),
                    config.getLong("judgment.timeout_sec", 120L)
            );

            if (scheduleEnabled) {
                return runSchedule(config, runner, sink, market);
            }
            ZoneId zone = config.getZone("schedule.zone");
            Cycle cycle = CycleSchedule.cycleFor(cmd.getOptionValue("cycle-id"), LocalDate.now(zone));
            CycleReport report = runCycle(config, runner, sink, cycle, market, "manual");
            if (report.aborted()) {
                return 130;
            }
            return 0;
        } catch (Exception e) {
            LOG.fatal("FATAL: {}", e.getMessage(), e);
            return 1;
        }
    }

    private int runSchedule(Config config, CycleRunner runner, BufferedNotificationSink sink, MarketCondition market) {
        ZoneId zoneId = config.getZone("schedule.zone");
        CycleSchedule schedule = CycleSchedule.parse(config.getString("schedule.times", ""));
        if (schedule.isEmpty()) {
            System.err.println("ERROR: invalid schedule config. Use schedule.times=09:30,15:00");
            return 2;
        }

        LOG.info("Schedule mode started. zone={}, times={}", zoneId, schedule.format());
        while (true) {
            ZonedDateTime next = schedule.nextRunTime(ZonedDateTime.now(zoneId));
            LOG.info("Next cycle at {}", DISPLAY_TS_FMT.format(next));
            if (!CycleSchedule.sleepUntil(next)) {
                return 130;
            }
            CycleReport report = runCycle(config, runner, sink, CycleSchedule.cycleAt(next), market, "schedule");
            if (report == null) {
                LOG.warn("cycle skipped: another run holds the run lock");
            } else if (report.aborted()) {
                return 130;
            } else if (!CycleReport.STATUS_SUCCESS.equals(report.status())) {
                LOG.warn("scheduled cycle {} finished with status {}", report.cycleId(), report.status());
            }
        }
    }

    /**
     * @return null when another cycle is already running in this process
     */
    private CycleReport runCycle(
            Config config,
            CycleRunner runner,
            BufferedNotificationSink sink,
            Cycle cycle,
            MarketCondition market,
            String trigger
    ) {
        if (!runLock.tryLock()) {
            return null;
        }
        try {
            List<ScreeningRequest> screening = loadScreening(config);
            CycleReport report = runner.run(cycle, market, screening, trigger);
            List<PortfolioEvent> events = sink.drain();
            System.out.println("Cycle " + cycle.id + " status=" + report.status() + " events=" + events.size());
            for (PortfolioEvent event : events) {
                System.out.println("  " + event.toLine());
            }
            System.out.println(report.summary().toSummaryLine());
            System.out.println(report.stats().toSummaryLine());
            return report;
        } finally {
            runLock.unlock();
        }
    }

    private List<ScreeningRequest> loadScreening(Config config) {
        Path path = config.getPath("screening.path");
        try {
            return ScreeningFile.read(path);
        } catch (IOException e) {
            LOG.error("screening list unreadable, continuing without entries: {} ({})", path, e.getMessage());
            return List.of();
        }
    }

    private void printStats(PortfolioEngine engine, double totalCapital) throws SQLException {
        HistoryStats stats = engine.history().stats();
        System.out.println(engine.ledger().summary().toSummaryLine());
        for (Position position : engine.ledger().listOpen()) {
            System.out.println(String.format(Locale.US, "  %s %s buy=%.0f now=%.0f target=%.0f stop=%.0f pnl=%.2f%% weight=%.2f%%",
                    position.ticker, position.companyName, position.buyPrice, position.currentPrice,
                    position.targetPrice(), position.stopLoss(), position.unrealizedProfitRatePercent(),
                    engine.capacity().weightOf(position, totalCapital)));
        }
        System.out.println(stats.toSummaryLine());
    }

    private StoreWiring openStore(Config config) throws SQLException {
        String type = config.getString("store.type", "memory").toLowerCase(Locale.ROOT);
        if (type.equals("postgres")) {
            Database database = Database.fromConfig(config);
            LOG.info("DB url={}, schema={}", database.maskedJdbcUrl(), database.schema());
            new MigrationRunner().run(database);
            CycleRunDao runDao = new CycleRunDao(database);
            runDao.recoverDanglingRuns();
            return new StoreWiring(new PostgresPortfolioStore(database), runDao);
        }
        if (!type.equals("memory")) {
            throw new IllegalArgumentException("store.type must be memory or postgres: " + type);
        }
        LOG.warn("store.type=memory: portfolio state is not persisted across runs");
        return new StoreWiring(new InMemoryPortfolioStore(), new InMemoryCycleRunLog());
    }

    static MarketCondition parseMarket(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        for (MarketCondition condition : MarketCondition.values()) {
            if (condition.name().equals(value)) {
                return condition;
            }
        }
        throw new IllegalArgumentException("--market must be BULL, NEUTRAL or BEAR: " + raw);
    }

    private void installLogRoutingIfNeeded(Config config) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (TrackerApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = config.getPath("outputs.dir").resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("stocktracker.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(TrackerApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
                LOG.info("Log4j routing enabled. dir={}", logDir.toAbsolutePath());
            } catch (IOException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("once").desc("run one cycle now and exit").build());
        options.addOption(Option.builder().longOpt("cycle-id").hasArg().argName("id")
                .desc("cycle id, e.g. 2026-10-19-AM; a leading date sets the cycle date").build());
        options.addOption(Option.builder().longOpt("market").hasArg().argName("condition")
                .desc("market condition for the entry threshold: BULL, NEUTRAL or BEAR").build());
        options.addOption(Option.builder().longOpt("stats").desc("print portfolio summary and trade statistics").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }

    private static final class StoreWiring {
        final PortfolioStore store;
        final CycleRunLog runLog;

        StoreWiring(PortfolioStore store, CycleRunLog runLog) {
            this.store = store;
            this.runLog = runLog;
        }
    }
}
