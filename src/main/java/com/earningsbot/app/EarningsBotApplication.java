package com.earningsbot.app;

import com.earningsbot.alerts.AlertNotFoundException;
import com.earningsbot.alerts.AlertService;
import com.earningsbot.model.Alert;
import com.earningsbot.model.DailyJobResult;
import com.earningsbot.model.Position;
import com.earningsbot.runner.DailyScanOrchestrator;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.boot.Banner;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

import java.io.PrintStream;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.UUID;

/**
 * Command line surface of the scanner. Every command prints one JSON document on stdout;
 * logs go to stderr.
 */
public final class EarningsBotApplication {
    private static final Logger LOG = LogManager.getLogger(EarningsBotApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_NOT_FOUND = 4;

    private final PrintStream out;
    private final PrintStream err;

    public EarningsBotApplication() {
        this(System.out, System.err);
    }

    EarningsBotApplication(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        int exit = new EarningsBotApplication().run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("earningsbot", options);
            err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        }

        if (cmd.hasOption("help") || args == null || args.length == 0) {
            new HelpFormatter().printHelp("earningsbot", options);
            return EXIT_OK;
        }
        if (cmd.hasOption("health")) {
            out.println(new JSONObject().put("ok", true));
            return EXIT_OK;
        }

        try {
            Command command = resolveCommand(cmd);
            try (ConfigurableApplicationContext context = openContext()) {
                return command.execute(context);
            }
        } catch (IllegalArgumentException e) {
            err.println("ERROR: " + e.getMessage());
            return EXIT_USAGE;
        } catch (AlertNotFoundException e) {
            err.println(new JSONObject().put("detail", e.getMessage()));
            return EXIT_NOT_FOUND;
        } catch (Exception e) {
            LOG.error("Command failed: {}", e.getMessage(), e);
            err.println("FATAL: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private ConfigurableApplicationContext openContext() {
        return new SpringApplicationBuilder(EarningsBotBootstrapConfig.class)
                .web(WebApplicationType.NONE)
                .bannerMode(Banner.Mode.OFF)
                .logStartupInfo(false)
                .run();
    }

    @FunctionalInterface
    private interface Command {
        int execute(ConfigurableApplicationContext context) throws Exception;
    }

    private Command resolveCommand(CommandLine cmd) {
        if (cmd.hasOption("run-daily")) {
            LocalDate asOf = parseDate(cmd.getOptionValue("as-of"));
            return context -> runDaily(context, asOf);
        }
        if (cmd.hasOption("pending-alerts")) {
            int limit = parseLimit(cmd.getOptionValue("limit"));
            return context -> pendingAlerts(context, limit);
        }
        if (cmd.hasOption("mark-sent")) {
            UUID id = parseId(cmd.getOptionValue("mark-sent"));
            return context -> markSent(context, id);
        }
        if (cmd.hasOption("open-positions")) {
            return this::openPositions;
        }
        throw new IllegalArgumentException("no command given, see --help");
    }

    private int runDaily(ConfigurableApplicationContext context, LocalDate asOf) {
        DailyJobResult result = context.getBean(DailyScanOrchestrator.class).runDailyJob(asOf);
        JSONObject json = new JSONObject()
                .put("as_of", result.asOf().toString())
                .put("new_entry_alerts", result.newEntryAlerts())
                .put("new_exit_alerts", result.newExitAlerts());
        out.println(json);
        return EXIT_OK;
    }

    private int pendingAlerts(ConfigurableApplicationContext context, int limit) throws Exception {
        List<Alert> alerts = context.getBean(AlertService.class).listPendingAlerts(limit);
        JSONArray array = new JSONArray();
        for (Alert alert : alerts) {
            array.put(alertJson(alert));
        }
        out.println(array.toString(2));
        return EXIT_OK;
    }

    private int markSent(ConfigurableApplicationContext context, UUID id) throws Exception {
        Alert alert = context.getBean(AlertService.class).markAlertSent(id);
        JSONObject json = new JSONObject()
                .put("success", true)
                .put("id", alert.getId().toString())
                .put("sent_at", String.valueOf(alert.getSentAt()));
        out.println(json);
        return EXIT_OK;
    }

    private int openPositions(ConfigurableApplicationContext context) throws Exception {
        List<Position> positions = context.getBean(AlertService.class).listOpenPositions();
        JSONArray array = new JSONArray();
        for (Position position : positions) {
            array.put(new JSONObject()
                    .put("id", position.getId().toString())
                    .put("symbol", position.getSymbol())
                    .put("entry_date", position.getEntryDate().toString())
                    .put("entry_price", position.getEntryPrice().toPlainString())
                    .put("status", position.getStatus().name()));
        }
        out.println(array.toString(2));
        return EXIT_OK;
    }

    static JSONObject alertJson(Alert alert) {
        return new JSONObject()
                .put("id", alert.getId().toString())
                .put("alert_type", alert.getAlertType().name())
                .put("symbol", alert.getSymbol())
                .put("as_of", alert.getAsOf().toString())
                .put("message", alert.getMessage());
    }

    static LocalDate parseDate(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("--as-of YYYY-MM-DD is required");
        }
        try {
            return LocalDate.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("invalid --as-of date: " + raw, e);
        }
    }

    static int parseLimit(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return AlertService.DEFAULT_LIMIT;
        }
        int limit;
        try {
            limit = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid --limit: " + raw, e);
        }
        if (limit < AlertService.MIN_LIMIT || limit > AlertService.MAX_LIMIT) {
            throw new IllegalArgumentException("--limit must be between "
                    + AlertService.MIN_LIMIT + " and " + AlertService.MAX_LIMIT);
        }
        return limit;
    }

    static UUID parseId(String raw) {
        try {
            return UUID.fromString(raw == null ? "" : raw.trim());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid alert id: " + raw, e);
        }
    }

    private static Options buildOptions() {
        Options options = new Options();
        OptionGroup commands = new OptionGroup();
        commands.addOption(Option.builder().longOpt("health").desc("print a liveness document and exit").build());
        commands.addOption(Option.builder().longOpt("run-daily").desc("run the entry and exit scans for --as-of").build());
        commands.addOption(Option.builder().longOpt("pending-alerts").desc("list unsent alerts, oldest first").build());
        commands.addOption(Option.builder().longOpt("mark-sent").hasArg().argName("id").desc("acknowledge delivery of an alert").build());
        commands.addOption(Option.builder().longOpt("open-positions").desc("list open positions").build());
        commands.addOption(Option.builder().longOpt("help").desc("show help").build());
        options.addOptionGroup(commands);
        options.addOption(Option.builder().longOpt("as-of").hasArg().argName("YYYY-MM-DD").desc("scan date for --run-daily").build());
        options.addOption(Option.builder().longOpt("limit").hasArg().argName("n").desc("max alerts for --pending-alerts (1..500, default 200)").build());
        return options;
    }
}
