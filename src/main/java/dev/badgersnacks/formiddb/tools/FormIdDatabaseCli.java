package dev.badgersnacks.formiddb.tools;

import dev.badgersnacks.formiddb.agents.AgentOrchestrator;
import dev.badgersnacks.formiddb.agents.AgentResult;
import dev.badgersnacks.formiddb.decoder.PluginDecoders;
import dev.badgersnacks.formiddb.ingest.ErrorSink;
import dev.badgersnacks.formiddb.ingest.IngestionOrchestrator;
import dev.badgersnacks.formiddb.ingest.ProgressListener;
import dev.badgersnacks.formiddb.ingest.RecordExtractor;
import dev.badgersnacks.formiddb.ingest.RecordLabelResolver;
import dev.badgersnacks.formiddb.ingest.RunSupervisor;
import dev.badgersnacks.formiddb.ingest.TextListExtractor;
import dev.badgersnacks.formiddb.loadorder.LoadOrderResolver;
import dev.badgersnacks.formiddb.loadorder.PluginsTxtLoadOrderProvider;
import dev.badgersnacks.formiddb.logging.ActionLogger;
import dev.badgersnacks.formiddb.model.GameRelease;
import dev.badgersnacks.formiddb.model.IngestionRequest;
import dev.badgersnacks.formiddb.model.IngestionResult;
import dev.badgersnacks.formiddb.persistence.IngestionSettings;
import dev.badgersnacks.formiddb.persistence.IngestionSettingsStorage;
import dev.badgersnacks.formiddb.scanner.PluginCandidateList;
import dev.badgersnacks.formiddb.scanner.PluginListScanner;
import dev.badgersnacks.formiddb.scanner.ScanResult;
import dev.badgersnacks.formiddb.store.BatchedStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command-line front end: lists candidate plugins and fills a FormID database from plugins or from a
 * FormID list export.
 */
public final class FormIdDatabaseCli {

    private static final Logger LOGGER = LoggerFactory.getLogger(FormIdDatabaseCli.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_FAILURE = 2;
    public static final int EXIT_CANCELLED = 130;

    private static final String USAGE = """
            Usage:
              FormIdDatabaseCli list <gameDir> <release> [--include-base] [--settings <file>]
              FormIdDatabaseCli plugins <gameDir> <release> <database> [--update] [--dry-run] [--all] [--settings <file>] [plugin...]
              FormIdDatabaseCli text <formIdList> <release> <database> [--update] [--dry-run] [--settings <file>]

            <gameDir>    Game install folder or its Data folder.
            <release>    One of %s.
            <database>   SQLite file to create or update (directories are created automatically).
            <formIdList> Text export with one plugin|formid|entry line per record.
            """;
    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    private final PrintStream out;
    private final PrintStream err;
    private final Path logsDirectory;
    private final RunSupervisor supervisor = new RunSupervisor();
    private volatile CountDownLatch activeRun = new CountDownLatch(0);

    public FormIdDatabaseCli(PrintStream out, PrintStream err, Path logsDirectory) {
        this.out = Objects.requireNonNull(out, "out");
        this.err = Objects.requireNonNull(err, "err");
        this.logsDirectory = Objects.requireNonNull(logsDirectory, "logsDirectory");
    }

    public static void main(String[] args) {
        FormIdDatabaseCli cli = new FormIdDatabaseCli(System.out, System.err, ActionLogger.defaultDirectory());
        Runtime.getRuntime().addShutdownHook(new Thread(cli::cancelAndAwait, "formid-shutdown"));
        System.exit(cli.execute(args));
    }

    public int execute(String[] args) {
        CommandLine command;
        try {
            command = CommandLine.parse(args);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.printf(USAGE, releaseNames());
            return EXIT_USAGE;
        }

        IngestionSettings settings = command.settingsFile() == null
                ? new IngestionSettingsStorage().load()
                : new IngestionSettingsStorage(command.settingsFile()).load();
        try (ActionLogger actionLogger = new ActionLogger(logsDirectory);
             AgentOrchestrator agents = new AgentOrchestrator()) {
            actionLogger.log("command", String.join(" ", args));
            ErrorSink logged = actionLogger.asErrorSink();
            ErrorSink errors = (message, informational) -> {
                logged.report(message, informational);
                (informational ? out : err).println(message);
            };
            LoadOrderResolver loadOrderResolver = new LoadOrderResolver(
                    new PluginsTxtLoadOrderProvider(settings.pluginsFilePath().orElse(null)));
            PluginListScanner scanner = new PluginListScanner(loadOrderResolver, agents, Runnable::run, errors,
                    (message, percent) -> LOGGER.debug(message), settings.scanProgressInterval());

            if (command.name().equals("list")) {
                return list(command, scanner);
            }
            BatchedStore store = new BatchedStore();
            RecordExtractor recordExtractor = new RecordExtractor(store, PluginDecoders.fromServiceLoader(),
                    new RecordLabelResolver(), errors, settings.pluginBatchSize(), settings.ignorableRecordErrors());
            TextListExtractor textListExtractor = new TextListExtractor(store, settings.textBatchSize(),
                    settings.progressInterval());
            IngestionOrchestrator orchestrator = new IngestionOrchestrator(store, loadOrderResolver, recordExtractor,
                    textListExtractor, errors, agents, supervisor);
            ProgressListener progress = (message, percent) -> {
                out.println(percent == null ? message : String.format(Locale.ROOT, "[%5.1f%%] %s", percent, message));
                actionLogger.log("progress", message);
            };
            return ingest(command, scanner, orchestrator, progress, actionLogger);
        }
    }

    /**
     * Cancels the active run, if any, and waits a bounded time for it to roll back.
     */
    public void cancelAndAwait() {
        if (!supervisor.cancelCurrent()) {
            return;
        }
        err.println("Cancelling...");
        try {
            if (!activeRun.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                LOGGER.warn("Run did not stop within {} seconds", SHUTDOWN_WAIT_SECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private int list(CommandLine command, PluginListScanner scanner) {
        PluginCandidateList candidates = new PluginCandidateList();
        ScanResult result = scanner.refreshList(command.source(), command.release(), candidates,
                command.includeBase()).join();
        if (result.status() != ScanResult.Status.PUBLISHED) {
            return EXIT_FAILURE;
        }
        result.pluginNames().forEach(out::println);
        return EXIT_OK;
    }

    private int ingest(CommandLine command,
                       PluginListScanner scanner,
                       IngestionOrchestrator orchestrator,
                       ProgressListener progress,
                       ActionLogger actionLogger) {
        IngestionRequest request;
        if (command.name().equals("text")) {
            request = IngestionRequest.forTextList(command.source(), command.database(), command.release(),
                    command.update(), command.dryRun());
        } else {
            List<String> plugins = selectPlugins(command, scanner);
            if (plugins == null) {
                return EXIT_FAILURE;
            }
            if (plugins.isEmpty()) {
                err.println("No plugins selected. Name plugins or pass --all.");
                return EXIT_USAGE;
            }
            request = IngestionRequest.forPlugins(command.source(), command.database(), command.release(),
                    plugins, command.update(), command.dryRun());
        }

        CountDownLatch finished = new CountDownLatch(1);
        activeRun = finished;
        try {
            AgentResult<IngestionResult> result = orchestrator.submit(request, progress).join();
            LOGGER.info("Run finished in {} ms", result.duration().toMillis());
            return result.payload().outcome() == IngestionResult.Outcome.COMPLETED_WITH_FAILURES
                    ? EXIT_FAILURE
                    : EXIT_OK;
        } catch (CompletionException | CancellationException e) {
            Throwable cause = unwrap(e);
            if (cause instanceof CancellationException) {
                actionLogger.log("run:cancelled", cause.getMessage());
                return EXIT_CANCELLED;
            }
            actionLogger.log("run:failed", cause.getMessage(), cause);
            err.println("Error: " + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()));
            return EXIT_FAILURE;
        } finally {
            finished.countDown();
        }
    }

    /**
     * @return the plugins to process, or {@code null} when the {@code --all} scan failed
     */
    private List<String> selectPlugins(CommandLine command, PluginListScanner scanner) {
        Set<String> selected = new LinkedHashSet<>();
        if (command.all()) {
            PluginCandidateList candidates = new PluginCandidateList();
            ScanResult scan = scanner.refreshList(command.source(), command.release(), candidates, false).join();
            if (scan.status() != ScanResult.Status.PUBLISHED) {
                return null;
            }
            PluginListScanner.selectAll(candidates);
            selected.addAll(candidates.selectedNames());
        }
        selected.addAll(command.plugins());
        return new ArrayList<>(selected);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String releaseNames() {
        List<String> names = new ArrayList<>();
        for (GameRelease release : GameRelease.values()) {
            names.add(release.tableName());
        }
        return String.join(", ", names);
    }

    /**
     * Parsed arguments. {@code source} is the game directory for {@code list}/{@code plugins} and the
     * FormID list file for {@code text}.
     */
    record CommandLine(String name,
                       Path source,
                       GameRelease release,
                       Path database,
                       boolean includeBase,
                       boolean update,
                       boolean dryRun,
                       boolean all,
                       Path settingsFile,
                       List<String> plugins) {

        static CommandLine parse(String[] args) {
            if (args.length == 0) {
                throw new IllegalArgumentException("Missing command.");
            }
            String name = args[0].toLowerCase(Locale.ROOT);
            int positionalCount = switch (name) {
                case "list" -> 2;
                case "plugins", "text" -> 3;
                default -> throw new IllegalArgumentException("Unknown command: " + args[0]);
            };

            List<String> positional = new ArrayList<>();
            List<String> plugins = new ArrayList<>();
            boolean includeBase = false;
            boolean update = false;
            boolean dryRun = false;
            boolean all = false;
            Path settingsFile = null;
            for (int i = 1; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--include-base" -> includeBase = requireCommand(name, arg, "list");
                    case "--update" -> update = requireCommand(name, arg, "plugins", "text");
                    case "--dry-run" -> dryRun = requireCommand(name, arg, "plugins", "text");
                    case "--all" -> all = requireCommand(name, arg, "plugins");
                    case "--settings" -> {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("--settings requires a file argument.");
                        }
                        settingsFile = Paths.get(args[++i]).toAbsolutePath().normalize();
                    }
                    default -> {
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option: " + arg);
                        }
                        if (positional.size() < positionalCount) {
                            positional.add(arg);
                        } else if (name.equals("plugins")) {
                            plugins.add(arg);
                        } else {
                            throw new IllegalArgumentException("Unexpected argument: " + arg);
                        }
                    }
                }
            }
            if (positional.size() < positionalCount) {
                throw new IllegalArgumentException("Missing arguments for " + name + ".");
            }
            Path source = Paths.get(positional.get(0)).toAbsolutePath().normalize();
            GameRelease release = GameRelease.fromName(positional.get(1));
            Path database = positionalCount > 2 ? Paths.get(positional.get(2)).toAbsolutePath().normalize() : null;
            return new CommandLine(name, source, release, database, includeBase, update, dryRun, all,
                    settingsFile, List.copyOf(plugins));
        }

        private static boolean requireCommand(String name, String option, String... allowed) {
            for (String candidate : allowed) {
                if (candidate.equals(name)) {
                    return true;
                }
            }
            throw new IllegalArgumentException(option + " is not valid for " + name + ".");
        }
    }
}
