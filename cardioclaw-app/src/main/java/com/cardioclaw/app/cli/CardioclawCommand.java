package com.cardioclaw.app.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import com.cardioclaw.common.errors.ConfigNotFoundException;
import com.cardioclaw.engine.CardioclawEngine;
import com.cardioclaw.engine.EngineSettings;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ScopeType;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.function.Function;

@Command(
        name = "cardioclaw",
        mixinStandardHelpOptions = true,
        version = "cardioclaw 0.1.0",
        description = "Declarative heartbeats for the OpenClaw cron scheduler",
        subcommands = {
                SyncCommand.class,
                DiscoverCommand.class,
                StatusCommand.class,
                RunsCommand.class,
                PruneCommand.class,
                DedupeCommand.class,
                ImportCommand.class,
                RemoveCommand.class,
                InitCommand.class,
                DashboardCommand.class
        }
)
public class CardioclawCommand implements Runnable {

    @Spec
    CommandSpec spec;

    @Option(names = {"-c", "--config"}, scope = ScopeType.INHERIT,
            description = "Path to cardioclaw.yaml (default: ./cardioclaw.yaml, then ~/.cardioclaw/cardioclaw.yaml)")
    String config;

    @Option(names = {"--db"}, scope = ScopeType.INHERIT, description = "Path to the state database")
    Path database;

    @Option(names = {"-v", "--verbose"}, scope = ScopeType.INHERIT,
            description = "Debug logging on stderr; for runs, also include error messages")
    boolean verbose;

    private final Function<EngineSettings, CardioclawEngine> engineFactory;
    private CardioclawEngine engine;
    private boolean serving;

    public CardioclawCommand() {
        this(CardioclawEngine::create);
    }

    public CardioclawCommand(Function<EngineSettings, CardioclawEngine> engineFactory) {
        this.engineFactory = engineFactory;
    }

    /**
     * Command line with the exit-code mapping and verbosity applied before any
     * subcommand runs.
     */
    public static CommandLine commandLine(CardioclawCommand root) {
        CommandLine cmd = new CommandLine(root);
        cmd.setExecutionExceptionHandler(new CliErrorHandler());
        cmd.setExecutionStrategy(parseResult -> {
            root.applyVerbosity();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return cmd;
    }

    @Override
    public void run() {
        spec.commandLine().usage(spec.commandLine().getOut());
    }

    public boolean isServing() {
        return serving;
    }

    void markServing() {
        this.serving = true;
    }

    CardioclawEngine engine() {
        if (engine == null) {
            engine = engineFactory.apply(EngineSettings.fromEnvironment().withDatabase(database));
        }
        return engine;
    }

    /**
     * @throws ConfigNotFoundException listing every location checked
     */
    Path requireConfig() {
        return engine().configLocator().require(config);
    }

    Optional<Path> locateConfig() {
        return engine().configLocator().locate(config);
    }

    boolean verbose() {
        return verbose;
    }

    String configOption() {
        return config;
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }

    /**
     * Prints each distinct warning once.
     */
    void printWarnings(Collection<String> warnings) {
        for (String warning : new LinkedHashSet<>(warnings)) {
            err().println("⚠️  " + warning);
        }
    }

    private void applyVerbosity() {
        if (!verbose)
            return;
        if (LoggerFactory.getLogger("com.cardioclaw") instanceof Logger logger) {
            logger.setLevel(Level.DEBUG);
        }
    }
}
