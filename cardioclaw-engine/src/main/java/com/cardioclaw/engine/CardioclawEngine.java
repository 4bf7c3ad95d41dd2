package com.cardioclaw.engine;

import com.cardioclaw.common.config.CardioclawPaths;
import com.cardioclaw.common.config.OpenClawSettings;
import com.cardioclaw.common.infra.ProcessRunner;
import com.cardioclaw.engine.command.CommandBuilder;
import com.cardioclaw.engine.command.TimezoneResolver;
import com.cardioclaw.engine.dedupe.Deduper;
import com.cardioclaw.engine.discovery.Discovery;
import com.cardioclaw.engine.heartbeat.ConfigInitializer;
import com.cardioclaw.engine.heartbeat.ConfigLocator;
import com.cardioclaw.engine.heartbeat.HeartbeatFileStore;
import com.cardioclaw.engine.importer.HeartbeatImporter;
import com.cardioclaw.engine.lifecycle.Archiver;
import com.cardioclaw.engine.lifecycle.Pruner;
import com.cardioclaw.engine.remove.HeartbeatRemover;
import com.cardioclaw.engine.scheduler.OpenClawCliClient;
import com.cardioclaw.engine.scheduler.SchedulerClient;
import com.cardioclaw.engine.store.CacheDatabase;
import com.cardioclaw.engine.store.CacheStore;
import com.cardioclaw.engine.sync.SyncEngine;

import java.time.Clock;

/**
 * Wires the engine's components around one scheduler client and one cache
 * file. The cache database is opened on first use, so operations that never
 * touch it leave no file behind.
 */
public class CardioclawEngine {

    private final EngineSettings settings;
    private final SchedulerClient scheduler;
    private final Clock clock;
    private final HeartbeatFileStore fileStore = new HeartbeatFileStore();
    private final TimezoneResolver timezoneResolver;
    private final ConfigLocator configLocator;

    private CacheStore cache;

    public CardioclawEngine(EngineSettings settings, SchedulerClient scheduler, TimezoneResolver timezoneResolver,
                            Clock clock) {
        this.settings = settings;
        this.scheduler = scheduler;
        this.timezoneResolver = timezoneResolver;
        this.clock = clock;
        this.configLocator = new ConfigLocator(settings.paths());
    }

    /**
     * Engine talking to the real {@code openclaw} CLI.
     */
    public static CardioclawEngine create(EngineSettings settings) {
        SchedulerClient client = new OpenClawCliClient(new ProcessRunner(settings.execTimeout()),
                settings.openclawBinary());
        TimezoneResolver resolver = new TimezoneResolver(new OpenClawSettings(settings.paths().openclawConfig()));
        return new CardioclawEngine(settings, client, resolver, Clock.systemUTC());
    }

    public EngineSettings settings() {
        return settings;
    }

    public CardioclawPaths paths() {
        return settings.paths();
    }

    public SchedulerClient scheduler() {
        return scheduler;
    }

    public Clock clock() {
        return clock;
    }

    public HeartbeatFileStore fileStore() {
        return fileStore;
    }

    public ConfigLocator configLocator() {
        return configLocator;
    }

    public TimezoneResolver timezoneResolver() {
        return timezoneResolver;
    }

    public synchronized CacheStore cache() {
        if (cache == null) {
            cache = new CacheStore(CacheDatabase.open(settings.paths().database()), clock);
        }
        return cache;
    }

    public CommandBuilder commandBuilder() {
        return new CommandBuilder(timezoneResolver);
    }

    public Discovery discovery() {
        return new Discovery(scheduler, cache(), fileStore);
    }

    public Archiver archiver() {
        return new Archiver(scheduler, fileStore, timezoneResolver, clock);
    }

    public SyncEngine syncEngine() {
        return new SyncEngine(scheduler, commandBuilder(), fileStore, this::discovery,
                archiver(), this::cache);
    }

    public Pruner pruner() {
        return new Pruner(fileStore, clock);
    }

    public Deduper deduper() {
        return new Deduper(scheduler);
    }

    public HeartbeatImporter importer() {
        return new HeartbeatImporter(scheduler, fileStore, timezoneResolver, clock);
    }

    public HeartbeatRemover remover() {
        return new HeartbeatRemover(scheduler, fileStore);
    }

    public ConfigInitializer initializer() {
        return new ConfigInitializer();
    }
}
