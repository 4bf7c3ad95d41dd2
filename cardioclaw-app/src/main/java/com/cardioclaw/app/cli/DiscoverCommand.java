package com.cardioclaw.app.cli;

import com.cardioclaw.engine.discovery.DiscoveryResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "discover", description = "Refresh the state cache from the scheduler")
class DiscoverCommand implements Callable<Integer> {

    @ParentCommand
    CardioclawCommand parent;

    @Override
    public Integer call() {
        DiscoveryResult result = parent.engine().discovery().discover(parent.locateConfig().orElse(null));
        PrintWriter out = parent.out();
        out.printf("🔍 Discovered %d job(s): %d managed, %d unmanaged%n",
                result.found(), result.managed(), result.found() - result.managed());
        out.printf("   %d new run(s) recorded%n", result.runsRecorded());
        if (result.evicted() > 0) {
            out.printf("   %d stale job(s) dropped from cache%n", result.evicted());
        }
        parent.printWarnings(result.warnings());
        return 0;
    }
}
