package de.htwsaar.minioffline.cli.command;

import de.htwsaar.minioffline.cli.di.CliContext;
import de.htwsaar.minioffline.cli.di.EngineServices;
import de.htwsaar.minioffline.cli.util.ConsoleUtils;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Metriken-Snapshot der Engine. */
@Command(name = "stats", description = "Engine metrics snapshot")
public final class StatsCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Option(names = "--window-sec", defaultValue = "60", description = "Window for the request rate (default: ${DEFAULT-VALUE})")
    private int windowSec;

    public StatsCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        if (windowSec <= 0) {
            ConsoleUtils.error(ctx.err(), "--window-sec must be > 0");
            return 2;
        }
        return ConsoleUtils.report(ctx.out(), ctx.err(), EngineServices.admin(ctx).stats(windowSec));
    }
}
