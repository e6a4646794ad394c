package de.htwsaar.minioffline.cli.command;

import de.htwsaar.minioffline.cli.di.CliContext;
import de.htwsaar.minioffline.cli.di.EngineServices;
import de.htwsaar.minioffline.cli.service.EngineAdminService;
import de.htwsaar.minioffline.cli.util.ConsoleUtils;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;

/** Prüft Health- und Ready-Probe der Engine. */
@Command(name = "health", description = "Check engine health and readiness")
public final class HealthCommand implements Callable<Integer> {

    private final CliContext ctx;

    public HealthCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        EngineAdminService admin = EngineServices.admin(ctx);
        int rc = ConsoleUtils.report(ctx.out(), ctx.err(), admin.health());
        if (rc != 0) {
            return rc;
        }
        return ConsoleUtils.report(ctx.out(), ctx.err(), admin.ready());
    }
}
