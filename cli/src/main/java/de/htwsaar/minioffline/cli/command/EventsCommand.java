package de.htwsaar.minioffline.cli.command;

import de.htwsaar.minioffline.cli.di.CliContext;
import de.htwsaar.minioffline.cli.di.EngineServices;
import de.htwsaar.minioffline.cli.util.ConsoleUtils;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Folgt dem Ereignisstrom der Engine. Solange der Befehl läuft, zählt die CLI als verbundener Client.
 */
@Command(name = "events", description = "Follow engine events (Ctrl+C to stop)")
public final class EventsCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Option(names = "--limit", defaultValue = "0", description = "Stop after N events (0 = unlimited)")
    private int limit;

    public EventsCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        if (limit < 0) {
            ConsoleUtils.error(ctx.err(), "--limit must be >= 0");
            return 2;
        }
        try {
            EngineServices.events(ctx)
                    .watch(limit, e -> ConsoleUtils.info(ctx.out(), "[%s] %s", e.name(), e.data()));
            return 0;
        } catch (IOException e) {
            ConsoleUtils.error(ctx.err(), "Event stream failed: %s", e.getMessage());
            return 2;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 130;
        }
    }
}
