package de.htwsaar.minioffline.cli.command;

import de.htwsaar.minioffline.cli.di.CliContext;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root-Command des CLI-Kommandobaums.
 *
 * <p>Die Engine-Adresse kommt aus {@code -Dminioffline.engine.url} oder {@code MINIOFFLINE_ENGINE_URL}.
 */
@Command(
        name = "minioffline",
        description = "Mini-Offline engine CLI",
        mixinStandardHelpOptions = true,
        subcommands = {
            CacheCommand.class,
            LifecycleCommand.class,
            SyncCommand.class,
            EventsCommand.class,
            StatsCommand.class,
            PushCommand.class,
            HealthCommand.class,
            HelpCommand.class
        })
public final class MiniOfflineRootCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    public MiniOfflineRootCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().println();
        ctx.out().printf("Engine: %s%n", ctx.engineBaseUrl());
        ctx.out().println("Tipp: `minioffline help <command>` oder ohne Args für die interaktive Shell.");
        ctx.out().flush();
    }
}
