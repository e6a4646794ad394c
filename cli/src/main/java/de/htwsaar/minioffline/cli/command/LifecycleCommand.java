package de.htwsaar.minioffline.cli.command;

import de.htwsaar.minioffline.cli.di.CliContext;
import de.htwsaar.minioffline.cli.di.EngineServices;
import de.htwsaar.minioffline.cli.util.ConsoleUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Versionsverwaltung: Status, Installation und sofortige Aktivierung.
 */
@Command(
        name = "lifecycle",
        description = "Engine version lifecycle",
        subcommands = {
            LifecycleCommand.StatusCommand.class,
            LifecycleCommand.InstallCommand.class,
            LifecycleCommand.SkipWaitingCommand.class
        })
public final class LifecycleCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    public LifecycleCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().flush();
    }

    @Command(name = "status", description = "Show active and waiting version")
    public static final class StatusCommand implements Callable<Integer> {

        @ParentCommand
        private LifecycleCommand parent;

        @Override
        public Integer call() {
            CliContext ctx = parent.ctx;
            return ConsoleUtils.report(ctx.out(), ctx.err(), EngineServices.admin(ctx).activeRelease());
        }
    }

    @Command(name = "install", description = "Install a new version from a JSON release file")
    public static final class InstallCommand implements Callable<Integer> {

        @ParentCommand
        private LifecycleCommand parent;

        @Option(names = {"-f", "--file"}, required = true, description = "Release JSON")
        private Path file;

        @Override
        public Integer call() {
            CliContext ctx = parent.ctx;
            String json;
            try {
                json = Files.readString(file);
            } catch (IOException e) {
                ConsoleUtils.error(ctx.err(), "Cannot read %s: %s", file, e.getMessage());
                return 2;
            }
            return ConsoleUtils.report(ctx.out(), ctx.err(), EngineServices.admin(ctx).installRelease(json));
        }
    }

    @Command(name = "skip-waiting", description = "Activate the waiting version now")
    public static final class SkipWaitingCommand implements Callable<Integer> {

        @ParentCommand
        private LifecycleCommand parent;

        @Override
        public Integer call() {
            CliContext ctx = parent.ctx;
            return ConsoleUtils.report(ctx.out(), ctx.err(), EngineServices.messaging(ctx)::skipWaiting);
        }
    }
}
