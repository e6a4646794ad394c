package de.htwsaar.minioffline.cli.command;

import de.htwsaar.minioffline.cli.di.CliContext;
import de.htwsaar.minioffline.cli.di.EngineServices;
import de.htwsaar.minioffline.cli.util.ConsoleUtils;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Einsicht in die Background-Sync-Queue.
 */
@Command(
        name = "sync",
        description = "Background sync queue",
        subcommands = {
            SyncCommand.PendingCommand.class,
            SyncCommand.AbandonedCommand.class,
            SyncCommand.DiscardCommand.class,
            SyncCommand.ReplayCommand.class
        })
public final class SyncCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    public SyncCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().flush();
    }

    @Command(name = "pending", description = "List queued mutations")
    public static final class PendingCommand implements Callable<Integer> {

        @ParentCommand
        private SyncCommand parent;

        @Override
        public Integer call() {
            CliContext ctx = parent.ctx;
            return ConsoleUtils.report(ctx.out(), ctx.err(), EngineServices.admin(ctx).pendingMutations());
        }
    }

    @Command(name = "abandoned", description = "List mutations that exhausted their retries")
    public static final class AbandonedCommand implements Callable<Integer> {

        @ParentCommand
        private SyncCommand parent;

        @Override
        public Integer call() {
            CliContext ctx = parent.ctx;
            return ConsoleUtils.report(ctx.out(), ctx.err(), EngineServices.admin(ctx).abandonedMutations());
        }
    }

    @Command(name = "discard", description = "Drop an abandoned mutation")
    public static final class DiscardCommand implements Callable<Integer> {

        @ParentCommand
        private SyncCommand parent;

        @Parameters(index = "0", paramLabel = "ID", description = "Mutation id")
        private String id;

        @Override
        public Integer call() {
            CliContext ctx = parent.ctx;
            return ConsoleUtils.report(ctx.out(), ctx.err(), EngineServices.admin(ctx).discardAbandoned(id));
        }
    }

    @Command(name = "replay", description = "Trigger a replay pass")
    public static final class ReplayCommand implements Callable<Integer> {

        @ParentCommand
        private SyncCommand parent;

        @Override
        public Integer call() {
            CliContext ctx = parent.ctx;
            return ConsoleUtils.report(ctx.out(), ctx.err(), EngineServices.admin(ctx).replaySync());
        }
    }
}
