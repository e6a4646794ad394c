package de.htwsaar.minioffline.cli.command;

import de.htwsaar.minioffline.cli.di.CliContext;
import de.htwsaar.minioffline.cli.di.EngineServices;
import de.htwsaar.minioffline.cli.service.EngineMessagingService;
import de.htwsaar.minioffline.cli.util.ConsoleUtils;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Cache-Operationen über den Nachrichtenkanal der Engine.
 *
 * <p>Ohne Subcommand wird die Usage angezeigt.
 */
@Command(
        name = "cache",
        description = "Inspect and manage the engine caches",
        subcommands = {
            CacheCommand.CacheStatsCommand.class,
            CacheCommand.CacheClearCommand.class,
            CacheCommand.CacheAddCommand.class
        })
public final class CacheCommand implements Runnable {

    private final CliContext ctx;

    @Spec
    private CommandSpec spec;

    public CacheCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public void run() {
        spec.commandLine().usage(ctx.out());
        ctx.out().flush();
    }

    EngineMessagingService messaging() {
        return EngineServices.messaging(ctx);
    }

    @Command(name = "stats", description = "Entries per store")
    public static final class CacheStatsCommand implements Callable<Integer> {

        @ParentCommand
        private CacheCommand parent;

        @Override
        public Integer call() {
            EngineMessagingService messaging = parent.messaging();
            return ConsoleUtils.report(parent.ctx.out(), parent.ctx.err(), messaging::cacheStats);
        }
    }

    @Command(name = "clear", description = "Delete one store or all stores")
    public static final class CacheClearCommand implements Callable<Integer> {

        @ParentCommand
        private CacheCommand parent;

        @Option(names = "--name", description = "Store name (default: all stores)")
        private String cacheName;

        @Override
        public Integer call() {
            EngineMessagingService messaging = parent.messaging();
            return ConsoleUtils.report(parent.ctx.out(), parent.ctx.err(), () -> messaging.clearCache(cacheName));
        }
    }

    @Command(name = "add", description = "Fetch URLs into the default store of the active version")
    public static final class CacheAddCommand implements Callable<Integer> {

        @ParentCommand
        private CacheCommand parent;

        @Parameters(arity = "1..*", paramLabel = "URL", description = "Resources to cache")
        private List<String> urls;

        @Override
        public Integer call() {
            EngineMessagingService messaging = parent.messaging();
            return ConsoleUtils.report(parent.ctx.out(), parent.ctx.err(), () -> messaging.cacheUrls(urls));
        }
    }
}
