package de.htwsaar.minioffline.cli.command;

import de.htwsaar.minioffline.cli.di.CliContext;
import de.htwsaar.minioffline.cli.di.EngineServices;
import de.htwsaar.minioffline.cli.util.ConsoleUtils;
import java.util.Objects;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Stellt der Engine eine Push-Nachricht zu, z. B. zum Testen der Benachrichtigungen. */
@Command(name = "push", description = "Deliver a push message to the engine")
public final class PushCommand implements Callable<Integer> {

    private final CliContext ctx;

    @Option(names = "--title", description = "Notification title")
    private String title;

    @Option(names = "--body", description = "Notification text")
    private String body;

    @Option(names = "--url", description = "URL opened on click")
    private String url;

    public PushCommand(CliContext ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    @Override
    public Integer call() {
        return ConsoleUtils.report(ctx.out(), ctx.err(), EngineServices.admin(ctx).push(title, body, url));
    }
}
