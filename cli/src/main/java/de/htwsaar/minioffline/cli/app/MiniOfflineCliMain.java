package de.htwsaar.minioffline.cli.app;

import de.htwsaar.minioffline.cli.command.MiniOfflineRootCommand;
import de.htwsaar.minioffline.cli.di.CliContext;
import de.htwsaar.minioffline.cli.di.ContextFactory;
import de.htwsaar.minioffline.cli.shell.MiniOfflineInteractiveShell;
import java.io.PrintWriter;
import java.net.http.HttpClient;
import java.time.Duration;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import picocli.CommandLine;

/**
 * Einstiegspunkt der Mini-Offline CLI.
 *
 * <p>Mit Argumenten wird genau ein Befehl ausgeführt, ohne Argumente startet die interaktive Shell.
 */
public final class MiniOfflineCliMain {

    public static void main(String[] args) throws Exception {
        Terminal terminal = TerminalBuilder.builder().system(true).build();
        PrintWriter out = terminal.writer();
        PrintWriter err = terminal.writer();

        CliContext ctx = new CliContext(
                terminal,
                out,
                err,
                HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(),
                Duration.ofSeconds(5),
                CliContext.resolveEngineBaseUrl());

        CommandLine cmd = new CommandLine(MiniOfflineRootCommand.class, new ContextFactory(ctx));

        if (args != null && args.length > 0) {
            int rc = cmd.execute(args);
            System.exit(rc);
        }

        new MiniOfflineInteractiveShell(cmd, ctx).run();
    }
}
