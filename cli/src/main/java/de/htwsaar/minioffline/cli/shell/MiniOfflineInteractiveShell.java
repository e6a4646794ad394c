package de.htwsaar.minioffline.cli.shell;

import de.htwsaar.minioffline.cli.di.CliContext;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.DefaultParser;
import org.jline.terminal.Terminal;
import org.jline.utils.AttributedStringBuilder;
import org.jline.utils.AttributedStyle;
import org.jline.utils.InfoCmp;
import picocli.CommandLine;
import picocli.shell.jline3.PicocliCommands;

/**
 * Interaktive Shell (REPL) für die Mini-Offline CLI.
 *
 * <p>Zeilen werden als Picocli-Kommandos ausgeführt, mit Autovervollständigung über {@link PicocliCommands}.
 * Shell-eigene Befehle: {@code clear}, {@code exit}/{@code quit}. Ctrl+C verwirft die Eingabe, Ctrl+D beendet.
 */
public final class MiniOfflineInteractiveShell {

    private static final Set<String> EXIT_WORDS = Set.of("exit", "quit");
    private static final Set<String> CLEAR_WORDS = Set.of("clear", "cls");

    private final CommandLine cmd;
    private final CliContext ctx;

    public MiniOfflineInteractiveShell(CommandLine cmd, CliContext ctx) {
        this.cmd = Objects.requireNonNull(cmd, "cmd");
        this.ctx = Objects.requireNonNull(ctx, "ctx");
    }

    /**
     * Startet die Shell-Schleife und blockiert bis zum Exit.
     * Die History liegt in {@code .minioffline.history} im Arbeitsverzeichnis.
     */
    public void run() {
        Terminal terminal = ctx.terminal();
        PrintWriter out = ctx.out();
        PrintWriter err = ctx.err();

        LineReader reader = LineReaderBuilder.builder()
                .terminal(terminal)
                .completer(new PicocliCommands(cmd).compileCompleters())
                .parser(new DefaultParser())
                .variable(LineReader.HISTORY_FILE, Path.of(".minioffline.history"))
                .build();

        String prompt = new AttributedStringBuilder()
                .style(AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN).bold())
                .append("mini-offline")
                .style(AttributedStyle.DEFAULT)
                .append("@" + ctx.engineBaseUrl().getAuthority() + "> ")
                .toAnsi();

        out.printf("Mini-Offline shell for %s. Type 'help', 'exit', 'clear'.%n", ctx.engineBaseUrl());
        out.flush();

        while (true) {
            String line;
            try {
                line = reader.readLine(prompt).trim();
            } catch (UserInterruptException e) {
                continue;
            } catch (EndOfFileException e) {
                break;
            }

            String word = line.toLowerCase(Locale.ROOT);
            if (line.isEmpty()) {
                continue;
            }
            if (EXIT_WORDS.contains(word)) {
                break;
            }
            if (CLEAR_WORDS.contains(word)) {
                terminal.puts(InfoCmp.Capability.clear_screen);
                terminal.flush();
                continue;
            }

            try {
                String[] argv = reader.getParser().parse(line, 0).words().toArray(new String[0]);
                int exitCode = cmd.execute(argv);
                if (exitCode != 0) {
                    err.printf("Command failed with exit code: %d%n", exitCode);
                    err.flush();
                }
            } catch (RuntimeException ex) {
                err.printf("Error executing command: %s%n", ex.getMessage());
                err.flush();
            }
        }
    }
}
