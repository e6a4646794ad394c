package de.htwsaar.minioffline.cli.util;

import de.htwsaar.minioffline.cli.dto.HttpCallResult;
import de.htwsaar.minioffline.common.messaging.EngineReply;
import de.htwsaar.minioffline.common.messaging.MessageTimeoutException;
import java.util.function.Supplier;
import java.io.PrintWriter;
import java.util.Objects;

/**
 * Formatierte Info- und Fehlerausgaben mit automatischem Flush.
 */
public final class ConsoleUtils {
    private ConsoleUtils() {}

    public static void info(PrintWriter out, String fmt, Object... args) {
        Objects.requireNonNull(out, "out");
        out.printf(fmt + "%n", args);
        out.flush();
    }

    public static void error(PrintWriter err, String fmt, Object... args) {
        Objects.requireNonNull(err, "err");
        err.printf(fmt + "%n", args);
        err.flush();
    }

    /**
     * Gibt das Ergebnis eines Engine-Aufrufs aus und bildet es auf einen Exit-Code ab.
     *
     * @return 0 bei 2xx, 1 bei HTTP-Fehler, 2 bei I/O-Fehler
     */
    public static int report(PrintWriter out, PrintWriter err, HttpCallResult result) {
        if (result.error() != null) {
            error(err, "Engine not reachable: %s", result.error());
            return 2;
        }
        if (!result.is2xx()) {
            error(err, "HTTP %d: %s", result.statusCode(), JsonUtils.formatJson(result.body()));
            return 1;
        }
        info(out, "%s", JsonUtils.formatJson(result.body()));
        return 0;
    }

    /**
     * Führt eine Nachricht aus, gibt die Antwort aus und bildet sie auf einen Exit-Code ab.
     *
     * @return 0 bei Erfolg, 1 wenn die Engine die Nachricht abgelehnt hat, 2 bei Timeout
     */
    public static int report(PrintWriter out, PrintWriter err, Supplier<EngineReply> call) {
        EngineReply reply;
        try {
            reply = call.get();
        } catch (MessageTimeoutException e) {
            error(err, "%s", e.getMessage());
            return 2;
        }
        if (!reply.success()) {
            error(err, "Engine error: %s", reply.error());
            return 1;
        }
        info(out, "%s", reply.data() == null ? "ok" : JsonUtils.formatObject(reply.data()));
        return 0;
    }
}
