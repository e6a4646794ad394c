package de.htwsaar.minioffline.cli.di;

import de.htwsaar.minioffline.cli.service.EngineAdminService;
import de.htwsaar.minioffline.cli.service.EngineMessagingService;
import de.htwsaar.minioffline.cli.service.EventStreamService;
import de.htwsaar.minioffline.cli.transport.HttpMessageTransport;
import de.htwsaar.minioffline.common.messaging.CorrelatingMessenger;
import java.util.UUID;

/**
 * Baut die Engine-Services aus einem {@link CliContext}.
 */
public final class EngineServices {

    private EngineServices() {}

    public static EngineAdminService admin(CliContext ctx) {
        return new EngineAdminService(ctx.httpClient(), ctx.engineBaseUrl(), ctx.defaultRequestTimeout());
    }

    public static EngineMessagingService messaging(CliContext ctx) {
        HttpMessageTransport transport =
                new HttpMessageTransport(ctx.httpClient(), ctx.engineBaseUrl(), ctx.defaultRequestTimeout());
        CorrelatingMessenger messenger = new CorrelatingMessenger(
                transport, ctx.defaultRequestTimeout(), () -> UUID.randomUUID().toString());
        return new EngineMessagingService(messenger);
    }

    public static EventStreamService events(CliContext ctx) {
        return new EventStreamService(ctx.httpClient(), ctx.engineBaseUrl());
    }
}
