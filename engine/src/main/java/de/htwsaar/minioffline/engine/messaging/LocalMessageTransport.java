package de.htwsaar.minioffline.engine.messaging;

import de.htwsaar.minioffline.common.messaging.EngineMessage;
import de.htwsaar.minioffline.common.messaging.EngineReply;
import de.htwsaar.minioffline.common.messaging.MessageTransport;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * In-Prozess-Transport zwischen {@link de.htwsaar.minioffline.common.messaging.CorrelatingMessenger}
 * und {@link EngineMessageHandler}.
 */
public final class LocalMessageTransport implements MessageTransport {

    private final EngineMessageHandler handler;

    public LocalMessageTransport(EngineMessageHandler handler) {
        this.handler = Objects.requireNonNull(handler, "handler must not be null");
    }

    @Override
    public void post(EngineMessage message, Consumer<EngineReply> replySink) {
        handler.handle(message).thenAccept(replySink);
    }
}
