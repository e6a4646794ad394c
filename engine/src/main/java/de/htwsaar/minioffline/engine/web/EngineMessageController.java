package de.htwsaar.minioffline.engine.web;

import de.htwsaar.minioffline.common.messaging.EngineMessage;
import de.htwsaar.minioffline.common.messaging.EngineReply;
import de.htwsaar.minioffline.engine.messaging.EngineMessageHandler;
import java.util.concurrent.CompletableFuture;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Nachrichtenkanal Host → Engine: {@code POST /_engine/messages}.
 */
@RestController
@RequestMapping("/_engine")
public class EngineMessageController {

    private final EngineMessageHandler handler;

    public EngineMessageController(EngineMessageHandler handler) {
        this.handler = handler;
    }

    /**
     * @param message Nachricht mit Correlation-ID
     * @return genau eine Antwort mit derselben Correlation-ID
     */
    @PostMapping("/messages")
    public CompletableFuture<EngineReply> post(@RequestBody EngineMessage message) {
        return handler.handle(message);
    }
}
