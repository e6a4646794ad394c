package de.htwsaar.minioffline.engine.messaging;

import de.htwsaar.minioffline.engine.domain.NetworkClient;
import de.htwsaar.minioffline.engine.domain.NetworkException;
import de.htwsaar.minioffline.engine.domain.ResourceRequest;
import de.htwsaar.minioffline.engine.domain.ResourceResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Decorator um den {@link NetworkClient}, der jeden Ausgang an den {@link ConnectivityMonitor} meldet.
 */
public final class ConnectivityAwareNetworkClient implements NetworkClient {

    private final NetworkClient delegate;
    private final ConnectivityMonitor monitor;

    public ConnectivityAwareNetworkClient(NetworkClient delegate, ConnectivityMonitor monitor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.monitor = Objects.requireNonNull(monitor, "monitor must not be null");
    }

    @Override
    public CompletableFuture<ResourceResponse> fetch(ResourceRequest request, Duration timeout) {
        return delegate.fetch(request, timeout).whenComplete((resp, ex) -> {
            if (ex == null) {
                monitor.reportSuccess();
                return;
            }
            Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof NetworkException && ((NetworkException) cause).isConnectivityFailure()) {
                monitor.reportFailure(cause.getMessage());
            }
        });
    }
}
