package fr.lapetina.analytics.connector.connection;

import fr.lapetina.analytics.connector.domain.model.ServerDescriptor;

import java.util.concurrent.CompletableFuture;

/**
 * Opens a new connection to a directly-addressable server.
 * On success the connection shows up in the {@link ServerRegistry}.
 */
@FunctionalInterface
public interface ConnectAction {

    CompletableFuture<Void> connect(ServerDescriptor server);
}
