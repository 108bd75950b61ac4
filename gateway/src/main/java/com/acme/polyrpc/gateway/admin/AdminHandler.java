package com.acme.polyrpc.gateway.admin;

import com.acme.polyrpc.gateway.admission.AdmissionSnapshot;
import com.acme.polyrpc.gateway.pool.AssetPool;
import com.acme.polyrpc.gateway.protocol.InboundMessage;
import com.acme.polyrpc.gateway.protocol.OutboundMessages;
import com.acme.polyrpc.gateway.transport.api.ClientConnection;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@code {call, '__admin__', Fun, Args}} commands. Answered inline, never queued;
 * the connection is closed after the reply.
 */
public final class AdminHandler {
    private static final Logger LOG = Logger.getLogger(AdminHandler.class.getName());

    static final String RELOAD_HANDLERS = "reload_handlers";
    static final String STATS = "stats";
    static final String RELOADED_REPLY = "Handlers reloaded.";
    static final String NOT_SUPPORTED_REPLY = "Admin function not supported.";

    private final AssetPool assetPool;
    private final Supplier<CompletableFuture<AdmissionSnapshot>> admissionStats;

    public AdminHandler(AssetPool assetPool, Supplier<CompletableFuture<AdmissionSnapshot>> admissionStats) {
        this.assetPool = Objects.requireNonNull(assetPool, "assetPool");
        this.admissionStats = Objects.requireNonNull(admissionStats, "admissionStats");
    }

    public void handle(InboundMessage.AdminCall call, ClientConnection connection) {
        LOG.info(() -> "Admin command " + call.function() + " on connection " + connection.connectionId());
        switch (call.function()) {
            case RELOAD_HANDLERS -> reloadHandlers(connection);
            case STATS -> stats(connection);
            default -> connection.sendAndClose(OutboundMessages.reply(NOT_SUPPORTED_REPLY));
        }
    }

    private void reloadHandlers(ClientConnection connection) {
        try {
            assetPool.reload();
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Handler reload failed", e);
            connection.close();
            return;
        }
        connection.sendAndClose(OutboundMessages.reply(RELOADED_REPLY));
    }

    private void stats(ClientConnection connection) {
        admissionStats.get().whenComplete((snapshot, error) -> {
            if (error != null) {
                LOG.log(Level.WARNING, "Stats unavailable", error);
                connection.close();
                return;
            }
            try {
                String body = renderStats(snapshot.totalDispatched(), assetPool.idleCount(), snapshot.pendingDepth());
                connection.sendAndClose(OutboundMessages.reply(body));
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "Stats rendering failed", e);
                connection.close();
            }
        });
    }

    static String renderStats(long totalDispatched, int idleWorkers, int pending) {
        return "connections.total=" + totalDispatched + "\n"
            + "workers.idle=" + idleWorkers + "\n"
            + "connections.pending=" + pending + "\n";
    }
}
