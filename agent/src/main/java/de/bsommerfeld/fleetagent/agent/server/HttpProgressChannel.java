package de.bsommerfeld.fleetagent.agent.server;

import de.bsommerfeld.fleetagent.updater.progress.ProgressEvent;
import de.bsommerfeld.fleetagent.updater.progress.RemoteProgressChannel;

import java.io.IOException;

/**
 * Posts progress events to {@code /api/v1/agents/<id>/update-progress} in
 * their wire form.
 */
public class HttpProgressChannel implements RemoteProgressChannel {

    private final ServerConnection connection;

    public HttpProgressChannel(ServerConnection connection) {
        this.connection = connection;
    }

    @Override
    public void send(ProgressEvent event) throws IOException {
        connection.postJson(connection.agentPath("/update-progress"), event.toWire());
    }
}
