package in.marketpulse.testing;

import in.marketpulse.infrastructure.venue.data.VenueConnectionException;
import in.marketpulse.infrastructure.venue.stream.StreamConnection;
import in.marketpulse.infrastructure.venue.stream.StreamConnector;

import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Supplier;

/**
 * Connector driven by a script: each connect() takes the next step, which either fails or
 * hands out a prepared connection. When the script is exhausted every further connect fails.
 */
public class FakeStreamConnector implements StreamConnector {

    private final Deque<Supplier<StreamConnection>> script = new ArrayDeque<>();
    private final List<URI> endpoints = new ArrayList<>();
    private final List<FakeStreamConnection> opened = new ArrayList<>();
    private boolean closed = false;

    public synchronized FakeStreamConnector failTimes(int times) {
        for (int i = 0; i < times; i++) {
            script.addLast(() -> {
                throw new VenueConnectionException("fake", "fake-0", "connection refused");
            });
        }
        return this;
    }

    public synchronized FakeStreamConnector thenConnect(FakeStreamConnection connection) {
        script.addLast(() -> connection);
        return this;
    }

    public synchronized FakeStreamConnector thenFail(RuntimeException error) {
        script.addLast(() -> {
            throw error;
        });
        return this;
    }

    @Override
    public StreamConnection connect(String venue, String connectionName, URI endpoint) {
        Supplier<StreamConnection> step;
        synchronized (this) {
            endpoints.add(endpoint);
            step = script.pollFirst();
        }
        if (step == null) {
            throw new VenueConnectionException(venue, connectionName, "script exhausted");
        }
        StreamConnection connection = step.get();
        synchronized (this) {
            if (connection instanceof FakeStreamConnection) {
                opened.add((FakeStreamConnection) connection);
            }
        }
        return connection;
    }

    @Override
    public synchronized void close() {
        closed = true;
        for (FakeStreamConnection connection : opened) {
            connection.close();
        }
    }

    public synchronized int connectCount() {
        return endpoints.size();
    }

    public synchronized List<URI> endpoints() {
        return new ArrayList<>(endpoints);
    }

    public synchronized boolean isClosed() {
        return closed;
    }
}
