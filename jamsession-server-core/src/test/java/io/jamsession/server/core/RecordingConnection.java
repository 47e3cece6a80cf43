package io.jamsession.server.core;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Live connection that keeps every frame it is sent.
 */
final class RecordingConnection implements LiveConnection {
    private final String id;
    private final List<String> frames = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private volatile boolean failing;

    RecordingConnection(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public void send(String frame) throws IOException {
        if (failing) throw new IOException("broken pipe");
        frames.add(frame);
    }

    List<String> frames() {
        return frames;
    }

    void close() {
        open = false;
    }

    void failSends() {
        failing = true;
    }
}
