package com.largomodo.retrohub.ipc;

import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Worker for one accepted client socket.
 * <p>
 * Reads newline-terminated requests until the peer disconnects or the socket is closed
 * by {@link IpcServer#stop()}, answering each one before reading the next (responses are
 * emitted in request order). Decode failures and handler failures are answered with an
 * error response and do not end the connection; only I/O failures do.
 * <p>
 * The remote address is published in the logging MDC under {@value #MDC_CLIENT} for the
 * lifetime of the worker.
 */
class ClientConnection implements Runnable {

    static final String MDC_CLIENT = "client";

    private static final Logger log = LoggerFactory.getLogger(ClientConnection.class);

    private final Socket socket;
    private final MessageCodec codec;
    private final Supplier<RequestHandler> handlerSource;
    private final Consumer<ClientConnection> onClose;
    private final String remoteAddress;

    /**
     * @param socket        Accepted client socket, owned by this connection from now on
     * @param codec         Line codec
     * @param handlerSource Current request handler (re-read per request so a handler
     *                      installed after start takes effect on open connections)
     * @param onClose       Registry callback invoked once when the worker ends
     */
    ClientConnection(Socket socket, MessageCodec codec, Supplier<RequestHandler> handlerSource,
                     Consumer<ClientConnection> onClose) {
        this.socket = socket;
        this.codec = codec;
        this.handlerSource = handlerSource;
        this.onClose = onClose;
        this.remoteAddress = String.valueOf(socket.getRemoteSocketAddress());
    }

    @Override
    public void run() {
        MDC.put(MDC_CLIENT, remoteAddress);
        log.info("Client connected: {}", remoteAddress);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
             Writer writer = new BufferedWriter(
                     new OutputStreamWriter(socket.getOutputStream(), StandardCharsets.UTF_8))) {

            String line;
            while ((line = readLine(reader)) != null) {
                line = line.strip();
                if (line.isEmpty()) {
                    continue;
                }

                Response response = process(line);
                writer.write(codec.encode(response));
                writer.write('\n');
                writer.flush();
            }
            log.info("Client disconnected: {}", remoteAddress);
        } catch (IOException e) {
            // Peer reset or socket closed by stop(); only this connection is affected
            log.debug("Connection {} ended: {}", remoteAddress, e.getMessage());
        } finally {
            close();
            onClose.accept(this);
            MDC.remove(MDC_CLIENT);
        }
    }

    /**
     * Read one request line. Only {@code '\n'} terminates a line; a {@code '\r'} stays in
     * the text and is removed by the caller's strip when it trails the line.
     *
     * @return The line without its terminator, or null at end of stream with nothing buffered
     */
    static String readLine(Reader reader) throws IOException {
        StringBuilder line = new StringBuilder();
        int c;
        while ((c = reader.read()) != -1) {
            if (c == '\n') {
                return line.toString();
            }
            line.append((char) c);
        }
        return line.length() > 0 ? line.toString() : null;
    }

    Response process(String line) {
        Request request;
        try {
            request = codec.decode(line);
        } catch (JsonParseException e) {
            log.debug("Rejected malformed request: {}", e.getMessage());
            return Response.error(null, "Invalid JSON: " + e.getMessage());
        }

        log.debug("Request type={} id={}", request.type(), request.id());
        try {
            return handlerSource.get().handle(request);
        } catch (RuntimeException e) {
            // Handler bug: answer and keep serving instead of killing the connection
            log.error("Handler failed for request type={} id={}", request.type(), request.id(), e);
            return Response.error(request.id(), "Internal error");
        }
    }

    /**
     * Close the socket. Unblocks a worker waiting in readLine. Safe to call repeatedly.
     */
    void close() {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Error closing connection {}: {}", remoteAddress, e.getMessage());
        }
    }

    String getRemoteAddress() {
        return remoteAddress;
    }
}
