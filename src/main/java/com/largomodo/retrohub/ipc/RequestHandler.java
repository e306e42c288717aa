package com.largomodo.retrohub.ipc;

/**
 * Turns a decoded request into the response written back to the client.
 * <p>
 * Invoked concurrently from every connection worker; implementations must be thread-safe.
 * Domain failures are expected to be returned as error responses. A RuntimeException
 * escaping this method is answered with a generic "Internal error" response.
 */
@FunctionalInterface
public interface RequestHandler {

    Response handle(Request request);
}
