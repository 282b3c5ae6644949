package io.httpr.client;

import java.util.Objects;

/**
 * Outcome of one executed {@link Request}: either a response or the error that prevented one.
 *
 * @param request the request that was executed
 * @param response the response, or null when the execution failed
 * @param error the failure, or null when a response was received
 * @param stopRequested true when a post-response hook asked the enclosing sequence to stop
 */
public record ResultEnvelope(Request request, Response response, Exception error, boolean stopRequested) {

    public ResultEnvelope {
        Objects.requireNonNull(request, "request");
        if ((response == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of response and error must be set");
        }
    }

    public static ResultEnvelope success(Request request, Response response) {
        return new ResultEnvelope(request, Objects.requireNonNull(response, "response"), null, false);
    }

    public static ResultEnvelope failure(Request request, Exception error) {
        return new ResultEnvelope(request, null, Objects.requireNonNull(error, "error"), false);
    }

    public boolean isSuccess() {
        return error == null;
    }

    ResultEnvelope withStopRequested() {
        return stopRequested ? this : new ResultEnvelope(request, response, error, true);
    }
}
