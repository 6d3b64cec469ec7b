package dev.chatclient.sdk.cancellation;

import lombok.Getter;

import java.util.Objects;

/**
 * Per-call state passed explicitly through the client.
 *
 * <p>Besides the cancellation token it records whether an enclosing call is
 * already instrumented. Calls made with an active context do not start their
 * own telemetry, so a streaming call that opens its response through the
 * unary helper is reported once.
 */
@Getter
public final class CallContext {

    private static final CallContext NONE = new CallContext(CancellationToken.none(), false);

    private final CancellationToken cancellationToken;
    private final boolean instrumentationActive;

    private CallContext(CancellationToken cancellationToken, boolean instrumentationActive) {
        this.cancellationToken = Objects.requireNonNull(cancellationToken, "cancellationToken");
        this.instrumentationActive = instrumentationActive;
    }

    public static CallContext none() {
        return NONE;
    }

    public static CallContext of(CancellationToken cancellationToken) {
        return new CallContext(cancellationToken, false);
    }

    /**
     * Same token, marked as running inside an instrumented call.
     */
    public CallContext withInstrumentationActive() {
        if (instrumentationActive) {
            return this;
        }
        return new CallContext(cancellationToken, true);
    }
}
