package dev.chatclient.sdk.protocol;

import lombok.AllArgsConstructor;
import lombok.Data;

import javax.annotation.Nullable;

/**
 * One dispatched server-sent event. Multi-line {@code data:} fields are
 * joined with {@code \n}.
 */
@Data
@AllArgsConstructor
public final class ServerSentEvent {
    @Nullable
    private final String eventType;
    private final String data;
    @Nullable
    private final String id;
}
