package de.entwicklertraining.chat.fetcher.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Why a candidate completion stopped.
 */
public enum FinishReason {
    STOP("stop"),
    /** The consumer cut the stream short by returning an offset from its delta callback. */
    CLIENT_TRIMMED("client-trimmed"),
    FUNCTION_CALL("function_call"),
    TOOL_CALLS("tool_calls"),
    CONTENT_FILTER("content_filter"),
    LENGTH("length"),
    /** The provider reported an error inside an otherwise successful stream. */
    SERVER_ERROR("error"),
    UNKNOWN("unknown");

    private static final Set<FinishReason> SUCCESSFUL = EnumSet.of(STOP, CLIENT_TRIMMED, FUNCTION_CALL, TOOL_CALLS);

    private final String wireName;

    FinishReason(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isSuccessful() {
        return SUCCESSFUL.contains(this);
    }

    public static FinishReason fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (FinishReason reason : values()) {
            if (reason.wireName.equals(value)) {
                return reason;
            }
        }
        return UNKNOWN;
    }
}
