package com.warp.bridge.stream;

public enum StreamState {
    IDLE,
    STREAMING,
    TOOL_CALLING,
    FINISHED,
    ERRORED;

    public boolean isTerminal() {
        return this == FINISHED || this == ERRORED;
    }
}
