package com.phillippitts.saleshud.domain;

import com.phillippitts.saleshud.exception.ErrorKind;

/**
 * Remote dependencies observed by the health monitor. Each owns one process-wide circuit breaker.
 */
public enum Dependency {
    TRANSCRIPTION("transcription", ErrorKind.CONNECTION_FAILED),
    AI_ANALYSIS("ai-analysis", ErrorKind.NETWORK_ERROR),
    PERSISTENCE("persistence", ErrorKind.NETWORK_ERROR);

    private final String id;
    private final ErrorKind terminalKind;

    Dependency(String id, ErrorKind terminalKind) {
        this.id = id;
        this.terminalKind = terminalKind;
    }

    public String id() {
        return id;
    }

    /** Error kind reported when the breaker short-circuits a call. */
    public ErrorKind terminalKind() {
        return terminalKind;
    }
}
