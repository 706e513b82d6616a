package io.endsession.core.pipeline;

import java.util.List;

/** The four ordered processing points of an endpoint request. */
public enum Stage {
    EXTRACT,
    VALIDATE,
    HANDLE,
    APPLY_RESPONSE;

    /** Stages that can be short-circuited; {@link #APPLY_RESPONSE} always runs. */
    static final List<Stage> PROCESSING = List.of(EXTRACT, VALIDATE, HANDLE);
}
