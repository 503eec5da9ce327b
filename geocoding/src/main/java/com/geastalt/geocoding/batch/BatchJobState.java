/*
 * Copyright (c) 2026 Bob Hablutzel. All rights reserved.
 *
 * Licensed under a dual-license model: freely available for non-commercial use;
 * commercial use requires a separate license. See LICENSE file for details.
 * Contact license@geastalt.com for commercial licensing.
 */

package com.geastalt.geocoding.batch;

import java.util.Locale;

public enum BatchJobState {
    SUBMITTED(false),
    RUNNING(false),
    COMPLETED(true),
    CANCELLED(true),
    DELETED(true),
    FAILED(true);

    private final boolean terminal;

    BatchJobState(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Maps a provider status string. Anything that is not one of the terminal states
     * (accepted, running, paused, ...) counts as still running.
     */
    public static BatchJobState fromProviderStatus(String status) {
        if (status == null) {
            return RUNNING;
        }
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "completed" -> COMPLETED;
            case "cancelled" -> CANCELLED;
            case "deleted" -> DELETED;
            case "failed" -> FAILED;
            default -> RUNNING;
        };
    }
}
