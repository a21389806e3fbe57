package com.jobgrid.model;

import java.util.EnumSet;
import java.util.Set;

public enum JobResultStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    ERRORED,
    FAILED;

    private static final Set<JobResultStatus> TERMINAL = EnumSet.of(COMPLETED, ERRORED, FAILED);

    public static Set<JobResultStatus> terminalStatuses() {
        return TERMINAL;
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
