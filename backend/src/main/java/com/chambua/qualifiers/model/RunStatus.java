package com.chambua.qualifiers.model;

public enum RunStatus {
    RUNNING, SUCCESS, PARTIAL, FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    /**
     * Terminal status for a batch that finished without an aborting exception.
     * An empty batch, or one where every row failed, counts as failed.
     */
    public static RunStatus fromCounts(int rowsProcessed, int rowsFailed) {
        if (rowsProcessed <= 0 || rowsFailed >= rowsProcessed) return FAILED;
        if (rowsFailed == 0) return SUCCESS;
        return PARTIAL;
    }
}
