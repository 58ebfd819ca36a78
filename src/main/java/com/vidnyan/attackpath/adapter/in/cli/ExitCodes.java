package com.vidnyan.attackpath.adapter.in.cli;

/**
 * Process exit codes of the command line interface.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int FAILURE = 1;
    public static final int USAGE = 2;
    public static final int MALFORMED_GRAPH = 3;
    public static final int EXPORT_FAILURE = 4;

    private ExitCodes() {
    }
}
