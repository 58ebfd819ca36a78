package com.vidnyan.attackpath.domain.graph;

/**
 * Raised when a graph description cannot be tokenized or is structurally
 * inconsistent. Fatal: no analysis runs on a malformed graph.
 */
public class MalformedGraphException extends RuntimeException {

    private final int line;

    public MalformedGraphException(String message) {
        this(message, -1);
    }

    public MalformedGraphException(String message, int line) {
        super(line > 0 ? message + " (line " + line + ")" : message);
        this.line = line;
    }

    /**
     * Line of the description the problem was found on, or -1 when not tied to a line.
     */
    public int line() {
        return line;
    }
}
