package com.agentbench.backend;

import java.util.List;

/**
 * A page of log lines and the cursor to continue from. Asking again with the same cursor
 * returns the same lines.
 *
 * @param lines      lines after the requested cursor, in order
 * @param nextCursor cursor to pass next time; equals the requested cursor when nothing was new
 */
public record LogPage(List<String> lines, String nextCursor) {

    public LogPage {
        lines = lines == null ? List.of() : List.copyOf(lines);
    }

    public static LogPage empty(String cursor) {
        return new LogPage(List.of(), cursor);
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
