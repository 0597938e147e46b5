package com.agentbench.backend.container;

import java.util.List;

/**
 * Reads the outcome of a test container from its output.
 * <p>
 * The test harness inside the image prints {@code TEST COMPLETED SUCCESSFULLY} or
 * {@code TEST FAILED}, and the agent's answer on lines prefixed with {@code RESPONSE:}.
 */
final class ResultMarkers {

    static final String SUCCESS = "TEST COMPLETED SUCCESSFULLY";
    static final String FAILURE = "TEST FAILED";
    static final String RESPONSE_PREFIX = "RESPONSE:";
    static final String ERROR_PREFIX = "ERROR:";

    private ResultMarkers() {}

    static boolean succeeded(List<String> lines, Integer exitCode) {
        boolean sawSuccess = false;
        for (String line : lines) {
            if (line.contains(FAILURE)) {
                return false;
            }
            if (line.contains(SUCCESS)) {
                sawSuccess = true;
            }
        }
        return sawSuccess || (exitCode != null && exitCode == 0);
    }

    static String response(List<String> lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            int idx = line.indexOf(RESPONSE_PREFIX);
            if (idx >= 0) {
                if (!sb.isEmpty()) {
                    sb.append('\n');
                }
                sb.append(line.substring(idx + RESPONSE_PREFIX.length()).trim());
            }
        }
        return sb.toString();
    }

    static String error(List<String> lines, Integer exitCode, String stoppedReason) {
        for (int i = lines.size() - 1; i >= 0; i--) {
            String line = lines.get(i);
            int idx = line.indexOf(ERROR_PREFIX);
            if (idx >= 0) {
                return line.substring(idx + ERROR_PREFIX.length()).trim();
            }
        }
        if (stoppedReason != null && !stoppedReason.isBlank()) {
            return stoppedReason;
        }
        return exitCode != null ? "Container exited with code " + exitCode : "Container stopped without a result";
    }
}
