package com.mafiaindexer.ingestion.decoder;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Walks runtime log lines of one transaction, tracking the invoke stack, and collects the "Program data:" and
 * "Program log:" lines emitted while the indexed program is the innermost invoked program.
 * Each depth-1 invoke starts a new top-level instruction.
 */
public final class ProgramLogParser {

    private static final Pattern INVOKE = Pattern.compile("^Program (\\S+) invoke \\[(\\d+)]$");
    private static final Pattern EXIT = Pattern.compile("^Program (\\S+) (success|failed.*)$");
    private static final String DATA_PREFIX = "Program data: ";
    private static final String LOG_PREFIX = "Program log: ";

    /** Base64 payload at a fixed position inside the transaction. */
    public record EncodedEvent(int instructionIndex, int eventIndex, String base64) {
    }

    /** "Program log:" message text with the instruction it belongs to. */
    public record ProgramLogLine(int instructionIndex, String message) {
    }

    public record ParsedLogs(List<EncodedEvent> events, List<ProgramLogLine> programLogs) {
    }

    private final String programId;

    /**
     * @param programId program whose output is collected; null accepts output of any program
     */
    public ProgramLogParser(String programId) {
        this.programId = programId;
    }

    public ParsedLogs parse(List<String> logs) {
        List<EncodedEvent> events = new ArrayList<>();
        List<ProgramLogLine> programLogs = new ArrayList<>();
        Deque<String> stack = new ArrayDeque<>();
        int instructionIndex = -1;
        int eventIndex = 0;
        for (String line : logs) {
            if (line == null) {
                continue;
            }
            Matcher invoke = INVOKE.matcher(line);
            if (invoke.matches()) {
                if ("1".equals(invoke.group(2))) {
                    instructionIndex++;
                    eventIndex = 0;
                    stack.clear();
                }
                stack.push(invoke.group(1));
                continue;
            }
            Matcher exit = EXIT.matcher(line);
            if (exit.matches()) {
                if (!stack.isEmpty()) {
                    stack.pop();
                }
                continue;
            }
            if (!emittedByIndexedProgram(stack)) {
                continue;
            }
            int ix = Math.max(instructionIndex, 0);
            if (line.startsWith(DATA_PREFIX)) {
                events.add(new EncodedEvent(ix, eventIndex++, line.substring(DATA_PREFIX.length()).trim()));
            } else if (line.startsWith(LOG_PREFIX)) {
                programLogs.add(new ProgramLogLine(ix, line.substring(LOG_PREFIX.length())));
            }
        }
        return new ParsedLogs(events, programLogs);
    }

    private boolean emittedByIndexedProgram(Deque<String> stack) {
        if (programId == null) {
            return true;
        }
        // Subscriptions filtered by program may deliver bare logs without invoke lines.
        return stack.isEmpty() || programId.equals(stack.peek());
    }
}
