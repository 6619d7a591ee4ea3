package com.mafiaindexer.ingestion.decoder;

import com.mafiaindexer.domain.EventKind;
import com.mafiaindexer.domain.EventOrigin;
import com.mafiaindexer.domain.ParsedEvent;
import com.mafiaindexer.domain.ProgramTransaction;
import com.mafiaindexer.ingestion.decoder.ProgramLogParser.ProgramLogLine;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reduced-fidelity recovery from the program's human-readable log messages. Used only for transactions
 * where no structured event decoded. Extracted events are always partial.
 */
@Slf4j
public final class LogTextEventExtractor {

    private static final String ADDRESS = "([1-9A-HJ-NP-Za-km-z]{32,44})";
    private static final Pattern EARNINGS_UPDATED = Pattern.compile("Earnings updated for player: " + ADDRESS);
    private static final Pattern EARNINGS_ADDED = Pattern.compile("New earnings added: (\\d+) lamports");
    private static final Pattern TOTAL_PENDING = Pattern.compile("Total pending: (\\d+) lamports");
    private static final Pattern ACTIVE_BUSINESSES = Pattern.compile("Active businesses: (\\d+)");
    private static final Pattern CLAIMED = Pattern.compile("Claimed (\\d+) lamports");
    private static final Pattern SLOT_UNLOCKED = Pattern.compile("Slot (\\d+) unlocked for (\\d+) lamports");

    private LogTextEventExtractor() {
    }

    public static List<ParsedEvent> extract(ProgramTransaction tx, List<ProgramLogLine> lines) {
        List<ParsedEvent> out = new ArrayList<>();
        Pending earnings = null;
        int eventIndex = 0;
        int currentInstruction = -1;
        for (ProgramLogLine line : lines) {
            if (line.instructionIndex() != currentInstruction) {
                if (earnings != null) {
                    out.add(earnings.toEvent(tx, eventIndex++));
                    earnings = null;
                }
                currentInstruction = line.instructionIndex();
            }
            String text = line.message();
            Matcher m;
            if ((m = EARNINGS_UPDATED.matcher(text)).find()) {
                if (earnings != null) {
                    out.add(earnings.toEvent(tx, eventIndex++));
                }
                earnings = new Pending(EventKind.EARNINGS_UPDATED, line.instructionIndex());
                earnings.fields.put("player", m.group(1));
            } else if (earnings != null && (m = EARNINGS_ADDED.matcher(text)).find()) {
                putLong(earnings.fields, "earnings_added", m.group(1));
            } else if (earnings != null && (m = TOTAL_PENDING.matcher(text)).find()) {
                putLong(earnings.fields, "total_pending", m.group(1));
            } else if (earnings != null && (m = ACTIVE_BUSINESSES.matcher(text)).find()) {
                putInt(earnings.fields, "businesses_count", m.group(1));
            } else if ((m = CLAIMED.matcher(text)).find()) {
                Pending claimed = new Pending(EventKind.EARNINGS_CLAIMED, line.instructionIndex());
                if (tx.feePayer() != null) {
                    claimed.fields.put("player", tx.feePayer());
                }
                putLong(claimed.fields, "amount", m.group(1));
                out.add(claimed.toEvent(tx, eventIndex++));
            } else if ((m = SLOT_UNLOCKED.matcher(text)).find()) {
                Pending unlocked = new Pending(EventKind.SLOT_UNLOCKED, line.instructionIndex());
                if (tx.feePayer() != null) {
                    unlocked.fields.put("player", tx.feePayer());
                }
                putInt(unlocked.fields, "slot_index", m.group(1));
                putLong(unlocked.fields, "unlock_cost", m.group(2));
                out.add(unlocked.toEvent(tx, eventIndex++));
            }
        }
        if (earnings != null) {
            out.add(earnings.toEvent(tx, eventIndex));
        }
        return out;
    }

    // Numbers outside the field's range are left out, like bytes past the end of a short payload.
    private static void putLong(Map<String, Object> fields, String name, String digits) {
        try {
            fields.put(name, Long.parseLong(digits));
        } catch (NumberFormatException e) {
            log.debug("Log value for {} out of range: {}", name, digits);
        }
    }

    private static void putInt(Map<String, Object> fields, String name, String digits) {
        try {
            fields.put(name, Integer.parseInt(digits));
        } catch (NumberFormatException e) {
            log.debug("Log value for {} out of range: {}", name, digits);
        }
    }

    private static final class Pending {
        private final EventKind kind;
        private final int instructionIndex;
        private final Map<String, Object> fields = new LinkedHashMap<>();

        private Pending(EventKind kind, int instructionIndex) {
            this.kind = kind;
            this.instructionIndex = instructionIndex;
        }

        private ParsedEvent toEvent(ProgramTransaction tx, int eventIndex) {
            return new ParsedEvent(kind, tx.signature(), tx.slot(), tx.blockTime(), instructionIndex, eventIndex,
                    fields, new byte[0], true, EventOrigin.LOG_TEXT);
        }
    }
}
