package com.mafiaindexer.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A decoded program event. {@code fields} keeps layout order and holds only the fields whose byte range fit
 * in the payload; {@code partial} is set when at least one field was skipped.
 * Field values are String (addresses, enum labels), Integer (u8, u16) or Long (u32, u64, i64).
 */
public record ParsedEvent(
        EventKind kind,
        String signature,
        long slot,
        Instant blockTime,
        int instructionIndex,
        int eventIndex,
        Map<String, Object> fields,
        byte[] raw,
        boolean partial,
        EventOrigin origin
) {

    public ParsedEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(signature, "signature");
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        raw = raw != null ? raw.clone() : new byte[0];
        origin = origin != null ? origin : EventOrigin.PROGRAM_DATA;
    }

    public DedupKey dedupKey() {
        return new DedupKey(signature, instructionIndex, eventIndex);
    }

    public Optional<Object> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    public Optional<String> stringField(String name) {
        return field(name).map(Object::toString);
    }

    public Optional<Long> longField(String name) {
        return field(name).filter(Number.class::isInstance).map(v -> ((Number) v).longValue());
    }

    /** Wallet the event belongs to: player, wallet or previous owner, whichever the layout carries. */
    public Optional<String> playerWallet() {
        return stringField("player")
                .or(() -> stringField("wallet"))
                .or(() -> stringField("owner"))
                .or(() -> stringField("seller"))
                .or(() -> stringField("old_owner"));
    }

    public Optional<String> businessMint() {
        return stringField("business_mint");
    }

    @Override
    public byte[] raw() {
        return raw.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParsedEvent other)) return false;
        return slot == other.slot
                && instructionIndex == other.instructionIndex
                && eventIndex == other.eventIndex
                && partial == other.partial
                && kind == other.kind
                && signature.equals(other.signature)
                && Objects.equals(blockTime, other.blockTime)
                && fields.equals(other.fields)
                && Arrays.equals(raw, other.raw)
                && origin == other.origin;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, signature, slot, instructionIndex, eventIndex, fields, Arrays.hashCode(raw));
    }

    @Override
    public String toString() {
        return "ParsedEvent{" + kind.getEventName() + " " + dedupKey() + " slot=" + slot
                + (partial ? " partial" : "") + " fields=" + fields + "}";
    }
}
