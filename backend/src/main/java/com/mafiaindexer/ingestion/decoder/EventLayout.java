package com.mafiaindexer.ingestion.decoder;

import java.util.List;

/**
 * Byte layout of one revision of an event payload (after the discriminator).
 *
 * @param variant          short name used in logs ("packed", "padded", ...)
 * @param fields           fields in wire order; offsets may overlap in observed drifted revisions
 * @param blockTimeField   field filled from the transaction block time when the payload does not carry it, or null
 */
public record EventLayout(String variant, List<FieldSpec> fields, String blockTimeField) {

    public EventLayout {
        if (fields == null || fields.isEmpty()) {
            throw new IllegalArgumentException("Layout " + variant + " has no fields");
        }
        fields = List.copyOf(fields);
    }

    public EventLayout(String variant, List<FieldSpec> fields) {
        this(variant, fields, null);
    }

    /** Bytes needed to decode every field. */
    public int fullLength() {
        return fields.stream().mapToInt(FieldSpec::end).max().orElse(0);
    }

    /** Bytes needed for the first field; below this nothing useful can be decoded. */
    public int minimumLength() {
        return fields.get(0).end();
    }
}
