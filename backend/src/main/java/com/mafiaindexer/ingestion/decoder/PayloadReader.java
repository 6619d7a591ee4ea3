package com.mafiaindexer.ingestion.decoder;

import com.mafiaindexer.common.Base58;

import java.util.Arrays;
import java.util.Optional;

/**
 * Bounds-checked little-endian reads over an event payload. A read whose range is not fully inside the
 * payload yields empty instead of throwing.
 */
final class PayloadReader {

    private final byte[] payload;

    PayloadReader(byte[] payload) {
        this.payload = payload;
    }

    int length() {
        return payload.length;
    }

    boolean fits(int offset, int size) {
        return offset >= 0 && size >= 0 && offset <= payload.length - size;
    }

    Optional<Object> read(FieldSpec field) {
        if (!fits(field.offset(), field.type().size())) {
            return Optional.empty();
        }
        int o = field.offset();
        Object value = switch (field.type()) {
            case PUBKEY -> Base58.encode(Arrays.copyOfRange(payload, o, o + 32));
            case U8 -> payload[o] & 0xFF;
            case U16 -> (int) littleEndian(o, 2);
            case U32 -> littleEndian(o, 4);
            case U64, I64 -> littleEndian(o, 8);
            case BUSINESS_TYPE, SLOT_TYPE -> field.type().label(payload[o] & 0xFF);
        };
        return Optional.of(value);
    }

    private long littleEndian(int offset, int size) {
        long value = 0;
        for (int i = size - 1; i >= 0; i--) {
            value = (value << 8) | (payload[offset + i] & 0xFFL);
        }
        return value;
    }
}
