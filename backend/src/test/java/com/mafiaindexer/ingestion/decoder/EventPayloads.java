package com.mafiaindexer.ingestion.decoder;

import com.mafiaindexer.domain.EventKind;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;
import java.util.Base64;

/**
 * Little-endian payload builder for decoder fixtures.
 */
public final class EventPayloads {

    private final ByteBuffer buf;

    private EventPayloads(int size) {
        this.buf = ByteBuffer.allocate(size).order(ByteOrder.LITTLE_ENDIAN);
    }

    public static EventPayloads ofLength(int size) {
        return new EventPayloads(size);
    }

    public static byte[] pubkeyBytes(int fill) {
        byte[] key = new byte[32];
        Arrays.fill(key, (byte) fill);
        return key;
    }

    public EventPayloads pubkey(int offset, int fill) {
        buf.put(offset, pubkeyBytes(fill));
        return this;
    }

    public EventPayloads u8(int offset, int value) {
        buf.put(offset, (byte) value);
        return this;
    }

    public EventPayloads u16(int offset, int value) {
        buf.putShort(offset, (short) value);
        return this;
    }

    public EventPayloads u32(int offset, long value) {
        buf.putInt(offset, (int) value);
        return this;
    }

    public EventPayloads u64(int offset, long value) {
        buf.putLong(offset, value);
        return this;
    }

    public byte[] build() {
        return buf.array().clone();
    }

    /** Discriminator followed by payload, base64 encoded as it appears after "Program data: ". */
    public static String programData(EventKind kind, byte[] payload) {
        byte[] disc = kind.discriminator();
        byte[] all = Arrays.copyOf(disc, disc.length + payload.length);
        System.arraycopy(payload, 0, all, disc.length, payload.length);
        return Base64.getEncoder().encodeToString(all);
    }

    /** Standard EarningsUpdated payload: earnings_added 1000, total_pending 5000, 2 businesses. */
    public static byte[] earningsUpdated(int playerFill, long nextEarningsTime) {
        return ofLength(57)
                .pubkey(0, playerFill)
                .u64(32, 1000)
                .u64(40, 5000)
                .u64(48, nextEarningsTime)
                .u8(56, 2)
                .build();
    }
}
