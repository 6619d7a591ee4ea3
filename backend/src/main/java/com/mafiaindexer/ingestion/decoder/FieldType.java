package com.mafiaindexer.ingestion.decoder;

import java.util.List;

/**
 * Wire types of event fields. All integers are little-endian.
 */
public enum FieldType {

    PUBKEY(32),
    U8(1),
    U16(2),
    U32(4),
    U64(8),
    I64(8),
    BUSINESS_TYPE(1, List.of("CryptoKiosk", "MemeCasino", "NFTLaundry", "MiningFarm", "DeFiEmpire", "SolanaCartel")),
    SLOT_TYPE(1, List.of("Basic", "Premium", "Vip", "Legendary"));

    private final int size;
    private final List<String> labels;

    FieldType(int size) {
        this(size, List.of());
    }

    FieldType(int size, List<String> labels) {
        this.size = size;
        this.labels = labels;
    }

    public int size() {
        return size;
    }

    /** Label of a u8 enum tag; tags outside the known range become "Unknown(n)". */
    String label(int tag) {
        return tag < labels.size() ? labels.get(tag) : "Unknown(" + tag + ")";
    }
}
