package com.mafiaindexer.ingestion.decoder;

/**
 * One fixed-offset field of an event layout.
 */
public record FieldSpec(String name, int offset, FieldType type) {

    public int end() {
        return offset + type.size();
    }

    public static FieldSpec pubkey(String name, int offset) {
        return new FieldSpec(name, offset, FieldType.PUBKEY);
    }

    public static FieldSpec u8(String name, int offset) {
        return new FieldSpec(name, offset, FieldType.U8);
    }

    public static FieldSpec u16(String name, int offset) {
        return new FieldSpec(name, offset, FieldType.U16);
    }

    public static FieldSpec u32(String name, int offset) {
        return new FieldSpec(name, offset, FieldType.U32);
    }

    public static FieldSpec u64(String name, int offset) {
        return new FieldSpec(name, offset, FieldType.U64);
    }

    public static FieldSpec i64(String name, int offset) {
        return new FieldSpec(name, offset, FieldType.I64);
    }

    public static FieldSpec businessType(String name, int offset) {
        return new FieldSpec(name, offset, FieldType.BUSINESS_TYPE);
    }

    public static FieldSpec slotType(String name, int offset) {
        return new FieldSpec(name, offset, FieldType.SLOT_TYPE);
    }
}
