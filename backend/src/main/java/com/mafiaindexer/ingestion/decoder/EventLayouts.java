package com.mafiaindexer.ingestion.decoder;

import com.mafiaindexer.domain.EventKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static com.mafiaindexer.ingestion.decoder.FieldSpec.businessType;
import static com.mafiaindexer.ingestion.decoder.FieldSpec.i64;
import static com.mafiaindexer.ingestion.decoder.FieldSpec.pubkey;
import static com.mafiaindexer.ingestion.decoder.FieldSpec.slotType;
import static com.mafiaindexer.ingestion.decoder.FieldSpec.u16;
import static com.mafiaindexer.ingestion.decoder.FieldSpec.u32;
import static com.mafiaindexer.ingestion.decoder.FieldSpec.u64;
import static com.mafiaindexer.ingestion.decoder.FieldSpec.u8;

/**
 * Static layout table per event kind. Kinds with several entries have been observed on chain with different
 * padding; the list is ordered by preference and {@link EventDecoder} picks the first one the payload fully fits.
 * The drift looks like an upstream encoding inconsistency, so no single table is treated as canonical.
 */
public final class EventLayouts {

    private static final Map<EventKind, List<EventLayout>> LAYOUTS;

    static {
        Map<EventKind, List<EventLayout>> m = new EnumMap<>(EventKind.class);

        m.put(EventKind.PLAYER_CREATED, List.of(new EventLayout("borsh", List.of(
                pubkey("wallet", 0),
                u64("entry_fee", 32),
                i64("created_at", 40),
                i64("next_earnings_time", 48)))));

        m.put(EventKind.BUSINESS_CREATED, List.of(new EventLayout("borsh", List.of(
                pubkey("owner", 0),
                pubkey("business_mint", 32),
                businessType("business_type", 64),
                u64("cost", 65),
                u16("daily_rate", 73),
                i64("created_at", 75)))));

        m.put(EventKind.BUSINESS_CREATED_IN_SLOT, List.of(
                new EventLayout("padded", List.of(
                        pubkey("player", 0),
                        u8("slot_index", 32),
                        businessType("business_type", 33),
                        u8("level", 34),
                        u64("base_cost", 40),
                        u64("slot_cost", 48),
                        u64("total_paid", 56),
                        u16("daily_rate", 64),
                        u32("created_at", 66))),
                new EventLayout("packed", List.of(
                        pubkey("player", 0),
                        u8("slot_index", 32),
                        businessType("business_type", 33),
                        u8("level", 34),
                        u64("base_cost", 35),
                        u64("slot_cost", 43),
                        u64("total_paid", 51),
                        u16("daily_rate", 59),
                        i64("created_at", 61)))));

        m.put(EventKind.BUSINESS_UPGRADED, List.of(new EventLayout("borsh", List.of(
                pubkey("owner", 0),
                pubkey("business_mint", 32),
                u8("old_level", 64),
                u8("new_level", 65),
                u64("upgrade_cost", 66),
                u16("new_daily_rate", 74),
                i64("upgraded_at", 76)))));

        m.put(EventKind.BUSINESS_UPGRADED_IN_SLOT, List.of(
                new EventLayout("padded", List.of(
                        pubkey("player", 0),
                        u8("slot_index", 32),
                        u8("old_level", 33),
                        u8("new_level", 34),
                        u64("upgrade_cost", 36),
                        u16("new_daily_rate", 44),
                        i64("upgraded_at", 46))),
                new EventLayout("packed", List.of(
                        pubkey("player", 0),
                        u8("slot_index", 32),
                        u8("old_level", 33),
                        u8("new_level", 34),
                        u64("upgrade_cost", 35),
                        u16("new_daily_rate", 43),
                        i64("upgraded_at", 45)))));

        m.put(EventKind.BUSINESS_SOLD, List.of(new EventLayout("borsh", List.of(
                pubkey("seller", 0),
                pubkey("business_mint", 32),
                businessType("business_type", 64),
                u64("sale_price", 65),
                u64("penalty_amount", 73),
                u64("days_held", 81),
                i64("sold_at", 89)))));

        m.put(EventKind.BUSINESS_SOLD_FROM_SLOT, List.of(
                new EventLayout("packed", List.of(
                        pubkey("player", 0),
                        u8("slot_index", 32),
                        businessType("business_type", 33),
                        u64("total_invested", 34),
                        u64("days_held", 42),
                        u8("base_fee_pct", 50),
                        u8("slot_discount", 51),
                        u8("final_fee_pct", 52),
                        u64("return_amount", 53),
                        i64("sold_at", 61))),
                // return_amount shares byte 53 with slot_discount in this revision
                new EventLayout("observed", List.of(
                        pubkey("player", 0),
                        u8("slot_index", 32),
                        businessType("business_type", 33),
                        u64("total_invested", 34),
                        u64("days_held", 44),
                        u8("base_fee_pct", 52),
                        u8("slot_discount", 53),
                        u32("return_amount", 53)),
                        "sold_at")));

        m.put(EventKind.EARNINGS_UPDATED, List.of(new EventLayout("borsh", List.of(
                pubkey("player", 0),
                u64("earnings_added", 32),
                u64("total_pending", 40),
                i64("next_earnings_time", 48),
                u8("businesses_count", 56)))));

        m.put(EventKind.EARNINGS_CLAIMED, List.of(new EventLayout("borsh", List.of(
                pubkey("player", 0),
                u64("amount", 32),
                i64("claimed_at", 40)))));

        m.put(EventKind.BUSINESS_TRANSFERRED, List.of(new EventLayout("borsh", List.of(
                pubkey("old_owner", 0),
                pubkey("new_owner", 32),
                pubkey("business_mint", 64),
                i64("transferred_at", 96)))));

        m.put(EventKind.BUSINESS_DEACTIVATED, List.of(new EventLayout("borsh", List.of(
                pubkey("player", 0),
                pubkey("business_mint", 32),
                u8("slot_index", 64),
                i64("deactivated_at", 65)))));

        m.put(EventKind.SLOT_UNLOCKED, List.of(new EventLayout("borsh", List.of(
                pubkey("player", 0),
                u8("slot_index", 32),
                u64("unlock_cost", 33),
                i64("unlocked_at", 41)))));

        m.put(EventKind.PREMIUM_SLOT_PURCHASED, List.of(new EventLayout("borsh", List.of(
                pubkey("player", 0),
                slotType("slot_type", 32),
                u8("slot_index", 33),
                u64("cost", 34),
                i64("purchased_at", 42)))));

        for (EventKind kind : EventKind.values()) {
            if (!m.containsKey(kind)) {
                throw new ExceptionInInitializerError("No layout registered for " + kind);
            }
        }
        LAYOUTS = Collections.unmodifiableMap(m);
    }

    private EventLayouts() {
    }

    public static List<EventLayout> forKind(EventKind kind) {
        return LAYOUTS.get(kind);
    }

    public static EventLayout primary(EventKind kind) {
        return LAYOUTS.get(kind).get(0);
    }

    /**
     * First layout whose full length fits the payload, else the primary layout (decoded partially).
     */
    public static EventLayout select(EventKind kind, int payloadLength) {
        List<EventLayout> candidates = LAYOUTS.get(kind);
        for (EventLayout layout : candidates) {
            if (payloadLength >= layout.fullLength()) {
                return layout;
            }
        }
        return candidates.get(0);
    }
}
