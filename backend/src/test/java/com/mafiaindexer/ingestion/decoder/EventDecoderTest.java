package com.mafiaindexer.ingestion.decoder;

import com.mafiaindexer.common.Base58;
import com.mafiaindexer.domain.EventKind;
import com.mafiaindexer.domain.EventOrigin;
import com.mafiaindexer.domain.ParsedEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Instant;
import java.util.Optional;

import static com.mafiaindexer.ingestion.decoder.EventPayloads.earningsUpdated;
import static com.mafiaindexer.ingestion.decoder.EventPayloads.ofLength;
import static com.mafiaindexer.ingestion.decoder.EventPayloads.pubkeyBytes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;

class EventDecoderTest {

    private static final Instant BLOCK_TIME = Instant.parse("2025-03-01T12:00:00Z");
    private static final DecodeContext CTX = new DecodeContext("sig1", 1234L, BLOCK_TIME, 0, 0);

    private final EventDecoder decoder = new EventDecoder();

    @Test
    @DisplayName("EarningsUpdated payload decodes to typed fields")
    void decode_earningsUpdated_fullPayload() {
        byte[] payload = earningsUpdated(7, 1_740_873_600L);

        Optional<ParsedEvent> result = decoder.decode(EventKind.EARNINGS_UPDATED.discriminator(), payload, CTX);

        assertThat(result).isPresent();
        ParsedEvent event = result.get();
        assertThat(event.kind()).isEqualTo(EventKind.EARNINGS_UPDATED);
        assertThat(event.partial()).isFalse();
        assertThat(event.origin()).isEqualTo(EventOrigin.PROGRAM_DATA);
        assertThat(event.signature()).isEqualTo("sig1");
        assertThat(event.slot()).isEqualTo(1234L);
        assertThat(event.fields()).containsExactly(
                entry("player", Base58.encode(pubkeyBytes(7))),
                entry("earnings_added", 1000L),
                entry("total_pending", 5000L),
                entry("next_earnings_time", 1_740_873_600L),
                entry("businesses_count", 2));
        assertThat(event.raw()).isEqualTo(payload);
        assertThat(event.playerWallet()).contains(Base58.encode(pubkeyBytes(7)));
    }

    @Test
    void decode_unknownDiscriminator_returnsEmpty() {
        byte[] disc = {1, 2, 3, 4, 5, 6, 7, 8};

        assertThat(decoder.decode(disc, earningsUpdated(1, 0), CTX)).isEmpty();
    }

    @Test
    @DisplayName("payload shorter than the first field produces no event")
    void decode_undersizedPayload_returnsEmpty() {
        assertThat(decoder.decode(EventKind.EARNINGS_UPDATED.discriminator(), new byte[20], CTX)).isEmpty();
        assertThat(decoder.decode(EventKind.EARNINGS_UPDATED.discriminator(), null, CTX)).isEmpty();
    }

    @Test
    @DisplayName("truncated payload keeps the fields that fit and marks the event partial")
    void decode_truncatedPayload_partialEvent() {
        byte[] payload = ofLength(44).pubkey(0, 3).u64(32, 1000).build();

        ParsedEvent event = decoder.decode(EventKind.EARNINGS_UPDATED.discriminator(), payload, CTX).orElseThrow();

        assertThat(event.partial()).isTrue();
        assertThat(event.fields()).containsOnlyKeys("player", "earnings_added");
        assertThat(event.longField("earnings_added")).contains(1000L);
    }

    @ParameterizedTest
    @EnumSource(EventKind.class)
    @DisplayName("every kind decodes a full-length payload without losing fields")
    void decode_everyKind_fullLengthIsComplete(EventKind kind) {
        EventLayout layout = EventLayouts.primary(kind);
        byte[] payload = new byte[layout.fullLength()];

        ParsedEvent event = decoder.decode(kind.discriminator(), payload, CTX).orElseThrow();

        assertThat(event.kind()).isEqualTo(kind);
        assertThat(event.partial()).isFalse();
        assertThat(event.fields().keySet())
                .containsAll(layout.fields().stream().map(FieldSpec::name).toList());
    }

    @Test
    void decode_businessUpgraded_goldenFields() {
        byte[] payload = ofLength(84).pubkey(0, 11).pubkey(32, 12).u8(64, 2).u8(65, 3)
                .u64(66, 250_000_000L).u16(74, 450).u64(76, 1_740_000_100L).build();

        ParsedEvent event = decoder.decode(EventKind.BUSINESS_UPGRADED.discriminator(), payload, CTX).orElseThrow();

        assertThat(event.partial()).isFalse();
        assertThat(event.fields()).containsExactly(
                entry("owner", Base58.encode(pubkeyBytes(11))),
                entry("business_mint", Base58.encode(pubkeyBytes(12))),
                entry("old_level", 2),
                entry("new_level", 3),
                entry("upgrade_cost", 250_000_000L),
                entry("new_daily_rate", 450),
                entry("upgraded_at", 1_740_000_100L));
    }

    @Test
    void decode_businessSold_goldenFields() {
        byte[] payload = ofLength(97).pubkey(0, 13).pubkey(32, 14).u8(64, 3)
                .u64(65, 900_000_000L).u64(73, 45_000_000L).u64(81, 17L).u64(89, 1_740_000_200L).build();

        ParsedEvent event = decoder.decode(EventKind.BUSINESS_SOLD.discriminator(), payload, CTX).orElseThrow();

        assertThat(event.partial()).isFalse();
        assertThat(event.fields()).containsExactly(
                entry("seller", Base58.encode(pubkeyBytes(13))),
                entry("business_mint", Base58.encode(pubkeyBytes(14))),
                entry("business_type", "MiningFarm"),
                entry("sale_price", 900_000_000L),
                entry("penalty_amount", 45_000_000L),
                entry("days_held", 17L),
                entry("sold_at", 1_740_000_200L));
    }

    @Test
    void decode_earningsClaimed_goldenFields() {
        byte[] payload = ofLength(48).pubkey(0, 15).u64(32, 123_456_789L).u64(40, 1_740_000_300L).build();

        ParsedEvent event = decoder.decode(EventKind.EARNINGS_CLAIMED.discriminator(), payload, CTX).orElseThrow();

        assertThat(event.partial()).isFalse();
        assertThat(event.fields()).containsExactly(
                entry("player", Base58.encode(pubkeyBytes(15))),
                entry("amount", 123_456_789L),
                entry("claimed_at", 1_740_000_300L));
    }

    @Test
    void decode_businessTransferred_goldenFields() {
        byte[] payload = ofLength(104).pubkey(0, 16).pubkey(32, 17).pubkey(64, 18).u64(96, 1_740_000_400L).build();

        ParsedEvent event = decoder.decode(EventKind.BUSINESS_TRANSFERRED.discriminator(), payload, CTX).orElseThrow();

        assertThat(event.partial()).isFalse();
        assertThat(event.fields()).containsExactly(
                entry("old_owner", Base58.encode(pubkeyBytes(16))),
                entry("new_owner", Base58.encode(pubkeyBytes(17))),
                entry("business_mint", Base58.encode(pubkeyBytes(18))),
                entry("transferred_at", 1_740_000_400L));
        assertThat(event.playerWallet()).contains(Base58.encode(pubkeyBytes(16)));
    }

    @Test
    void decode_businessDeactivated_goldenFields() {
        byte[] payload = ofLength(73).pubkey(0, 19).pubkey(32, 20).u8(64, 5).u64(65, 1_740_000_500L).build();

        ParsedEvent event = decoder.decode(EventKind.BUSINESS_DEACTIVATED.discriminator(), payload, CTX).orElseThrow();

        assertThat(event.partial()).isFalse();
        assertThat(event.fields()).containsExactly(
                entry("player", Base58.encode(pubkeyBytes(19))),
                entry("business_mint", Base58.encode(pubkeyBytes(20))),
                entry("slot_index", 5),
                entry("deactivated_at", 1_740_000_500L));
    }

    @Test
    void decode_slotUnlocked_goldenFields() {
        byte[] payload = ofLength(49).pubkey(0, 21).u8(32, 4).u64(33, 500_000_000L).u64(41, 1_740_000_600L).build();

        ParsedEvent event = decoder.decode(EventKind.SLOT_UNLOCKED.discriminator(), payload, CTX).orElseThrow();

        assertThat(event.partial()).isFalse();
        assertThat(event.fields()).containsExactly(
                entry("player", Base58.encode(pubkeyBytes(21))),
                entry("slot_index", 4),
                entry("unlock_cost", 500_000_000L),
                entry("unlocked_at", 1_740_000_600L));
    }

    @Test
    void decode_playerCreated() {
        byte[] payload = ofLength(56).pubkey(0, 9).u64(32, 100_000_000L).u64(40, 1_700_000_000L).u64(48, 1_700_000_600L).build();

        ParsedEvent event = decoder.decode(EventKind.PLAYER_CREATED.discriminator(), payload, CTX).orElseThrow();

        assertThat(event.fields()).containsEntry("wallet", Base58.encode(pubkeyBytes(9)))
                .containsEntry("entry_fee", 100_000_000L)
                .containsEntry("created_at", 1_700_000_000L);
        assertThat(event.playerWallet()).contains(Base58.encode(pubkeyBytes(9)));
    }

    @Test
    @DisplayName("business type tags map to labels, unknown tags keep the number")
    void decode_businessTypeLabels() {
        byte[] known = ofLength(83).pubkey(0, 1).pubkey(32, 2).u8(64, 5).u64(65, 10).u16(73, 300).u64(75, 1).build();
        byte[] unknown = ofLength(83).pubkey(0, 1).pubkey(32, 2).u8(64, 42).build();

        ParsedEvent a = decoder.decode(EventKind.BUSINESS_CREATED.discriminator(), known, CTX).orElseThrow();
        ParsedEvent b = decoder.decode(EventKind.BUSINESS_CREATED.discriminator(), unknown, CTX).orElseThrow();

        assertThat(a.fields()).containsEntry("business_type", "SolanaCartel").containsEntry("daily_rate", 300);
        assertThat(a.businessMint()).contains(Base58.encode(pubkeyBytes(2)));
        assertThat(b.fields()).containsEntry("business_type", "Unknown(42)");
    }

    @Test
    void decode_premiumSlotPurchased_slotTypeLabel() {
        byte[] payload = ofLength(50).pubkey(0, 4).u8(32, 2).u8(33, 6).u64(34, 2_000_000_000L).u64(42, 1).build();

        ParsedEvent event = decoder.decode(EventKind.PREMIUM_SLOT_PURCHASED.discriminator(), payload, CTX).orElseThrow();

        assertThat(event.fields()).containsEntry("slot_type", "Vip")
                .containsEntry("slot_index", 6)
                .containsEntry("cost", 2_000_000_000L);
    }

    @Test
    @DisplayName("BusinessCreatedInSlot: 70 bytes uses the padded layout, 69 bytes the packed one")
    void decode_businessCreatedInSlot_probesLayoutByLength() {
        byte[] padded = ofLength(70).pubkey(0, 1).u8(32, 2).u8(33, 0).u8(34, 1)
                .u64(40, 111).u64(48, 222).u64(56, 333).u16(64, 50).u32(66, 1_700_000_000L).build();
        byte[] packed = ofLength(69).pubkey(0, 1).u8(32, 2).u8(33, 3).u8(34, 1)
                .u64(35, 111).u64(43, 222).u64(51, 333).u16(59, 50).u64(61, 1_700_000_000L).build();

        ParsedEvent p = decoder.decode(EventKind.BUSINESS_CREATED_IN_SLOT.discriminator(), padded, CTX).orElseThrow();
        ParsedEvent k = decoder.decode(EventKind.BUSINESS_CREATED_IN_SLOT.discriminator(), packed, CTX).orElseThrow();

        assertThat(p.fields()).containsEntry("base_cost", 111L).containsEntry("total_paid", 333L)
                .containsEntry("created_at", 1_700_000_000L).containsEntry("business_type", "CryptoKiosk");
        assertThat(k.fields()).containsEntry("base_cost", 111L).containsEntry("total_paid", 333L)
                .containsEntry("created_at", 1_700_000_000L).containsEntry("business_type", "MiningFarm");
        assertThat(p.partial()).isFalse();
        assertThat(k.partial()).isFalse();
    }

    @Test
    @DisplayName("BusinessUpgradedInSlot: extra padding byte shifts upgrade_cost")
    void decode_businessUpgradedInSlot_probesLayoutByLength() {
        byte[] padded = ofLength(54).pubkey(0, 1).u8(32, 0).u8(33, 1).u8(34, 2)
                .u64(36, 5_000).u16(44, 120).u64(46, 1_700_000_100L).build();
        byte[] packed = ofLength(53).pubkey(0, 1).u8(32, 0).u8(33, 1).u8(34, 2)
                .u64(35, 5_000).u16(43, 120).u64(45, 1_700_000_100L).build();

        ParsedEvent p = decoder.decode(EventKind.BUSINESS_UPGRADED_IN_SLOT.discriminator(), padded, CTX).orElseThrow();
        ParsedEvent k = decoder.decode(EventKind.BUSINESS_UPGRADED_IN_SLOT.discriminator(), packed, CTX).orElseThrow();

        for (ParsedEvent e : new ParsedEvent[]{p, k}) {
            assertThat(e.fields()).containsEntry("old_level", 1).containsEntry("new_level", 2)
                    .containsEntry("upgrade_cost", 5_000L).containsEntry("new_daily_rate", 120)
                    .containsEntry("upgraded_at", 1_700_000_100L);
            assertThat(e.partial()).isFalse();
        }
    }

    @Test
    void decode_businessSoldFromSlot_packedLayout() {
        byte[] payload = ofLength(69).pubkey(0, 1).u8(32, 3).u8(33, 1).u64(34, 10_000).u64(42, 12)
                .u8(50, 20).u8(51, 5).u8(52, 15).u64(53, 8_500).u64(61, 1_700_001_000L).build();

        ParsedEvent event = decoder.decode(EventKind.BUSINESS_SOLD_FROM_SLOT.discriminator(), payload, CTX).orElseThrow();

        assertThat(event.partial()).isFalse();
        assertThat(event.fields()).containsEntry("days_held", 12L)
                .containsEntry("final_fee_pct", 15)
                .containsEntry("return_amount", 8_500L)
                .containsEntry("sold_at", 1_700_001_000L);
    }

    @Test
    @DisplayName("BusinessSoldFromSlot observed layout takes sold_at from the block time")
    void decode_businessSoldFromSlot_observedLayout() {
        byte[] payload = ofLength(57).pubkey(0, 1).u8(32, 3).u8(33, 4).u64(34, 10_000).u64(44, 30)
                .u8(52, 20).u32(53, 7_000).build();

        ParsedEvent event = decoder.decode(EventKind.BUSINESS_SOLD_FROM_SLOT.discriminator(), payload, CTX).orElseThrow();

        assertThat(event.partial()).isFalse();
        assertThat(event.fields()).containsEntry("business_type", "DeFiEmpire")
                .containsEntry("days_held", 30L)
                .containsEntry("return_amount", 7_000L)
                .containsEntry("sold_at", BLOCK_TIME.getEpochSecond());
    }

    @Test
    void decode_observedLayoutWithoutBlockTime_omitsSoldAt() {
        byte[] payload = ofLength(57).pubkey(0, 1).build();
        DecodeContext noTime = new DecodeContext("sig2", 1L, null, 0, 0);

        ParsedEvent event = decoder.decode(EventKind.BUSINESS_SOLD_FROM_SLOT.discriminator(), payload, noTime).orElseThrow();

        assertThat(event.fields()).doesNotContainKey("sold_at");
    }

    @Test
    @DisplayName("decode coordinates come from the context")
    void decode_keepsContextCoordinates() {
        DecodeContext ctx = new DecodeContext("sigX", 99L, BLOCK_TIME, 2, 3);

        ParsedEvent event = decoder.decode(EventKind.EARNINGS_UPDATED.discriminator(), earningsUpdated(1, 0), ctx).orElseThrow();

        assertThat(event.instructionIndex()).isEqualTo(2);
        assertThat(event.eventIndex()).isEqualTo(3);
        assertThat(event.dedupKey().toString()).isEqualTo("sigX#2:3");
        assertThat(event.blockTime()).isEqualTo(BLOCK_TIME);
    }
}
