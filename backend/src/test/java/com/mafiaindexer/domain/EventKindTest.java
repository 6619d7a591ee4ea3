package com.mafiaindexer.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class EventKindTest {

    @Test
    @DisplayName("discriminator is the first 8 bytes of sha256(\"event:\" + name)")
    void discriminator_matchesAnchorConvention() {
        assertThat(EventKind.PLAYER_CREATED.discriminator())
                .containsExactly(-2, 9, 74, 81, 92, 5, -67, -36);
        assertThat(EventKind.EARNINGS_UPDATED.discriminator())
                .containsExactly(-8, -23, -25, 77, 17, 8, 94, 66);
        assertThat(EventKind.BUSINESS_SOLD_FROM_SLOT.discriminator())
                .containsExactly(10, -22, 116, 19, 68, 21, -107, -12);
    }

    @ParameterizedTest
    @EnumSource(EventKind.class)
    @DisplayName("every kind resolves back from its own discriminator")
    void fromDiscriminator_roundTripsEveryKind(EventKind kind) {
        assertThat(EventKind.fromDiscriminator(kind.discriminator())).contains(kind);
    }

    @Test
    void discriminators_areDistinct() {
        Set<String> seen = new HashSet<>();
        for (EventKind kind : EventKind.values()) {
            seen.add(Arrays.toString(kind.discriminator()));
        }
        assertThat(seen).hasSize(EventKind.values().length);
    }

    @Test
    void fromDiscriminator_unknownOrWrongLength_returnsEmpty() {
        assertThat(EventKind.fromDiscriminator(new byte[8])).isEmpty();
        assertThat(EventKind.fromDiscriminator(new byte[7])).isEmpty();
        assertThat(EventKind.fromDiscriminator(null)).isEmpty();
    }

    @Test
    void discriminator_returnsDefensiveCopy() {
        byte[] disc = EventKind.SLOT_UNLOCKED.discriminator();
        disc[0] ^= 0x7F;
        assertThat(EventKind.fromDiscriminator(EventKind.SLOT_UNLOCKED.discriminator())).contains(EventKind.SLOT_UNLOCKED);
    }
}
