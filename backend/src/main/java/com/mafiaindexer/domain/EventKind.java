package com.mafiaindexer.domain;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Events emitted by the game program. Each kind is identified on the wire by an 8-byte discriminator,
 * the first 8 bytes of sha256("event:" + eventName).
 */
public enum EventKind {

    PLAYER_CREATED("PlayerCreated"),
    BUSINESS_CREATED("BusinessCreated"),
    BUSINESS_CREATED_IN_SLOT("BusinessCreatedInSlot"),
    BUSINESS_UPGRADED("BusinessUpgraded"),
    BUSINESS_UPGRADED_IN_SLOT("BusinessUpgradedInSlot"),
    BUSINESS_SOLD("BusinessSold"),
    BUSINESS_SOLD_FROM_SLOT("BusinessSoldFromSlot"),
    EARNINGS_UPDATED("EarningsUpdated"),
    EARNINGS_CLAIMED("EarningsClaimed"),
    BUSINESS_TRANSFERRED("BusinessTransferred"),
    BUSINESS_DEACTIVATED("BusinessDeactivated"),
    SLOT_UNLOCKED("SlotUnlocked"),
    PREMIUM_SLOT_PURCHASED("PremiumSlotPurchased");

    public static final int DISCRIMINATOR_LENGTH = 8;

    private static final Map<Long, EventKind> BY_DISCRIMINATOR;

    static {
        Map<Long, EventKind> map = new HashMap<>();
        for (EventKind kind : values()) {
            map.put(ByteBuffer.wrap(kind.discriminator).getLong(), kind);
        }
        BY_DISCRIMINATOR = Collections.unmodifiableMap(map);
    }

    private final String eventName;
    private final byte[] discriminator;

    EventKind(String eventName) {
        this.eventName = eventName;
        this.discriminator = anchorDiscriminator(eventName);
    }

    public String getEventName() {
        return eventName;
    }

    public byte[] discriminator() {
        return discriminator.clone();
    }

    /**
     * Static table lookup. Empty for tags of other programs, instructions or unknown event kinds.
     */
    public static Optional<EventKind> fromDiscriminator(byte[] tag) {
        if (tag == null || tag.length != DISCRIMINATOR_LENGTH) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_DISCRIMINATOR.get(ByteBuffer.wrap(tag).getLong()));
    }

    static byte[] anchorDiscriminator(String eventName) {
        try {
            byte[] hash = MessageDigest.getInstance("SHA-256")
                    .digest(("event:" + eventName).getBytes(StandardCharsets.UTF_8));
            return Arrays.copyOf(hash, DISCRIMINATOR_LENGTH);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
