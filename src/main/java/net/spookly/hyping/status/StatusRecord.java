package net.spookly.hyping.status;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Immutable snapshot of what the server is and how busy it is.
 * <p>
 * Two records with equal fields are interchangeable. The build id is opaque; all zeros means
 * "unknown". Player counts are not checked against each other, a server may report more players
 * than its cap.
 */
public record StatusRecord(byte[] buildId, int playersCount, int playerCap, BattleMode battleMode) {
    public static final int BUILD_ID_LENGTH = 8;
    public static final int MAX_COUNT = 0xFFFF;

    private static final byte[] UNKNOWN_BUILD = new byte[BUILD_ID_LENGTH];

    public StatusRecord {
        Objects.requireNonNull(buildId, "buildId");
        Objects.requireNonNull(battleMode, "battleMode");
        if (buildId.length != BUILD_ID_LENGTH) {
            throw new IllegalArgumentException("buildId must be " + BUILD_ID_LENGTH + " bytes: " + buildId.length);
        }
        requireCount(playersCount, "playersCount");
        requireCount(playerCap, "playerCap");
        buildId = buildId.clone();
    }

    /**
     * Build a record from a textual build id of at most {@link #BUILD_ID_LENGTH} ASCII characters.
     */
    public static StatusRecord of(String buildId, int playersCount, int playerCap, BattleMode battleMode) {
        return new StatusRecord(buildIdFromText(buildId), playersCount, playerCap, battleMode);
    }

    /**
     * Encode a textual build id, zero padded on the right. Null or empty yields the unknown id.
     */
    public static byte[] buildIdFromText(String text) {
        if (text == null || text.isEmpty()) {
            return UNKNOWN_BUILD.clone();
        }
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) > 0x7F) {
                throw new IllegalArgumentException("buildId must be ASCII: " + text);
            }
        }
        byte[] raw = text.getBytes(StandardCharsets.US_ASCII);
        if (raw.length > BUILD_ID_LENGTH) {
            throw new IllegalArgumentException("buildId must be at most " + BUILD_ID_LENGTH + " characters: " + text);
        }
        return Arrays.copyOf(raw, BUILD_ID_LENGTH);
    }

    @Override
    public byte[] buildId() {
        return buildId.clone();
    }

    /**
     * Build id as text with trailing zero bytes removed.
     */
    public String buildIdText() {
        int end = buildId.length;
        while (end > 0 && buildId[end - 1] == 0) {
            end--;
        }
        return new String(buildId, 0, end, StandardCharsets.US_ASCII);
    }

    public boolean isBuildKnown() {
        return !Arrays.equals(buildId, UNKNOWN_BUILD);
    }

    public StatusRecord withPlayersCount(int count) {
        return new StatusRecord(buildId, count, playerCap, battleMode);
    }

    public StatusRecord withBattleMode(BattleMode mode) {
        return new StatusRecord(buildId, playersCount, playerCap, mode);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof StatusRecord that)) {
            return false;
        }
        return playersCount == that.playersCount
                && playerCap == that.playerCap
                && Arrays.equals(buildId, that.buildId)
                && battleMode.equals(that.battleMode);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(buildId);
        result = 31 * result + playersCount;
        result = 31 * result + playerCap;
        result = 31 * result + battleMode.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "StatusRecord{buildId=" + HexFormat.of().formatHex(buildId)
                + ", playersCount=" + playersCount
                + ", playerCap=" + playerCap
                + ", battleMode=" + battleMode
                + '}';
    }

    private static void requireCount(int value, String field) {
        if (value < 0 || value > MAX_COUNT) {
            throw new IllegalArgumentException(field + " must be between 0 and " + MAX_COUNT + ": " + value);
        }
    }
}
