package net.spookly.hyping.status;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import lombok.experimental.Accessors;

/**
 * Combat mode advertised by the server.
 * <p>
 * {@link Type#PER_PLAYER} lets each player override the mode and carries the default
 * applied to players that did not choose one.
 */
@Value
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BattleMode {
    private static final BattleMode GLOBAL_PVP = new BattleMode(Type.GLOBAL_PVP, false);
    private static final BattleMode GLOBAL_PVE = new BattleMode(Type.GLOBAL_PVE, false);
    private static final BattleMode PER_PLAYER_PVE = new BattleMode(Type.PER_PLAYER, false);
    private static final BattleMode PER_PLAYER_PVP = new BattleMode(Type.PER_PLAYER, true);

    Type type;
    /**
     * PvP state for players without an override. Always false outside {@link Type#PER_PLAYER}.
     */
    boolean perPlayerDefault;

    public static BattleMode globalPvp() {
        return GLOBAL_PVP;
    }

    public static BattleMode globalPve() {
        return GLOBAL_PVE;
    }

    public static BattleMode perPlayer(boolean pvpByDefault) {
        return pvpByDefault ? PER_PLAYER_PVP : PER_PLAYER_PVE;
    }

    public enum Type {
        GLOBAL_PVP(0x00),
        GLOBAL_PVE(0x01),
        PER_PLAYER(0x02);

        private final int tag;

        Type(int tag) {
            this.tag = tag;
        }

        public int tag() {
            return tag;
        }

        /**
         * Resolve a wire tag, returning null for tags outside the known set.
         */
        public static Type fromTag(int tag) {
            for (Type type : values()) {
                if (type.tag == tag) {
                    return type;
                }
            }
            return null;
        }
    }
}
