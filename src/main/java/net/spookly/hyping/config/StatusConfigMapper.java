package net.spookly.hyping.config;

import net.spookly.hyping.status.BattleMode;
import net.spookly.hyping.status.StatusRecord;

/**
 * Builds the initial status record from the {@code status} section.
 */
public final class StatusConfigMapper {
    private StatusConfigMapper() {
    }

    public static StatusRecord toRecord(HypingConfig.StatusConfig status) {
        if (status == null) {
            throw new ConfigException("status section is required");
        }
        return StatusRecord.of(
                status.buildId,
                status.playersCount == null ? 0 : status.playersCount,
                status.playerCap == null ? 0 : status.playerCap,
                battleMode(status)
        );
    }

    private static BattleMode battleMode(HypingConfig.StatusConfig status) {
        if (ConfigValidator.isOneOf(status.battleMode, "global_pvp")) {
            return BattleMode.globalPvp();
        }
        if (ConfigValidator.isOneOf(status.battleMode, "global_pve")) {
            return BattleMode.globalPve();
        }
        if (ConfigValidator.isOneOf(status.battleMode, "per_player")) {
            return BattleMode.perPlayer(Boolean.TRUE.equals(status.perPlayerDefault));
        }
        throw new ConfigException("Unknown status.battleMode: " + status.battleMode);
    }
}
