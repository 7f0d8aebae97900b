package com.critter.coordination;

/**
 * Key layout shared by every worker.
 */
public final class CoordinationKeys {

    private static final String PREFIX = "critter:";

    private CoordinationKeys() {
    }

    public static String chatSpawnCooldown(Long chatId) {
        return PREFIX + "cooldown:spawn:" + chatId;
    }

    public static String userClaimCooldown(Long userId) {
        return PREFIX + "cooldown:claim:" + userId;
    }

    public static String spawnLock(String spawnId) {
        return PREFIX + "lock:spawn:" + spawnId;
    }

    public static String battleLock(String battleId) {
        return PREFIX + "lock:battle:" + battleId;
    }

    public static String trainerBattleStartLock(Long trainerId) {
        return PREFIX + "lock:battle-start:" + trainerId;
    }

    public static String tradeLock(String tradeId) {
        return PREFIX + "lock:trade:" + tradeId;
    }
}
