package com.aiinpocket.mystica.model.combat;

/**
 * 遭遇池成員；spawnWeight 必須為正數。
 */
public record EnemyPoolMember(
        String poolId,
        String enemyTypeId,
        double spawnWeight
) {}
