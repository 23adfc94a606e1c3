package com.aiinpocket.mystica.model.combat;

import com.aiinpocket.mystica.model.enums.CombatAction;
import com.aiinpocket.mystica.model.enums.HitZone;

import java.time.Instant;

/**
 * 單回合戰鬥紀錄（只新增、不修改）。
 * playerHp / enemyHp 為本回合結束後的 HP，session 的當前 HP 由最後一筆紀錄推導。
 *
 * @param damageDealt   攻擊回合造成的傷害（自傷時為玩家承受的傷害）
 * @param selfInflicted 攻擊落在自傷區段
 * @param damageBlocked 防禦回合擋下的傷害（自傷區段為負數，代表放大）
 * @param damageTaken   防禦回合實際承受的傷害
 */
public record CombatLogEntry(
        int turn,
        CombatAction action,
        double tapDegrees,
        HitZone zone,
        int damageDealt,
        boolean selfInflicted,
        int damageBlocked,
        int damageTaken,
        int playerHp,
        int enemyHp,
        Instant timestamp
) {

    public static CombatLogEntry attack(int turn, double tapDegrees, HitZone zone, int damageDealt,
                                        int playerHp, int enemyHp, Instant timestamp) {
        return new CombatLogEntry(turn, CombatAction.ATTACK, tapDegrees, zone, damageDealt,
                zone == HitZone.INJURE, 0, 0, playerHp, enemyHp, timestamp);
    }

    public static CombatLogEntry defense(int turn, double tapDegrees, HitZone zone, int damageBlocked,
                                         int damageTaken, int playerHp, int enemyHp, Instant timestamp) {
        return new CombatLogEntry(turn, CombatAction.DEFEND, tapDegrees, zone, 0, false,
                damageBlocked, damageTaken, playerHp, enemyHp, timestamp);
    }
}
