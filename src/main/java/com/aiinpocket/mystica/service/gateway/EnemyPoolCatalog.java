package com.aiinpocket.mystica.service.gateway;

import com.aiinpocket.mystica.model.combat.EnemyPoolMember;

import java.util.Collection;
import java.util.List;

public interface EnemyPoolCatalog {

    /** 指定地點在該戰鬥等級可用的遭遇池 */
    List<String> findEligiblePoolIds(String locationId, int combatLevel);

    List<EnemyPoolMember> findMembers(Collection<String> poolIds);
}
