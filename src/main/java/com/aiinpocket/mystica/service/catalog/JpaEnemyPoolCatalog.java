package com.aiinpocket.mystica.service.catalog;

import com.aiinpocket.mystica.model.combat.EnemyPoolMember;
import com.aiinpocket.mystica.repository.EnemyPoolMemberRepository;
import com.aiinpocket.mystica.repository.EnemyPoolRepository;
import com.aiinpocket.mystica.service.gateway.EnemyPoolCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaEnemyPoolCatalog implements EnemyPoolCatalog {

    private final EnemyPoolRepository poolRepo;
    private final EnemyPoolMemberRepository memberRepo;

    @Override
    public List<String> findEligiblePoolIds(String locationId, int combatLevel) {
        return poolRepo.findEligibleIds(locationId, combatLevel);
    }

    @Override
    public List<EnemyPoolMember> findMembers(Collection<String> poolIds) {
        if (poolIds.isEmpty()) return List.of();
        return memberRepo.findByPoolIds(poolIds).stream()
                .map(m -> new EnemyPoolMember(m.getPool().getId(), m.getEnemyType().getId(), m.getSpawnWeight()))
                .toList();
    }
}
