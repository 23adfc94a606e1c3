package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.PlayerWeapon;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface PlayerWeaponRepository extends JpaRepository<PlayerWeapon, Long> {

    Optional<PlayerWeapon> findByPlayerId(String playerId);
}
