package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.MaterialStack;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface MaterialStackRepository extends JpaRepository<MaterialStack, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM MaterialStack s WHERE s.playerId = :playerId " +
            "AND s.materialId = :materialId AND s.styleId = :styleId")
    Optional<MaterialStack> findForUpdate(@Param("playerId") String playerId,
                                          @Param("materialId") String materialId,
                                          @Param("styleId") String styleId);
}
