package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.ItemType;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ItemTypeRepository extends JpaRepository<ItemType, String> {
}
