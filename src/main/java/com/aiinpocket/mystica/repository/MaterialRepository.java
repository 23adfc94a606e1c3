package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.Material;
import org.springframework.data.jpa.repository.JpaRepository;

public interface MaterialRepository extends JpaRepository<Material, String> {
}
