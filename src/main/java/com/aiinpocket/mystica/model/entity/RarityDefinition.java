package com.aiinpocket.mystica.model.entity;

import com.aiinpocket.mystica.model.enums.Rarity;
import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "rarity_definition")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RarityDefinition {

    @Id
    @Enumerated(EnumType.STRING)
    @Column(length = 15)
    private Rarity rarity;

    /** 基礎掉率（相對權重） */
    @Column(name = "base_drop_rate", nullable = false)
    private Double baseDropRate;
}
