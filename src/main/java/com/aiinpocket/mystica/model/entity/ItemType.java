package com.aiinpocket.mystica.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "item_type")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ItemType {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    /** 裝備部位分類（weapon、head、armor 等） */
    @Column(nullable = false, length = 30)
    private String category;
}
