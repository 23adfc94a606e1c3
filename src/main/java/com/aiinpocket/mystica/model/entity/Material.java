package com.aiinpocket.mystica.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "material")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Material {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    /** 固定風格；null 表示繼承敵人風格 */
    @Column(name = "style_id", length = 32)
    private String styleId;
}
