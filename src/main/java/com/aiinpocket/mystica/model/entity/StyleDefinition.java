package com.aiinpocket.mystica.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 外觀風格（normal、pixel_art、watercolor 等）。
 */
@Entity
@Table(name = "style_definition")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StyleDefinition {

    @Id
    @Column(length = 32)
    private String id;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;
}
