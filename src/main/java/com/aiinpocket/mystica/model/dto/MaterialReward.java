package com.aiinpocket.mystica.model.dto;

public record MaterialReward(
        String materialId,
        String name,
        String styleId,
        String styleName
) {}
