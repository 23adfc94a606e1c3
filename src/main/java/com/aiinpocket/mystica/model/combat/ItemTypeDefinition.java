package com.aiinpocket.mystica.model.combat;

public record ItemTypeDefinition(
        String id,
        String name,
        String category
) {}
