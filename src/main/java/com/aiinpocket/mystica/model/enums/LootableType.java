package com.aiinpocket.mystica.model.enums;

/**
 * 掉落表項目類型：材料或裝備類型。
 */
public enum LootableType {
    MATERIAL,
    ITEM_TYPE
}
