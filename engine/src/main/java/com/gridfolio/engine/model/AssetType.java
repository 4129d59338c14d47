package com.gridfolio.engine.model;

public enum AssetType {
    WIND,
    SOLAR
}
