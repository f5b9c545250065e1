package com.wpanther.greengoods.dto.ai;

public enum TaskType {
    PLANTING,
    WEEDING,
    MAINTENANCE,
    HARVESTING,
    OTHER;

    public String label() {
        return name().toLowerCase();
    }
}
