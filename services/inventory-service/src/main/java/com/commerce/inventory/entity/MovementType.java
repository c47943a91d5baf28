package com.commerce.inventory.entity;

public enum MovementType {
    RESERVED,
    RELEASED,
    COMMITTED,
    ADJUSTED
}
