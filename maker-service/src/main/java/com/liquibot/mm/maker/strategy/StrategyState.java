package com.liquibot.mm.maker.strategy;

public enum StrategyState {
    IDLE,
    RUNNING,
    WINDING_DOWN,
    DONE,
}
