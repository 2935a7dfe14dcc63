package com.spring.fateweaver.engine.fate;

public record FateResolution(FateRoll roll, FateEngineState nextState) {}
