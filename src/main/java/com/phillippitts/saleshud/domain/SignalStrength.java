package com.phillippitts.saleshud.domain;

public enum SignalStrength {
    STRONG, MODERATE, WEAK
}
