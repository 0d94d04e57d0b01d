package com.phillippitts.saleshud.domain;

public enum ConnectionQuality {
    EXCELLENT, GOOD, FAIR, POOR
}
