package com.phillippitts.saleshud.domain;

public enum Sentiment {
    POSITIVE, NEUTRAL, NEGATIVE
}
