package com.phillippitts.saleshud.domain;

public enum Emotion {
    NEUTRAL, EXCITED, CONFUSED, CONCERNED
}
