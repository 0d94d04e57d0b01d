package com.phillippitts.saleshud.domain;

public enum InsightType {
    KEY_INSIGHT, BUYING_SIGNAL, OBJECTION, NEXT_ACTION, RISK, COACHING
}
