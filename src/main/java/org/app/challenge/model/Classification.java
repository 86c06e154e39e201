package org.app.challenge.model;

public enum Classification {
    UNCLASSIFIED,
    LEGITIMATE,
    SUSPECT
}
