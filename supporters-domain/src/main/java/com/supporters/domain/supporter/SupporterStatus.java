package com.supporters.domain.supporter;

public enum SupporterStatus {
    NEW("New"),
    ACTIVE("Active"),
    LAPSED("Lapsed"),
    LOST("Lost");

    private final String displayName;

    SupporterStatus(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
