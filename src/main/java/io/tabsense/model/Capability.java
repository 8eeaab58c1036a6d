package io.tabsense.model;

public enum Capability {
    WEB_ANALYSIS("webAnalysis"),
    AUTOMATION("automation"),
    AI_INTERACTION("aiInteraction"),
    PERFORMANCE("performance"),
    SECURITY("security"),
    ACCESSIBILITY("accessibility"),
    LEARNING("learning"),
    PREDICTION("prediction"),
    PERSONALIZATION("personalization"),
    COLLABORATION("collaboration");

    private final String wireName;

    Capability(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Capability fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Capability cannot be empty");
        }
        String value = raw.trim();
        for (Capability capability : values()) {
            if (capability.name().equalsIgnoreCase(value)
                    || capability.wireName.equalsIgnoreCase(value)
                    || capability.name().replace("_", "").equalsIgnoreCase(value.replace("-", "").replace("_", ""))) {
                return capability;
            }
        }
        throw new IllegalArgumentException("Unknown capability: " + raw);
    }
}
