package cn.bitsleep.sysdocs.domain;

public enum DocumentPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT;

    public static DocumentPriority fromName(String name) {
        for (var v : values()) if (v.name().equals(name)) return v;
        throw new IllegalArgumentException("Unknown priority: " + name);
    }
}
