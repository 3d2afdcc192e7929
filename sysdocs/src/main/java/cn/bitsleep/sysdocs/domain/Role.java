package cn.bitsleep.sysdocs.domain;

public enum Role {
    ADMIN,
    EDITOR,
    USER;

    public static Role fromName(String name) {
        for (var v : values()) if (v.name().equals(name)) return v;
        throw new IllegalArgumentException("Unknown role: " + name);
    }
}
