package cn.bitsleep.sysdocs.domain;

/**
 * Board column of a document. Any status may move to any other.
 */
public enum DocumentStatus {
    TODO,
    IN_PROGRESS,
    DONE;

    public static DocumentStatus fromName(String name) {
        for (var v : values()) if (v.name().equals(name)) return v;
        throw new IllegalArgumentException("Unknown status: " + name);
    }
}
