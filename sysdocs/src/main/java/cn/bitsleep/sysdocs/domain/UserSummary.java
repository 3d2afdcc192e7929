package cn.bitsleep.sysdocs.domain;

/**
 * Read-only projection of the non-secret user columns.
 */
public interface UserSummary {
    Long getId();
    String getName();
    String getEmail();
    Role getRole();
}
