package sh.erebus.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-topic scope carried in a grant.
 * <p>
 * {@link #HUH} is the decoy "curiosity" scope: such sockets never see real
 * traffic and get a fixed informational payload instead.
 * </p>
 */
public enum Access {
    READ("read"),
    WRITE("write"),
    READ_WRITE("read-write"),
    HUH("huh?");

    private final String wireName;

    Access(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean canRead() {
        return this == READ || this == READ_WRITE;
    }

    public boolean canWrite() {
        return this == WRITE || this == READ_WRITE;
    }

    @JsonCreator
    public static Access fromWireName(String value) {
        for (Access access : values()) {
            if (access.wireName.equals(value)) {
                return access;
            }
        }
        throw new IllegalArgumentException("Unknown access scope: " + value);
    }
}
