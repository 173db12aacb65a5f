package org.pivotspec.dates;

import java.util.Optional;

/**
 * Operators of a custom (non-preset) date filter.
 */
public enum CustomRangeOp {
    AFTER("after"),
    BEFORE("before"),
    BETWEEN("between");

    private final String id;

    CustomRangeOp(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<CustomRangeOp> fromId(String id) {
        for (CustomRangeOp op : values()) {
            if (op.id.equals(id)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
