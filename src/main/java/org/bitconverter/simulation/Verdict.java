package org.bitconverter.simulation;

/**
 * 一次运行的结论。
 * {@link #STUCK} 不是错误：它表示不完备的自动机在某个前缀上无法给出回答。
 */
public enum Verdict {

    ACCEPTED("Accepted"),
    REJECTED("Rejected"),
    STUCK("Stuck");

    private final String displayName;

    Verdict(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
