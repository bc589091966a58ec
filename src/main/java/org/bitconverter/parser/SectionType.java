package org.bitconverter.parser;

import java.util.Locale;
import java.util.Optional;

/**
 * 自动机定义文件中允许出现的段。
 */
public enum SectionType {

    STATES("states"),
    ALPHABET("alphabet"),
    INITIAL("initial"),
    ACCEPTING("accepting"),
    TRANSITIONS("transitions");

    private final String header;

    SectionType(String header) {
        this.header = header;
    }

    /**
     * 按段头关键字查找段类型，不区分大小写。
     */
    public static Optional<SectionType> fromHeader(String keyword) {
        String normalized = keyword.trim().toLowerCase(Locale.ROOT);
        for (SectionType type : values()) {
            if (type.header.equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return header;
    }
}
