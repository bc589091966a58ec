package org.bitconverter.exceptions;

import lombok.Getter;

import java.nio.file.Path;

/**
 * 定义文件无法读取。
 */
@Getter
public class DefinitionLoadException extends AutomatonException {

    private final Path path;

    public DefinitionLoadException(Path path, String reason, Throwable cause) {
        super(0, "cannot read definition file " + path + ": " + reason, cause);
        this.path = path;
    }
}
