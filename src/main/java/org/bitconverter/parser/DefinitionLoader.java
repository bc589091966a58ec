package org.bitconverter.parser;

import org.bitconverter.exceptions.DefinitionLoadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * 从文件读取自动机定义文本。
 * 依次尝试配置的字符集，遇到无法解码的字节时换下一个；全部失败时用最后一个字符集替换解码。
 */
public class DefinitionLoader {

    private static final Logger logger = LoggerFactory.getLogger(DefinitionLoader.class);

    public static final List<Charset> DEFAULT_CHARSETS = List.of(
            StandardCharsets.UTF_8,
            Charset.forName("windows-1252"),
            StandardCharsets.ISO_8859_1);

    private static final char BOM = '\uFEFF';

    private final List<Charset> charsets;

    public DefinitionLoader() {
        this(DEFAULT_CHARSETS);
    }

    /**
     * @param charsets 按优先级排列的字符集，不能为空。
     */
    public DefinitionLoader(List<Charset> charsets) {
        Objects.requireNonNull(charsets, "Charsets list cannot be null.");
        if (charsets.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个字符集");
        }
        this.charsets = List.copyOf(charsets);
    }

    /**
     * 读取文件内容。
     *
     * @param path 定义文件路径。
     * @return 解码后的文本，已去掉开头的 BOM。
     * @throws DefinitionLoadException 如果文件不存在或无法读取。
     */
    public String load(Path path) {
        Objects.requireNonNull(path, "Path cannot be null.");
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            logger.error("定义文件不存在: {}", path);
            throw new DefinitionLoadException(path, "file not found", e);
        } catch (IOException e) {
            logger.error("读取定义文件 {} 失败: {}", path, e.getMessage());
            throw new DefinitionLoadException(path, e.getMessage(), e);
        }

        for (Charset charset : charsets) {
            try {
                String text = charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
                logger.info("以 {} 读取定义文件 {} ({} 字节)", charset, path, bytes.length);
                return stripBom(text);
            } catch (CharacterCodingException e) {
                logger.warn("定义文件 {} 不是有效的 {} 文本，尝试下一个字符集", path, charset);
            }
        }

        Charset last = charsets.get(charsets.size() - 1);
        logger.warn("所有字符集都无法完整解码 {}，以 {} 替换非法字节", path, last);
        return stripBom(new String(bytes, last));
    }

    private static String stripBom(String text) {
        return !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;
    }
}
