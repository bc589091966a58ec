package org.bitconverter.parser;

import org.bitconverter.exceptions.DefinitionLoadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DefinitionLoaderTest {

    @TempDir
    Path tempDir;

    private final DefinitionLoader loader = new DefinitionLoader();

    @Test
    @DisplayName("UTF-8 文件应原样读取，并去掉 BOM")
    void testUtf8WithBom() throws IOException {
        Path file = tempDir.resolve("parity.afd");
        Files.writeString(file, "\uFEFFstates: início fim\n", StandardCharsets.UTF_8);

        String text = loader.load(file);

        assertEquals("states: início fim\n", text);
    }

    @Test
    @DisplayName("非 UTF-8 文件应回退到单字节字符集")
    void testFallbackToSingleByteCharset() throws IOException {
        Path file = tempDir.resolve("latin.afd");
        Files.write(file, "states: início\n".getBytes(StandardCharsets.ISO_8859_1));

        assertEquals("states: início\n", loader.load(file));
    }

    @Test
    @DisplayName("自定义字符集全部失败时以最后一个字符集替换解码")
    void testReplacementWhenNoCharsetFits() throws IOException {
        Path file = tempDir.resolve("bad.afd");
        Files.write(file, new byte[]{'q', '0', (byte) 0xFF});

        String text = new DefinitionLoader(List.of(StandardCharsets.US_ASCII)).load(file);

        assertTrue(text.startsWith("q0"));
        assertEquals(3, text.length());
    }

    @Test
    @DisplayName("不存在的文件应抛出 DefinitionLoadException")
    void testMissingFile() {
        Path missing = tempDir.resolve("missing.afd");

        DefinitionLoadException e = assertThrows(DefinitionLoadException.class, () -> loader.load(missing));
        assertEquals(missing, e.getPath());
    }

    @Test
    @DisplayName("字符集列表不能为空")
    void testEmptyCharsetList() {
        assertThrows(IllegalArgumentException.class, () -> new DefinitionLoader(List.of()));
    }
}
