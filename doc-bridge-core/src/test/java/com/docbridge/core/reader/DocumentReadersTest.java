package com.docbridge.core.reader;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DocumentReaders}.
 */
class DocumentReadersTest {

    @Test
    void forPath_knownExtensions_selectReader() {
        assertThat(DocumentReaders.forPath(Path.of("guide.xml"))).isInstanceOf(DocutilsXmlReader.class);
        assertThat(DocumentReaders.forPath(Path.of("dir/API.JSON"))).isInstanceOf(JsonTreeReader.class);
    }

    @Test
    void forPath_unsupportedExtension_listsSupportedOnes() {
        assertThatThrownBy(() -> DocumentReaders.forPath(Path.of("guide.rst")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("json, xml");
    }

    @Test
    void all_returnsBuiltInReaders() {
        assertThat(DocumentReaders.all()).extracting(DocumentReader::getId)
            .containsExactly("docutils-xml", "json-tree");
    }
}
