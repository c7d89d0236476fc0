package com.czesl.vert.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

final class MetaFilesTest {

    @Test
    void groupsDirectoryByBaseName() throws Exception {
        Path dir = Files.createTempDirectory("czesl-meta");
        writeSet(dir, "zeta");
        writeSet(dir, "alpha");
        Files.writeString(dir.resolve("notes.txt"), "ignored");

        List<MetaFile> metaFiles = MetaFiles.fromDirectory(dir);

        assertEquals(2, metaFiles.size());
        assertEquals("alpha", metaFiles.get(0).getName());
        assertEquals("zeta", metaFiles.get(1).getName());
        assertEquals(dir.resolve("alpha.w.xml"), metaFiles.get(0).getWFile());
        assertEquals(dir.resolve("alpha.a.xml"), metaFiles.get(0).getAFile());
        assertEquals(dir.resolve("alpha.b.xml"), metaFiles.get(0).getBFile());
    }

    @Test
    void missingLayerFileIsReported() throws Exception {
        Path dir = Files.createTempDirectory("czesl-meta");
        Files.writeString(dir.resolve("essay.w.xml"), "<wdata/>");
        Files.writeString(dir.resolve("essay.b.xml"), "<bdata/>");

        NoSuchFileException ex =
                assertThrows(NoSuchFileException.class, () -> MetaFiles.fromDirectory(dir));
        assertEquals("essay.a.xml", ex.getFile());
    }

    @Test
    void explicitFilesAreDeduplicated() throws Exception {
        Path dir = Files.createTempDirectory("czesl-meta");
        writeSet(dir, "essay");

        List<MetaFile> metaFiles =
                MetaFiles.fromFiles(
                        List.of(
                                dir.resolve("essay.w.xml"),
                                dir.resolve("essay.a.xml"),
                                dir.resolve("essay.b.xml"),
                                dir.resolve("essay.w.xml")));

        assertEquals(1, metaFiles.size());
        assertTrue(metaFiles.get(0).getBFile().isAbsolute());
    }

    @Test
    void readsAllThreeLayers() throws Exception {
        Path dir = Files.createTempDirectory("czesl-meta");
        writeSet(dir, "essay");

        MetaXml metaXml = MetaFiles.read(MetaFiles.fromDirectory(dir).get(0));

        assertEquals("essay", metaXml.getName());
        assertEquals("<wdata>čeština</wdata>", metaXml.getWXml());
        assertEquals("<adata/>", metaXml.getAXml());
        assertEquals("<bdata/>", metaXml.getBXml());
    }

    @Test
    void baseNameStopsAtFirstDot() {
        assertEquals("essay", MetaFiles.baseName(Path.of("/tmp/essay.w.xml")));
        assertEquals("plain", MetaFiles.baseName(Path.of("plain")));
    }

    private static void writeSet(Path dir, String base) throws Exception {
        Files.writeString(
                dir.resolve(base + ".w.xml"), "<wdata>čeština</wdata>", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve(base + ".a.xml"), "<adata/>", StandardCharsets.UTF_8);
        Files.writeString(dir.resolve(base + ".b.xml"), "<bdata/>", StandardCharsets.UTF_8);
    }
}
