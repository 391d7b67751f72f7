package info.isaksson.erland.tracematrix.extract;

import info.isaksson.erland.tracematrix.model.ScannedDocument;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentScannerTest {

    private static Path createDocs() throws Exception {
        Path tmp = Files.createTempDirectory("tm-docs-");
        Path docs = tmp.resolve("docs");
        Files.createDirectories(docs.resolve("a"));
        Files.createDirectories(docs.resolve("b"));
        Files.createDirectories(docs.resolve("templates"));
        Files.createDirectories(docs.resolve("target"));

        Files.writeString(docs.resolve("b/two.md"), "## REQ-F-002: Two\n", StandardCharsets.UTF_8);
        Files.writeString(docs.resolve("a/one.md"), "## REQ-F-001: One\n", StandardCharsets.UTF_8);
        Files.writeString(docs.resolve("top.md"), "## StR-CORE-001: Top\n", StandardCharsets.UTF_8);
        Files.writeString(docs.resolve("templates/tpl.md"), "## REQ-F-999: Placeholder\n", StandardCharsets.UTF_8);
        Files.writeString(docs.resolve("README.md"), "## REQ-F-998: Readme\n", StandardCharsets.UTF_8);
        Files.writeString(docs.resolve("notes.txt"), "## REQ-F-997: Notes\n", StandardCharsets.UTF_8);
        Files.writeString(docs.resolve("target/built.md"), "## REQ-F-996: Built\n", StandardCharsets.UTF_8);
        Files.write(docs.resolve("bad.md"), new byte[] {'#', ' ', (byte) 0xC3, (byte) 0x28, '\n'});
        return docs;
    }

    private static List<String> paths(DocumentScanResult res) {
        return res.documents.stream().map(d -> d.path).collect(Collectors.toList());
    }

    @Test
    void scansInCanonicalOrderAndSkipsIgnoredFiles() throws Exception {
        Path docs = createDocs();
        DocumentScanResult res = new DocumentScanner().scan(List.of(docs), DocumentScanner.DEFAULT_IGNORE_PATTERNS);

        assertEquals(List.of("docs/top.md", "docs/a/one.md", "docs/b/two.md"), paths(res));
        assertEquals(4, res.files.size(), "bad.md is discovered but not parsed");
        assertEquals(1, res.warnings.size(), "warnings: " + res.warnings);
        assertTrue(res.warnings.get(0).contains("docs/bad.md"));
    }

    @Test
    void defaultIgnoresCanBeReplacedAndExtended() throws Exception {
        Path docs = createDocs();
        DocumentScanResult all = new DocumentScanner().scan(List.of(docs), List.of());
        assertTrue(paths(all).contains("docs/templates/tpl.md"));

        DocumentScanResult globbed = new DocumentScanner().scan(List.of(docs), List.of("**/b/*.md"));
        assertFalse(paths(globbed).contains("docs/b/two.md"));
        assertTrue(paths(globbed).contains("docs/a/one.md"));
    }

    @Test
    void missingRootWarnsAndFileRootIsParsedDirectly() throws Exception {
        Path docs = createDocs();
        DocumentScanResult res = new DocumentScanner().scan(
                List.of(docs.resolve("nope"), docs.resolve("top.md")), List.of());
        assertEquals(1, res.documents.size());
        ScannedDocument top = res.documents.get(0);
        assertEquals("docs/top.md", top.path);
        assertEquals(1, res.warnings.size());
        assertTrue(res.warnings.get(0).startsWith("Requirements path not found"));
    }
}
