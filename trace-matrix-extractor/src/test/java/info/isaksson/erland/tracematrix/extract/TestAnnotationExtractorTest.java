package info.isaksson.erland.tracematrix.extract;

import info.isaksson.erland.tracematrix.model.TestAnnotation;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestAnnotationExtractorTest {

    private static final String CPP = """
            #include <catch2/catch.hpp>
            // @satisfies StR-CORE-001
            // @satisfies REQ-F-002, StR-CORE-001
            TEST_CASE("Sync works", "[sync]") {
            }
            // @satisfies REQ-F-003
            TEST(Clock, Drift) {}
            void helper() {}
            // @satisfies REQ-F-004
            void test_offset_calc(void) {}
            // @satisfies REQ-F-009
            """;

    private final TestAnnotationExtractor extractor = new TestAnnotationExtractor();

    @Test
    void attachesPendingAnnotationsToTheNextDeclaration() {
        List<TestAnnotation> out = extractor.extractFile("tests/test_sync.cpp", "test_sync.cpp", List.of(CPP.split("\n")));
        assertEquals(3, out.size(), "annotations: " + out);

        assertEquals("tests/test_sync.cpp::Sync works::sync", out.get(0).testId);
        assertEquals(List.of("StR-CORE-001", "REQ-F-002"), out.get(0).requirementIds);
        assertEquals("sync", out.get(0).shortName());

        assertEquals("tests/test_sync.cpp::Clock::Drift", out.get(1).testId);
        assertEquals(List.of("REQ-F-003"), out.get(1).requirementIds);

        assertEquals("tests/test_sync.cpp::test_offset_calc", out.get(2).testId);
        assertEquals(List.of("REQ-F-004"), out.get(2).requirementIds);
        assertFalse(out.get(2).fileLevel);
    }

    @Test
    void fileWithoutDeclarationsFallsBackToFileLevelTest() {
        List<TestAnnotation> out = extractor.extractFile("tests/test_offset.sh", "test_offset.sh",
                List.of("# @satisfies REQ-F-001", "run_it", "# @satisfies REQ-F-002"));
        assertEquals(1, out.size());
        assertEquals("tests/test_offset.sh::offset", out.get(0).testId);
        assertEquals(List.of("REQ-F-001", "REQ-F-002"), out.get(0).requirementIds);
        assertTrue(out.get(0).fileLevel);
    }

    @Test
    void recognizesJUnitAndKotlinTestsAfterTheirMarker() {
        List<TestAnnotation> out = extractor.extractFile("tests/ClockTest.java", "ClockTest.java", List.of(
                "class ClockTest {",
                "    // @satisfies REQ-F-001",
                "    @Test",
                "    @DisplayName(\"reads time\")",
                "    void readsTime() {}",
                "    void helper() {}",
                "    // @satisfies REQ-F-002",
                "    @Test public void drifts() {}",
                "    // @satisfies REQ-F-003",
                "    @ParameterizedTest",
                "    fun `handles leap seconds`(s: Int) {}",
                "}"));
        assertEquals(3, out.size(), "annotations: " + out);
        assertEquals("tests/ClockTest.java::readsTime", out.get(0).testId);
        assertEquals("tests/ClockTest.java::drifts", out.get(1).testId);
        assertEquals("tests/ClockTest.java::handles leap seconds", out.get(2).testId);
        assertEquals(List.of("REQ-F-003"), out.get(2).requirementIds);
    }

    @Test
    void recognizesGoRustAndJavaScriptTests() {
        List<TestAnnotation> go = extractor.extractFile("tests/clock_test.go", "clock_test.go", List.of(
                "// @satisfies REQ-F-001", "func TestClockSync(t *testing.T) {", "}"));
        assertEquals("tests/clock_test.go::TestClockSync", go.get(0).testId);
        assertFalse(go.get(0).fileLevel);

        List<TestAnnotation> rust = extractor.extractFile("tests/clock_test.rs", "clock_test.rs", List.of(
                "fn helper() {}",
                "// @satisfies REQ-F-002",
                "#[test]",
                "fn syncs() {}",
                "// @satisfies REQ-F-003",
                "#[tokio::test]",
                "async fn syncs_async() {}"));
        assertEquals(2, rust.size(), "annotations: " + rust);
        assertEquals("tests/clock_test.rs::syncs", rust.get(0).testId);
        assertEquals("tests/clock_test.rs::syncs_async", rust.get(1).testId);

        List<TestAnnotation> js = extractor.extractFile("tests/clock.test.js", "clock.test.js", List.of(
                "describe('clock', () => {",
                "  // @satisfies REQ-F-004",
                "  it('keeps time', () => {});",
                "  // @satisfies REQ-F-005",
                "  test.skip(\"drifts\", () => {});",
                "});"));
        assertEquals(2, js.size(), "annotations: " + js);
        assertEquals("tests/clock.test.js::keeps time", js.get(0).testId);
        assertEquals("tests/clock.test.js::drifts", js.get(1).testId);
    }

    @Test
    void recognizesTestSourceNames() {
        assertTrue(TestAnnotationExtractor.isTestSource("test_bmca.cpp"));
        assertTrue(TestAnnotationExtractor.isTestSource("ClockTest.java"));
        assertTrue(TestAnnotationExtractor.isTestSource("clock_test.go"));
        assertTrue(TestAnnotationExtractor.isTestSource("ServiceTests.kt"));
        assertTrue(TestAnnotationExtractor.isTestSource("clock.test.js"));
        assertTrue(TestAnnotationExtractor.isTestSource("clock.spec.ts"));
        assertFalse(TestAnnotationExtractor.isTestSource("helper.cpp"));
        assertFalse(TestAnnotationExtractor.isTestSource("test_notes.md"));
    }

    @Test
    void extractsFromDirectoryAndWarnsOnMissingRoot() throws Exception {
        Path tmp = Files.createTempDirectory("tm-tests-");
        Path tests = tmp.resolve("tests");
        Files.createDirectories(tests.resolve("unit"));
        Files.writeString(tests.resolve("unit/test_clock.py"), """
                # @satisfies REQ-F-010
                def test_clock_reads_time():
                    assert True
                """, StandardCharsets.UTF_8);
        Files.writeString(tests.resolve("unit/helper.py"), "# @satisfies REQ-F-011\ndef test_x():\n    pass\n",
                StandardCharsets.UTF_8);

        TestAnnotationScanResult res = extractor.extract(List.of(tests, tmp.resolve("missing")), List.of());
        assertEquals(1, res.files.size());
        assertEquals(1, res.annotations.size());
        assertEquals("tests/unit/test_clock.py::test_clock_reads_time", res.annotations.get(0).testId);
        assertEquals(1, res.warnings.size());
    }
}
