package uast.normalizer;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import uast.nodes.Node;
import uast.nodes.NodeJson;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

/// Runs every `golden/<name>.native.json` through the C# normalizer and compares the result with
/// `golden/<name>.expected.json`.
class NormalizerGoldenFilesTest extends NormalizerLoggingConfig {

    private static final Logger LOG = Logger.getLogger(NormalizerGoldenFilesTest.class.getName());

    private static final String NATIVE_SUFFIX = ".native.json";
    private static final String EXPECTED_SUFFIX = ".expected.json";

    @ParameterizedTest(name = "{0}")
    @MethodSource("inputs")
    void goldenFiles(String testName) throws IOException {
        LOG.info(() -> "TEST: goldenFiles testName=" + testName);

        final var dir = goldenDir();
        final Node source = parseFile(dir.resolve(testName + NATIVE_SUFFIX));
        final Node expected = parseFile(dir.resolve(testName + EXPECTED_SUFFIX));

        final var actual = Normalizer.csharp().transform(source);

        assertThat(actual)
                .as(() -> "normalized " + testName + ":\n" + NodeJson.toDisplayString(actual, 2))
                .isEqualTo(expected);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("inputs")
    void goldenFiles_normalizedTreeIsStable(String testName) throws IOException {
        LOG.info(() -> "TEST: goldenFiles_normalizedTreeIsStable testName=" + testName);

        final Node expected = parseFile(goldenDir().resolve(testName + EXPECTED_SUFFIX));

        assertThat(Normalizer.csharp().transform(expected)).isEqualTo(expected);
    }

    static Stream<String> inputs() throws IOException {
        try (var stream = Files.list(goldenDir())) {
            return stream
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(NATIVE_SUFFIX))
                    .map(name -> name.substring(0, name.length() - NATIVE_SUFFIX.length()))
                    .sorted()
                    .toList()
                    .stream();
        }
    }

    private static Path goldenDir() {
        final var prop = System.getProperty("uast.test.resources");
        final var base = prop == null || prop.isBlank()
                ? Paths.get("src", "test", "resources").toAbsolutePath()
                : Path.of(prop);
        return base.resolve("golden");
    }

    private static Node parseFile(Path path) throws IOException {
        return NodeJson.parse(Files.readString(path));
    }
}
