package uast.normalizer;

import org.junit.jupiter.api.BeforeAll;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Base class for normalizer tests that configures JUL logging from system properties.
/// It also points `uast.test.resources` at the test resources unless the build already did.
public class NormalizerLoggingConfig {

    @BeforeAll
    static void enableJulDebug() {
        final var log = Logger.getLogger(NormalizerLoggingConfig.class.getName());
        final var root = Logger.getLogger("");
        final var levelProp = System.getProperty("java.util.logging.ConsoleHandler.level");

        Level targetLevel = Level.INFO;
        if (levelProp != null) {
            try {
                targetLevel = Level.parse(levelProp.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException ex) {
                log.warning(() -> "Unrecognized logging level from 'java.util.logging.ConsoleHandler.level': " + levelProp);
            }
        }

        if (root.getLevel() == null || root.getLevel().intValue() > targetLevel.intValue()) {
            root.setLevel(targetLevel);
        }
        for (Handler handler : root.getHandlers()) {
            final var handlerLevel = handler.getLevel();
            if (handlerLevel == null || handlerLevel.intValue() > targetLevel.intValue()) {
                handler.setLevel(targetLevel);
            }
        }

        final var prop = System.getProperty("uast.test.resources");
        if (prop == null || prop.isBlank()) {
            Path base = Paths.get("src", "test", "resources").toAbsolutePath();
            System.setProperty("uast.test.resources", base.toString());
            log.config(() -> "uast.test.resources set to " + base);
        }
    }
}
