package json.validator.cli;

import java.util.Locale;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Applies `-Djava.util.logging.ConsoleHandler.level=FINE` (or any other level)
/// to the root logger and its handlers so diagnostics can be switched on from
/// the command line. Without the property nothing is changed.
final class CliLogging {

    static final String LEVEL_PROPERTY = "java.util.logging.ConsoleHandler.level";

    private CliLogging() {
    }

    static void configure() {
        final String levelProp = System.getProperty(LEVEL_PROPERTY);
        if (levelProp == null || levelProp.isBlank()) {
            return;
        }
        final var log = Logger.getLogger(CliLogging.class.getName());
        final Level targetLevel;
        try {
            targetLevel = Level.parse(levelProp.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            log.warning(() -> "Unrecognized logging level from '" + LEVEL_PROPERTY + "': " + levelProp);
            return;
        }
        final Logger root = Logger.getLogger("");
        if (root.getLevel() == null || root.getLevel().intValue() > targetLevel.intValue()) {
            root.setLevel(targetLevel);
        }
        for (Handler handler : root.getHandlers()) {
            final Level handlerLevel = handler.getLevel();
            if (handlerLevel == null || handlerLevel.intValue() > targetLevel.intValue()) {
                handler.setLevel(targetLevel);
            }
        }
        log.config(() -> "Logging level set to " + targetLevel);
    }
}
