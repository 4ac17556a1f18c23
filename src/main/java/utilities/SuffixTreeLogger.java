package utilities;

import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

/**
 * Static front for the library's java.util.logging logger.
 *
 * <p>System properties read once at class load:
 * <ul>
 *   <li>{@code suffixtree.log.level}: any {@link Level} name, default {@code INFO}</li>
 *   <li>{@code suffixtree.log.file}: when set, records are also appended to this file</li>
 * </ul>
 */
public final class SuffixTreeLogger {

    public static final String LEVEL_PROPERTY = "suffixtree.log.level";
    public static final String FILE_PROPERTY = "suffixtree.log.file";

    private static final Logger logger = Logger.getLogger(SuffixTreeLogger.class.getName());

    static {
        Level level = parseLevel(System.getProperty(LEVEL_PROPERTY));
        logger.setUseParentHandlers(false);

        ConsoleHandler consoleHandler = new ConsoleHandler();
        consoleHandler.setLevel(level);
        consoleHandler.setFormatter(new SimpleFormatter());
        logger.addHandler(consoleHandler);

        String file = System.getProperty(FILE_PROPERTY);
        if (file != null && !file.isBlank()) {
            try {
                FileHandler fileHandler = new FileHandler(file, true); // append mode
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                logger.addHandler(fileHandler);
            } catch (Exception e) {
                System.err.println("Failed to open log file " + file + ": " + e.getMessage());
            }
        }

        logger.setLevel(level);
    }

    private SuffixTreeLogger() {
    }

    static Level parseLevel(String value) {
        if (value == null || value.isBlank()) {
            return Level.INFO;
        }
        try {
            return Level.parse(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            System.err.println("Unknown log level '" + value + "', falling back to INFO");
            return Level.INFO;
        }
    }

    public static boolean isDebugEnabled() {
        return logger.isLoggable(Level.FINE);
    }

    public static boolean isTraceEnabled() {
        return logger.isLoggable(Level.FINEST);
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warning(String msg) {
        logger.warning(msg);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void error(String msg, Throwable cause) {
        logger.log(Level.SEVERE, msg, cause);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }

    public static void trace(String msg) {
        logger.finest(msg);
    }
}
