package utilities;

import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class SelectionLogger {

    // Set to an empty string to keep the log on the console only.
    public static final String LOG_FILE_PROPERTY = "selection.log.file";
    private static final String DEFAULT_LOG_FILE = "selection-benchmark.log";

    private static final Logger logger = Logger.getLogger(SelectionLogger.class.getName());
    private static final ConsoleHandler consoleHandler = new ConsoleHandler();

    static {
        logger.setUseParentHandlers(false); // Disable default console handler

        consoleHandler.setLevel(Level.INFO);
        logger.addHandler(consoleHandler);

        String logFile = System.getProperty(LOG_FILE_PROPERTY, DEFAULT_LOG_FILE);
        if (!logFile.isBlank()) {
            try {
                FileHandler fileHandler = new FileHandler(logFile, true); // true = append mode
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                logger.addHandler(fileHandler);
            } catch (Exception e) {
                System.err.println("Failed to open log file " + logFile + ": " + e.getMessage());
            }
        }

        // FINEST traces every selection call; see setLevel.
        logger.setLevel(Level.FINE);
    }

    private SelectionLogger() {
    }

    public static void info(String msg) {
        logger.info(msg);
    }

    public static void warning(String msg) {
        logger.warning(msg);
    }

    public static void warning(String msg, Throwable cause) {
        logger.log(Level.WARNING, msg, cause);
    }

    public static void error(String msg) {
        logger.severe(msg);
    }

    public static void debug(String msg) {
        logger.fine(msg);
    }

    public static void trace(String msg) {
        logger.finest(msg);
    }

    // Lets hot loops skip building messages nobody will read.
    public static boolean isTraceEnabled() {
        if (!logger.isLoggable(Level.FINEST)) {
            return false;
        }
        for (Handler handler : logger.getHandlers()) {
            if (handler.getLevel().intValue() <= Level.FINEST.intValue()) {
                return true;
            }
        }
        return false;
    }

    // Applies to the console as well, so --log-level=finest shows the traces.
    public static void setLevel(Level level) {
        logger.setLevel(level);
        consoleHandler.setLevel(level);
    }

    public static Level level() {
        return logger.getLevel();
    }
}
