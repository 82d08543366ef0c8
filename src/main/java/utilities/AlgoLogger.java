package utilities;

import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public class AlgoLogger {
    private static Logger logger;

    static {
        try {
            logger = Logger.getLogger(AlgoLogger.class.getName());
            logger.setUseParentHandlers(false); // Disable default console handler

            ConsoleHandler consoleHandler = new ConsoleHandler();
            consoleHandler.setLevel(Level.INFO);
            logger.addHandler(consoleHandler);

            // Kernels only log at debug/trace, so a file is attached on request and
            // finer records are only produced while it is.
            String logFile = System.getProperty("algo.log.file");
            if (logFile != null && !logFile.isEmpty()) {
                FileHandler fileHandler = new FileHandler(logFile, true); // true = append mode
                fileHandler.setLevel(Level.ALL);
                fileHandler.setFormatter(new SimpleFormatter());
                logger.addHandler(fileHandler);
                logger.setLevel(Level.ALL);
            } else {
                logger.setLevel(Level.INFO);
            }

        } catch (Exception e) {
            System.err.println("Failed to initialize logger: " + e.getMessage());
        }
    }

    private AlgoLogger() {
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

    public static void debug(String msg) {
        logger.fine(msg);
    }

    public static void trace(String msg) {
        logger.finest(msg);
    }

}
