package utilities;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class AlgoLoggerTest {

    @Test
    void finerLevelsAreOffWithoutALogFile() {
        String logFile = System.getProperty("algo.log.file");
        assumeTrue(logFile == null || logFile.isEmpty());
        assertFalse(AlgoLogger.isDebugEnabled());
        assertFalse(AlgoLogger.isTraceEnabled());
        // Guarded call sites still accept messages when logging is off.
        AlgoLogger.debug("dropped");
        AlgoLogger.trace("dropped");
    }
}
