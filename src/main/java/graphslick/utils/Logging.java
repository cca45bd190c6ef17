package graphslick.utils;

import java.io.IOException;
import java.io.InputStream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.ConfigurationSource;
import org.apache.logging.log4j.core.config.xml.XmlConfiguration;

/**
 * Static front for the GraphSlick logger. Every line reads {@code [prefix] - msg},
 * where the prefix names the component that logged it.
 */
public class Logging {

    private static final String DEFAULT_LOGGER_NAME = "GraphSlick";
    private static final String DEFAULT_CONFIG_FILE_PATH = "/log4j2_default.xml";

    /** Falls back to whatever log4j finds on its own until {@link #init()} is called */
    private static Logger defaultLogger = LogManager.getLogger(DEFAULT_LOGGER_NAME);

    /**
     * Load {@code log4j2_default.xml} from the classpath and switch the logger over to it.
     * @return false if the configuration could not be found or read
     */
    public static boolean init() {
        try (InputStream in = Logging.class.getResourceAsStream(DEFAULT_CONFIG_FILE_PATH)) {
            if (in == null) {
                System.out.println("Cannot locate logging config file :" + DEFAULT_CONFIG_FILE_PATH);
                return false;
            }
            Configuration configuration = new XmlConfiguration(new LoggerContext(DEFAULT_LOGGER_NAME),
                    new ConfigurationSource(in));
            LoggerContext context = (LoggerContext) LogManager.getContext(true);
            context.stop();
            context.start(configuration);
            defaultLogger = context.getLogger(DEFAULT_LOGGER_NAME);
        } catch (IOException e) {
            System.out.println("Cannot read logging config file :" + e.getMessage());
            return false;
        }
        return true;
    }

    /**
     * Log a failure that aborts the current operation.
     * @param prefix component name
     * @param msg message text
     */
    public static void error(String prefix, String msg) {
        defaultLogger.error("[{}] - {}", prefix, msg);
    }

    /**
     * Log something recoverable, e.g. a group dropped by sanitization.
     */
    public static void warn(String prefix, String msg) {
        defaultLogger.warn("[{}] - {}", prefix, msg);
    }

    /** Log pipeline progress. */
    public static void info(String prefix, String msg) {
        defaultLogger.info("[{}] - {}", prefix, msg);
    }

    /** Log internal state, shown when the config lowers the level to debug. */
    public static void debug(String prefix, String msg) {
        defaultLogger.debug("[{}] - {}", prefix, msg);
    }

    public static void trace(String prefix, String msg) {
        defaultLogger.trace("[{}] - {}", prefix, msg);
    }
}
