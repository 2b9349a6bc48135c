package io.debugtoolbar.core.encoding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Class-loading probe for codec libraries that may be missing from the runtime classpath. */
final class OptionalLibraries {

    private static final Logger LOG = LoggerFactory.getLogger(OptionalLibraries.class);

    private OptionalLibraries() {
        // utility class
    }

    /**
     * Loads and initializes {@code className}. Missing classes and native libraries that fail to
     * link both count as "not loadable".
     */
    static boolean isLoadable(String className) {
        try {
            Class.forName(className, true, OptionalLibraries.class.getClassLoader());
            return true;
        } catch (ClassNotFoundException e) {
            LOG.debug("Optional codec library not on classpath: {}", className);
            return false;
        } catch (LinkageError e) {
            LOG.debug("Optional codec library failed to load: {} ({})", className, e.toString());
            return false;
        }
    }
}
