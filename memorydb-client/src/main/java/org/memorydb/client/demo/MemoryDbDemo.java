package org.memorydb.client.demo;

import java.util.Optional;

import org.jboss.logging.Logger;
import org.memorydb.client.MemoryDbClient;
import org.memorydb.client.config.MemoryDbConfig;
import org.memorydb.client.connection.LettuceMemoryDbClient;

/**
 * Connects to the configured cluster, writes, reads, expires and deletes a couple of keys, then disconnects.
 *
 * <p>Configuration comes from {@code memorydb.properties}; any key can be overridden with a
 * {@code -Dmemorydb.<key>=...} system property.</p>
 */
public final class MemoryDbDemo {

    private static final Logger logger = Logger.getLogger(MemoryDbDemo.class);

    static final String TEST_KEY = "test_key";
    static final String TEST_VALUE = "Hello MemoryDB!";
    static final String TEMP_KEY = "temp_key";
    static final String TEMP_VALUE = "temporary data";
    static final long TEMP_TTL_SECONDS = 60;

    private MemoryDbDemo() {
    }

    public static void main(String[] args) {
        run(new LettuceMemoryDbClient(MemoryDbConfig.load()));
    }

    /**
     * Runs the demo sequence and closes {@code client} on every path.
     *
     * @return {@code false} if the client could not connect
     */
    static boolean run(MemoryDbClient client) {
        try {
            if (!client.connect()) {
                logger.error("Failed to connect to the MemoryDB cluster");
                return false;
            }

            if (client.setValue(TEST_KEY, TEST_VALUE)) {
                logger.info("Data write complete");
            }

            Optional<String> value = client.getValue(TEST_KEY);
            logger.infof("Value of %s: %s", TEST_KEY, value.orElse(null));

            if (client.setValue(TEMP_KEY, TEMP_VALUE, TEMP_TTL_SECONDS)) {
                logger.infof("Stored temporary data expiring in %d seconds", TEMP_TTL_SECONDS);
            }

            if (client.deleteKey(TEST_KEY)) {
                logger.infof("%s deleted", TEST_KEY);
            }
            return true;
        } finally {
            client.close();
        }
    }
}
