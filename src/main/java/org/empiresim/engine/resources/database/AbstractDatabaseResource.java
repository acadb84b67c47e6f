package org.empiresim.engine.resources.database;

import com.typesafe.config.Config;
import org.empiresim.engine.resources.AbstractResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Base class of JDBC-backed stores: query and error counters plus pool shutdown.
 */
public abstract class AbstractDatabaseResource extends AbstractResource implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AbstractDatabaseResource.class);

    protected final AtomicLong queriesExecuted = new AtomicLong(0);
    protected final AtomicLong rowsWritten = new AtomicLong(0);
    protected final AtomicLong writeErrors = new AtomicLong(0);
    protected final AtomicLong readErrors = new AtomicLong(0);

    protected AbstractDatabaseResource(String name, Config options) {
        super(name, options);
    }

    /**
     * Closes the connection pool. Best effort: failures are recorded, not thrown.
     */
    @Override
    public void close() {
        try {
            closeConnectionPool();
            log.debug("Database '{}' closed", getResourceName());
        } catch (Exception e) {
            log.warn("Failed to close connection pool of database '{}'", getResourceName());
            recordError("POOL_CLOSE_FAILED", "Failed to close connection pool",
                "Database: " + getResourceName() + ", Error: " + e.getMessage());
        }
    }

    protected abstract void closeConnectionPool() throws Exception;

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("queries_executed", queriesExecuted.get());
        metrics.put("rows_written", rowsWritten.get());
        metrics.put("write_errors", writeErrors.get());
        metrics.put("read_errors", readErrors.get());
    }
}
