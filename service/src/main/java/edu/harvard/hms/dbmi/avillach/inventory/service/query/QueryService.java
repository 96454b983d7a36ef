package edu.harvard.hms.dbmi.avillach.inventory.service.query;

import edu.harvard.hms.dbmi.avillach.inventory.data.query.CohortQuery;
import edu.harvard.hms.dbmi.avillach.inventory.data.query.CohortResult;
import edu.harvard.hms.dbmi.avillach.inventory.processing.query.CompiledQuery;
import edu.harvard.hms.dbmi.avillach.inventory.processing.query.QueryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs cohort queries and keeps a cancellation flag for each query while it is being evaluated.
 */
@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    private final QueryEngine queryEngine;

    private final ConcurrentHashMap<UUID, AtomicBoolean> running = new ConcurrentHashMap<>();

    @Autowired
    public QueryService(QueryEngine queryEngine) {
        this.queryEngine = queryEngine;
    }

    public CohortResult runQuery(CohortQuery query) {
        CompiledQuery compiled = queryEngine.compile(query);
        UUID queryId = compiled.query().id();
        AtomicBoolean cancelled = new AtomicBoolean();
        if (running.putIfAbsent(queryId, cancelled) != null) {
            throw new IllegalStateException("Query " + queryId + " is already running");
        }
        try {
            return queryEngine.evaluate(compiled, cancelled::get);
        } finally {
            running.remove(queryId);
        }
    }

    /**
     * @return false if no query with this id is running
     */
    public boolean cancel(UUID queryId) {
        AtomicBoolean cancelled = running.get(queryId);
        if (cancelled == null) {
            return false;
        }
        log.info("Cancelling query {}", queryId);
        cancelled.set(true);
        return true;
    }

    boolean isRunning(UUID queryId) {
        return running.containsKey(queryId);
    }
}
