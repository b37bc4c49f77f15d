package com.stratumduck.sampling;

import com.stratumduck.backend.DataBackend;
import com.stratumduck.backend.RelationName;
import com.stratumduck.exception.BackendException;
import com.stratumduck.logging.SamplingLogger;
import com.stratumduck.logical.LogicalPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.UUID;

/**
 * Intermediate relations owned by one sampling invocation.
 *
 * <p>Every staging relation and helper column name embeds a token that is
 * fresh per invocation, so concurrent invocations never share intermediate
 * state and helper columns never collide with source columns. Closing the
 * area drops every staging relation it created, in reverse order.
 *
 * <pre>
 *   try (StagingArea staging = new StagingArea(backend, source, "__strat_")) {
 *       RelationName labeled = staging.materialize("labeled", plan);
 *       ...
 *   } // staging relations dropped here
 * </pre>
 */
public class StagingArea implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(StagingArea.class);

    private final DataBackend backend;
    private final RelationName anchor;
    private final String prefix;
    private final String token;
    private final Deque<RelationName> created = new ArrayDeque<>();
    private boolean closed;
    private boolean outputCreated;

    /**
     * Opens a staging area.
     *
     * @param backend the backend to materialize into
     * @param anchor relation whose schema holds the staging relations
     * @param prefix prefix of every staging name
     */
    public StagingArea(DataBackend backend, RelationName anchor, String prefix) {
        this.backend = Objects.requireNonNull(backend, "backend must not be null");
        this.anchor = Objects.requireNonNull(anchor, "anchor must not be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix must not be null");
        this.token = UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public DataBackend backend() {
        return backend;
    }

    public String token() {
        return token;
    }

    /**
     * Returns a helper column name unique to this invocation, e.g.
     * {@code __strat_label_1a2b3c4d5e6f}.
     */
    public String column(String role) {
        return prefix + role + "_" + token;
    }

    /**
     * Returns the name of a staging relation for a stage, e.g.
     * {@code main.__strat_1a2b3c4d5e6f_labeled}.
     */
    public RelationName relation(String stage) {
        return anchor.sibling(prefix + token + "_" + stage);
    }

    /**
     * Materializes a staging relation. It is registered before creation, so a
     * partially created relation is dropped on close as well.
     *
     * @param stage stage name, used in the relation name and in logs
     * @param plan the bulk operation
     * @return the staging relation
     */
    public RelationName materialize(String stage, LogicalPlan plan) {
        ensureOpen();
        RelationName name = relation(stage);
        created.push(name);
        run(stage, name, plan);
        return name;
    }

    /**
     * Materializes the final output relation. The output is not owned by the
     * staging area and survives {@link #close()}.
     */
    public void materializeOutput(String stage, RelationName output, LogicalPlan plan) {
        ensureOpen();
        run(stage, output, plan);
        outputCreated = true;
    }

    /**
     * Returns whether {@link #materializeOutput} created the output relation.
     * A relation of the same name made by anyone else is never reported.
     */
    public boolean outputCreated() {
        return outputCreated;
    }

    private void run(String stage, RelationName name, LogicalPlan plan) {
        SamplingLogger.enterStage(stage);
        long start = System.nanoTime();
        backend.createRelation(name, plan);
        SamplingLogger.logStage(stage, (System.nanoTime() - start) / 1_000_000);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Staging area " + token + " is closed");
        }
    }

    /**
     * Drops every staging relation. All drops are attempted; the first
     * failure is rethrown with later ones suppressed.
     *
     * @throws BackendException if a staging relation could not be dropped
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        BackendException failure = null;
        while (!created.isEmpty()) {
            RelationName name = created.pop();
            try {
                backend.dropRelation(name);
            } catch (BackendException e) {
                logger.error("Failed to drop staging relation {}", name, e);
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        logger.debug("Staging area {} cleaned up", token);
    }
}
