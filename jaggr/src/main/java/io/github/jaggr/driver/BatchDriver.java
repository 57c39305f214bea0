package io.github.jaggr.driver;

import io.github.jaggr.executor.AggrExecutor;
import io.github.jaggr.executor.StreamAggrExecutor;
import io.github.jaggr.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

/**
 * Pulls batches from a source into an executor. Errors raised by the source or the executor
 * propagate unchanged and leave the driver unusable.
 */
public class BatchDriver {
    private static final Logger logger = LoggerFactory.getLogger(BatchDriver.class);

    private final BatchSource source;
    private final AggrExecutor executor;
    private long batches;
    private long rows;
    private long outputRows;
    private long elapsedNanos;
    private boolean exhausted;
    private boolean finished;

    public BatchDriver(BatchSource source, AggrExecutor executor) {
        this.source = requireNonNull(source);
        this.executor = requireNonNull(executor);
    }

    /**
     * Feeds batches until the source returns null.
     */
    public void run() {
        checkState(!finished, "driver is finished");
        long start = System.nanoTime();
        Table batch;
        while (!exhausted) {
            batch = source.next();
            if (null == batch) {
                exhausted = true;
                break;
            }
            batches++;
            rows += batch.activeCount();
            executor.update(batch);
        }
        elapsedNanos += System.nanoTime() - start;
    }

    /**
     * @return groups already complete, only a stream executor has any before the end of input;
     * null if there is nothing to emit
     */
    public Table flush() {
        checkState(!finished, "driver is finished");
        if (!(executor instanceof StreamAggrExecutor)) {
            return null;
        }
        Table output = ((StreamAggrExecutor) executor).takeOutput();
        outputRows += output.size();
        return output.size() == 0 ? null : output;
    }

    /**
     * Runs to the end of input if needed and returns the remaining output.
     */
    public Table finish() {
        run();
        long start = System.nanoTime();
        Table output = executor.finish();
        elapsedNanos += System.nanoTime() - start;
        finished = true;
        outputRows += output.size();
        logger.info("aggregated {} batches, {} rows into {} groups in {} ms",
                batches, rows, outputRows, elapsedNanos / 1_000_000);
        return output;
    }

    /**
     * Runs to the end of input if needed and returns the partial states of every group.
     */
    public Table finishPartial() {
        run();
        Table output = executor.partial();
        finished = true;
        outputRows += output.size();
        logger.info("aggregated {} batches, {} rows into {} partial groups", batches, rows, output.size());
        return output;
    }

    public long getBatches() {
        return batches;
    }

    public long getRows() {
        return rows;
    }

    public long getOutputRows() {
        return outputRows;
    }
}
