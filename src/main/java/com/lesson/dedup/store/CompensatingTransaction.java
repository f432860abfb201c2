package com.lesson.dedup.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Undo log for stores without multi-statement transactions.
 *
 * <p>Each write is applied immediately and its inverse is pushed on a stack. If the
 * transaction is closed without {@link #commit()}, the inverses run newest first.</p>
 *
 * <pre>
 * try (CompensatingTransaction tx = new CompensatingTransaction("resolve")) {
 *     tx.apply("update lesson", () -> writeLesson(merged), () -> writeLesson(previous));
 *     tx.apply("archive lesson", () -> archive(a), () -> restore(a));
 *     tx.commit();
 * }
 * </pre>
 */
public class CompensatingTransaction implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CompensatingTransaction.class);

    private final String name;
    private final Deque<Step> undoLog = new ArrayDeque<>();
    private boolean committed = false;
    private boolean closed = false;
    private int failedCompensations = 0;

    public CompensatingTransaction(String name) {
        this.name = name;
    }

    /**
     * Applies a write and records how to undo it. If the write itself throws, nothing is
     * recorded for it and the exception propagates; the caller's close() rolls back earlier steps.
     */
    public void apply(String description, Runnable write, Runnable undo) {
        ensureOpen();
        log.debug("tx.step tx={} step={}", name, description);
        write.run();
        undoLog.push(new Step(description, undo));
    }

    /**
     * Applies a write whose result determines its undo action.
     */
    public <T> T applyReturning(String description, Supplier<T> write, Consumer<T> undo) {
        ensureOpen();
        log.debug("tx.step tx={} step={}", name, description);
        T result = write.get();
        undoLog.push(new Step(description, () -> undo.accept(result)));
        return result;
    }

    public void commit() {
        ensureOpen();
        committed = true;
        log.debug("tx.committed tx={} steps={}", name, undoLog.size());
    }

    public boolean isCommitted() {
        return committed;
    }

    /**
     * Number of undo actions that themselves failed during rollback.
     */
    public int failedCompensations() {
        return failedCompensations;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!committed && !undoLog.isEmpty()) {
            log.warn("tx.rollback tx={} steps={}", name, undoLog.size());
            rollback();
        }
        undoLog.clear();
    }

    private void rollback() {
        while (!undoLog.isEmpty()) {
            Step step = undoLog.pop();
            try {
                step.undo().run();
            } catch (RuntimeException e) {
                failedCompensations++;
                log.error("tx.compensation.failed tx={} step={} error={}", name, step.description(), e.getMessage(), e);
            }
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Transaction " + name + " is already closed");
        }
        if (committed) {
            throw new IllegalStateException("Transaction " + name + " is already committed");
        }
    }

    private record Step(String description, Runnable undo) {}
}
