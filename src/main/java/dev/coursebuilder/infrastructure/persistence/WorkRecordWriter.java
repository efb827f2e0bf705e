package dev.coursebuilder.infrastructure.persistence;

import dev.coursebuilder.domain.entity.WorkRecord;
import dev.coursebuilder.domain.entity.WorkRecordId;
import dev.coursebuilder.exception.ConcurrencyConflictException;
import dev.coursebuilder.exception.WorkRecordNotFoundException;
import dev.coursebuilder.repository.WorkRecordRepository;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.SQLException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Read-modify-write of a single work record with no lost updates.
 *
 * <p>Every attempt loads the record in a fresh transaction, applies the mutation and
 * flushes. The {@code @Version} column turns a concurrent write into an
 * optimistic-locking failure, which the {@code work-record} retry answers by running
 * the whole attempt again against the newer state. Callers must not hold an outer
 * transaction: a retry inside one would reuse the stale persistence context.
 *
 * <p>Domain exceptions thrown by the mutation (not found, invalid input) are not
 * retried and reach the caller unchanged, and neither are integrity violations other
 * than a duplicate key. The transaction rolls back, so the record is left as it was.
 */
@Component
public class WorkRecordWriter {

    private static final Logger log = LoggerFactory.getLogger(WorkRecordWriter.class);

    private static final String UNIQUE_VIOLATION = "23505";

    private final WorkRecordRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Retry retry;
    private final Counter conflictCounter;

    public WorkRecordWriter(WorkRecordRepository repository,
                            TransactionTemplate transactionTemplate,
                            Retry workRecordRetry,
                            MeterRegistry meterRegistry) {
        this.repository = repository;
        this.transactionTemplate = transactionTemplate;
        this.retry = workRecordRetry;
        this.conflictCounter = Counter.builder("coursebuilder.work_record.conflicts")
                .description("Work record writes abandoned after exhausting retries")
                .register(meterRegistry);
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying work record write (attempt {}): {}",
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    /**
     * Applies {@code mutation} to the existing record and returns {@code projection}
     * of the flushed result.
     *
     * @throws WorkRecordNotFoundException if no record exists for {@code id}
     * @throws ConcurrencyConflictException if every attempt lost to a concurrent writer
     */
    public <T> T update(WorkRecordId id, Consumer<WorkRecord> mutation, Function<WorkRecord, T> projection) {
        return write(id, () -> transactionTemplate.execute(status -> {
            WorkRecord record = repository.findById(id)
                    .orElseThrow(() -> new WorkRecordNotFoundException(id));
            mutation.accept(record);
            return projection.apply(repository.saveAndFlush(record));
        }));
    }

    /**
     * Overwrites the record with {@code overwrite}, or inserts the one built by
     * {@code creator} when none exists. Two first inserts racing on the same key end
     * with the loser retrying as an overwrite.
     */
    public <T> T upsert(WorkRecordId id, Supplier<WorkRecord> creator, Consumer<WorkRecord> overwrite,
                        Function<WorkRecord, T> projection) {
        return write(id, () -> transactionTemplate.execute(status -> {
            WorkRecord record = repository.findById(id)
                    .map(existing -> {
                        overwrite.accept(existing);
                        return existing;
                    })
                    .orElseGet(creator);
            return projection.apply(repository.saveAndFlush(record));
        }));
    }

    /**
     * True when {@code ex} means another writer got to the record first. A racing
     * first insert shows up as a unique violation (SQLState 23505).
     */
    public static boolean isWriteConflict(Throwable ex) {
        if (ex instanceof ConcurrencyFailureException || ex instanceof DuplicateKeyException) return true;
        if (!(ex instanceof DataIntegrityViolationException)) return false;
        for (Throwable cause = ex.getCause(); cause != null; cause = cause.getCause()) {
            if (cause instanceof SQLException sql && UNIQUE_VIOLATION.equals(sql.getSQLState())) return true;
        }
        return false;
    }

    private <T> T write(WorkRecordId id, Supplier<T> attempt) {
        try {
            return Retry.decorateSupplier(retry, attempt).get();
        } catch (ConcurrencyFailureException | DataIntegrityViolationException e) {
            if (!isWriteConflict(e)) throw e;
            conflictCounter.increment();
            int attempts = retry.getRetryConfig().getMaxAttempts();
            log.error("Giving up on work record {} after {} attempts: {}", id, attempts, e.getMessage());
            throw new ConcurrencyConflictException(id, attempts, e);
        }
    }
}
