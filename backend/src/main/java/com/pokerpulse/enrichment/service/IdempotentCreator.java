package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.util.KeyedLocks;
import com.pokerpulse.enrichment.web.InvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.function.Supplier;

/**
 * "Create if missing" for canonical entities. Callers in this process serialize on the idempotency key;
 * callers in other processes are caught by the unique constraint, after which the loser re-reads the
 * winner's row instead of creating a duplicate.
 */
@Component
public class IdempotentCreator {
    private static final Logger log = LoggerFactory.getLogger(IdempotentCreator.class);

    private final KeyedLocks locks = new KeyedLocks(64);
    private final TransactionTemplate creationTx;

    public IdempotentCreator(@Qualifier("creationTx") TransactionTemplate creationTx) {
        this.creationTx = creationTx;
    }

    public record Created<T>(T entity, boolean wasCreated) {}

    public static String key(String kind, Long entityId, String normalizedName) {
        return kind + ":" + entityId + ":" + normalizedName;
    }

    public <T> Created<T> findOrCreate(String idempotencyKey, Supplier<Optional<T>> lookup, Supplier<T> create) {
        return locks.withLock(idempotencyKey, () -> {
            Optional<T> existing = creationTx.execute(status -> lookup.get());
            if (existing != null && existing.isPresent()) {
                return new Created<>(existing.get(), false);
            }
            try {
                T created = creationTx.execute(status -> create.get());
                log.info("[Idempotent][Create] key={}", idempotencyKey);
                return new Created<>(created, true);
            } catch (DataIntegrityViolationException race) {
                log.info("[Idempotent][Race] key={} lost creation race, re-reading winner: {}", idempotencyKey, race.getMostSpecificCause().getMessage());
                Optional<T> winner = creationTx.execute(status -> lookup.get());
                if (winner == null || winner.isEmpty()) {
                    throw new InvariantViolationException("Unique constraint hit for '" + idempotencyKey + "' but no row found");
                }
                return new Created<>(winner.get(), false);
            }
        });
    }
}
