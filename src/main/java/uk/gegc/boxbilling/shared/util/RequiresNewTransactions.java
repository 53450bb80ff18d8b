package uk.gegc.boxbilling.shared.util;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.function.Supplier;

/**
 * Runs a unit of work in its own transaction.
 *
 * <p>Used for inserts guarded by a unique constraint: a violation rolls back only the inner
 * transaction, leaving the caller free to re-read the winning row.</p>
 */
@Component
public class RequiresNewTransactions {

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public <T> T call(Supplier<T> work) {
        return work.get();
    }

    public static boolean isDuplicateKey(DataIntegrityViolationException e) {
        String message = e.getMostSpecificCause().getMessage();
        if (message == null) {
            return false;
        }
        String normalized = message.toLowerCase();
        return normalized.contains("duplicate") || normalized.contains("unique");
    }
}
