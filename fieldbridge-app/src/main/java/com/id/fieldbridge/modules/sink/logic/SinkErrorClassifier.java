package com.id.fieldbridge.modules.sink.logic;

import com.id.fieldbridge.modules.sink.model.SinkWriteException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;

public final class SinkErrorClassifier {

    private SinkErrorClassifier() {
    }

    /**
     * Wraps a store failure, flagging network and timeout problems as retryable.
     */
    public static SinkWriteException classify(String sink, RuntimeException e) {
        String message = "%s write failed: %s".formatted(sink, e.getMessage());
        return isTransient(e)
                ? SinkWriteException.retryable(message, e)
                : SinkWriteException.permanent(message, e);
    }

    static boolean isTransient(Throwable e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof TransientDataAccessException
                    || current instanceof RecoverableDataAccessException
                    || current instanceof DataAccessResourceFailureException
                    || current instanceof MongoSocketException
                    || current instanceof MongoTimeoutException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }
}
