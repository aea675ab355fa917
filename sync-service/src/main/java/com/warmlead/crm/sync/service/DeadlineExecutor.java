package com.warmlead.crm.sync.service;

import com.warmlead.crm.common.error.ErrorKind;
import com.warmlead.crm.common.error.SyncException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Races an operation against a deadline.
 * 
 * The operation runs on the sync executor while the caller waits. When the deadline
 * wins, the operation's thread is interrupted so it stops at its next interruption
 * check instead of writing after the timeout has been reported.
 */
@Component
public class DeadlineExecutor {

    private final ExecutorService syncTaskExecutor;

    public DeadlineExecutor(@Qualifier("syncTaskExecutor") ExecutorService syncTaskExecutor) {
        this.syncTaskExecutor = syncTaskExecutor;
    }

    /**
     * @throws SyncException of kind NETWORK with the supplied message when the deadline passes
     * @throws Exception whatever the operation threw
     */
    public <T> T call(Callable<T> operation, long timeoutMs, Supplier<String> timeoutMessage) throws Exception {
        Future<T> future = syncTaskExecutor.submit(operation);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new SyncException(ErrorKind.NETWORK, timeoutMessage.get(), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception exception) {
                throw exception;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
