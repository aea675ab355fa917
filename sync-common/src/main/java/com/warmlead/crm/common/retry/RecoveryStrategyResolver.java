package com.warmlead.crm.common.retry;

import com.warmlead.crm.common.error.ErrorKind;

/**
 * Resolves the recovery strategy for a classified failure.
 * 
 * Keeps the classification logic decoupled from the retry logic: classifiers decide
 * what went wrong, resolvers decide what to do about it.
 * 
 * Implementations must be pure functions of the error kind.
 */
public interface RecoveryStrategyResolver {

    /**
     * Resolve the recovery strategy for an error kind.
     *
     * @param kind classified error kind
     * @return strategy to apply, never null
     */
    RecoveryStrategy resolve(ErrorKind kind);
}
