package com.ranco.auth.global.tx;

import java.util.function.Function;

/**
 * Runs a unit of work atomically. A returned value means the work was durably committed;
 * any thrown exception means every change made through the {@link UnitOfWork} was discarded.
 * Repositories never begin, commit or roll back on their own.
 */
public interface TransactionCoordinator {

    <T> T runAtomic(ExecutionContext context, Function<UnitOfWork, T> work);

    <T> T runReadOnly(ExecutionContext context, Function<UnitOfWork, T> work);
}
