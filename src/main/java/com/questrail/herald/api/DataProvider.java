package com.questrail.herald.api;

/**
 * DataProvider
 * -----------------------------------------------------------------------------
 * Narrow boundary to an external data source (rail departure board, council
 * collection calendar). Parsing and transport live entirely behind it.
 *
 * <h2>Failure contract</h2>
 * Any network, protocol or parse failure is reported as
 * {@link ProviderUnavailableException}. Callers treat it as transient: the
 * current tick is abandoned without advancing persisted pointers and the work
 * is retried on the next tick.
 *
 * @param <Q> query type
 * @param <R> snapshot type
 */
@FunctionalInterface
public interface DataProvider<Q, R>
{
    R fetch(Q query) throws ProviderUnavailableException;
}
