package com.questrail.herald.domain.train;

import com.questrail.herald.api.DataProvider;

/**
 * Live departure board source, queried by station code.
 */
@FunctionalInterface
public interface DepartureBoardProvider extends DataProvider<String, DepartureBoard>
{
}
