package com.questrail.herald.domain.bins;

import com.questrail.herald.api.DataProvider;
import com.questrail.herald.api.ProviderUnavailableException;

import java.util.List;

/**
 * Source of the council collection calendar. The query is ignored; the
 * address is part of the provider's own configuration.
 */
@FunctionalInterface
public interface CollectionScheduleProvider extends DataProvider<Void, List<BinCollection>>
{
    List<BinCollection> fetchSchedule() throws ProviderUnavailableException;

    @Override
    default List<BinCollection> fetch(Void query) throws ProviderUnavailableException {
        return fetchSchedule();
    }
}
