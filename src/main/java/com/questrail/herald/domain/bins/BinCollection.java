package com.questrail.herald.domain.bins;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One bin type collected on one date.
 */
public record BinCollection(LocalDate date, String type)
{
    public BinCollection {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(type, "type");
    }
}
