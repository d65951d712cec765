package com.beacon.statusservice.domain;

import com.beacon.statusmodel.StatusRecord;

/**
 * A record accepted by the ingest path together with the identifier the store assigned to it.
 */
public record RecordedStatus(RecordId id, StatusRecord record) {}
