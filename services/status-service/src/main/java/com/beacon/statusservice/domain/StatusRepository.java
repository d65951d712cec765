package com.beacon.statusservice.domain;

import com.beacon.statusmodel.StatusRecord;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only store of {@link StatusRecord}s.
 *
 * <p>"Latest" for a name means the record with the greatest timestamp; when two records tie on
 * timestamp, the one appended later wins. Implementations must apply this order exactly, see
 * {@link LatestRecordIndex}.
 *
 * <p>Every operation throws {@link StoreUnavailableException} when the backing store cannot be
 * reached. Implementations must be safe for concurrent use.
 */
public interface StatusRepository {

    /**
     * Appends one record atomically: either the whole record is stored or nothing is.
     *
     * @return the identifier assigned to the stored record
     */
    RecordId append(StatusRecord record);

    /** Latest record for the name, or empty if no record with that name was ever appended. */
    Optional<StatusRecord> latestByName(String serviceName);

    /**
     * Latest record of every name ever appended, in order of each name's first appearance.
     * The returned map is an unmodifiable snapshot.
     */
    Map<String, StatusRecord> latestAll();
}
