package net.linkcoverage.repository;

import jakarta.annotation.Nullable;
import net.linkcoverage.model.BacklinkRecord;
import net.linkcoverage.model.CoverageStatus;

/**
 * Optional narrowing for {@link BacklinkRecordRepository#queryBacklinkRecords}.
 */
public record BacklinkRecordFilter(@Nullable CoverageStatus coverageStatus, @Nullable Double minDomainRating) {

    private static final BacklinkRecordFilter ALL = new BacklinkRecordFilter(null, null);

    public static BacklinkRecordFilter all() {
        return ALL;
    }

    public static BacklinkRecordFilter withStatus(CoverageStatus status) {
        return new BacklinkRecordFilter(status, null);
    }

    public boolean matches(BacklinkRecord record) {
        if (coverageStatus != null && record.coverageStatus() != coverageStatus) {
            return false;
        }
        if (minDomainRating != null) {
            return record.domainRating() != null && record.domainRating() >= minDomainRating;
        }
        return true;
    }
}
