package me.toymail.jobsync.classify;

import me.toymail.jobsync.store.ResponseStatus;

import java.time.Instant;

/**
 * One job event found in a message. {@code eventAt} is the applied, status or response date
 * depending on {@code type}. {@code exists} and {@code matchedRecordId} are only set by matching.
 */
public record CandidateItem(
        CandidateType type,
        String jobTitle,
        String company,
        String companyLocation,
        Instant eventAt,
        ResponseStatus responseValue,
        String statusNote,
        String externalId,
        String website,
        String sourceMessageId,
        String sourceFolder,
        boolean exists,
        String matchedRecordId
) {
    public static CandidateItem application(String jobTitle, String company, String companyLocation, Instant appliedAt,
                                            String externalId, String website, String messageId, String folder) {
        return new CandidateItem(CandidateType.APPLICATION, jobTitle, company, companyLocation, appliedAt,
                null, null, externalId, website, messageId, folder, false, null);
    }

    public static CandidateItem statusUpdate(String jobTitle, String company, Instant statusAt, String statusNote,
                                             String externalId, String website, String messageId, String folder) {
        return new CandidateItem(CandidateType.STATUS_UPDATE, jobTitle, company, null, statusAt,
                null, statusNote, externalId, website, messageId, folder, false, null);
    }

    public static CandidateItem response(String jobTitle, String company, Instant respondedAt, ResponseStatus value,
                                         String externalId, String website, String messageId, String folder) {
        return new CandidateItem(CandidateType.RESPONSE, jobTitle, company, null, respondedAt,
                value, null, externalId, website, messageId, folder, false, null);
    }

    public CandidateItem withMatch(String recordId) {
        return new CandidateItem(type, jobTitle, company, companyLocation, eventAt, responseValue, statusNote,
                externalId, website, sourceMessageId, sourceFolder, recordId != null, recordId);
    }
}
