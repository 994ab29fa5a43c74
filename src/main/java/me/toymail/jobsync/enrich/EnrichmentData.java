package me.toymail.jobsync.enrich;

/**
 * Fields scraped from a posting. Any of them may be null.
 */
public record EnrichmentData(
        String jobTitle,
        String company,
        String location,
        String description,
        String employmentType,
        String locationType,
        Double wagesMin,
        Double wagesMax,
        String wageType,
        String externalJobId
) {}
