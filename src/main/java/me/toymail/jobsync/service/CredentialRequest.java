package me.toymail.jobsync.service;

import java.util.List;

/**
 * Create or update payload for a mailbox account. Null fields keep their current (or default)
 * value. The password is write-only.
 */
public record CredentialRequest(
        String address,
        String password,
        String host,
        Integer port,
        Boolean useTLS,
        Boolean rejectUnauthorized,
        Integer searchTimeframeDays,
        List<String> searchFolders,
        Boolean autoImport
) {}
