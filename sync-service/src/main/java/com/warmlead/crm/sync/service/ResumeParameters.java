package com.warmlead.crm.sync.service;

public record ResumeParameters(
    int startFromContact,
    int skipContacts,
    int estimatedRemaining,
    int batchSize
) {
}
