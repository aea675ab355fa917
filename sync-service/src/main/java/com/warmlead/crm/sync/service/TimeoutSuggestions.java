package com.warmlead.crm.sync.service;

public record TimeoutSuggestions(boolean shouldIncrease, long recommendedTimeoutMs, String reason) {
}
