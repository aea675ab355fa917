package com.warmlead.crm.sync.service;

import com.warmlead.crm.common.error.ErrorKind;

import java.time.LocalDateTime;
import java.util.UUID;

public record ErrorEvent(ErrorKind kind, UUID userId, LocalDateTime timestamp, boolean recoverable) {
}
