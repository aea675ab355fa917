package com.warmlead.crm.sync.service;

import java.util.List;

public record ConfigValidation(boolean valid, List<String> errors) {
}
