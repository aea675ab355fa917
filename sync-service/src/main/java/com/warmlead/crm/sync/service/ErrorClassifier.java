package com.warmlead.crm.sync.service;

import com.warmlead.crm.common.error.ErrorClassification;
import com.warmlead.crm.common.error.ErrorKind;
import com.warmlead.crm.common.error.SyncException;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Classifies sync failures into an {@link ErrorKind}.
 * 
 * Classification rules, first match wins:
 * - A SyncException anywhere in the cause chain: its own kind
 * - A Spring DataAccessException in the cause chain: DATABASE
 * - Message text, checked against the pattern table in this fixed order:
 *   RATE_LIMIT, AUTHENTICATION, NETWORK, DATABASE, VALIDATION, EXTERNAL_API
 * - Otherwise UNKNOWN
 * 
 * Message matching is the fallback for errors raised by libraries that do not
 * carry a kind. The outermost message is tried first, then each cause in turn.
 */
@Service
public class ErrorClassifier {

    private static final Map<ErrorKind, List<Pattern>> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put(ErrorKind.RATE_LIMIT, patterns(
            "rate limit", "too many requests", "retry after"));
        PATTERNS.put(ErrorKind.AUTHENTICATION, patterns(
            "api key", "invalid.*token", "unauthorized", "authentication failed"));
        PATTERNS.put(ErrorKind.NETWORK, patterns(
            "network timeout", "connection failed", "failed to connect", "timeout", "timed out"));
        PATTERNS.put(ErrorKind.DATABASE, patterns(
            "database connection", "connection lost", "database error", "(jdbc|hibernate|sql).*(error|exception)"));
        PATTERNS.put(ErrorKind.VALIDATION, patterns(
            "invalid.*format", "validation failed", "required field"));
        PATTERNS.put(ErrorKind.EXTERNAL_API, patterns(
            "pipedrive.*error", "api.*error"));
    }

    public ErrorClassification classify(Throwable error) {
        return ErrorClassification.of(kindOf(error));
    }

    public ErrorClassification classify(String message) {
        return ErrorClassification.of(matchMessage(message));
    }

    public ErrorKind kindOf(Throwable error) {
        if (error == null) {
            return ErrorKind.UNKNOWN;
        }
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
            if (current instanceof SyncException syncException && syncException.getKind() != null) {
                return syncException.getKind();
            }
            if (current instanceof DataAccessException) {
                return ErrorKind.DATABASE;
            }
        }
        seen.clear();
        for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
            ErrorKind kind = matchMessage(current.getMessage());
            if (kind != ErrorKind.UNKNOWN) {
                return kind;
            }
        }
        return ErrorKind.UNKNOWN;
    }

    private static ErrorKind matchMessage(String message) {
        if (message == null || message.isBlank()) {
            return ErrorKind.UNKNOWN;
        }
        for (Map.Entry<ErrorKind, List<Pattern>> entry : PATTERNS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(message).find()) {
                    return entry.getKey();
                }
            }
        }
        return ErrorKind.UNKNOWN;
    }

    private static List<Pattern> patterns(String... regexes) {
        return Arrays.stream(regexes)
            .map(regex -> Pattern.compile(regex, Pattern.CASE_INSENSITIVE))
            .toList();
    }
}
