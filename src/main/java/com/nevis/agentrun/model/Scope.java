package com.nevis.agentrun.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Optional;

/**
 * Capabilities a user can grant through the external authorization provider.
 */
@Getter
@RequiredArgsConstructor
public enum Scope {
    DRIVE("drive", "https://www.googleapis.com/auth/drive",
        "Full access to Google Drive files and folders"),
    GMAIL_READONLY("gmail_readonly", "https://www.googleapis.com/auth/gmail.readonly",
        "Read-only access to Gmail"),
    GMAIL_FULL("gmail_full", "https://www.googleapis.com/auth/gmail.modify",
        "Full access to Gmail (read, send, modify)"),
    GMAIL_LABELS("gmail_labels", "https://www.googleapis.com/auth/gmail.labels",
        "Manage Gmail labels"),
    GMAIL_COMPOSE("gmail_compose", "https://www.googleapis.com/auth/gmail.compose",
        "Compose Gmail messages"),
    CALENDAR_EVENTS("calendar_events", "https://www.googleapis.com/auth/calendar.events",
        "Manage calendar events"),
    CALENDAR_READONLY("calendar_readonly", "https://www.googleapis.com/auth/calendar.readonly",
        "Read-only access to calendar"),
    DOCUMENTS("documents", "https://www.googleapis.com/auth/documents",
        "Access Google Docs"),
    SPREADSHEETS("spreadsheets", "https://www.googleapis.com/auth/spreadsheets",
        "Access Google Sheets"),
    SPREADSHEETS_READONLY("spreadsheets_readonly", "https://www.googleapis.com/auth/spreadsheets.readonly",
        "Read-only access to Google Sheets");

    private final String scopeName;
    private final String uri;
    private final String description;

    public static Optional<Scope> fromName(String name) {
        return Arrays.stream(values())
            .filter(scope -> scope.scopeName.equals(name))
            .findFirst();
    }

    public static boolean isKnown(String name) {
        return fromName(name).isPresent();
    }
}
