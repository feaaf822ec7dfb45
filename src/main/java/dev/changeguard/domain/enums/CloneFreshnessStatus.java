package dev.changeguard.domain.enums;

public enum CloneFreshnessStatus {
    OK, STALE, NOT_FOUND, ERROR, SKIPPED
}
