package uk.gegc.boxbilling.features.usage.application;

public record OverageRunSummary(int boxesChecked, int recordsCreated, int alreadyCalculated, int failures) {
}
