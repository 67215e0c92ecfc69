package com.keer.studiosync.classifier.model;

import java.time.LocalDate;

public record ExtractedDate(LocalDate date, boolean yearInferred) {
}
