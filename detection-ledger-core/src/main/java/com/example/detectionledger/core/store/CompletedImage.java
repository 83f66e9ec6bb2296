package com.example.detectionledger.core.store;

import java.time.LocalDate;

/** Upload date and file name of an image found by a status query for one customer. */
public record CompletedImage(LocalDate uploadDate, String filename) {}
