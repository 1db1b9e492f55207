package com.goormthonuniv.factcheck.service;

public class ReportNotFoundException extends RuntimeException {

    public ReportNotFoundException(String reportId) {
        super("report not found: " + reportId);
    }
}
