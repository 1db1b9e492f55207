package com.goormthonuniv.factcheck.dto;

/** 소스 유형별 analyzed 소스 수와 평균 agreementRatio */
public record TypeBreakdown(int count, double averageAgreement) {}
