package com.medical.records.service.summary;

import lombok.Value;

@Value
public class SummaryRequest {
    String document;
    int maxTokens;
    double temperature;
}
