package com.medical.records.service.summary;

/**
 * External natural-language summarizer. Implementations block until the call completes
 * and report every failure through {@link SummaryResult}, never by throwing.
 */
public interface Summarizer {

    SummaryResult summarize(SummaryRequest request);
}
