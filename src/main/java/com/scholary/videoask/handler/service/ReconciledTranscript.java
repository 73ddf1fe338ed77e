package com.scholary.videoask.handler.service;

import com.scholary.videoask.handler.quality.QualityReport;

/** Enhanced transcript text with its merged quality report and the store outcome. */
public record ReconciledTranscript(
    String jobId, String transcript, QualityReport quality, boolean stored) {}
