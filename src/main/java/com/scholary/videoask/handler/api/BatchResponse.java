package com.scholary.videoask.handler.api;

import com.scholary.videoask.handler.service.BatchItemResult;
import java.util.List;

/** Results in request order, with the number of items and of failed items. */
public record BatchResponse(List<BatchItemResult> results, int total, int failed) {

  static BatchResponse of(List<BatchItemResult> results) {
    int failed = (int) results.stream().filter(BatchItemResult::isFailed).count();
    return new BatchResponse(results, results.size(), failed);
  }
}
