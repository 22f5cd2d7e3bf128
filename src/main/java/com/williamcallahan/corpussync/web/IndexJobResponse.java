package com.williamcallahan.corpussync.web;

import com.williamcallahan.corpussync.indexing.IndexJobStatus;

public record IndexJobResponse(String jobId, String collection, IndexJobStatus status) {}
