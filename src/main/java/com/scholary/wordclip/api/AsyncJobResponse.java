package com.scholary.wordclip.api;

/** Returns the id to poll for an accepted clip job. */
public record AsyncJobResponse(String jobId) {}
