package com.scholary.wordclip.asr;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/**
 * A segment of recognized speech as returned by the ASR service.
 *
 * <p>Fields are boxed so a missing value survives deserialization as null; the reconstructor
 * decides what to skip.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AsrSegment(String text, Double start, Double end, List<AsrToken> tokens) {}
