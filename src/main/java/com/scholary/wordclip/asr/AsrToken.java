package com.scholary.wordclip.asr;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A sub-word token inside an ASR segment.
 *
 * <p>Any field may be null when the recognizer could not provide it. Ids at or above the special
 * token threshold are control tokens (timestamps, language tags) rather than text.
 *
 * @param text token text, usually with a leading space at word starts
 * @param id vocabulary id
 * @param time approximate start time in seconds
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AsrToken(String text, Integer id, @JsonAlias("t0") Double time) {}
