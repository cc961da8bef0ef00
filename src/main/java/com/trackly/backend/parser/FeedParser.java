package com.trackly.backend.parser;

import com.trackly.backend.model.ParseResult;

/**
 * Decodes one raw feed payload into validated track observations.
 * Implementations never throw: a malformed payload yields
 * {@link ParseResult.Status#FAILED}.
 */
public interface FeedParser {

    /**
     * Value of {@code feed.format} that selects this parser.
     */
    String format();

    ParseResult parse(byte[] payload);
}
