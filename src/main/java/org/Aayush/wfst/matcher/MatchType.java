package org.Aayush.wfst.matcher;

/**
 * Which side of an arc a matcher indexes.
 *
 * <p>Matchers support {@code MATCH_INPUT} and {@code MATCH_OUTPUT}; {@code MATCH_BOTH} and
 * {@code MATCH_NONE} exist so callers can express unsupported requests and get a
 * construction failure instead of silent fallback.</p>
 */
public enum MatchType {
    MATCH_INPUT,
    MATCH_OUTPUT,
    MATCH_BOTH,
    MATCH_NONE
}
