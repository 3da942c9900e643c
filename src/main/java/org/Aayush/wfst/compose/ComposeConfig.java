package org.Aayush.wfst.compose;

import lombok.Builder;
import lombok.Value;
import org.Aayush.wfst.matcher.MatchType;

/**
 * Composition options.
 */
@Value
@Builder
public class ComposeConfig {
    static final String PROP_MATCH_TYPE = "wfst.compose.matchType";

    /**
     * Match-direction policy.
     * <p>
     * {@link MatchType#MATCH_INPUT}: arcs of the left automaton drive the expansion and partners
     * are found through the right matcher, keyed by the driving arc's output label.
     * {@link MatchType#MATCH_OUTPUT}: arcs of the right automaton drive the expansion and partners
     * are found through the left matcher, keyed by the driving arc's input label.
     * </p>
     */
    @Builder.Default
    MatchType matchType = MatchType.MATCH_INPUT;

    /**
     * Default options, honouring the {@code wfst.compose.matchType} system property.
     */
    public static ComposeConfig defaults() {
        return ComposeConfig.builder()
                .matchType(readMatchType())
                .build();
    }

    private static MatchType readMatchType() {
        String raw = System.getProperty(PROP_MATCH_TYPE);
        if (raw == null || raw.isBlank()) {
            return MatchType.MATCH_INPUT;
        }
        try {
            return MatchType.valueOf(raw.trim());
        } catch (IllegalArgumentException ex) {
            return MatchType.MATCH_INPUT;
        }
    }
}
