package com.phillippitts.champ.service.ensemble;

import com.phillippitts.champ.domain.RoundContext;

import java.util.Locale;

/**
 * Fixed prompt contract sent to every endpoint in a round.
 */
public final class PromptTemplate {

    private static final String HEADER = """
            You are competing in a public Novelty Championship.
            Respond with exactly ONE item starting with:
            TRADE: <pair, direction, entry, exit, expected X% profit, 3-line python stub>
            or
            PAPER: <Title> - 300 words abstract with a concrete mechanism and evaluation path.

            """;

    private static final String FOOTER = "\n\nRules: no filler, no preamble, one output only.";

    private PromptTemplate() {
        // Utility class - prevent instantiation
    }

    public static String build(RoundContext context) {
        String contextJson = String.format(Locale.ROOT, """
                Context JSON: {
                    "symbol": "%s",
                    "price": %s,
                    "sol_tips_proxy": %s,
                    "sol_whales_proxy": %s,
                    "trending_source": "%s",
                    "timestamp": %s
                }""",
                context.symbol(),
                context.price(),
                context.solTipsProxy(),
                context.solWhalesProxy(),
                context.trendingSource(),
                context.timestamp().toEpochMilli() / 1000.0);
        return HEADER + contextJson + FOOTER;
    }
}
