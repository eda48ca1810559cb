package com.mtg.decksync.deck;

import java.util.Locale;
import java.util.Set;

/**
 * Basic land names. These are the only cards a deck list may repeat
 * on the same board (as separate lines or pre-summed).
 */
public final class BasicLands {
    private BasicLands() {}

    private static final Set<String> NAMES = Set.of(
            "plains", "island", "swamp", "mountain", "forest", "wastes",
            "snow-covered plains", "snow-covered island", "snow-covered swamp",
            "snow-covered mountain", "snow-covered forest", "snow-covered wastes"
    );

    public static boolean isBasic(String cardName) {
        return cardName != null && NAMES.contains(cardName.trim().toLowerCase(Locale.ROOT));
    }
}
