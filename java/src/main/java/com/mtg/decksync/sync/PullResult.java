package com.mtg.decksync.sync;

import java.nio.file.Path;
import java.util.List;

/**
 * Files written by a pull and remote decks skipped because a local file already links them.
 */
public record PullResult(List<Path> pulled, List<String> skipped) {
    public PullResult {
        pulled = List.copyOf(pulled);
        skipped = List.copyOf(skipped);
    }
}
