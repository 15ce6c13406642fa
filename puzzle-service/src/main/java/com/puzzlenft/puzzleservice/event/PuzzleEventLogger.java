package com.puzzlenft.puzzleservice.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Writes minted/solved events to the application log.
 */
@Slf4j
@Component
public class PuzzleEventLogger {

    @EventListener
    public void onMinted(MintedEvent event) {
        log.info("Puzzle minted: asset={} type={} number={} minter={}",
                event.getAssetId(), event.getPuzzleType().getWireName(), event.getPuzzleNumber(), event.getMinter());
    }

    @EventListener
    public void onSolved(SolvedEvent event) {
        log.info("Puzzle solved: asset={} solver={} timestamp={} rarity={}",
                event.getAssetId(), event.getSolver(), event.getSolveTimestamp(), event.getRarity().getDisplayName());
    }
}
