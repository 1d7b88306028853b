package org.minesolver.service.game;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.minesolver.dto.RoundEvent;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/** Publie chaque tour joué sur {@code /topic/solver/{gameId}}. */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameEventPublisher {

    static final String TOPIC = "/topic/solver/";

    private final SimpMessagingTemplate broker;

    public void roundPlayed(SolverGame game, RoundReport report) {
        var evt = RoundEvent.builder()
                .gameId(game.getId())
                .round(report.round())
                .revealed(report.revealed())
                .flagged(report.flagged())
                .remainingSafeCells(report.remainingSafeCells())
                .flagsRemaining(report.flagsRemaining())
                .status(report.status().name())
                .build();
        try {
            broker.convertAndSend(TOPIC + game.getId(), evt);
        } catch (MessagingException ex) {
            // un envoi raté ne termine jamais la partie
            log.warn("Could not publish round {} of game {}: {}", report.round(), game.getId(), ex.getMessage());
        }
    }
}
