package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.config.ResolutionSettings;
import com.pokerpulse.enrichment.model.DiscrepancySeverity;
import com.pokerpulse.enrichment.model.Game;
import com.pokerpulse.enrichment.model.ReconciliationRecord;
import com.pokerpulse.enrichment.model.SocialPlacement;
import com.pokerpulse.enrichment.model.SocialPost;
import com.pokerpulse.enrichment.util.NameNormalizer;
import com.pokerpulse.enrichment.util.TextSimilarity;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Scores social result posts against games and computes the numeric discrepancies between what a post
 * claims was paid and what the game record says. Never writes to the game.
 */
@Component
public class SocialPostReconciler {

    public static final String MANUAL_REVIEW = "MANUAL_REVIEW";

    public enum Signal implements MatchSignal {
        DATE(0.40),
        VENUE(0.35),
        BUY_IN(0.25);

        private final double weight;

        Signal(double weight) { this.weight = weight; }

        @Override
        public double defaultWeight() { return weight; }
    }

    private final ResolutionSettings settings;

    public SocialPostReconciler(ResolutionSettings settings) {
        this.settings = settings;
    }

    /** The post's event date: the extracted date, else the day it was posted. */
    public static LocalDate eventDate(SocialPost post) {
        if (post.getExtractedDate() != null) return post.getExtractedDate();
        return post.getPostedAt() == null ? null : post.getPostedAt().atZone(ZoneOffset.UTC).toLocalDate();
    }

    public List<ScoredCandidate<Game>> score(SocialPost post, List<Game> games) {
        LocalDate date = eventDate(post);
        List<ScoredCandidate<Game>> out = new ArrayList<>();
        if (date == null) return out;
        for (Game g : games) {
            List<SignalMatch> signals = List.of(
                    SignalMatch.of(Signal.DATE, dateScore(date, g.getGameStartDateTime() == null ? null : g.getGameStartDateTime().toLocalDate())),
                    SignalMatch.of(Signal.VENUE, venueScore(post, g)),
                    SignalMatch.of(Signal.BUY_IN, buyInScore(post.getExtractedBuyIn(), g.getBuyIn())));
            out.add(ScoredCandidate.of(g, g.getId(), g.getName(), g.getUpdatedAt(), signals));
        }
        return ConfidenceScorer.rank(out);
    }

    static double dateScore(LocalDate postDate, LocalDate gameDate) {
        if (postDate == null || gameDate == null) return 0.0;
        long days = Math.abs(ChronoUnit.DAYS.between(postDate, gameDate));
        if (days == 0) return 1.0;
        if (days == 1) return 0.6;
        return days == 2 ? 0.3 : 0.0;
    }

    static double venueScore(SocialPost post, Game game) {
        Long gameVenue = game.getVenueAssignment().getStatus().isAssigned() ? game.getVenueAssignment().getTargetId() : null;
        if (post.getVenueHintId() != null && Objects.equals(post.getVenueHintId(), gameVenue)) return 1.0;
        String a = NameNormalizer.normalizeForMatch(post.getExtractedVenueName());
        String b = NameNormalizer.normalizeForMatch(game.getVenueName());
        if (a.isEmpty() || b.isEmpty()) return 0.0;
        if (a.equals(b)) return 1.0;
        return 0.5 * TextSimilarity.tokenJaccard(a, b) + 0.5 * TextSimilarity.editRatio(a, b);
    }

    static double buyInScore(BigDecimal postBuyIn, BigDecimal gameBuyIn) {
        if (postBuyIn == null || gameBuyIn == null) return 0.5;
        if (postBuyIn.compareTo(gameBuyIn) == 0) return 1.0;
        if (gameBuyIn.signum() == 0) return 0.0;
        BigDecimal rel = postBuyIn.subtract(gameBuyIn).abs().divide(gameBuyIn.abs(), 4, RoundingMode.HALF_UP);
        return rel.compareTo(new BigDecimal("0.10")) <= 0 ? 0.5 : 0.0;
    }

    /** Fills {@code target} with the post-versus-game comparison. Differences are post minus game. */
    public ReconciliationRecord reconcile(SocialPost post, Game game, ReconciliationRecord target) {
        BigDecimal socialCash = BigDecimal.ZERO.setScale(2);
        int socialTickets = 0;
        BigDecimal socialTicketValue = null;
        for (SocialPlacement p : post.getPlacements()) {
            if (p.getCashPrize() != null) socialCash = socialCash.add(p.getCashPrize());
            if (p.hasTicket()) {
                socialTickets++;
                if (socialTicketValue == null) socialTicketValue = p.getTicketValue();
            }
        }
        socialCash = socialCash.setScale(2, RoundingMode.HALF_UP);

        target.setEntityId(post.getEntityId());
        target.setSocialPostId(post.getId());
        target.setGameId(game.getId());
        target.setSocialTotalCashPaid(socialCash);
        target.setSocialTicketCount(socialTickets);
        target.setSocialTicketValue(scale(socialTicketValue));
        target.setGamePrizepoolPaid(scale(game.getPrizepoolPaid()));
        target.setGameTicketCount(game.getNumberOfTicketsPaid());
        target.setGameTicketValue(scale(game.getTicketValue()));

        BigDecimal cashDiff = game.getPrizepoolPaid() == null ? null : socialCash.subtract(scale(game.getPrizepoolPaid()));
        Integer ticketCountDiff = game.getNumberOfTicketsPaid() == null ? null : socialTickets - game.getNumberOfTicketsPaid();
        BigDecimal ticketValueDiff = socialTicketValue == null || game.getTicketValue() == null
                ? null : scale(socialTicketValue).subtract(scale(game.getTicketValue()));
        target.setCashDifference(cashDiff);
        target.setTicketCountDifference(ticketCountDiff);
        target.setTicketValueDifference(ticketValueDiff);

        List<String> notes = new ArrayList<>();
        DiscrepancySeverity severity = severity(socialCash, game.getPrizepoolPaid(), cashDiff, ticketCountDiff, ticketValueDiff, notes);
        target.setSeverity(severity);
        target.setNotes(notes.isEmpty() ? null : String.join("; ", notes));
        target.setSuggestedAction(severity == DiscrepancySeverity.NONE ? null : MANUAL_REVIEW);
        return target;
    }

    DiscrepancySeverity severity(BigDecimal socialCash, BigDecimal gameCash, BigDecimal cashDiff,
                                 Integer ticketCountDiff, BigDecimal ticketValueDiff, List<String> notes) {
        BigDecimal tolerance = BigDecimal.valueOf(settings.getSocialCashTolerance());
        boolean major = false;
        boolean minor = false;
        if (cashDiff == null) {
            if (socialCash.signum() > 0) {
                notes.add("game prizepool paid unknown");
                minor = true;
            }
        } else if (cashDiff.abs().compareTo(tolerance) > 0) {
            notes.add("cash differs by " + cashDiff.toPlainString());
            BigDecimal majorAbsolute = BigDecimal.valueOf(settings.getSocialMajorCashAbsolute());
            BigDecimal majorRelative = gameCash.abs().multiply(BigDecimal.valueOf(settings.getSocialMajorCashPercent()));
            if (cashDiff.abs().compareTo(majorAbsolute) > 0 && cashDiff.abs().compareTo(majorRelative) > 0) major = true;
            else minor = true;
        }
        if (ticketCountDiff != null && ticketCountDiff != 0) {
            notes.add("ticket count differs by " + ticketCountDiff);
            major = true;
        }
        if (ticketValueDiff != null && ticketValueDiff.abs().compareTo(tolerance) > 0) {
            notes.add("ticket value differs by " + ticketValueDiff.toPlainString());
            minor = true;
        }
        if (major) return DiscrepancySeverity.MAJOR;
        return minor ? DiscrepancySeverity.MINOR : DiscrepancySeverity.NONE;
    }

    private static BigDecimal scale(BigDecimal v) {
        return v == null ? null : v.setScale(2, RoundingMode.HALF_UP);
    }
}
