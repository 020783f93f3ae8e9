package com.pokerpulse.enrichment.service;

import com.pokerpulse.enrichment.dto.RawGameRecordRequest;
import com.pokerpulse.enrichment.dto.SocialPostRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "pokerpulse.social.max-candidates=3")
@ActiveProfiles("test")
class SocialPostCandidateWindowIntegrationTest {

    private static final AtomicLong ENTITIES = new AtomicLong(29000);

    @Autowired private IngestionService ingestionService;
    @Autowired private SocialPostService socialPostService;
    @Autowired private VenueService venueService;

    private Long entityId;
    private Long joesId;

    @BeforeEach
    void setUp() {
        entityId = ENTITIES.incrementAndGet();
        joesId = venueService.findOrCreateVenue(entityId, "Joe's Card Room", null, null).entity().getId();
        venueService.findOrCreateVenue(entityId, "Crown Poker Lounge", null, null);
    }

    private Long ingestGame(String venue, int month, int day, int hour) {
        RawGameRecordRequest req = new RawGameRecordRequest(entityId,
                "https://example.test/" + entityId + "/" + venue.hashCode() + "/" + month + "-" + day + "-" + hour,
                "Daily Freezeout", venue, OffsetDateTime.of(2024, month, day, hour, 0, 0, 0, ZoneOffset.UTC));
        req.setBuyIn(new BigDecimal("100"));
        return ingestionService.enrichAndSave(entityId, req).gameId();
    }

    private SocialPostRequest resultsPost(Long venueHintId) {
        SocialPostRequest req = new SocialPostRequest();
        req.setExternalPostId("fb-window-" + entityId);
        req.setVenueName("Joe's Card Room");
        req.setVenueHintId(venueHintId);
        req.setDate(LocalDate.of(2024, 3, 2));
        req.setBuyIn(new BigDecimal("100"));
        req.setPlacements(List.of(new SocialPostRequest.Placement(1, "Alice", new BigDecimal("300"), null)));
        return req;
    }

    @Test
    void sameDayGameIsPrimaryWhenTheWindowOverflowsTheCap() {
        ingestGame("Joe's Card Room", 2, 28, 13);
        ingestGame("Joe's Card Room", 2, 29, 13);
        ingestGame("Joe's Card Room", 3, 1, 13);
        Long sameDay = ingestGame("Joe's Card Room", 3, 2, 13);

        SocialPostService.ReconcileResult result = socialPostService.ingest(entityId, resultsPost(null));

        assertThat(result.links()).hasSizeLessThanOrEqualTo(3);
        assertThat(result.links()).filteredOn(SocialPostService.LinkView::primary)
                .singleElement()
                .satisfies(l -> assertThat(l.gameId()).isEqualTo(sameDay));
    }

    @Test
    void hintedVenueGamesAreConsideredBeforeOtherVenues() {
        ingestGame("Crown Poker Lounge", 3, 2, 12);
        ingestGame("Crown Poker Lounge", 3, 2, 13);
        ingestGame("Crown Poker Lounge", 3, 2, 14);
        Long joes = ingestGame("Joe's Card Room", 3, 1, 13);

        SocialPostService.ReconcileResult result = socialPostService.ingest(entityId, resultsPost(joesId));

        assertThat(result.links()).extracting(SocialPostService.LinkView::gameId).contains(joes);
    }
}
