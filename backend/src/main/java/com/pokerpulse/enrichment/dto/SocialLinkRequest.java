package com.pokerpulse.enrichment.dto;

/** Manual link of a social post to a game. */
public class SocialLinkRequest {
    private Long gameId;
    private boolean primary = true;

    public Long getGameId() { return gameId; }
    public void setGameId(Long gameId) { this.gameId = gameId; }
    public boolean isPrimary() { return primary; }
    public void setPrimary(boolean primary) { this.primary = primary; }
}
