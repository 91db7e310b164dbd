package com.nationrank.api.model.readonly;

/**
 * One player row embedded in a {@link MatchDocument}.
 */
public class MatchPlayerEntry {

    private String userId;
    private Integer teamId;
    private String partyId;
    private Double skill;
    private Double uncertainty;

    public MatchPlayerEntry() {
    }

    public MatchPlayerEntry(String userId, Integer teamId, String partyId, Double skill, Double uncertainty) {
        this.userId = userId;
        this.teamId = teamId;
        this.partyId = partyId;
        this.skill = skill;
        this.uncertainty = uncertainty;
    }

    public String getUserId() { return userId; }
    public Integer getTeamId() { return teamId; }
    public String getPartyId() { return partyId; }
    public Double getSkill() { return skill; }
    public Double getUncertainty() { return uncertainty; }
}
