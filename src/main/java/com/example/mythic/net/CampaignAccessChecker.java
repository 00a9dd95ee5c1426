package com.example.mythic.net;

/**
 * Authorization collaborator: confirms a caller participates in a campaign
 * before any combat state is read.
 */
@FunctionalInterface
public interface CampaignAccessChecker {

    /**
     * @throws CampaignAccessException if the user is not a participant
     */
    void requireParticipant(String userId, String campaignId);
}
