package com.example.mythic.net;

/**
 * Raised when a caller asks to resolve combat in a campaign they do not belong to.
 */
public class CampaignAccessException extends RuntimeException {

    public CampaignAccessException(String message) {
        super(message);
    }
}
