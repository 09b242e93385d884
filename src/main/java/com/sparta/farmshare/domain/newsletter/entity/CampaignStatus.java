package com.sparta.farmshare.domain.newsletter.entity;

public enum CampaignStatus {
    QUEUED,
    SENDING,
    COMPLETED
}
