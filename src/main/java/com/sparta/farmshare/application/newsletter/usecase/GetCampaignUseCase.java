package com.sparta.farmshare.application.newsletter.usecase;

import com.sparta.farmshare.application.newsletter.dto.CampaignResponse;
import com.sparta.farmshare.domain.newsletter.exception.CampaignNotFoundException;
import com.sparta.farmshare.domain.newsletter.repository.NewsletterCampaignRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class GetCampaignUseCase {

    private final NewsletterCampaignRepository campaignRepository;

    @Transactional(readOnly = true)
    public CampaignResponse execute(Long campaignId) {
        return campaignRepository.findById(campaignId)
                .map(CampaignResponse::from)
                .orElseThrow(CampaignNotFoundException::new);
    }
}
