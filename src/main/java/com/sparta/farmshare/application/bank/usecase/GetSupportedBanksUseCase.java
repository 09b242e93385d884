package com.sparta.farmshare.application.bank.usecase;

import com.sparta.farmshare.application.bank.dto.SupportedBank;
import com.sparta.farmshare.application.bank.service.PaystackVerificationService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class GetSupportedBanksUseCase {

    private final PaystackVerificationService paystackVerificationService;

    public List<SupportedBank> execute() {
        return paystackVerificationService.getSupportedBanks();
    }
}
