package com.sparta.farmshare.application.payout.support;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;

/**
 * 정산 reference 생성: fs_<판매자ID 앞 8자>_<epochMillis>_<랜덤 6자>
 */
@Component
public class PayoutReferenceGenerator {

    private static final String ALPHABET = "abcdefghijklmnopqrstuvwxyz0123456789";
    private static final int RANDOM_LENGTH = 6;
    private static final int VENDOR_PREFIX_LENGTH = 8;

    private final SecureRandom random = new SecureRandom();
    private final Clock clock;

    public PayoutReferenceGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate(String vendorId) {
        String vendorPrefix = vendorId.replace("-", "");
        if (vendorPrefix.length() > VENDOR_PREFIX_LENGTH) {
            vendorPrefix = vendorPrefix.substring(0, VENDOR_PREFIX_LENGTH);
        }

        StringBuilder suffix = new StringBuilder(RANDOM_LENGTH);
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return "fs_" + vendorPrefix + "_" + clock.millis() + "_" + suffix;
    }
}
