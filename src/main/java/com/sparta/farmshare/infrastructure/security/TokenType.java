package com.sparta.farmshare.infrastructure.security;

/**
 * JWT type 클레임 값
 */
public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    public String getClaimValue() {
        return claimValue;
    }

    public static TokenType fromClaim(String value) {
        for (TokenType type : values()) {
            if (type.claimValue.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown token type: " + value);
    }
}
