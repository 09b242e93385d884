package com.sparta.farmshare.domain.common.exception;

import org.springframework.http.HttpStatus;

/**
 * 에러 코드 정의
 * 코드, HTTP 상태, 클라이언트에 내려가는 기본 메시지
 */
public enum ErrorCode {
    // 인증 관련 에러
    A001("A001", HttpStatus.UNAUTHORIZED, "Invalid email or password"),
    A002("A002", HttpStatus.FORBIDDEN, "Your account has been suspended. Please contact support."),
    A003("A003", HttpStatus.FORBIDDEN, "Please verify your email before logging in"),
    A004("A004", HttpStatus.BAD_REQUEST, "Invalid OTP"),
    A005("A005", HttpStatus.BAD_REQUEST, "OTP has expired. Please request a new one."),
    A006("A006", HttpStatus.NOT_FOUND, "No pending signup found for this email"),
    A007("A007", HttpStatus.CONFLICT, "An account with this email already exists"),
    A008("A008", HttpStatus.UNAUTHORIZED, "Invalid refresh token"),
    A009("A009", HttpStatus.BAD_REQUEST, "Invalid or expired reset token"),
    A010("A010", HttpStatus.UNAUTHORIZED, "Authentication required"),
    A011("A011", HttpStatus.UNAUTHORIZED, "Invalid or expired token"),
    A012("A012", HttpStatus.FORBIDDEN, "Access denied"),
    A013("A013", HttpStatus.FORBIDDEN, "Invalid admin secret key"),
    A014("A014", HttpStatus.BAD_GATEWAY, "Google authentication failed"),
    A015("A015", HttpStatus.BAD_REQUEST, "Passwords do not match"),
    A016("A016", HttpStatus.INTERNAL_SERVER_ERROR, "Frontend URL is not configured"),
    A017("A017", HttpStatus.BAD_REQUEST, "Role must be BUYER or VENDOR"),

    // 사용자 관련 에러
    U001("U001", HttpStatus.NOT_FOUND, "User not found"),

    // 보안 정책 관련 에러
    S001("S001", HttpStatus.TOO_MANY_REQUESTS, "Too many requests. Please wait a minute before trying again."),

    // 뉴스레터 관련 에러
    N001("N001", HttpStatus.CONFLICT, "This email is already subscribed to our newsletter."),
    N002("N002", HttpStatus.NOT_FOUND, "Email not found in our newsletter list."),
    N003("N003", HttpStatus.NOT_FOUND, "Newsletter campaign not found"),

    // 은행 계좌 인증 관련 에러
    B001("B001", HttpStatus.BAD_REQUEST, "Bank verification failed. Please try again."),
    B002("B002", HttpStatus.SERVICE_UNAVAILABLE, "Bank verification service temporarily unavailable"),

    // 정산(송금) 관련 에러
    PO001("PO001", HttpStatus.NOT_FOUND, "Payout not found"),
    PO002("PO002", HttpStatus.BAD_REQUEST, "Vendor is not eligible for payout"),
    PO003("PO003", HttpStatus.BAD_GATEWAY, "Payout provider request failed"),

    // 결제 관련 에러
    PAY001("PAY001", HttpStatus.NOT_FOUND, "Payment not found"),
    PAY002("PAY002", HttpStatus.BAD_GATEWAY, "Payment provider request failed"),
    PAY003("PAY003", HttpStatus.UNAUTHORIZED, "Invalid webhook signature"),

    // 공통 에러
    COMMON001("COMMON001", HttpStatus.BAD_REQUEST, "Required parameter is missing or invalid"),
    COMMON002("COMMON002", HttpStatus.BAD_REQUEST, "Malformed request"),
    COMMON003("COMMON003", HttpStatus.CONFLICT, "Request conflicted with another update. Please try again."),
    COMMON004("COMMON004", HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error"),
    COMMON005("COMMON005", HttpStatus.CONFLICT, "Another request is being processed. Please try again shortly.");

    private final String code;
    private final HttpStatus status;
    private final String message;

    ErrorCode(String code, HttpStatus status, String message) {
        this.code = code;
        this.status = status;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
