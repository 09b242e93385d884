package com.sparta.farmshare.infrastructure.mail;

/**
 * SMTP 전송 실패
 * 치명 여부는 호출자가 판단한다
 */
public class EmailSendException extends RuntimeException {
    public EmailSendException(String to, Throwable cause) {
        super("Failed to send email to " + to, cause);
    }
}
