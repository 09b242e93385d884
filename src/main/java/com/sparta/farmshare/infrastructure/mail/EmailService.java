package com.sparta.farmshare.infrastructure.mail;

import com.sparta.farmshare.common.config.properties.FrontendProperties;
import com.sparta.farmshare.common.config.properties.MailProperties;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.util.HtmlUtils;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.text.NumberFormat;
import java.util.Locale;

/**
 * 메일 발송 서비스 (JavaMailSender, HTML)
 *
 * SMTP가 설정되지 않은 환경에서는 경고 로그만 남기고 false 반환.
 * 전송 실패는 EmailSendException으로 던진다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmailService {

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final MailProperties mailProperties;
    private final FrontendProperties frontendProperties;

    public boolean sendOtpEmail(String to, String name, String otp, long ttlMinutes) {
        String html = """
                <h2>Verify Your Email</h2>
                <p>Hi %s,</p>
                <p>Use the code below to verify your FarmShare account:</p>
                <p style="font-size:28px;font-weight:bold;letter-spacing:6px">%s</p>
                <p>This code expires in %d minutes. If you did not sign up, you can ignore this email.</p>
                """.formatted(escape(name), otp, ttlMinutes);
        String text = "Your FarmShare verification code is " + otp
                + ". It expires in " + ttlMinutes + " minutes.";

        return send(to, "Verify Your Email", html, text);
    }

    public boolean sendPasswordResetEmail(String to, String name, String resetToken) {
        String link = UriComponentsBuilder.fromHttpUrl(frontendProperties.url())
                .path("/reset-password")
                .queryParam("token", resetToken)
                .queryParam("email", to)
                .encode()
                .toUriString();

        String html = """
                <h2>Reset Your Password</h2>
                <p>Hi %s,</p>
                <p>We received a request to reset your password. Click the link below to choose a new one:</p>
                <p><a href="%s">Reset password</a></p>
                <p>This link expires in 1 hour. If you did not request a reset, you can ignore this email.</p>
                """.formatted(escape(name), link);
        String text = "Reset your FarmShare password: " + link + " (expires in 1 hour)";

        return send(to, "Reset Your Password", html, text);
    }

    public boolean sendAdminWelcomeEmail(String to, String name) {
        String html = """
                <h2>Welcome to FarmShare Admin</h2>
                <p>Hi %s,</p>
                <p>Your administrator account has been created.</p>
                """.formatted(escape(name));

        return send(to, "Welcome to FarmShare Admin", html, "Your FarmShare administrator account has been created.");
    }

    /**
     * 정산(송금) 상태 알림
     */
    public boolean sendPayoutStatusEmail(String to, String name, String subject, String statusLine,
                                         long netAmount, String reference) {
        String amount = "NGN " + NumberFormat.getNumberInstance(Locale.US).format(netAmount);
        String html = """
                <h2>%s</h2>
                <p>Hi %s,</p>
                <p>%s</p>
                <p>Amount: <strong>%s</strong><br/>Reference: %s</p>
                """.formatted(escape(subject), escape(name), escape(statusLine), amount, reference);
        String text = statusLine + " Amount: " + amount + ". Reference: " + reference;

        return send(to, subject, html, text);
    }

    /**
     * 임의 본문 발송 (뉴스레터)
     */
    public boolean sendCustomEmail(String to, String subject, String html, String text) {
        return send(to, subject, html, text);
    }

    private boolean send(String to, String subject, String html, String text) {
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (!isConfigured(mailSender)) {
            log.warn("[Mail] SMTP 미설정으로 메일 발송 생략 - to={}, subject={}", to, subject);
            return false;
        }

        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(mailProperties.fromAddress(), mailProperties.fromName());
            helper.setTo(to);
            helper.setSubject(subject);
            if (StringUtils.hasText(text)) {
                helper.setText(text, html);
            } else {
                helper.setText(html, true);
            }

            mailSender.send(message);
            log.info("[Mail] 발송 완료 - to={}, subject={}", to, subject);
            return true;
        } catch (MessagingException | UnsupportedEncodingException | MailException e) {
            log.error("[Mail] 발송 실패 - to={}, subject={}", to, subject, e);
            throw new EmailSendException(to, e);
        }
    }

    private boolean isConfigured(JavaMailSender mailSender) {
        if (mailSender == null) {
            return false;
        }
        if (mailSender instanceof JavaMailSenderImpl impl) {
            return StringUtils.hasText(impl.getHost());
        }
        return true;
    }

    private String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
