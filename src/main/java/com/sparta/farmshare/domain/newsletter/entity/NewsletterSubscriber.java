package com.sparta.farmshare.domain.newsletter.entity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 뉴스레터 구독자
 * 구독 해지 시 삭제하지 않고 비활성화한다 (재구독 시 이전 정보 유지)
 */
@Entity
@Table(name = "newsletter_subscribers", indexes = {
        @Index(name = "uk_newsletter_subscribers_email", columnList = "email", unique = true),
        @Index(name = "idx_newsletter_subscribers_active", columnList = "active, subscribed_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NewsletterSubscriber {

    public static final String DEFAULT_SOURCE = "footer";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String email;

    private String name;

    @Column(nullable = false, length = 50)
    private String source;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "newsletter_subscriber_tags", joinColumns = @JoinColumn(name = "subscriber_id"))
    @Column(name = "tag", length = 50)
    private Set<String> tags = new LinkedHashSet<>();

    private boolean active;

    @Column(name = "subscribed_at", nullable = false)
    private LocalDateTime subscribedAt;

    @Column(name = "unsubscribed_at")
    private LocalDateTime unsubscribedAt;

    public static NewsletterSubscriber subscribe(String email, String name, String source,
                                                 Collection<String> tags, LocalDateTime now) {
        return NewsletterSubscriber.builder()
                .email(email)
                .name(name)
                .source(hasText(source) ? source : DEFAULT_SOURCE)
                .tags(tags != null ? new LinkedHashSet<>(tags) : new LinkedHashSet<>())
                .active(true)
                .subscribedAt(now)
                .build();
    }

    /**
     * 재구독: 새 값이 주어진 항목만 덮어쓴다
     */
    public void reactivate(String name, String source, Collection<String> tags) {
        this.active = true;
        this.unsubscribedAt = null;
        if (hasText(name)) {
            this.name = name;
        }
        if (hasText(source)) {
            this.source = source;
        }
        if (tags != null) {
            this.tags.clear();
            this.tags.addAll(tags);
        }
    }

    public void unsubscribe(LocalDateTime now) {
        this.active = false;
        this.unsubscribedAt = now;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
