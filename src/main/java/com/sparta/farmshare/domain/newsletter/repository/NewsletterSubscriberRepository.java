package com.sparta.farmshare.domain.newsletter.repository;

import com.sparta.farmshare.domain.newsletter.entity.NewsletterSubscriber;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface NewsletterSubscriberRepository extends JpaRepository<NewsletterSubscriber, Long> {

    Optional<NewsletterSubscriber> findByEmail(String email);

    Page<NewsletterSubscriber> findByActiveTrue(Pageable pageable);

    long countByActive(boolean active);

    long countByActiveTrueAndSubscribedAtGreaterThanEqual(LocalDateTime since);

    @Query("SELECT s.email FROM NewsletterSubscriber s WHERE s.active = true ORDER BY s.id")
    List<String> findActiveEmails();

    /**
     * 태그 중 하나라도 가진 활성 구독자
     */
    @Query("SELECT DISTINCT s.email FROM NewsletterSubscriber s JOIN s.tags t " +
            "WHERE s.active = true AND t IN :tags")
    List<String> findActiveEmailsByAnyTag(@Param("tags") Collection<String> tags);
}
