package com.sparta.farmshare.infrastructure.aop.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.util.concurrent.TimeUnit;

/**
 * Redisson 분산 락 어노테이션
 * key는 SpEL로 평가되며 "lock:" prefix가 붙는다
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface DistributedLock {

    /**
     * 락 이름 (SpEL)
     */
    String key();

    TimeUnit timeUnit() default TimeUnit.SECONDS;

    /**
     * 락 획득 대기 시간
     */
    long waitTime() default 10L;

    /**
     * 락 임대 시간, 지나면 자동 해제
     */
    long leaseTime() default 3L;
}
