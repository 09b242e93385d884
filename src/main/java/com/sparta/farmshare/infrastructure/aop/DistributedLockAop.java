package com.sparta.farmshare.infrastructure.aop;

import com.sparta.farmshare.domain.common.exception.LockAcquisitionException;
import com.sparta.farmshare.infrastructure.aop.annotation.DistributedLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

/**
 * @DistributedLock 처리 Aspect
 *
 * 1. SpEL로 락 키 생성
 * 2. 락 획득 (waitTime 동안 대기)
 * 3. 새 트랜잭션에서 비즈니스 로직 실행 (커밋 후 락 해제)
 * 4. 락 해제
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class DistributedLockAop {

    private static final String REDISSON_LOCK_PREFIX = "lock:";

    private final RedissonClient redissonClient;
    private final LockTransactionExecutor lockTransactionExecutor;

    @Around("@annotation(com.sparta.farmshare.infrastructure.aop.annotation.DistributedLock)")
    public Object lock(final ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();
        DistributedLock distributedLock = method.getAnnotation(DistributedLock.class);

        String key = REDISSON_LOCK_PREFIX + LockKeyResolver.resolve(
                signature.getParameterNames(), joinPoint.getArgs(), distributedLock.key());
        RLock rLock = redissonClient.getLock(key);

        try {
            boolean available = rLock.tryLock(
                    distributedLock.waitTime(), distributedLock.leaseTime(), distributedLock.timeUnit());
            if (!available) {
                log.warn("[분산 락] 락 획득 실패 - key={}", key);
                throw new LockAcquisitionException();
            }

            log.debug("[분산 락] 락 획득 - key={}", key);
            return lockTransactionExecutor.proceedInNewTransaction(joinPoint);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(e);
        } finally {
            if (rLock.isHeldByCurrentThread()) {
                rLock.unlock();
                log.debug("[분산 락] 락 해제 - key={}", key);
            }
        }
    }
}
