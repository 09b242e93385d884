package com.sparta.farmshare.infrastructure.aop;

import org.aspectj.lang.ProceedingJoinPoint;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 락 안의 로직을 별도 트랜잭션으로 실행
 * 커밋이 끝난 뒤에 락이 풀려야 다음 요청이 커밋된 정산 상태를 본다
 */
@Component
public class LockTransactionExecutor {

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Object proceedInNewTransaction(ProceedingJoinPoint joinPoint) throws Throwable {
        return joinPoint.proceed();
    }
}
