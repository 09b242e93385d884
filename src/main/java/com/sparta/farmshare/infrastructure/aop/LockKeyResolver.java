package com.sparta.farmshare.infrastructure.aop;

import org.springframework.expression.EvaluationContext;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.StandardEvaluationContext;

/**
 * {@code @DistributedLock} key(SpEL)를 메서드 인자로 평가해 락 이름을 만든다
 * 예: {@code 'payout:vendor:'.concat(#request.vendorId())} → payout:vendor:3f2a...
 */
final class LockKeyResolver {

    private static final ExpressionParser PARSER = new SpelExpressionParser();

    private LockKeyResolver() {
    }

    static String resolve(String[] parameterNames, Object[] args, String expression) {
        EvaluationContext context = new StandardEvaluationContext();
        for (int i = 0; i < parameterNames.length; i++) {
            context.setVariable(parameterNames[i], args[i]);
        }

        String key = PARSER.parseExpression(expression).getValue(context, String.class);
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Lock key is empty for expression: " + expression);
        }
        return key;
    }
}
