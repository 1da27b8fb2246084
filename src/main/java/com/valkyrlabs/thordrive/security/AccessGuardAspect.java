package com.valkyrlabs.thordrive.security;

import java.lang.reflect.Method;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.support.AopUtils;
import org.springframework.context.expression.MethodBasedEvaluationContext;
import org.springframework.core.BridgeMethodResolver;
import org.springframework.core.DefaultParameterNameDiscoverer;
import org.springframework.core.ParameterNameDiscoverer;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.core.annotation.Order;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.stereotype.Component;

import com.valkyrlabs.thordrive.config.ThorDriveProperties;

/**
 * Authorize-then-run wrapper for {@link AccessGuarded} operations.
 *
 * <p>
 * Takes the hierarchy lock (exclusive for mutating operations, shared for
 * reads), evaluates every {@link RequiresAccess} against the call arguments
 * and asks the {@link AccessResolver} to enforce it. The operation body only
 * runs once all requirements have passed, so a denied call never writes.
 * </p>
 *
 * <p>
 * Ordered ahead of the transaction advice: lock and checks wrap the whole
 * transaction.
 * </p>
 */
@Aspect
@Component
@Order(AccessGuardAspect.ORDER)
public class AccessGuardAspect {

    public static final int ORDER = 0;

    private static final Logger logger = LoggerFactory.getLogger(AccessGuardAspect.class);

    private final AccessResolver accessResolver;
    private final ReentrantReadWriteLock hierarchyLock;

    private final ExpressionParser parser = new SpelExpressionParser();
    private final ParameterNameDiscoverer parameterNames = new DefaultParameterNameDiscoverer();
    private final Map<String, Expression> expressions = new ConcurrentHashMap<>();

    public AccessGuardAspect(AccessResolver accessResolver, ThorDriveProperties properties) {
        this.accessResolver = accessResolver;
        this.hierarchyLock = new ReentrantReadWriteLock(properties.getLock().isFair());
    }

    @Around("@annotation(com.valkyrlabs.thordrive.security.AccessGuarded)")
    public Object guard(ProceedingJoinPoint pjp) throws Throwable {
        Method method = resolveMethod(pjp);
        AccessGuarded guarded = AnnotationUtils.findAnnotation(method, AccessGuarded.class);
        if (guarded == null) {
            // matched through a proxy we cannot resolve back to the annotated method
            throw new IllegalStateException("No @AccessGuarded on " + method);
        }

        Lock lock = guarded.mutates() ? hierarchyLock.writeLock() : hierarchyLock.readLock();
        lock.lock();
        try {
            RequiresAccess[] requirements = guarded.value();
            if (requirements.length > 0) {
                EvaluationContext context = new MethodBasedEvaluationContext(pjp.getTarget(), method, pjp.getArgs(),
                        parameterNames);
                for (RequiresAccess requirement : requirements) {
                    enforce(requirement, context, method);
                }
            }
            logger.trace("Guards passed for {}", method.getName());
            return pjp.proceed();
        } finally {
            lock.unlock();
        }
    }

    private void enforce(RequiresAccess requirement, EvaluationContext context, Method method) {
        String nodeId = evaluate(requirement.node(), context);
        if (nodeId == null && requirement.optional()) {
            logger.trace("{}: optional {} requirement {} is null, skipping", method.getName(),
                    requirement.kind().toValue(), requirement.node());
            return;
        }
        String userId = evaluate(requirement.user(), context);
        logger.trace("{}: requiring {} access to {} {}", method.getName(), userId, requirement.kind().toValue(),
                nodeId);
        accessResolver.requireAccess(userId, nodeId, requirement.kind());
    }

    private String evaluate(String expression, EvaluationContext context) {
        Object value = expressions.computeIfAbsent(expression, parser::parseExpression).getValue(context);
        return value != null ? value.toString() : null;
    }

    private static Method resolveMethod(ProceedingJoinPoint pjp) {
        Method method = ((MethodSignature) pjp.getSignature()).getMethod();
        if (pjp.getTarget() != null) {
            method = AopUtils.getMostSpecificMethod(method, pjp.getTarget().getClass());
        }
        return BridgeMethodResolver.findBridgedMethod(method);
    }
}
