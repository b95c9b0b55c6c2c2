package com.example.presence.shared.aspect;

import com.example.presence.shared.config.MonitoringConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.stereotype.Component;

@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.PresenceMetricsCollector metricsCollector;

    @Around("@within(com.example.presence.shared.aspect.Monitored) || @annotation(com.example.presence.shared.aspect.Monitored)")
    public Object timeCollaboratorCall(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Monitored monitored = resolve(joinPoint, signature);
        if (monitored == null) {
            return joinPoint.proceed();
        }

        String collaborator = joinPoint.getTarget().getClass().getSimpleName();
        String operation = signature.getName();
        long start = System.currentTimeMillis();
        String outcome = "success";
        try {
            return joinPoint.proceed();
        } catch (Exception e) {
            outcome = "error";
            log.warn("{}.{} failed: {}", collaborator, operation, e.getMessage());
            throw e;
        } finally {
            long elapsed = System.currentTimeMillis() - start;
            String group = "presence." + monitored.value();
            metricsCollector.recordTimer(group + ".latency", elapsed,
                    "collaborator", collaborator, "operation", operation, "outcome", outcome);
            metricsCollector.incrementCounter(group + ".calls",
                    "collaborator", collaborator, "operation", operation, "outcome", outcome);
            if (elapsed > monitored.slowCallMillis()) {
                log.warn("Slow collaborator call {}.{} took {}ms", collaborator, operation, elapsed);
            } else {
                log.trace("{}.{} {} in {}ms", collaborator, operation, outcome, elapsed);
            }
        }
    }

    private static Monitored resolve(ProceedingJoinPoint joinPoint, MethodSignature signature) {
        Monitored onMethod = AnnotationUtils.findAnnotation(signature.getMethod(), Monitored.class);
        if (onMethod != null) {
            return onMethod;
        }
        return AnnotationUtils.findAnnotation(joinPoint.getTarget().getClass(), Monitored.class);
    }
}
