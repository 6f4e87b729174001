package com.bit.sdupi.aop;

import com.bit.sdupi.aop.annotation.AdminOperation;
import com.bit.sdupi.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Pointcut;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;
import java.util.Arrays;

@Slf4j
@Aspect
@Component
public class AdminAuditAspect {

    /**
     * 设置切入点 在注解的位置切入代码
     */
    @Pointcut("@annotation(com.bit.sdupi.aop.annotation.AdminOperation)")
    public void adminPointCut() {}

    @Around(value = "adminPointCut()")
    public Object around(ProceedingJoinPoint pjp) throws Throwable {
        MethodSignature signature = (MethodSignature) pjp.getSignature();
        Method method = signature.getMethod();
        AdminOperation annotation = method.getAnnotation(AdminOperation.class);
        String operation = annotation.value().isEmpty() ? method.getName() : annotation.value();
        long start = System.currentTimeMillis();
        Object result = pjp.proceed();
        long cost = System.currentTimeMillis() - start;
        if (result instanceof Result<?> r && !r.isSuccess()) {
            log.warn("[审计] 管理操作失败: {} 参数: {} 原因: {} 耗时{}ms",
                    operation, Arrays.toString(pjp.getArgs()), r.getMessage(), cost);
        } else {
            log.info("[审计] 管理操作: {} 参数: {} 耗时{}ms", operation, Arrays.toString(pjp.getArgs()), cost);
        }
        return result;
    }
}
