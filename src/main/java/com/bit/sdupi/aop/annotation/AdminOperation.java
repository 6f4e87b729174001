package com.bit.sdupi.aop.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 管理操作注解：标注的接口调用会记录审计日志（操作人、参数、耗时、结果）
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface AdminOperation {

    /**
     * 操作名称
     */
    String value() default "";
}
