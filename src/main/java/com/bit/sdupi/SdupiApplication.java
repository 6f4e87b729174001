package com.bit.sdupi;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.sdupi")
public class SdupiApplication {
    public static void main(String[] args) {
        long start = System.currentTimeMillis();
        SpringApplication.run(SdupiApplication.class, args);
        log.info("启动耗时{}ms", System.currentTimeMillis() - start);
    }
    //金额统一使用最小单位（18位精度）
    //时间统一使用秒级时间戳
}
