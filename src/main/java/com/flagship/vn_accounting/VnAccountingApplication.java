package com.flagship.vn_accounting;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class VnAccountingApplication {

    public static void main(String[] args) {
        SpringApplication.run(VnAccountingApplication.class, args);
    }
}
