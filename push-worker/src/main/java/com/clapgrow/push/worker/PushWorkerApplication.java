package com.clapgrow.push.worker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.kafka.annotation.EnableKafka;

@SpringBootApplication
@EnableKafka
public class PushWorkerApplication {
    public static void main(String[] args) {
        SpringApplication.run(PushWorkerApplication.class, args);
    }
}
