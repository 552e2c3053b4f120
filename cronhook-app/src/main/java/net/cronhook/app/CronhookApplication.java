package net.cronhook.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CronhookApplication {
    public static void main(String[] args) {
        SpringApplication.run(CronhookApplication.class, args);
    }
}
