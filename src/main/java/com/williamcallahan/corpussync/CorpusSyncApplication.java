package com.williamcallahan.corpussync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CorpusSyncApplication {

    public static void main(String[] args) {
        // Disable Netty native OpenSSL (tcnative) to avoid Alpine musl segfaults
        System.setProperty("io.grpc.netty.shaded.io.netty.handler.ssl.noOpenSsl", "true");
        SpringApplication.run(CorpusSyncApplication.class, args);
    }
}
