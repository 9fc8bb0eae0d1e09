package com.warp.bridge;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WarpBridgeApplication {

    private static final Logger log = LoggerFactory.getLogger(WarpBridgeApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(WarpBridgeApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("╔═══════════════════════════════════════════════════╗");
        log.info("║            Warp Bridge Java v1.0.0                ║");
        log.info("║       OpenAI Compatible Warp Multi-Agent API      ║");
        log.info("╚═══════════════════════════════════════════════════╝");
        log.info("API 端点:");
        log.info("  POST /v1/chat/completions");
        log.info("  GET  /v1/models");
        log.info("  GET  /v1/usage");
        log.info("  GET  /healthz");
    }
}
