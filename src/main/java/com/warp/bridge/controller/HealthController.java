package com.warp.bridge.controller;

import com.alibaba.fastjson2.JSONObject;
import com.warp.bridge.auth.Credential;
import com.warp.bridge.auth.CredentialManager;
import com.warp.bridge.session.SessionRegistry;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Optional;

/**
 * 健康检查端点
 */
@RestController
public class HealthController {

    private final CredentialManager credentialManager;
    private final SessionRegistry sessions;
    private final Clock clock;

    public HealthController(CredentialManager credentialManager, SessionRegistry sessions, Clock clock) {
        this.credentialManager = credentialManager;
        this.sessions = sessions;
        this.clock = clock;
    }

    @GetMapping(value = "/healthz", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> health() {
        Optional<Credential> credential = credentialManager.current();
        JSONObject result = new JSONObject();
        result.put("status", "ok");
        result.put("version", "1.0.0");
        result.put("credential", JSONObject.of( //
                "present", credential.isPresent(), //
                "expiresAt", credential.map(c -> c.expiresAt().toString()).orElse(null), //
                "expired", credential.map(c -> !c.expiresAt().isAfter(clock.instant())).orElse(true) //
        ));
        result.put("sessions", sessions.size());
        return Mono.just(result.toJSONString());
    }

    @GetMapping(value = "/", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<String> root() {
        JSONObject result = JSONObject.of(
                "service", "warp-bridge-java", //
                "status", "running", //
                "endpoints", JSONObject.of( //
                        "chat_completions", "/v1/chat/completions", //
                        "models", "/v1/models", //
                        "usage", "/v1/usage", //
                        "health", "/healthz" //
                ) //
        );
        return Mono.just(result.toJSONString());
    }
}
