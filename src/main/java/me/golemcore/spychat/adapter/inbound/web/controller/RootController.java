package me.golemcore.spychat.adapter.inbound.web.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
public class RootController {

    @GetMapping("/")
    public Mono<ResponseEntity<Map<String, String>>> root() {
        return Mono.just(ResponseEntity.ok(Map.of("message", "Welcome to the Spy Chat API")));
    }
}
