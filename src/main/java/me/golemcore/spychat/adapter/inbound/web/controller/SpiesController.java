package me.golemcore.spychat.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spychat.adapter.inbound.web.dto.SpyDto;
import me.golemcore.spychat.adapter.inbound.web.dto.SpyRequest;
import me.golemcore.spychat.domain.model.Persona;
import me.golemcore.spychat.domain.service.PersonaService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Spy catalogue endpoints.
 */
@RestController
@RequestMapping("/api/spies")
@RequiredArgsConstructor
@Slf4j
public class SpiesController {

    private static final int MAX_PAGE_SIZE = 100;

    private final PersonaService personaService;

    @GetMapping
    public Mono<ResponseEntity<List<SpyDto>>> listSpies(
            @RequestParam(defaultValue = "0") int offset,
            @RequestParam(defaultValue = "20") int limit,
            @RequestParam(required = false) String specialty) {
        List<Persona> spies = specialty != null && !specialty.isBlank()
                ? personaService.searchBySpecialty(specialty)
                : personaService.list(Math.max(0, offset), Math.max(1, Math.min(limit, MAX_PAGE_SIZE)));
        return Mono.just(ResponseEntity.ok(spies.stream().map(this::toDto).toList()));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<SpyDto>> getSpy(@PathVariable String id) {
        Persona persona = personaService.resolvePersona(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Spy not found"));
        return Mono.just(ResponseEntity.ok(toDto(persona)));
    }

    @GetMapping("/codename/{codename}")
    public Mono<ResponseEntity<SpyDto>> getSpyByCodename(@PathVariable String codename) {
        Persona persona = personaService.findByCodename(codename)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Spy not found"));
        return Mono.just(ResponseEntity.ok(toDto(persona)));
    }

    @PostMapping
    public Mono<ResponseEntity<SpyDto>> createSpy(@RequestBody SpyRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        Persona created = personaService.create(toPersona(request));
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(created)));
    }

    @PutMapping("/{id}")
    public Mono<ResponseEntity<SpyDto>> updateSpy(@PathVariable String id, @RequestBody SpyRequest request) {
        if (request == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request body is required");
        }
        Persona updated = personaService.update(id, toPersona(request))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Spy not found"));
        return Mono.just(ResponseEntity.ok(toDto(updated)));
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteSpy(@PathVariable String id) {
        if (!personaService.delete(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Spy not found");
        }
        return Mono.just(ResponseEntity.noContent().build());
    }

    private Persona toPersona(SpyRequest request) {
        return Persona.builder()
                .name(request.getName())
                .codename(request.getCodename())
                .biography(request.getBiography())
                .specialty(request.getSpecialty())
                .build();
    }

    private SpyDto toDto(Persona persona) {
        return SpyDto.builder()
                .id(persona.getId())
                .name(persona.getName())
                .codename(persona.getCodename())
                .biography(persona.getBiography())
                .specialty(persona.getSpecialty())
                .createdAt(persona.getCreatedAt() != null ? persona.getCreatedAt().toString() : null)
                .updatedAt(persona.getUpdatedAt() != null ? persona.getUpdatedAt().toString() : null)
                .build();
    }
}
