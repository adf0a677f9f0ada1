package me.golemcore.spychat.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.spychat.domain.model.Persona;
import me.golemcore.spychat.infrastructure.config.SpyChatProperties;
import me.golemcore.spychat.port.outbound.PersonaPort;
import me.golemcore.spychat.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Catalogue of spies, persisted as {@code personas/<id>.json}. Codenames are
 * unique (case-insensitive).
 */
@Service
@Slf4j
public class PersonaService implements PersonaPort {

    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final SpyChatProperties properties;
    private final String directory;

    private final Map<String, Persona> personaCache = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    public PersonaService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            SpyChatProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties;
        this.directory = properties.getStorage().getDirectories().getPersonas();
    }

    @PostConstruct
    public void init() {
        try {
            storagePort.ensureDirectory(directory).join();
            List<String> files = storagePort.listObjects(directory, "").join();
            for (String file : files) {
                if (file.endsWith(JSON_EXTENSION)) {
                    loadFile(file);
                }
            }
            seedConfiguredPersonas();
            log.info("[Personas] {} spies available", personaCache.size());
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Personas] Failed to load personas: {}", e.getMessage());
        }
    }

    @Override
    public Optional<Persona> resolvePersona(String personaId) {
        if (personaId == null || personaId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(personaCache.get(personaId));
    }

    /**
     * Creates a spy.
     *
     * @throws IllegalArgumentException
     *             if name or codename is missing
     * @throws IllegalStateException
     *             if the codename is already taken
     */
    public Persona create(Persona draft) {
        validate(draft);
        synchronized (writeLock) {
            ensureCodenameAvailable(draft.getCodename(), null);
            Instant now = clock.instant();
            String id = draft.getId() != null && !draft.getId().isBlank()
                    ? draft.getId().trim()
                    : UUID.randomUUID().toString();
            if (personaCache.containsKey(id)) {
                throw new IllegalStateException("Spy already exists: " + id);
            }
            Persona persona = draft.toBuilder()
                    .id(id)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            save(persona);
            log.info("[Personas] Created spy {} ({})", persona.getName(), persona.getCodename());
            return persona;
        }
    }

    /**
     * Applies non-null fields of {@code changes} to an existing spy.
     */
    public Optional<Persona> update(String personaId, Persona changes) {
        synchronized (writeLock) {
            Persona existing = personaCache.get(personaId);
            if (existing == null) {
                return Optional.empty();
            }
            if (changes.getCodename() != null) {
                ensureCodenameAvailable(changes.getCodename(), personaId);
            }
            Persona updated = existing.toBuilder()
                    .name(changes.getName() != null ? changes.getName() : existing.getName())
                    .codename(changes.getCodename() != null ? changes.getCodename() : existing.getCodename())
                    .biography(changes.getBiography() != null ? changes.getBiography() : existing.getBiography())
                    .specialty(changes.getSpecialty() != null ? changes.getSpecialty() : existing.getSpecialty())
                    .updatedAt(clock.instant())
                    .build();
            validate(updated);
            save(updated);
            return Optional.of(updated);
        }
    }

    public boolean delete(String personaId) {
        synchronized (writeLock) {
            Persona removed = personaCache.remove(personaId);
            if (removed == null) {
                return false;
            }
            storagePort.deleteObject(directory, personaId + JSON_EXTENSION).join();
            log.info("[Personas] Deleted spy {}", personaId);
            return true;
        }
    }

    public List<Persona> list(int offset, int limit) {
        return personaCache.values().stream()
                .sorted(Comparator.comparing(Persona::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(Persona::getId))
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .toList();
    }

    public Optional<Persona> findByCodename(String codename) {
        if (codename == null || codename.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(codename);
        return personaCache.values().stream()
                .filter(persona -> normalize(persona.getCodename()).equals(normalized))
                .findFirst();
    }

    public List<Persona> searchBySpecialty(String specialty) {
        if (specialty == null || specialty.isBlank()) {
            return List.of();
        }
        String needle = normalize(specialty);
        return personaCache.values().stream()
                .filter(persona -> persona.getSpecialty() != null
                        && normalize(persona.getSpecialty()).contains(needle))
                .sorted(Comparator.comparing(Persona::getName, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    private void seedConfiguredPersonas() {
        for (SpyChatProperties.PersonaSeed seed : properties.getPersonas()) {
            if (seed.getId() == null || seed.getId().isBlank() || personaCache.containsKey(seed.getId())) {
                continue;
            }
            try {
                create(Persona.builder()
                        .id(seed.getId())
                        .name(seed.getName())
                        .codename(seed.getCodename())
                        .biography(seed.getBiography())
                        .specialty(seed.getSpecialty())
                        .build());
            } catch (IllegalArgumentException | IllegalStateException e) {
                log.warn("[Personas] Skipping seed {}: {}", seed.getId(), e.getMessage());
            }
        }
    }

    private void loadFile(String file) {
        String json = storagePort.getText(directory, file).join();
        if (json == null || json.isBlank()) {
            return;
        }
        try {
            Persona persona = objectMapper.readValue(json, Persona.class);
            String id = file.substring(0, file.length() - JSON_EXTENSION.length());
            persona.setId(id);
            personaCache.put(id, persona);
        } catch (JsonProcessingException e) {
            log.warn("[Personas] Unreadable persona file {}: {}", file, e.getOriginalMessage());
        }
    }

    private void save(Persona persona) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(persona);
            storagePort.putTextAtomic(directory, persona.getId() + JSON_EXTENSION, json, false).join();
            personaCache.put(persona.getId(), persona);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize spy " + persona.getId(), e);
        }
    }

    private void validate(Persona persona) {
        if (persona == null) {
            throw new IllegalArgumentException("Spy is required");
        }
        if (persona.getName() == null || persona.getName().isBlank()) {
            throw new IllegalArgumentException("Spy name is required");
        }
        if (persona.getCodename() == null || persona.getCodename().isBlank()) {
            throw new IllegalArgumentException("Spy codename is required");
        }
    }

    private void ensureCodenameAvailable(String codename, String ownId) {
        findByCodename(codename)
                .filter(other -> !other.getId().equals(ownId))
                .ifPresent(other -> {
                    throw new IllegalStateException("Codename already in use: " + codename);
                });
    }

    private String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
