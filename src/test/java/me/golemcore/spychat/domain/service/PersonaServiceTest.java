package me.golemcore.spychat.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.spychat.domain.model.Persona;
import me.golemcore.spychat.infrastructure.config.AutoConfiguration;
import me.golemcore.spychat.infrastructure.config.SpyChatProperties;
import me.golemcore.spychat.testsupport.InMemoryStoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PersonaServiceTest {

    private static final String DIR = "personas";
    private static final Instant NOW = Instant.parse("2026-02-14T00:00:00Z");

    private InMemoryStoragePort storage;
    private ObjectMapper objectMapper;
    private SpyChatProperties properties;
    private PersonaService service;

    @BeforeEach
    void setUp() {
        storage = new InMemoryStoragePort();
        objectMapper = AutoConfiguration.objectMapper();
        properties = new SpyChatProperties();
        service = newService();
    }

    private PersonaService newService() {
        return new PersonaService(storage, objectMapper, Clock.fixed(NOW, ZoneId.of("UTC")), properties);
    }

    private static Persona draft(String id, String name, String codename, String specialty) {
        return Persona.builder()
                .id(id)
                .name(name)
                .codename(codename)
                .biography("Trained in Vienna")
                .specialty(specialty)
                .build();
    }

    // ==================== create ====================

    @Test
    void shouldCreateAndPersistSpy() throws Exception {
        Persona created = service.create(draft("spy-7", "Natasha Volkova", "Nightingale", "Infiltration"));

        assertEquals("spy-7", created.getId());
        assertEquals(NOW, created.getCreatedAt());
        assertTrue(service.resolvePersona("spy-7").isPresent());
        JsonNode stored = objectMapper.readTree(storage.read(DIR, "spy-7.json"));
        assertEquals("Nightingale", stored.get("codename").asText());
    }

    @Test
    void shouldGenerateIdWhenMissing() {
        Persona created = service.create(draft(null, "Harold Finch", "Bookkeeper", "Finance"));

        assertNotNull(created.getId());
        assertFalse(created.getId().isBlank());
    }

    @Test
    void shouldRejectMissingNameOrCodename() {
        assertThrows(IllegalArgumentException.class,
                () -> service.create(draft(null, " ", "Ghost", null)));
        assertThrows(IllegalArgumentException.class,
                () -> service.create(draft(null, "Nameless", null, null)));
        assertThrows(IllegalArgumentException.class, () -> service.create(null));
    }

    @Test
    void shouldRejectDuplicateCodenameIgnoringCase() {
        service.create(draft("spy-7", "Natasha Volkova", "Nightingale", "Infiltration"));

        assertThrows(IllegalStateException.class,
                () -> service.create(draft("spy-8", "Other", " nightingale ", null)));
    }

    @Test
    void shouldRejectDuplicateId() {
        service.create(draft("spy-7", "Natasha Volkova", "Nightingale", "Infiltration"));

        assertThrows(IllegalStateException.class,
                () -> service.create(draft("spy-7", "Copy", "Mockingbird", null)));
    }

    // ==================== update / delete ====================

    @Test
    void shouldApplyOnlyProvidedFieldsOnUpdate() {
        service.create(draft("spy-7", "Natasha Volkova", "Nightingale", "Infiltration"));

        Persona updated = service.update("spy-7", Persona.builder().specialty("Cryptography").build())
                .orElseThrow();

        assertEquals("Natasha Volkova", updated.getName());
        assertEquals("Nightingale", updated.getCodename());
        assertEquals("Cryptography", updated.getSpecialty());
    }

    @Test
    void shouldAllowKeepingOwnCodenameOnUpdate() {
        service.create(draft("spy-7", "Natasha Volkova", "Nightingale", "Infiltration"));

        assertTrue(service.update("spy-7", Persona.builder().codename("NIGHTINGALE").build()).isPresent());
    }

    @Test
    void shouldReturnEmptyWhenUpdatingUnknownSpy() {
        assertTrue(service.update("ghost", Persona.builder().name("x").build()).isEmpty());
    }

    @Test
    void shouldDeleteSpy() {
        service.create(draft("spy-7", "Natasha Volkova", "Nightingale", "Infiltration"));

        assertTrue(service.delete("spy-7"));

        assertTrue(service.resolvePersona("spy-7").isEmpty());
        assertNull(storage.read(DIR, "spy-7.json"));
        assertFalse(service.delete("spy-7"));
    }

    // ==================== queries ====================

    @Test
    void shouldFindByCodenameAndSearchBySpecialty() {
        service.create(draft("spy-7", "Natasha Volkova", "Nightingale", "Infiltration"));
        service.create(draft("spy-12", "Harold Finch", "Bookkeeper", "Financial intelligence"));
        service.create(draft("spy-3", "Anna Chapman", "Sparrow", "Signals intelligence"));

        assertEquals("spy-12", service.findByCodename("bookkeeper").orElseThrow().getId());
        assertTrue(service.findByCodename("Unknown").isEmpty());
        List<Persona> intel = service.searchBySpecialty("INTELLIGENCE");
        assertEquals(List.of("Anna Chapman", "Harold Finch"), intel.stream().map(Persona::getName).toList());
        assertTrue(service.searchBySpecialty(" ").isEmpty());
    }

    @Test
    void shouldPageList() {
        service.create(draft("a", "A", "Alpha", null));
        service.create(draft("b", "B", "Bravo", null));
        service.create(draft("c", "C", "Charlie", null));

        assertEquals(List.of("a", "b"), service.list(0, 2).stream().map(Persona::getId).toList());
        assertEquals(List.of("c"), service.list(2, 2).stream().map(Persona::getId).toList());
    }

    // ==================== init ====================

    @Test
    void shouldLoadStoredSpiesAndSeedConfiguredOnes() {
        storage.seed(DIR, "spy-7.json", "{\"name\":\"Natasha Volkova\",\"codename\":\"Nightingale\"}");
        storage.seed(DIR, "broken.json", "{not json");
        SpyChatProperties.PersonaSeed existing = new SpyChatProperties.PersonaSeed();
        existing.setId("spy-7");
        existing.setName("Someone Else");
        existing.setCodename("Other");
        SpyChatProperties.PersonaSeed fresh = new SpyChatProperties.PersonaSeed();
        fresh.setId("spy-12");
        fresh.setName("Harold Finch");
        fresh.setCodename("Bookkeeper");
        SpyChatProperties.PersonaSeed invalid = new SpyChatProperties.PersonaSeed();
        invalid.setId("spy-99");
        properties.setPersonas(List.of(existing, fresh, invalid));

        service.init();

        assertEquals("Natasha Volkova", service.resolvePersona("spy-7").orElseThrow().getName());
        assertEquals("Harold Finch", service.resolvePersona("spy-12").orElseThrow().getName());
        assertTrue(service.resolvePersona("spy-99").isEmpty());
        assertTrue(service.resolvePersona("broken").isEmpty());
    }
}
