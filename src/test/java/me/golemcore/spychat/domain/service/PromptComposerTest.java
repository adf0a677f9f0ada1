package me.golemcore.spychat.domain.service;

import me.golemcore.spychat.domain.model.Persona;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertTrue;

class PromptComposerTest {

    private final PromptComposer composer = new PromptComposer();

    @Test
    void shouldIncludePersonaProfile() {
        String prompt = composer.compose(Persona.builder()
                .name("Natasha Volkova")
                .codename("Nightingale")
                .biography("Raised in Leningrad")
                .specialty("Infiltration")
                .build());

        assertTrue(prompt.startsWith("You are Natasha Volkova, a spy"));
        assertTrue(prompt.contains("Codename: Nightingale"));
        assertTrue(prompt.contains("Biography: Raised in Leningrad"));
        assertTrue(prompt.contains("Specialty: Infiltration"));
    }

    @Test
    void shouldDescribeMissionToolRules() {
        String prompt = composer.compose(Persona.builder().name("Harold Finch").build());

        assertTrue(prompt.contains("get_mission_context"));
        assertTrue(prompt.contains("explicitly gives a mission ID"));
    }

    @Test
    void shouldFallBackForMissingFields() {
        String prompt = composer.compose(Persona.builder().name("Ghost").build());

        assertTrue(prompt.contains("Codename: classified"));
        assertTrue(prompt.contains("Specialty: classified"));
    }
}
