package me.golemcore.spychat.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SpyDto {
    private String id;
    private String name;
    private String codename;
    private String biography;
    private String specialty;
    private String createdAt;
    private String updatedAt;
}
