package com.siat.siat_backend.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siat.siat_backend.model.domain.SiatTemplate;
import com.siat.siat_backend.repository.SiatTemplateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Upserts the read-only system templates by name. Existing rows are refreshed in place.
 */
@Slf4j
@Component
@Order(2)
@RequiredArgsConstructor
public class SystemTemplateSeeder implements ApplicationRunner {

    static final String SEED_RESOURCE = "siat/system-templates.json";

    private final SiatTemplateRepository templateRepo;
    private final ObjectMapper objectMapper;

    @Value("${siat.templates.seed:true}")
    private boolean enabled;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (!enabled) {
            log.info("[Seed] System template seeding disabled");
            return;
        }
        List<SeedTemplate> seeds;
        try (InputStream in = new ClassPathResource(SEED_RESOURCE).getInputStream()) {
            seeds = objectMapper.readValue(in, new TypeReference<>() {});
        }

        int created = 0;
        for (SeedTemplate seed : seeds) {
            SiatTemplate template = templateRepo.findFirstByNameAndSystemTrue(seed.name()).orElse(null);
            if (template == null) {
                template = new SiatTemplate();
                template.setName(seed.name());
                template.setSystem(true);
                template.setCreatedBy("system");
                created++;
            }
            template.setDescription(seed.description());
            template.setType(seed.type());
            template.setTemplate(seed.template() != null ? new HashMap<>(seed.template()) : new HashMap<>());
            template.setTags(seed.tags() != null ? new ArrayList<>(seed.tags()) : new ArrayList<>());
            templateRepo.save(template);
        }
        log.info("[Seed] System templates ready: {} total, {} new", seeds.size(), created);
    }

    record SeedTemplate(String name, String description, String type,
                        Map<String, Object> template, List<String> tags) {}
}
