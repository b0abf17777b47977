package com.siat.siat_backend.config;

import com.siat.siat_backend.FlowStatus;
import com.siat.siat_backend.model.domain.ExecutionStatus;
import com.siat.siat_backend.model.domain.FlowType;
import com.siat.siat_backend.model.domain.LlmProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Rewrites the enum check constraints Hibernate created earlier so that values added to
 * FlowStatus, FlowType, ExecutionStatus or LlmProvider since then are accepted.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class SiatEnumConstraintMigration implements ApplicationRunner {

    private final JdbcTemplate jdbcTemplate;

    @Override
    public void run(ApplicationArguments args) {
        refresh("siat_flows", "status", FlowStatus.values());
        refresh("siat_flows", "type", FlowType.values());
        refresh("siat_executions", "status", ExecutionStatus.values());
        refresh("siat_llm_provider_configs", "provider", LlmProvider.values());
    }

    private void refresh(String table, String column, Enum<?>[] values) {
        String constraint = table + "_" + column + "_check";
        String allowed = String.join("', '", Arrays.stream(values).map(Enum::name).toList());
        try {
            jdbcTemplate.execute("ALTER TABLE " + table + " DROP CONSTRAINT IF EXISTS " + constraint);
            jdbcTemplate.execute("ALTER TABLE " + table + " ADD CONSTRAINT " + constraint
                    + " CHECK (" + column + " IN ('" + allowed + "'))");
            log.debug("Updated {} to allow {}", constraint, allowed);
        } catch (DataAccessException e) {
            log.warn("Could not update {}: {}", constraint, e.getMessage());
        }
    }
}
