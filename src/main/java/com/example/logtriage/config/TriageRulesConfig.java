package com.example.logtriage.config;

import com.example.logtriage.model.TriageRules;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Компилирует правила при старте приложения. Ошибка в любом правиле
 * не даёт контексту подняться.
 */
@Configuration
public class TriageRulesConfig {

    @Bean
    public TriageRules triageRules(TriageConfig triageConfig) {
        return PatternRuleCompiler.compile(triageConfig);
    }
}
