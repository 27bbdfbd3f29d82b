package ch.so.arp.finrag.orchestration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import ch.so.arp.finrag.financials.FinancialDataRepository;
import ch.so.arp.finrag.llm.LanguageModel;
import ch.so.arp.finrag.tools.ToolRegistry;

@Configuration
@EnableConfigurationProperties(OrchestrationProperties.class)
public class OrchestrationConfiguration {

    @Bean
    public ToolOrchestrator toolOrchestrator(LanguageModel languageModel, ToolRegistry toolRegistry,
            FinancialDataRepository financialDataRepository, OrchestrationProperties properties) {
        return new ToolOrchestrator(languageModel, toolRegistry, financialDataRepository, properties);
    }
}
