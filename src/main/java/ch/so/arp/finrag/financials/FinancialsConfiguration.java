package ch.so.arp.finrag.financials;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.support.ResourcePatternResolver;

import com.fasterxml.jackson.databind.ObjectMapper;

@Configuration
@EnableConfigurationProperties(FinancialsProperties.class)
public class FinancialsConfiguration {

    @Bean
    public FinancialDataRepository financialDataRepository(FinancialsProperties properties,
            ResourcePatternResolver resourcePatternResolver, ObjectMapper objectMapper) {
        return new JsonFinancialDataRepository(resourcePatternResolver, objectMapper, properties.getLocation());
    }
}
