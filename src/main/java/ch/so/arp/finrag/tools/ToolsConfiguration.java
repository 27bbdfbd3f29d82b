package ch.so.arp.finrag.tools;

import java.util.List;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import ch.so.arp.finrag.financials.FinancialDataRepository;
import ch.so.arp.finrag.resilience.ResilientCallExecutor;
import ch.so.arp.finrag.retrieval.RetrievalService;

@Configuration
public class ToolsConfiguration {

    @Bean
    public ToolRegistry toolRegistry(FinancialDataRepository financialDataRepository,
            RetrievalService retrievalService, ResilientCallExecutor resilientCallExecutor) {
        return new ToolRegistry(List.of(
                new FetchMetricTool(financialDataRepository),
                new FetchMultiPeriodTool(financialDataRepository),
                new ComputeGrowthTool(financialDataRepository),
                new SearchTranscriptsTool(retrievalService),
                new ListAvailableDataTool(financialDataRepository)), resilientCallExecutor);
    }
}
