package com.spendguard.autoconfigure;

import com.spendguard.core.SpendGuardEngine;
import com.spendguard.core.alert.AlertDispatcher;
import com.spendguard.core.budget.BudgetLedger;
import com.spendguard.core.config.SpendGuardProperties;
import com.spendguard.core.cost.CostCalculator;
import com.spendguard.core.cost.TokenEstimator;
import com.spendguard.core.event.ErrorReporter;
import com.spendguard.core.event.LoggingErrorReporter;
import com.spendguard.core.event.SpendSignalPublisher;
import com.spendguard.core.pipeline.PipelineStage;
import com.spendguard.core.pipeline.StageContext;
import com.spendguard.core.pipeline.StageRegistry;
import com.spendguard.core.pricing.DriverPricingCatalog;
import com.spendguard.core.pricing.DriverPricingTable;
import com.spendguard.core.pricing.PricingResolver;
import com.spendguard.core.recording.CostRecorder;
import com.spendguard.core.store.BudgetStore;
import com.spendguard.core.store.CostRecordStore;
import com.spendguard.core.store.InMemoryBudgetStore;
import com.spendguard.core.store.InMemoryCostRecordStore;
import com.spendguard.core.store.InMemoryPriceStore;
import com.spendguard.core.store.PriceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Auto-configuration for SpendGuard.
 * Activated when {@code spendguard.enabled=true} (default).
 */
@AutoConfiguration
@ConditionalOnProperty(name = "spendguard.enabled", havingValue = "true", matchIfMissing = true)
@ComponentScan(basePackages = "com.spendguard.module")
public class SpendGuardAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SpendGuardAutoConfiguration.class);

    @Bean
    @ConfigurationProperties(prefix = "spendguard")
    public SpendGuardProperties spendGuardProperties() {
        return new SpendGuardProperties();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock spendGuardClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public PriceStore priceStore() {
        log.info("[SpendGuard] Using InMemoryPriceStore (provide a PriceStore bean for production)");
        return new InMemoryPriceStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public BudgetStore budgetStore() {
        log.info("[SpendGuard] Using InMemoryBudgetStore (provide a BudgetStore bean for production)");
        return new InMemoryBudgetStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public CostRecordStore costRecordStore() {
        return new InMemoryCostRecordStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public DriverPricingCatalog driverPricingCatalog(List<DriverPricingTable> tables) {
        return DriverPricingCatalog.of(tables);
    }

    @Bean
    @ConditionalOnMissingBean
    public PricingResolver pricingResolver(PriceStore priceStore, DriverPricingCatalog catalog,
            SpendGuardProperties properties, Clock clock,
            @Qualifier("spendguardStoreExecutor") Executor spendguardStoreExecutor) {
        return new PricingResolver(priceStore, catalog, properties.getPricing(), clock, spendguardStoreExecutor);
    }

    @Bean
    public SmartInitializingSingleton spendGuardPricingWarmUp(PricingResolver pricingResolver) {
        return pricingResolver::warmUp;
    }

    @Bean
    @ConditionalOnMissingBean
    public CostCalculator costCalculator() {
        return new CostCalculator();
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenEstimator tokenEstimator(SpendGuardProperties properties) {
        return new TokenEstimator(properties.getEstimation());
    }

    @Bean
    @ConditionalOnMissingBean(name = "spendguardStoreExecutor")
    public Executor spendguardStoreExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(200);
        executor.setThreadNamePrefix("spendguard-store-");
        executor.initialize();
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public BudgetLedger budgetLedger(BudgetStore budgetStore, SpendGuardProperties properties, Clock clock,
            @Qualifier("spendguardStoreExecutor") Executor spendguardStoreExecutor) {
        return new BudgetLedger(budgetStore, properties.getBudget(), clock, spendguardStoreExecutor);
    }

    @Bean
    public SmartInitializingSingleton spendGuardBudgetWarmUp(BudgetLedger budgetLedger) {
        return budgetLedger::warmUp;
    }

    @Bean
    @ConditionalOnMissingBean
    public SpendSignalPublisher spendSignalPublisher(ApplicationEventPublisher eventPublisher) {
        return new ApplicationEventSpendSignalPublisher(eventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorReporter errorReporter() {
        return new LoggingErrorReporter();
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertDispatcher alertDispatcher(BudgetLedger ledger, SpendSignalPublisher publisher,
            SpendGuardProperties properties, Clock clock) {
        return new AlertDispatcher(ledger, publisher, properties.getRecording(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public CostRecorder costRecorder(PricingResolver pricingResolver, CostCalculator costCalculator,
            BudgetLedger ledger, CostRecordStore costRecordStore, SpendSignalPublisher publisher,
            ErrorReporter errorReporter, AlertDispatcher alertDispatcher, SpendGuardProperties properties,
            Clock clock) {
        return new CostRecorder(pricingResolver, costCalculator, ledger, costRecordStore, publisher,
                errorReporter, List.of(alertDispatcher), properties.getRecording(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public StageContext stageContext(PricingResolver pricingResolver, CostCalculator costCalculator,
            TokenEstimator tokenEstimator, BudgetLedger budgetLedger, SpendGuardProperties properties) {
        return new StageContext(pricingResolver, costCalculator, tokenEstimator, budgetLedger, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public StageRegistry stageRegistry(List<PipelineStage> stages) {
        return new StageRegistry(stages);
    }

    @Bean
    @ConditionalOnMissingBean(name = "spendguardExecutor")
    public Executor spendguardExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("spendguard-async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public SpendGuardEngine spendGuardEngine(StageRegistry registry, StageContext context,
            SpendGuardProperties properties, CostRecorder costRecorder, ErrorReporter errorReporter,
            @Qualifier("spendguardExecutor") Executor spendguardExecutor, Clock clock) {
        return new SpendGuardEngine(registry, context, properties, costRecorder, errorReporter,
                spendguardExecutor, clock);
    }
}
