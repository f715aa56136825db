package com.maturityplatform.assessment.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.maturityplatform.common.benchmark.BenchmarkComparator;
import com.maturityplatform.common.classifier.MaturityClassifier;
import com.maturityplatform.common.pilot.PilotStateMachine;
import com.maturityplatform.common.pilot.PilotValidator;
import com.maturityplatform.common.report.ReportAssembler;
import com.maturityplatform.common.roadmap.RoadmapGenerator;
import com.maturityplatform.common.rules.RuleSet;
import com.maturityplatform.common.rules.RuleSetLoader;
import com.maturityplatform.common.scoring.DimensionScorer;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class AssessmentServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(AssessmentServiceConfig.class);

    @Value("${services.events.base-url}")
    private String eventsUrl;

    @Value("${maturity.rules.location:classpath:rules/maturity-rules-v1.json}")
    private String rulesLocation;

    @Bean
    public WebClient eventsClient(WebClient.Builder builder) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 5_000)
            .responseTimeout(Duration.ofSeconds(10))
            .doOnConnected(conn ->
                conn.addHandlerLast(new ReadTimeoutHandler(10, TimeUnit.SECONDS))
            );

        return builder
            .baseUrl(eventsUrl)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ── Rule tables and engines ─────────────────────────────────────────────

    @Bean
    public RuleSet ruleSet(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        Resource resource = resourceLoader.getResource(rulesLocation);
        try (InputStream in = resource.getInputStream()) {
            RuleSet rules = new RuleSetLoader(objectMapper).load(in);
            log.info("Rule tables loaded. location={} version={} templates={}",
                rulesLocation, rules.version(), rules.initiativeCatalog().size());
            return rules;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read rule tables at " + rulesLocation, e);
        }
    }

    @Bean
    public MaturityClassifier maturityClassifier(RuleSet ruleSet) {
        return new MaturityClassifier(ruleSet.maturityBands());
    }

    @Bean
    public DimensionScorer dimensionScorer() {
        return new DimensionScorer();
    }

    @Bean
    public BenchmarkComparator benchmarkComparator() {
        return new BenchmarkComparator();
    }

    @Bean
    public RoadmapGenerator roadmapGenerator(MaturityClassifier maturityClassifier, RuleSet ruleSet) {
        return new RoadmapGenerator(maturityClassifier, ruleSet.initiativeCatalog());
    }

    @Bean
    public PilotValidator pilotValidator() {
        return new PilotValidator();
    }

    @Bean
    public PilotStateMachine pilotStateMachine(PilotValidator pilotValidator) {
        return new PilotStateMachine(pilotValidator);
    }

    @Bean
    public ReportAssembler reportAssembler(MaturityClassifier maturityClassifier,
                                           PilotStateMachine pilotStateMachine) {
        return new ReportAssembler(maturityClassifier, pilotStateMachine);
    }
}
