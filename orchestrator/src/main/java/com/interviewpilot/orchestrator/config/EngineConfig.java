package com.interviewpilot.orchestrator.config;

import com.interviewpilot.orchestrator.engine.FollowUpPolicy;
import com.interviewpilot.orchestrator.evaluation.AnswerEvaluator;
import com.interviewpilot.orchestrator.evaluation.EvaluationMode;
import com.interviewpilot.orchestrator.evaluation.JudgeAnswerEvaluator;
import com.interviewpilot.orchestrator.evaluation.KeywordAnswerEvaluator;
import com.interviewpilot.orchestrator.judge.BoundedJudge;
import com.interviewpilot.orchestrator.judge.ClaudeJudge;
import com.interviewpilot.orchestrator.judge.Judge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wiring for the dialogue engine.
 *
 * Two fixed pools keep the process responsive however many sessions are open:
 * session workers run turn evaluation (never parked waiting for an answer),
 * judge workers run the bounded judge calls.
 */
@Configuration
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    EngineSettings engineSettings(
            @Value("${interview.session.max-active:100}")     int      maxActive,
            @Value("${interview.session.idle-timeout:30m}")   Duration idleTimeout,
            @Value("${interview.session.startup-timeout:10s}") Duration startupTimeout,
            @Value("${interview.judge.timeout:30s}")          Duration judgeTimeout,
            @Value("${interview.evaluator.mode:keyword}")     String   evaluatorMode,
            @Value("${interview.follow-up.policy:per_question}") String policy) {
        EngineSettings settings = new EngineSettings(maxActive, idleTimeout, startupTimeout, judgeTimeout,
                EvaluationMode.fromProperty(evaluatorMode), FollowUpPolicy.fromProperty(policy));
        log.info("Interview engine settings: {}", settings);
        return settings;
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService sessionWorkers(@Value("${interview.workers:8}") int workers) {
        return Executors.newFixedThreadPool(workers);
    }

    @Bean(destroyMethod = "shutdownNow")
    ExecutorService judgeWorkers(@Value("${interview.judge.workers:8}") int workers) {
        return Executors.newFixedThreadPool(workers);
    }

    /** Every judge call in the engine goes through the timeout-enforcing decorator. */
    @Bean
    @Primary
    Judge boundedJudge(ClaudeJudge claudeJudge, EngineSettings settings,
                       @Qualifier("judgeWorkers") ExecutorService judgeWorkers,
                       MeterRegistry meterRegistry) {
        return new BoundedJudge(claudeJudge, judgeWorkers, settings.judgeTimeout(), meterRegistry);
    }

    @Bean
    AnswerEvaluator answerEvaluator(EngineSettings settings, Judge judge) {
        return switch (settings.evaluationMode()) {
            case KEYWORD -> new KeywordAnswerEvaluator();
            case JUDGE   -> new JudgeAnswerEvaluator(judge);
        };
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
