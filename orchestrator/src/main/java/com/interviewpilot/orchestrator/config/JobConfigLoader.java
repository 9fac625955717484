package com.interviewpilot.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.interviewpilot.orchestrator.model.InterviewConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads job configurations from JSON.
 *
 * File shape:
 * <pre>
 * {
 *   "job_description": "Backend engineer ...",
 *   "max_followup_chances": 2,
 *   "follow_up_policy": "per_question",
 *   "questions": [
 *     {"id": "q1", "text": "...", "required_keywords": ["redis", "ttl"], "guidance": "..."}
 *   ]
 * }
 * </pre>
 * Locations are Spring resource strings: {@code classpath:job_config.json},
 * {@code file:/etc/interview/job.json}, or a plain path.
 */
@Component
public class JobConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(JobConfigLoader.class);

    private final ObjectMapper   objectMapper;
    private final ResourceLoader resourceLoader;
    private final String         defaultLocation;

    public JobConfigLoader(ObjectMapper objectMapper,
                           @Value("${interview.job-config:classpath:job_config.json}") String defaultLocation) {
        this(objectMapper, new DefaultResourceLoader(), defaultLocation);
    }

    JobConfigLoader(ObjectMapper objectMapper, ResourceLoader resourceLoader, String defaultLocation) {
        this.objectMapper    = objectMapper;
        this.resourceLoader  = resourceLoader;
        this.defaultLocation = defaultLocation;
    }

    /** Load and validate the configured default job. */
    public InterviewConfig loadDefault() {
        return load(defaultLocation);
    }

    /**
     * Load and validate a job configuration.
     *
     * @throws ConfigInvalidException if the resource is missing, unparsable or invalid
     */
    public InterviewConfig load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ConfigInvalidException("job config not found: " + location, null);
        }
        try (InputStream in = resource.getInputStream()) {
            InterviewConfig config = objectMapper.readValue(in, InterviewConfig.class).validate();
            log.info("Loaded job config '{}' with {} question(s)", location, config.questionCount());
            return config;
        } catch (IOException e) {
            throw new ConfigInvalidException("could not parse " + location + ": " + e.getMessage(), e);
        }
    }
}
