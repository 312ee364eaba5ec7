package io.jobclock.server.jobs;

import io.jobclock.JobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class PrintHelloJob implements JobHandler<Map<String, Object>> {
    private static final Logger log = LoggerFactory.getLogger(PrintHelloJob.class);

    public static final String NAME = "print_hello";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    @SuppressWarnings("unchecked")
    public Class<Map<String, Object>> dataClass() {
        return (Class<Map<String, Object>>) (Class<?>) Map.class;
    }

    @Override
    public void execute(String jobId, Map<String, Object> data) {
        log.info("Hello from job {}! metadata={}", jobId, data);
    }
}
