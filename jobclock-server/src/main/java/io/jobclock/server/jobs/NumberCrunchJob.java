package io.jobclock.server.jobs;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.jobclock.JobHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Demo workload: sums 0..99 and scales the result by the job's {@code multiplier} (default 1).
 */
@Component
public class NumberCrunchJob implements JobHandler<NumberCrunchJob.Params> {
    private static final Logger log = LoggerFactory.getLogger(NumberCrunchJob.class);

    public static final String NAME = "dummy_number_crunch";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Params(Long multiplier) {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Class<Params> dataClass() {
        return Params.class;
    }

    @Override
    public void execute(String jobId, Params data) {
        long multiplier = data == null || data.multiplier() == null ? 1 : data.multiplier();
        long result = crunch(multiplier);
        log.info("Executed job {} | result={} | multiplier={}", jobId, result, multiplier);
    }

    static long crunch(long multiplier) {
        long sum = 0;
        for (int i = 0; i < 100; i++) {
            sum += i;
        }
        return sum * multiplier;
    }
}
