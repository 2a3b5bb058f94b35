package com.synthgen.perftuner.benchmark;

import com.synthgen.perftuner.config.PerfTunerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

/**
 * Runs one benchmark at startup when perf.benchmark.enabled=true, e.g.
 * {@code --perf.benchmark.enabled=true --perf.benchmark.duration=120s}.
 */
@Component
@ConditionalOnProperty(prefix = "perf.benchmark", name = "enabled", havingValue = "true")
@Slf4j
public class BenchmarkRunner implements CommandLineRunner {

    private final BenchmarkDriver driver;
    private final PerfTunerProperties props;
    private final ConfigurableApplicationContext context;

    public BenchmarkRunner(BenchmarkDriver driver,
                           PerfTunerProperties props,
                           ConfigurableApplicationContext context) {
        this.driver = driver;
        this.props = props;
        this.context = context;
    }

    @Override
    public void run(String... args) throws Exception {
        int exitCode = 0;
        try {
            BenchmarkReport report = driver.run(BenchmarkOptions.fromProperties(props.getBenchmark()));
            report.log();
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Benchmark error: {}", e.getMessage(), e);
            exitCode = 1;
        }

        if (props.getBenchmark().isExitOnCompletion()) {
            int code = exitCode;
            System.exit(SpringApplication.exit(context, () -> code));
        } else if (exitCode != 0) {
            throw new IllegalStateException("Benchmark failed");
        }
    }
}
