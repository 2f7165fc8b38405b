package dk.trustworks.payroll.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Runtime tuning of the payroll engine.
 *
 * <p>Example configuration in application.properties:
 * <pre>
 * payroll.batch.max-concurrency=5
 * payroll.workflow.validation-enabled=true
 * payroll.workflow.optional-steps=employee_position
 * payroll.workflow.session-idle-timeout=PT30M
 * payroll.contribution.high-ratio=2.0
 * payroll.contribution.low-ratio=0.5
 * </pre>
 */
@ConfigMapping(prefix = "payroll")
public interface PayrollEngineConfig {

    Batch batch();

    Workflow workflow();

    Contribution contribution();

    interface Batch {

        /**
         * Maximum number of batch items in flight at once. 1 runs items sequentially
         * on the calling thread.
         * Default: 5
         */
        @WithDefault("5")
        int maxConcurrency();
    }

    interface Workflow {

        /**
         * When false every step may be left without validation.
         * Default: true
         */
        @WithDefault("true")
        boolean validationEnabled();

        /**
         * Wire ids of steps whose completeness shortfall does not block advancing.
         */
        Optional<List<String>> optionalSteps();

        /**
         * Sessions untouched for longer than this are dropped.
         * Default: 30 minutes
         */
        @WithDefault("PT30M")
        Duration sessionIdleTimeout();
    }

    interface Contribution {

        /**
         * Base / latest gross pay above this ratio produces a warning.
         * Default: 2.0
         */
        @WithDefault("2.0")
        BigDecimal highRatio();

        /**
         * Base / latest gross pay below this ratio produces a warning.
         * Default: 0.5
         */
        @WithDefault("0.5")
        BigDecimal lowRatio();
    }
}
