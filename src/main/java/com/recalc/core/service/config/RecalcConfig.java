package com.recalc.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for the recalc core service.
 *
 * Contains the master switch and feature toggles for the individual loops.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "recalc")
public class RecalcConfig {

    /**
     * Enable or disable all background loops.
     */
    private boolean enabled = true;

    /**
     * Feature flags for optional loops.
     */
    private Features features = new Features();

    @Getter
    @Setter
    public static class Features {

        /**
         * Recalculate program calibrations when observations become ready.
         */
        private boolean obscalcEnabled = true;

        /**
         * Recalculate calibration targets when calibration times change.
         */
        private boolean calibrationTimeEnabled = true;

        /**
         * Run the telluric polling daemon.
         */
        private boolean telluricEnabled = true;

        /**
         * Push telluric entries that become pending to the daemon between ticks.
         */
        private boolean telluricEventsEnabled = true;

        /**
         * Recheck resolved telluric targets when a science observation becomes ready.
         */
        private boolean telluricRecheckEnabled = true;
    }
}
