package com.board.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Overall application configuration for Board Core Service.
 *
 * Contains feature toggles and board defaults.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "board")
public class BoardConfig {

    /**
     * Board type written for new boards and for blank board-type text.
     */
    private String defaultBoardType = "Eventstorming";

    /**
     * Feature flags.
     */
    private Features features = new Features();

    @Getter
    @Setter
    public static class Features {

        /**
         * Declare constraints and indexes at startup. Startup fails if the store is unreachable.
         */
        private boolean schemaBootstrapEnabled = true;

        /**
         * Run each write cycle in a single store transaction.
         * When disabled every statement auto-commits and a failure mid-cycle
         * leaves the earlier statements applied.
         */
        private boolean transactionalWrites = true;
    }
}
