package com.taskboard.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Application settings bound from the {@code app.*} keys.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "app")
public class TaskboardProperties {

    /**
     * Base URL of the web client, used to build invitation links.
     */
    private String frontendUrl = "http://localhost:3000";

    private Invitation invitation = new Invitation();

    private Workspace workspace = new Workspace();

    private Errors errors = new Errors();

    private Notifications notifications = new Notifications();

    @Getter
    @Setter
    public static class Invitation {
        private int expiryDays = 7;
    }

    @Getter
    @Setter
    public static class Workspace {
        /**
         * Seed default categories and starter tasks into new workspaces.
         */
        private boolean seedDefaults = true;
    }

    @Getter
    @Setter
    public static class Errors {
        /**
         * Include exception messages in 500 responses. Disabled in prod.
         */
        private boolean exposeDetails = true;
    }

    @Getter
    @Setter
    public static class Notifications {
        private long sendTimeoutMs = 500;
    }
}
