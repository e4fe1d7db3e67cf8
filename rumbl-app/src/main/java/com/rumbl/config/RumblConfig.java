package com.rumbl.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Site-wide settings shown by the layout and the home page.
 * Define them in application.yml under 'rumbl'
 */
@Configuration
@ConfigurationProperties(prefix = "rumbl")
public class RumblConfig {

    private String siteName = "Rumbl";
    private String welcomeMessage = "A productive web framework that does not compromise speed or maintainability.";

    public String getSiteName() {
        return siteName;
    }

    public void setSiteName(String siteName) {
        this.siteName = siteName;
    }

    public String getWelcomeMessage() {
        return welcomeMessage;
    }

    public void setWelcomeMessage(String welcomeMessage) {
        this.welcomeMessage = welcomeMessage;
    }
}
