package com.rumbl.controller;

import com.rumbl.config.RumblConfig;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ModelAttribute;

// Exposes the site name to every page rendered through the layout
@ControllerAdvice
public class SiteModelAdvice {

    private final RumblConfig rumblConfig;

    public SiteModelAdvice(RumblConfig rumblConfig) {
        this.rumblConfig = rumblConfig;
    }

    @ModelAttribute("siteName")
    public String siteName() {
        return rumblConfig.getSiteName();
    }
}
