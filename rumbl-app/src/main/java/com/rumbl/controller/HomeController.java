package com.rumbl.controller;

import com.rumbl.config.RumblConfig;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;

@Controller
public class HomeController {

    private final RumblConfig rumblConfig;

    public HomeController(RumblConfig rumblConfig) {
        this.rumblConfig = rumblConfig;
    }

    @GetMapping("/")
    public String home(Model model) {
        model.addAttribute("welcomeMessage", rumblConfig.getWelcomeMessage());
        return "home";
    }
}
